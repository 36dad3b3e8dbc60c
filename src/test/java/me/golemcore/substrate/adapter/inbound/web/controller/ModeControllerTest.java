package me.golemcore.substrate.adapter.inbound.web.controller;

import me.golemcore.substrate.adapter.inbound.web.dto.ModeRequest;
import me.golemcore.substrate.domain.exception.PrivilegeRequiredException;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.DenialKind;
import me.golemcore.substrate.domain.model.ModeChangeRequest;
import me.golemcore.substrate.domain.model.ModeState;
import me.golemcore.substrate.domain.model.Privilege;
import me.golemcore.substrate.domain.model.SystemMode;
import me.golemcore.substrate.domain.service.KernelService;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import reactor.test.StepVerifier;

import java.security.Principal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModeControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Caller OPERATOR = Caller.operator("ops-1");

    private KernelService kernelService;
    private ModeController controller;
    private Principal principal;

    @BeforeEach
    void setUp() {
        kernelService = mock(KernelService.class);
        controller = new ModeController(kernelService, new CallerResolver(new SubstrateProperties()));
        principal = new UsernamePasswordAuthenticationToken(OPERATOR, null);
    }

    @Test
    void shouldReturnCurrentMode() {
        when(kernelService.currentMode()).thenReturn(ModeState.initial(NOW));

        StepVerifier.create(controller.getMode())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(SystemMode.OBSERVE, response.getBody().getMode());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnOkForApprovedRequest() {
        ModeChangeRequest approved = pending().approve("system:arbiter", NOW, 3);
        when(kernelService.requestModeChange(OPERATOR, SystemMode.ALERT, "sensor drift")).thenReturn(approved);

        StepVerifier.create(controller.requestModeChange(new ModeRequest(SystemMode.ALERT, "sensor drift"), principal))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().isApproved());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnConflictWithReasonForDeniedRequest() {
        ModeChangeRequest denied = pending().deny(DenialKind.THRASH_LIMIT, "3 transitions within PT1M",
                "system:arbiter", NOW, 3);
        when(kernelService.requestModeChange(OPERATOR, SystemMode.ALERT, "sensor drift")).thenReturn(denied);

        StepVerifier.create(controller.requestModeChange(new ModeRequest(SystemMode.ALERT, "sensor drift"), principal))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertFalse(response.getBody().isApproved());
                    assertEquals(DenialKind.THRASH_LIMIT, response.getBody().getDenialKind());
                    assertEquals("3 transitions within PT1M", response.getBody().getReason());
                })
                .verifyComplete();
    }

    @Test
    void shouldListRequestHistory() {
        when(kernelService.listModeRequests(OPERATOR)).thenReturn(List.of(pending()));

        StepVerifier.create(controller.listRequests(principal))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldPropagatePrivilegeRejection() {
        when(kernelService.listModeRequests(OPERATOR))
                .thenThrow(new PrivilegeRequiredException("AUDITOR privilege required", null));

        StepVerifier.create(controller.listRequests(principal))
                .expectError(PrivilegeRequiredException.class)
                .verify();
    }

    private static ModeChangeRequest pending() {
        return ModeChangeRequest.builder()
                .id("mcr-1")
                .requesterId("ops-1")
                .requesterPrivilege(Privilege.OPERATOR)
                .fromMode(SystemMode.OBSERVE)
                .targetMode(SystemMode.ALERT)
                .justification("sensor drift")
                .submittedAt(NOW)
                .requestLedgerSequence(2)
                .build();
    }
}
