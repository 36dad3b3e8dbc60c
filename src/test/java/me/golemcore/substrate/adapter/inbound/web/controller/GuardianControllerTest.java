package me.golemcore.substrate.adapter.inbound.web.controller;

import me.golemcore.substrate.adapter.inbound.web.dto.ReasonRequest;
import me.golemcore.substrate.domain.exception.AgentTerminatedException;
import me.golemcore.substrate.domain.model.Agent;
import me.golemcore.substrate.domain.model.AgentStatus;
import me.golemcore.substrate.domain.model.AgentType;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.QuarantineRecord;
import me.golemcore.substrate.domain.model.QuarantineStatus;
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
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GuardianControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Caller OPERATOR = Caller.operator("ops-1");

    private KernelService kernelService;
    private GuardianController controller;
    private Principal principal;

    @BeforeEach
    void setUp() {
        kernelService = mock(KernelService.class);
        controller = new GuardianController(kernelService, new CallerResolver(new SubstrateProperties()));
        principal = new UsernamePasswordAuthenticationToken(OPERATOR, null);
    }

    @Test
    void shouldListQuarantines() {
        when(kernelService.listQuarantines(OPERATOR)).thenReturn(List.of(quarantine(QuarantineStatus.ACTIVE)));

        StepVerifier.create(controller.listQuarantines(principal))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("a1", response.getBody().get(0).getAgentId());
                })
                .verifyComplete();
    }

    @Test
    void shouldQuarantineWithReason() {
        when(kernelService.quarantine(OPERATOR, "a1", "manual hold"))
                .thenReturn(quarantine(QuarantineStatus.ACTIVE));

        StepVerifier.create(controller.quarantine("a1", new ReasonRequest("manual hold"), principal))
                .assertNext(response -> assertEquals(QuarantineStatus.ACTIVE, response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldReleaseWithoutBody() {
        when(kernelService.release(OPERATOR, "a1", null)).thenReturn(quarantine(QuarantineStatus.RELEASED));

        StepVerifier.create(controller.release("a1", null, principal))
                .assertNext(response -> assertEquals(QuarantineStatus.RELEASED, response.getBody().getStatus()))
                .verifyComplete();
        verify(kernelService).release(OPERATOR, "a1", null);
    }

    @Test
    void shouldTerminate() {
        Agent terminated = Agent.builder()
                .id("a1")
                .type(AgentType.REFLEX)
                .status(AgentStatus.TERMINATED)
                .registeredAt(NOW)
                .statusChangedAt(NOW)
                .build();
        when(kernelService.terminate(OPERATOR, "a1", "compromised")).thenReturn(terminated);

        StepVerifier.create(controller.terminate("a1", new ReasonRequest("compromised"), principal))
                .assertNext(response -> assertEquals(AgentStatus.TERMINATED, response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateAlreadyTerminated() {
        when(kernelService.terminate(eq(OPERATOR), eq("a1"), isNull()))
                .thenThrow(new AgentTerminatedException("agent a1 is terminated", 12L));

        StepVerifier.create(controller.terminate("a1", null, principal))
                .expectError(AgentTerminatedException.class)
                .verify();
    }

    private static QuarantineRecord quarantine(QuarantineStatus status) {
        return QuarantineRecord.builder()
                .agentId("a1")
                .triggerRule("manual")
                .reason("manual hold")
                .createdAt(NOW)
                .status(status)
                .ledgerSequence(7)
                .build();
    }
}
