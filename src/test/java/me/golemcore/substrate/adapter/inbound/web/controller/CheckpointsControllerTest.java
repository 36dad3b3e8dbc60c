package me.golemcore.substrate.adapter.inbound.web.controller;

import me.golemcore.substrate.adapter.inbound.web.dto.ReasonRequest;
import me.golemcore.substrate.domain.exception.UnknownCheckpointException;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.Checkpoint;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CheckpointsControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Caller OPERATOR = Caller.operator("ops-1");

    private KernelService kernelService;
    private CheckpointsController controller;
    private Principal principal;

    @BeforeEach
    void setUp() {
        kernelService = mock(KernelService.class);
        controller = new CheckpointsController(kernelService, new CallerResolver(new SubstrateProperties()));
        principal = new UsernamePasswordAuthenticationToken(OPERATOR, null);
    }

    @Test
    void shouldCreateCheckpointWithDescription() {
        Checkpoint checkpoint = new Checkpoint("cp-1", 12, "ops-1", NOW, "before rollout");
        when(kernelService.createCheckpoint(OPERATOR, "before rollout")).thenReturn(checkpoint);

        StepVerifier.create(controller.create(new ReasonRequest("before rollout"), principal))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals(12, response.getBody().sequence());
                })
                .verifyComplete();
    }

    @Test
    void shouldCreateCheckpointWithoutBody() {
        when(kernelService.createCheckpoint(OPERATOR, null)).thenReturn(new Checkpoint("cp-1", 3, "ops-1", NOW, ""));

        StepVerifier.create(controller.create(null, principal))
                .assertNext(response -> assertEquals("", response.getBody().description()))
                .verifyComplete();
    }

    @Test
    void shouldListCheckpoints() {
        when(kernelService.listCheckpoints(OPERATOR)).thenReturn(List.of(
                new Checkpoint("cp-1", 3, "ops-1", NOW, "a"),
                new Checkpoint("cp-2", 9, "ops-1", NOW, "b")));

        StepVerifier.create(controller.list(principal))
                .assertNext(response -> assertEquals(2, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldRollBack() {
        LedgerEntry rollback = LedgerEntry.builder()
                .sequence(20)
                .actor("ops-1")
                .actionKind(LedgerActions.ROLLBACK)
                .outcome(EntryOutcome.COMMITTED)
                .build();
        when(kernelService.rollback(OPERATOR, "cp-1")).thenReturn(rollback);

        StepVerifier.create(controller.rollback("cp-1", principal))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(20, response.getBody().sequence());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateUnknownCheckpoint() {
        when(kernelService.rollback(OPERATOR, "cp-404")).thenThrow(new UnknownCheckpointException("cp-404"));

        StepVerifier.create(controller.rollback("cp-404", principal))
                .expectError(UnknownCheckpointException.class)
                .verify();
    }
}
