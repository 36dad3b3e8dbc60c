package me.golemcore.substrate.domain.arbiter;

import me.golemcore.substrate.domain.exception.AgentQuarantinedException;
import me.golemcore.substrate.domain.exception.ArbitrationDeniedException;
import me.golemcore.substrate.domain.exception.InvalidTransitionException;
import me.golemcore.substrate.domain.model.AgentType;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.DenialKind;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.ModeChangeRequest;
import me.golemcore.substrate.domain.model.Privilege;
import me.golemcore.substrate.domain.model.RequestResolution;
import me.golemcore.substrate.domain.model.SignalType;
import me.golemcore.substrate.domain.model.SystemMode;
import me.golemcore.substrate.testsupport.KernelFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArbiterTest {

    private static final Caller OPERATOR = Caller.operator("ops");
    private static final Caller ARCHITECT = new Caller("root", Privilege.ARCHITECT);

    private KernelFixture fixture;
    private Arbiter arbiter;

    @BeforeEach
    void setUp() {
        fixture = KernelFixture.create(properties -> {
            properties.getArbiter().setThrashLimit(3);
            properties.getArbiter().setThrashWindow(Duration.ofMinutes(1));
            properties.getGuardian().setMaxConsecutiveDenials(10);
        });
        arbiter = fixture.arbiter;
    }

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    @Test
    void shouldStartInObserve() {
        assertEquals(SystemMode.OBSERVE, arbiter.currentMode().getMode());
        assertEquals(0, arbiter.currentMode().getTransitionsInWindow());
    }

    @Test
    void shouldRecordRequestAndResolutionForApproval() {
        ModeChangeRequest request = arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "sensor spike");

        assertTrue(request.isApproved());
        assertEquals(SystemMode.ALERT, arbiter.currentMode().getMode());
        LedgerEntry submitted = fixture.ledger.get(request.getRequestLedgerSequence()).orElseThrow();
        LedgerEntry resolved = fixture.ledger.get(request.getResolutionLedgerSequence()).orElseThrow();
        assertEquals(LedgerActions.MODE_REQUESTED, submitted.actionKind());
        assertEquals(EntryOutcome.INTENT, submitted.outcome());
        assertEquals("ops", submitted.actor());
        assertEquals(LedgerActions.MODE_RESOLVED, resolved.actionKind());
        assertEquals(Arbiter.ACTOR, resolved.actor());
        assertEquals(EntryOutcome.COMMITTED, resolved.outcome());
        assertEquals(resolved.sequence(), arbiter.currentMode().getLedgerSequence());
    }

    @Test
    void shouldDenyInvalidTransitionWithoutChangingMode() {
        ModeChangeRequest request = arbiter.requestModeChange(ARCHITECT, SystemMode.ACT, "skip ahead");

        assertEquals(RequestResolution.DENIED, request.getResolution());
        assertEquals(DenialKind.INVALID_TRANSITION, request.getDenialKind());
        assertEquals(SystemMode.OBSERVE, arbiter.currentMode().getMode());
        assertEquals(EntryOutcome.FAILED,
                fixture.ledger.get(request.getResolutionLedgerSequence()).orElseThrow().outcome());
        assertThrows(InvalidTransitionException.class, request::orThrow);
    }

    @Test
    void shouldDenyAgentWithoutRequiredPrivilege() {
        fixture.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 10);
        arbiter.requestModeChange(Caller.agent("agent-a"), SystemMode.ALERT, "anomaly seen");

        ModeChangeRequest request = arbiter.requestModeChange(Caller.agent("agent-a"), SystemMode.ACT, "engage");

        assertEquals(DenialKind.INSUFFICIENT_PRIVILEGE, request.getDenialKind());
        assertEquals(SystemMode.ALERT, arbiter.currentMode().getMode());
        assertThrows(ArbitrationDeniedException.class, request::orThrow);
        assertEquals(List.of(SignalType.MODE_REQUEST_APPROVED, SignalType.MODE_REQUEST_DENIED),
                fixture.signals.stream().map(signal -> signal.type()).toList());
    }

    @Test
    void shouldDenyFourthTransitionInsideWindowRegardlessOfPrivilege() {
        assertTrue(arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "1").isApproved());
        fixture.clock.advance(Duration.ofSeconds(10));
        assertTrue(arbiter.requestModeChange(OPERATOR, SystemMode.ACT, "2").isApproved());
        fixture.clock.advance(Duration.ofSeconds(10));
        assertTrue(arbiter.requestModeChange(OPERATOR, SystemMode.OBSERVE, "3").isApproved());
        fixture.clock.advance(Duration.ofSeconds(10));

        ModeChangeRequest fourth = arbiter.requestModeChange(ARCHITECT, SystemMode.ALERT, "4");

        assertFalse(fourth.isApproved());
        assertEquals(DenialKind.THRASH_LIMIT, fourth.getDenialKind());
        assertEquals(SystemMode.OBSERVE, arbiter.currentMode().getMode());
        assertEquals(3, arbiter.currentMode().getTransitionsInWindow());
    }

    @Test
    void shouldNotCountDeniedRequestsTowardWindow() {
        arbiter.requestModeChange(OPERATOR, SystemMode.ACT, "invalid");
        arbiter.requestModeChange(Caller.auditor("audit"), SystemMode.DEFEND, "not allowed");

        assertEquals(0, arbiter.currentMode().getTransitionsInWindow());
        assertEquals(2, arbiter.listRequests().size());
    }

    @Test
    void shouldAcceptDefendWhileThrashing() {
        arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "1");
        arbiter.requestModeChange(OPERATOR, SystemMode.OBSERVE, "2");
        arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "3");

        ModeChangeRequest defend = arbiter.requestModeChange(OPERATOR, SystemMode.DEFEND, "under attack");

        assertTrue(defend.isApproved());
        assertEquals(SystemMode.DEFEND, arbiter.currentMode().getMode());
    }

    @Test
    void shouldReopenWindowAfterItElapses() {
        arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "1");
        arbiter.requestModeChange(OPERATOR, SystemMode.OBSERVE, "2");
        arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "3");
        assertFalse(arbiter.requestModeChange(OPERATOR, SystemMode.OBSERVE, "4").isApproved());

        fixture.clock.advance(Duration.ofSeconds(61));

        assertTrue(arbiter.requestModeChange(OPERATOR, SystemMode.OBSERVE, "5").isApproved());
        assertEquals(1, arbiter.currentMode().getTransitionsInWindow());
    }

    @Test
    void shouldRefuseQuarantinedAgentBeforeRecordingRequest() {
        fixture.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 10);
        fixture.kernel.quarantine(OPERATOR, "agent-a", "suspicious");
        long tailBefore = fixture.ledger.tailSequence();

        assertThrows(AgentQuarantinedException.class,
                () -> arbiter.requestModeChange(Caller.agent("agent-a"), SystemMode.ALERT, "let me"));

        LedgerEntry rejection = fixture.ledger.tail().orElseThrow();
        assertEquals(tailBefore + 1, rejection.sequence());
        assertEquals(LedgerActions.ADMISSION_REJECTED, rejection.actionKind());
        assertTrue(arbiter.listRequests().isEmpty());
    }

    @Test
    void shouldRecheckStatusOnceTransitionLockIsHeld() throws Exception {
        fixture.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 10);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<ModeChangeRequest> request = fixture.transitionLock.execute(() -> {
            Future<ModeChangeRequest> waiting = executor.submit(
                    () -> arbiter.requestModeChange(Caller.agent("agent-a"), SystemMode.ALERT, "let me"));
            sleepQuietly(100);
            fixture.guardian.quarantine("ops", "agent-a", "manual", "suspicious");
            return waiting;
        });

        ExecutionException error = assertThrows(ExecutionException.class, () -> request.get(5, TimeUnit.SECONDS));
        executor.shutdown();

        assertTrue(error.getCause() instanceof AgentQuarantinedException);
        assertTrue(arbiter.listRequests().isEmpty());
        assertTrue(fixture.ledger.all().stream()
                .noneMatch(entry -> LedgerActions.MODE_REQUESTED.equals(entry.actionKind())));
    }

    @Test
    void shouldRestoreReplayedModeKeepingWindow() {
        arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "1");
        LedgerEntry tail = fixture.ledger.tail().orElseThrow();

        arbiter.restoreMode(me.golemcore.substrate.domain.model.ModeState.initial(KernelFixture.START), tail);

        assertEquals(SystemMode.OBSERVE, arbiter.currentMode().getMode());
        assertEquals(1, arbiter.currentMode().getTransitionsInWindow());
        assertThrows(IllegalArgumentException.class,
                () -> arbiter.restoreMode(arbiter.currentMode(), null));
    }

    @Test
    void shouldSeedWindowFromPastTransitions() {
        arbiter.restoreWindow(List.of(KernelFixture.START.minusSeconds(120), KernelFixture.START.minusSeconds(5),
                KernelFixture.START.minusSeconds(2), KernelFixture.START.minusSeconds(1)));

        assertEquals(3, arbiter.currentMode().getTransitionsInWindow());
        assertEquals(DenialKind.THRASH_LIMIT,
                arbiter.requestModeChange(OPERATOR, SystemMode.ALERT, "blocked").getDenialKind());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
