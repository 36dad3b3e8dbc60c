package me.golemcore.substrate.domain.budget;

import me.golemcore.substrate.domain.exception.AgentQuarantinedException;
import me.golemcore.substrate.domain.exception.InsufficientBudgetException;
import me.golemcore.substrate.domain.exception.UnknownAgentException;
import me.golemcore.substrate.domain.ledger.ReplayState;
import me.golemcore.substrate.domain.model.AgentType;
import me.golemcore.substrate.domain.model.AnomalySignal;
import me.golemcore.substrate.domain.model.BudgetAccount;
import me.golemcore.substrate.domain.model.BudgetSummary;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.DebitResult;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.SignalType;
import me.golemcore.substrate.testsupport.KernelFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetRegisterTest {

    private static final Caller OPERATOR = Caller.operator("ops");

    private KernelFixture fixture;
    private BudgetRegister register;

    @BeforeEach
    void setUp() {
        fixture = KernelFixture.create();
        register = fixture.budgetRegister;
        fixture.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 100);
    }

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    // ===== Debit =====

    @Test
    void shouldAcceptDebitCoveredByRemaining() {
        DebitResult result = register.debit("agent-a", 40);

        assertTrue(result.isAccepted());
        assertEquals(60, result.getRemaining());
        assertEquals(40, register.getTotalConsumed("agent-a"));
        LedgerEntry entry = fixture.ledger.get(result.getLedgerSequence()).orElseThrow();
        assertEquals(LedgerActions.BUDGET_DEBIT, entry.actionKind());
        assertEquals(EntryOutcome.COMMITTED, entry.outcome());
    }

    @Test
    void shouldRejectDebitExceedingRemainingAndKeepAccount() {
        register.debit("agent-a", 40);

        DebitResult result = register.debit("agent-a", 70);

        assertFalse(result.isAccepted());
        assertEquals(60, result.getRemaining());
        assertEquals(60, register.getAccount("agent-a").getRemaining());
        LedgerEntry entry = fixture.ledger.get(result.getLedgerSequence()).orElseThrow();
        assertEquals(EntryOutcome.FAILED, entry.outcome());
        assertTrue(entry.payload().get("reason").toString().contains("insufficient budget"));
        InsufficientBudgetException error = assertThrows(InsufficientBudgetException.class, result::orThrow);
        assertEquals(result.getLedgerSequence(), error.getLedgerSequence());
    }

    @Test
    void shouldAcceptDebitOfExactRemaining() {
        assertTrue(register.debit("agent-a", 100).isAccepted());
        assertEquals(0, register.getAccount("agent-a").getRemaining());
        assertFalse(register.debit("agent-a", 1).isAccepted());
        assertTrue(register.debit("agent-a", 0).isAccepted());
    }

    @Test
    void shouldReferenceIntentInDebitEntry() {
        DebitResult result = register.debit("agent-a", 5, 1, "task.execute");

        LedgerEntry entry = fixture.ledger.get(result.getLedgerSequence()).orElseThrow();
        assertEquals(1, ((Number) entry.payload().get("intentSequence")).intValue());
        assertEquals("task.execute", entry.payload().get("costType"));
        assertTrue(register.isPaid(1));
    }

    @Test
    void shouldPayIntentOnlyOnce() {
        register.debit("agent-a", 5, 1, "task.execute");
        long tail = fixture.ledger.tailSequence();

        assertThrows(IllegalArgumentException.class, () -> register.debit("agent-a", 5, 1, "task.execute"));
        assertEquals(95, register.getAccount("agent-a").getRemaining());
        assertEquals(tail, fixture.ledger.tailSequence());
    }

    @Test
    void shouldNotMarkIntentPaidWhenDebitIsRejected() {
        DebitResult result = register.debit("agent-a", 500, 1, "task.execute");

        assertFalse(result.isAccepted());
        assertFalse(register.isPaid(1));
    }

    @Test
    void shouldTotalCostsPerType() {
        register.debit("agent-a", 5, 1, "task.execute");
        register.debit("agent-a", 5, 2, "task.execute");
        register.debit("agent-a", 1, 3, "perception.sense");
        register.debit("agent-a", 4);

        assertEquals(15, register.getTotalCost("agent-a", null));
        assertEquals(10, register.getTotalCost("agent-a", "task.execute"));
        assertEquals(1, register.getTotalCost("agent-a", "perception.sense"));
        assertEquals(4, register.getTotalCost("agent-a", BudgetAccount.UNATTRIBUTED));
        assertEquals(0, register.getTotalCost("agent-a", "report.generate"));
    }

    @Test
    void shouldRejectNegativeAmount() {
        assertThrows(IllegalArgumentException.class, () -> register.debit("agent-a", -1));
    }

    @Test
    void shouldRefuseUnknownAndQuarantinedAgentsBeforeReadingAccount() {
        assertThrows(UnknownAgentException.class, () -> register.debit("ghost", 1));

        fixture.kernel.quarantine(OPERATOR, "agent-a", "suspicious");

        assertThrows(AgentQuarantinedException.class, () -> register.debit("agent-a", 1));
        assertEquals(100, register.getAccount("agent-a").getRemaining());
    }

    @Test
    void shouldNeverGoNegativeUnderConcurrentDebits() throws Exception {
        int threads = 16;
        int attemptsPerThread = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<DebitResult>>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                List<DebitResult> results = new ArrayList<>();
                for (int i = 0; i < attemptsPerThread; i++) {
                    results.add(register.debit("agent-a", 3));
                }
                return results;
            }));
        }
        start.countDown();
        long acceptedTotal = 0;
        int accepted = 0;
        for (Future<List<DebitResult>> future : futures) {
            for (DebitResult result : future.get(30, TimeUnit.SECONDS)) {
                assertTrue(result.getRemaining() >= 0);
                if (result.isAccepted()) {
                    acceptedTotal += result.getAmount();
                    accepted++;
                }
            }
        }
        executor.shutdown();

        BudgetAccount account = register.getAccount("agent-a");
        assertEquals(33, accepted);
        assertEquals(account.getAllocated() - account.getRemaining(), acceptedTotal);
        assertEquals(1, account.getRemaining());
        assertTrue(fixture.ledger.verifyChain().isIntact());
    }

    // ===== Allocation =====

    @Test
    void shouldAllocateUnderAuthorizerName() {
        BudgetAccount account = register.allocate("ops", "agent-a", 25);

        assertEquals(125, account.getAllocated());
        LedgerEntry entry = fixture.ledger.tail().orElseThrow();
        assertEquals(LedgerActions.BUDGET_ALLOCATED, entry.actionKind());
        assertEquals("ops", entry.actor());
    }

    @Test
    void shouldRefuseDebitsOnceBudgetWindowEnds() {
        BudgetAccount account = register.allocate("ops", "agent-a", 10, Duration.ofHours(24));
        assertEquals(KernelFixture.START.plus(Duration.ofHours(24)), account.getWindowEndsAt());
        assertEquals(KernelFixture.START.plus(Duration.ofHours(24)).toString(),
                fixture.ledger.tail().orElseThrow().payload().get("windowEndsAt"));

        fixture.clock.advance(Duration.ofHours(24));
        assertTrue(register.debit("agent-a", 5).isAccepted());

        fixture.clock.advance(Duration.ofSeconds(1));
        DebitResult expired = register.debit("agent-a", 5);

        assertFalse(expired.isAccepted());
        assertTrue(expired.getReason().startsWith("budget window expired"));
        assertEquals(105, register.getAccount("agent-a").getRemaining());
        assertEquals(EntryOutcome.FAILED, fixture.ledger.get(expired.getLedgerSequence()).orElseThrow().outcome());

        register.allocate("ops", "agent-a", 1, Duration.ofHours(1));
        assertTrue(register.debit("agent-a", 5).isAccepted());
    }

    @Test
    void shouldKeepWindowWhenAllocatingWithoutOne() {
        register.allocate("ops", "agent-a", 10, Duration.ofHours(1));

        BudgetAccount account = register.allocate("ops", "agent-a", 10);

        assertEquals(KernelFixture.START.plus(Duration.ofHours(1)), account.getWindowEndsAt());
        assertThrows(IllegalArgumentException.class,
                () -> register.allocate("ops", "agent-a", 10, Duration.ZERO));
    }

    @Test
    void shouldRejectNonPositiveAllocation() {
        assertThrows(IllegalArgumentException.class, () -> register.allocate("ops", "agent-a", 0));
        assertThrows(UnknownAgentException.class, () -> register.allocate("ops", "ghost", 5));
    }

    @Test
    void shouldRequireRegistrationEntryToOpenAccount() {
        LedgerEntry unrelated = fixture.ledger.tail().orElseThrow().toBuilder()
                .actionKind(LedgerActions.BUDGET_DEBIT)
                .build();

        assertThrows(IllegalArgumentException.class, () -> register.openAccount("agent-x", 10, unrelated));
        assertTrue(register.findAccount("agent-x").isEmpty());
    }

    @Test
    void shouldSummarizeAllAccounts() {
        fixture.kernel.registerAgent(OPERATOR, "agent-b", AgentType.REFLEX, 50);
        register.debit("agent-a", 10);
        register.debit("agent-b", 5);

        BudgetSummary summary = register.getSummary();

        assertEquals(2, summary.getAccounts().size());
        assertEquals(150, summary.getTotalAllocated());
        assertEquals(15, summary.getTotalConsumed());
        assertEquals(135, summary.getTotalRemaining());
    }

    // ===== Status changes =====

    @Test
    void shouldHoldQuarantineUntilAccountLockIsReleased() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        Future<DebitResult> holder = executor.submit(() -> register.underAccountLock("agent-a", () -> {
            held.countDown();
            awaitQuietly(release);
            return register.debit("agent-a", 1);
        }));
        assertTrue(held.await(5, TimeUnit.SECONDS));
        Future<?> quarantine = executor.submit(
                () -> fixture.guardian.quarantine("ops", "agent-a", "manual", "suspicious"));

        Thread.sleep(100);
        assertFalse(quarantine.isDone());
        release.countDown();

        assertTrue(holder.get(5, TimeUnit.SECONDS).isAccepted());
        quarantine.get(5, TimeUnit.SECONDS);
        executor.shutdown();
        assertThrows(AgentQuarantinedException.class, () -> register.debit("agent-a", 1));
    }

    // ===== Velocity =====

    @Test
    void shouldSignalDebitVelocityWithoutRejecting() {
        fixture.shutdown();
        fixture = KernelFixture.create(properties -> {
            properties.getBudget().setVelocityThreshold(2);
            properties.getBudget().setVelocityWindow(Duration.ofSeconds(1));
            properties.getGuardian().setVelocityStrikes(10);
        });
        fixture.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 100);

        fixture.budgetRegister.debit("agent-a", 1);
        fixture.budgetRegister.debit("agent-a", 1);
        DebitResult third = fixture.budgetRegister.debit("agent-a", 1);

        assertTrue(third.isAccepted());
        List<AnomalySignal> velocity = fixture.signals.stream()
                .filter(signal -> signal.type() == SignalType.DEBIT_VELOCITY)
                .toList();
        assertEquals(1, velocity.size());
        assertEquals(third.getLedgerSequence(), velocity.get(0).ledgerSequence());
    }

    @Test
    void shouldCountRejectedAttemptsTowardVelocity() {
        fixture.shutdown();
        fixture = KernelFixture.create(properties -> {
            properties.getBudget().setVelocityThreshold(1);
            properties.getGuardian().setVelocityStrikes(10);
        });
        fixture.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 1);

        fixture.budgetRegister.debit("agent-a", 5);
        fixture.budgetRegister.debit("agent-a", 5);

        assertEquals(1, fixture.signals.stream()
                .filter(signal -> signal.type() == SignalType.DEBIT_VELOCITY)
                .count());
    }

    // ===== Restore =====

    @Test
    void shouldReplaceAccountsAndPaidIntentsOnRestore() {
        register.debit("agent-a", 30, 1, "task.execute");
        LedgerEntry tail = fixture.ledger.tail().orElseThrow();
        ReplayState replayed = ReplayState.builder()
                .accounts(Map.of("agent-a", BudgetAccount.open("agent-a", 100)))
                .paidIntents(Set.of(7L))
                .build();

        register.restore(() -> replayed, tail);

        assertEquals(100, register.getAccount("agent-a").getRemaining());
        assertFalse(register.isPaid(1));
        assertTrue(register.isPaid(7));
        assertThrows(IllegalArgumentException.class, () -> register.restore(() -> replayed, null));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
