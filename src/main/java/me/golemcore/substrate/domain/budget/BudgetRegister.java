package me.golemcore.substrate.domain.budget;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.agent.AgentRegistry;
import me.golemcore.substrate.domain.exception.UnknownAgentException;
import me.golemcore.substrate.domain.ledger.Ledger;
import me.golemcore.substrate.domain.ledger.LedgerWrite;
import me.golemcore.substrate.domain.ledger.ReplayState;
import me.golemcore.substrate.domain.model.AnomalySignal;
import me.golemcore.substrate.domain.model.BudgetAccount;
import me.golemcore.substrate.domain.model.BudgetSummary;
import me.golemcore.substrate.domain.model.DebitResult;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.PayloadKeys;
import me.golemcore.substrate.domain.model.SignalType;
import me.golemcore.substrate.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-agent cost accounting. No action executes unless it is paid for.
 *
 * <p>
 * Each account has its own lock; the check-and-decrement of a debit and the
 * ledger entry recording it happen while that lock is held, so concurrent
 * debits for one agent never lose updates while distinct agents never block
 * each other. Accounts are immutable snapshots swapped on every committed
 * change.
 *
 * <p>
 * Agent status is checked again once the account lock is held, and the
 * Guardian takes the same lock to quarantine or terminate, so no debit is
 * accepted for an agent after the entry that took it out of service.
 */
@Service
@Slf4j
public class BudgetRegister {

    private final Ledger ledger;
    private final AgentRegistry agentRegistry;
    private final CostTable costTable;
    private final DebitVelocityMonitor velocityMonitor;
    private final SpringEventBus eventBus;
    private final Clock clock;

    private final Map<String, BudgetAccount> accounts = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<Long> paidIntents = ConcurrentHashMap.newKeySet();

    public BudgetRegister(Ledger ledger, AgentRegistry agentRegistry, CostTable costTable,
            DebitVelocityMonitor velocityMonitor, SpringEventBus eventBus, Clock clock) {
        this.ledger = ledger;
        this.agentRegistry = agentRegistry;
        this.costTable = costTable;
        this.velocityMonitor = velocityMonitor;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public long quote(String actionKind) {
        return costTable.quote(actionKind);
    }

    /**
     * Debit {@code amount} from the agent's account.
     *
     * <p>
     * A rejected debit leaves the account unchanged and is still recorded as a
     * {@code Failed} entry. Quarantined and terminated agents are refused before
     * the account is looked at.
     */
    public DebitResult debit(String agentId, long amount) {
        return debit(agentId, amount, 0L, BudgetAccount.UNATTRIBUTED);
    }

    /**
     * Debit bound to an intent. An intent is paid at most once; the cost type
     * is the intent's action kind.
     *
     * @throws IllegalArgumentException
     *             if the intent was already paid
     */
    public DebitResult debit(String agentId, long amount, long intentSequence, String costType) {
        if (amount < 0) {
            throw new IllegalArgumentException("debit amount must not be negative");
        }
        agentRegistry.admit(agentId, "debit");
        ReentrantLock lock = lockFor(agentId);
        DebitResult result;
        lock.lock();
        try {
            // Status may have changed while waiting for the lock.
            agentRegistry.admit(agentId, "debit");
            if (intentSequence > 0 && paidIntents.contains(intentSequence)) {
                throw new IllegalArgumentException("intent #" + intentSequence + " is already paid");
            }
            String type = costType == null ? BudgetAccount.UNATTRIBUTED : costType;
            BudgetAccount account = requireAccount(agentId);
            String refusal = refusalOf(account, amount, clock.instant());
            if (refusal != null) {
                LedgerEntry entry = ledger.append(
                        debitWrite(agentId, amount, account.getRemaining(), intentSequence, type)
                                .detail(PayloadKeys.REASON, refusal)
                                .outcome(EntryOutcome.FAILED)
                                .build());
                log.warn("[Budget] Debit of {} rejected for {}: {} (ledger #{})", amount, agentId, refusal,
                        entry.sequence());
                result = DebitResult.rejected(agentId, amount, account.getRemaining(), entry.sequence(), refusal);
            } else {
                BudgetAccount debited = account.withDebit(amount, type);
                LedgerEntry entry = ledger.commit(
                        debitWrite(agentId, amount, debited.getRemaining(), intentSequence, type).build(),
                        recorded -> {
                            accounts.put(agentId, debited);
                            if (intentSequence > 0) {
                                paidIntents.add(intentSequence);
                            }
                        });
                log.debug("[Budget] Debited {} ({}) from {}: remaining {} (ledger #{})", amount, type, agentId,
                        debited.getRemaining(), entry.sequence());
                result = DebitResult.accepted(agentId, amount, debited.getRemaining(), entry.sequence());
            }
        } finally {
            lock.unlock();
        }
        observeVelocity(agentId, result.getLedgerSequence());
        return result;
    }

    public boolean isPaid(long intentSequence) {
        return paidIntents.contains(intentSequence);
    }

    /**
     * Run {@code action} while holding the agent's account lock. Status changes
     * that must not interleave with a debit go through here.
     */
    public <T> T underAccountLock(String agentId, Supplier<T> action) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Privileged top-up. The entry names the authorizer as its actor. Privilege
     * is checked by the caller.
     */
    public BudgetAccount allocate(String authorizedBy, String agentId, long amount) {
        return allocate(authorizedBy, agentId, amount, null);
    }

    /**
     * Top-up that also opens a new budget window of length {@code window}
     * starting now. A null window keeps the current one.
     */
    public BudgetAccount allocate(String authorizedBy, String agentId, long amount, Duration window) {
        if (amount <= 0) {
            throw new IllegalArgumentException("allocation must be positive");
        }
        if (window != null && (window.isNegative() || window.isZero())) {
            throw new IllegalArgumentException("budget window must be positive");
        }
        agentRegistry.require(agentId);
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            BudgetAccount replenished = requireAccount(agentId).withAllocation(amount);
            LedgerWrite.LedgerWriteBuilder write = LedgerWrite.builder()
                    .actor(authorizedBy)
                    .actionKind(LedgerActions.BUDGET_ALLOCATED)
                    .detail(PayloadKeys.AGENT_ID, agentId)
                    .detail(PayloadKeys.AMOUNT, amount)
                    .detail(PayloadKeys.ALLOCATED, replenished.getAllocated());
            if (window != null) {
                Instant endsAt = clock.instant().plus(window);
                replenished = replenished.withWindow(endsAt);
                write.detail(PayloadKeys.WINDOW_ENDS_AT, endsAt.toString());
            }
            BudgetAccount installed = replenished;
            LedgerEntry entry = ledger.commit(write.build(), recorded -> accounts.put(agentId, installed));
            log.info("[Budget] {} allocated {} to {}: remaining {} (ledger #{})", authorizedBy, amount, agentId,
                    replenished.getRemaining(), entry.sequence());
            return installed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Create the account of a newly registered agent.
     */
    public void openAccount(String agentId, long allocation, LedgerEntry recordedBy) {
        requireEntry(recordedBy, LedgerActions.AGENT_REGISTERED);
        accounts.putIfAbsent(agentId, BudgetAccount.open(agentId, allocation));
    }

    /**
     * Replace all accounts and paid intents with replayed ones. Called by
     * rollback and on start, with the entry that made the replay necessary. The
     * replay runs while every account lock is held, so no debit lands between
     * reading the ledger and installing its result.
     */
    public void restore(Supplier<ReplayState> replay, LedgerEntry recordedBy) {
        if (recordedBy == null) {
            throw new IllegalArgumentException("restore requires its ledger entry");
        }
        List<ReentrantLock> held = accounts.keySet().stream().sorted().map(this::lockFor).toList();
        held.forEach(ReentrantLock::lock);
        try {
            ReplayState state = replay.get();
            Map<String, BudgetAccount> replayed = state.getAccounts();
            accounts.keySet().retainAll(replayed.keySet());
            accounts.putAll(replayed);
            paidIntents.clear();
            paidIntents.addAll(state.getPaidIntents());
            log.info("[Budget] Restored {} accounts from ledger #{}", replayed.size(), recordedBy.sequence());
        } finally {
            held.forEach(ReentrantLock::unlock);
        }
    }

    public Optional<BudgetAccount> findAccount(String agentId) {
        return Optional.ofNullable(accounts.get(agentId));
    }

    public BudgetAccount getAccount(String agentId) {
        return requireAccount(agentId);
    }

    public long getTotalConsumed(String agentId) {
        return requireAccount(agentId).getConsumed();
    }

    /**
     * Consumption of one cost type; a null type means all types.
     */
    public long getTotalCost(String agentId, String costType) {
        BudgetAccount account = requireAccount(agentId);
        return costType == null ? account.getConsumed() : account.getConsumed(costType);
    }

    public BudgetSummary getSummary() {
        List<BudgetAccount> snapshot = accounts.values().stream()
                .sorted(Comparator.comparing(BudgetAccount::getAgentId))
                .toList();
        long allocated = snapshot.stream().mapToLong(BudgetAccount::getAllocated).sum();
        long consumed = snapshot.stream().mapToLong(BudgetAccount::getConsumed).sum();
        return BudgetSummary.builder()
                .accounts(snapshot)
                .totalAllocated(allocated)
                .totalConsumed(consumed)
                .build();
    }

    private void observeVelocity(String agentId, long ledgerSequence) {
        Instant now = clock.instant();
        int attempts = velocityMonitor.record(agentId, now);
        if (velocityMonitor.exceeds(attempts)) {
            String detail = attempts + " debits within " + velocityMonitor.getWindow()
                    + " (threshold " + velocityMonitor.getThreshold() + ")";
            log.warn("[Budget] Debit velocity anomaly for {}: {}", agentId, detail);
            eventBus.publish(new AnomalySignal(agentId, SignalType.DEBIT_VELOCITY, detail, now, ledgerSequence));
        }
    }

    private static String refusalOf(BudgetAccount account, long amount, Instant now) {
        if (account.isExpired(now)) {
            return "budget window expired at " + account.getWindowEndsAt();
        }
        if (!account.covers(amount)) {
            return "insufficient budget: requested " + amount + ", remaining " + account.getRemaining();
        }
        return null;
    }

    private LedgerWrite.LedgerWriteBuilder debitWrite(String agentId, long amount, long remaining,
            long intentSequence, String costType) {
        LedgerWrite.LedgerWriteBuilder builder = LedgerWrite.builder()
                .actor(agentId)
                .actionKind(LedgerActions.BUDGET_DEBIT)
                .detail(PayloadKeys.AGENT_ID, agentId)
                .detail(PayloadKeys.AMOUNT, amount)
                .detail(PayloadKeys.REMAINING, remaining)
                .detail(PayloadKeys.COST_TYPE, costType);
        if (intentSequence > 0) {
            builder.detail(PayloadKeys.INTENT_SEQUENCE, intentSequence);
        }
        return builder;
    }

    private BudgetAccount requireAccount(String agentId) {
        BudgetAccount account = accounts.get(agentId);
        if (account == null) {
            throw new UnknownAgentException("no budget account for agent " + agentId, null);
        }
        return account;
    }

    private ReentrantLock lockFor(String agentId) {
        return locks.computeIfAbsent(agentId, id -> new ReentrantLock());
    }

    private static void requireEntry(LedgerEntry entry, String actionKind) {
        if (entry == null || !actionKind.equals(entry.actionKind())) {
            throw new IllegalArgumentException("state change requires a " + actionKind + " ledger entry");
        }
    }
}
