package me.golemcore.substrate.domain.guardian;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.agent.AgentRegistry;
import me.golemcore.substrate.domain.arbiter.Arbiter;
import me.golemcore.substrate.domain.arbiter.GlobalTransitionLock;
import me.golemcore.substrate.domain.budget.BudgetRegister;
import me.golemcore.substrate.domain.exception.AgentTerminatedException;
import me.golemcore.substrate.domain.exception.UnknownCheckpointException;
import me.golemcore.substrate.domain.ledger.Ledger;
import me.golemcore.substrate.domain.ledger.LedgerReplayer;
import me.golemcore.substrate.domain.ledger.LedgerWrite;
import me.golemcore.substrate.domain.ledger.ReplayState;
import me.golemcore.substrate.domain.model.Agent;
import me.golemcore.substrate.domain.model.AgentStatus;
import me.golemcore.substrate.domain.model.AnomalySignal;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.Checkpoint;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.PayloadKeys;
import me.golemcore.substrate.domain.model.QuarantineRecord;
import me.golemcore.substrate.domain.model.QuarantineStatus;
import me.golemcore.substrate.domain.model.ReviewFlag;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Behavioral monitor that isolates or reverts misbehaving agents.
 *
 * <p>
 * Anomaly signals from the Budget Register, the Arbiter and the kernel facade
 * are run through the configured {@link GuardianRule rules}. A firing rule
 * quarantines the agent. Rule evaluation is bounded by
 * {@code substrate.guardian.evaluation-timeout}: past it the action stays
 * allowed, a review flag is recorded and the late verdict resolves it. A
 * background sweeper quarantines agents whose flags outlive
 * {@code review-deadline} and releases expired quarantines.
 *
 * <p>
 * Rollback and checkpoint creation share the {@link GlobalTransitionLock} with
 * mode transitions.
 */
@Service
@Slf4j
public class Guardian {

    private static final String EXPIRED_REVIEW_RULE = "review-deadline";

    private final Ledger ledger;
    private final LedgerReplayer replayer;
    private final AgentRegistry agentRegistry;
    private final BudgetRegister budgetRegister;
    private final Arbiter arbiter;
    private final GlobalTransitionLock transitionLock;
    private final List<GuardianRule> rules;
    private final SubstrateProperties.GuardianProperties settings;
    private final Clock clock;

    private final Object quarantineLock = new Object();
    private final Map<String, QuarantineRecord> quarantines = new ConcurrentHashMap<>();
    private final Map<String, Integer> quarantineCounts = new ConcurrentHashMap<>();
    private final Map<String, ReviewFlag> reviewFlags = new ConcurrentHashMap<>();

    // Guarded by transitionLock.
    private final Map<String, Checkpoint> checkpoints = new LinkedHashMap<>();
    private Checkpoint activeCheckpoint;

    private final ExecutorService evaluator;
    private ScheduledExecutorService sweeper;
    private ScheduledFuture<?> sweepTask;

    public Guardian(Ledger ledger, LedgerReplayer replayer, AgentRegistry agentRegistry,
            BudgetRegister budgetRegister, Arbiter arbiter, GlobalTransitionLock transitionLock,
            List<GuardianRule> rules, SubstrateProperties properties, Clock clock) {
        this.ledger = ledger;
        this.replayer = replayer;
        this.agentRegistry = agentRegistry;
        this.budgetRegister = budgetRegister;
        this.arbiter = arbiter;
        this.transitionLock = transitionLock;
        this.rules = List.copyOf(rules);
        this.settings = properties.getGuardian();
        this.clock = clock;
        AtomicInteger threadCounter = new AtomicInteger();
        this.evaluator = Executors.newFixedThreadPool(Math.max(1, settings.getEvaluatorThreads()), r -> {
            Thread t = new Thread(r, "guardian-evaluator-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void start() {
        long intervalMillis = Math.max(1, settings.getSweepInterval().toMillis());
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "guardian-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweepTask = sweeper.scheduleAtFixedRate(this::sweepSafely, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[Guardian] Started with rules {} (sweep every {})",
                rules.stream().map(GuardianRule::getName).toList(), settings.getSweepInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (sweeper != null) {
            sweeper.shutdown();
        }
        evaluator.shutdown();
        try {
            if (!evaluator.awaitTermination(5, TimeUnit.SECONDS)) {
                evaluator.shutdownNow();
            }
        } catch (InterruptedException e) {
            evaluator.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @EventListener
    public void onSignal(AnomalySignal signal) {
        evaluate(signal.agentId(), signal);
    }

    /**
     * Run the rules against a signal.
     *
     * @return the quarantine created by a firing rule, empty when nothing fired
     *         or when the verdict was deferred to re-review
     */
    public Optional<QuarantineRecord> evaluate(String agentId, AnomalySignal signal) {
        CompletableFuture<Optional<RuleFiring>> verdict = CompletableFuture.supplyAsync(
                () -> runRules(signal), evaluator);
        Optional<RuleFiring> firing;
        try {
            firing = verdict.get(settings.getEvaluationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ReviewFlag flag = flagForReview(agentId, signal);
            verdict.whenComplete((late, error) -> resolveReview(flag, late, error));
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Guardian rule evaluation failed for " + agentId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while evaluating rules for " + agentId, e);
        }
        return firing.flatMap(fired -> quarantineIfActive(agentId, fired.rule(), fired.reason()));
    }

    /**
     * Quarantine an agent. Returns the existing record if it is already
     * quarantined.
     *
     * <p>
     * The status change is committed while holding the global transition lock
     * and the agent's account lock, so no debit, intent or mode request of the
     * agent is accepted after the quarantine entry.
     */
    public QuarantineRecord quarantine(String actorId, String agentId, String rule, String reason) {
        Placement placement = outOfService(agentId, () -> placeQuarantine(actorId, agentId, rule, reason));
        QuarantineRecord record = placement.record();
        if (!placement.fresh()) {
            return record;
        }
        log.warn("[Guardian] Quarantined {} by {} ({}): {} (ledger #{})", agentId, actorId, rule, reason,
                record.getLedgerSequence());
        int escalateAfter = settings.getTerminationAfterQuarantines();
        if (escalateAfter > 0 && placement.count() >= escalateAfter) {
            terminate(Caller.SYSTEM_GUARDIAN, agentId,
                    placement.count() + " quarantines reached the termination threshold");
            return quarantines.get(agentId);
        }
        return record;
    }

    /**
     * Lift an active quarantine.
     *
     * @throws IllegalStateException
     *             if the agent is not quarantined
     */
    public QuarantineRecord release(String actorId, String agentId, String reason) {
        QuarantineRecord released;
        synchronized (quarantineLock) {
            QuarantineRecord record = quarantines.get(agentId);
            Agent agent = agentRegistry.require(agentId);
            if (record == null || !record.isActive() || agent.getStatus() != AgentStatus.QUARANTINED) {
                throw new IllegalStateException("agent " + agentId + " is not quarantined");
            }
            LedgerEntry entry = ledger.commit(LedgerWrite.builder()
                    .actor(actorId)
                    .actionKind(LedgerActions.AGENT_RELEASED)
                    .detail(PayloadKeys.AGENT_ID, agentId)
                    .detail(PayloadKeys.REASON, reason)
                    .build(), recorded -> {
                        agentRegistry.changeStatus(agentId, AgentStatus.ACTIVE, recorded);
                        quarantines.put(agentId,
                                record.close(QuarantineStatus.RELEASED, actorId, recorded.timestamp()));
                    });
            rules.forEach(rule -> rule.reset(agentId));
            released = quarantines.get(agentId);
            log.info("[Guardian] Released {} by {}: {} (ledger #{})", agentId, actorId, reason, entry.sequence());
        }
        return released;
    }

    /**
     * Permanently terminate an agent. Every later operation from it fails with
     * {@link AgentTerminatedException}.
     */
    public Agent terminate(String actorId, String agentId, String reason) {
        return outOfService(agentId, () -> {
            Agent agent = agentRegistry.require(agentId);
            if (agent.getStatus() == AgentStatus.TERMINATED) {
                throw new AgentTerminatedException("agent " + agentId + " is already terminated",
                        agent.getStatusLedgerSequence());
            }
            AtomicReference<Agent> terminated = new AtomicReference<>();
            LedgerEntry entry = ledger.commit(LedgerWrite.builder()
                    .actor(actorId)
                    .actionKind(LedgerActions.AGENT_TERMINATED)
                    .detail(PayloadKeys.AGENT_ID, agentId)
                    .detail(PayloadKeys.REASON, reason)
                    .build(), recorded -> {
                        terminated.set(agentRegistry.changeStatus(agentId, AgentStatus.TERMINATED, recorded));
                        quarantines.computeIfPresent(agentId, (id, record) -> record.isActive()
                                ? record.close(QuarantineStatus.ESCALATED_TO_TERMINATION, actorId,
                                        recorded.timestamp())
                                : record);
                    });
            log.warn("[Guardian] Terminated {} by {}: {} (ledger #{})", agentId, actorId, reason, entry.sequence());
            return terminated.get();
        });
    }

    /**
     * Designate the current ledger tail as a rollback target.
     */
    public Checkpoint createCheckpoint(String actorId, String description) {
        return transitionLock.execute(() -> {
            long target = ledger.tailSequence();
            String id = UUID.randomUUID().toString();
            String text = description == null ? "" : description;
            AtomicReference<Checkpoint> created = new AtomicReference<>();
            ledger.commit(LedgerWrite.builder()
                    .actor(actorId)
                    .actionKind(LedgerActions.CHECKPOINT_CREATED)
                    .detail(PayloadKeys.CHECKPOINT_ID, id)
                    .detail(PayloadKeys.TARGET_SEQUENCE, target)
                    .detail(PayloadKeys.DESCRIPTION, text)
                    .build(), recorded -> {
                        Checkpoint checkpoint = Checkpoint.builder()
                                .id(id)
                                .sequence(target)
                                .createdBy(actorId)
                                .createdAt(recorded.timestamp())
                                .description(text)
                                .build();
                        checkpoints.put(id, checkpoint);
                        created.set(checkpoint);
                    });
            log.info("[Guardian] Checkpoint {} at ledger #{} by {}", id, target, actorId);
            return created.get();
        });
    }

    /**
     * Make {@code checkpointId} the authoritative position. Nothing is deleted:
     * the rollback entry tells replay to resume from the branch exactly as it
     * stood when the checkpoint was taken, and Budget and Mode are rebuilt from
     * that branch. Agent status is left as it is.
     */
    public LedgerEntry rollback(String actorId, String checkpointId) {
        return transitionLock.execute(() -> {
            Checkpoint checkpoint = checkpoints.get(checkpointId);
            if (checkpoint == null) {
                throw new UnknownCheckpointException(checkpointId);
            }
            AtomicReference<ReplayState> replayed = new AtomicReference<>();
            LedgerEntry entry = ledger.commit(LedgerWrite.builder()
                    .actor(actorId)
                    .actionKind(LedgerActions.ROLLBACK)
                    .detail(PayloadKeys.CHECKPOINT_ID, checkpointId)
                    .detail(PayloadKeys.TARGET_SEQUENCE, checkpoint.sequence())
                    .build(), recorded -> {
                        budgetRegister.restore(() -> {
                            replayed.set(replayer.replay(ledger.all()));
                            return replayed.get();
                        }, recorded);
                        arbiter.restoreMode(replayed.get().getMode(), recorded);
                        activeCheckpoint = checkpoint;
                    });
            log.warn("[Guardian] Rolled back to checkpoint {} (ledger #{}) by {}; mode now {}", checkpointId,
                    checkpoint.sequence(), actorId, replayed.get().getMode().getMode());
            return entry;
        });
    }

    /**
     * Quarantine agents whose review flag is overdue and release expired
     * quarantines. Runs on the sweeper thread.
     */
    public void sweep() {
        Instant now = clock.instant();
        for (ReviewFlag flag : new ArrayList<>(reviewFlags.values())) {
            if (flag.isOverdue(now) && reviewFlags.remove(flag.id()) != null) {
                recordReviewResolution(flag, "EXPIRED");
                quarantineIfActive(flag.agentId(), EXPIRED_REVIEW_RULE,
                        "review of " + flag.signalType() + " flagged at ledger #" + flag.ledgerSequence()
                                + " unresolved by " + flag.deadline());
            }
        }
        for (QuarantineRecord record : new ArrayList<>(quarantines.values())) {
            if (record.isExpired(now)) {
                try {
                    release(Caller.SYSTEM_GUARDIAN, record.getAgentId(), "quarantine expired at "
                            + record.getExpiresAt());
                } catch (IllegalStateException e) {
                    log.debug("[Guardian] Expired quarantine of {} already lifted", record.getAgentId());
                }
            }
        }
    }

    /**
     * Install state rebuilt from the ledger at start.
     */
    public void restore(ReplayState state) {
        synchronized (quarantineLock) {
            quarantines.clear();
            quarantines.putAll(state.getQuarantines());
            quarantineCounts.clear();
            quarantineCounts.putAll(state.getQuarantineCounts());
        }
        transitionLock.execute(() -> {
            checkpoints.clear();
            state.getCheckpoints().forEach(checkpoint -> checkpoints.put(checkpoint.id(), checkpoint));
            return checkpoints.size();
        });
    }

    public Optional<QuarantineRecord> findQuarantine(String agentId) {
        return Optional.ofNullable(quarantines.get(agentId));
    }

    public List<QuarantineRecord> listQuarantines() {
        return quarantines.values().stream()
                .sorted(Comparator.comparing(QuarantineRecord::getCreatedAt))
                .toList();
    }

    public List<Checkpoint> listCheckpoints() {
        return transitionLock.execute(() -> List.copyOf(checkpoints.values()));
    }

    public Optional<Checkpoint> getActiveCheckpoint() {
        return transitionLock.execute(() -> Optional.ofNullable(activeCheckpoint));
    }

    public Collection<ReviewFlag> listReviewFlags() {
        return List.copyOf(reviewFlags.values());
    }

    private Optional<RuleFiring> runRules(AnomalySignal signal) {
        Optional<RuleFiring> firing = Optional.empty();
        for (GuardianRule rule : rules) {
            Optional<RuleFiring> result = rule.evaluate(signal);
            if (firing.isEmpty() && result.isPresent()) {
                firing = result;
            }
        }
        return firing;
    }

    /**
     * Lock order for taking an agent out of service: transition lock, then the
     * quarantine monitor, then the agent's account lock.
     */
    private <T> T outOfService(String agentId, Supplier<T> statusChange) {
        return transitionLock.execute(() -> {
            synchronized (quarantineLock) {
                return budgetRegister.underAccountLock(agentId, statusChange);
            }
        });
    }

    private Placement placeQuarantine(String actorId, String agentId, String rule, String reason) {
        Agent agent = agentRegistry.require(agentId);
        if (agent.getStatus() == AgentStatus.TERMINATED) {
            throw new AgentTerminatedException("agent " + agentId + " is terminated",
                    agent.getStatusLedgerSequence());
        }
        QuarantineRecord existing = quarantines.get(agentId);
        if (agent.getStatus() == AgentStatus.QUARANTINED && existing != null && existing.isActive()) {
            return new Placement(existing, quarantineCounts.getOrDefault(agentId, 0), false);
        }
        Instant now = clock.instant();
        Instant expiresAt = settings.getQuarantineExpiry().isZero() ? null
                : now.plus(settings.getQuarantineExpiry());
        LedgerWrite.LedgerWriteBuilder write = LedgerWrite.builder()
                .actor(actorId)
                .actionKind(LedgerActions.AGENT_QUARANTINED)
                .detail(PayloadKeys.AGENT_ID, agentId)
                .detail(PayloadKeys.RULE, rule)
                .detail(PayloadKeys.REASON, reason);
        if (expiresAt != null) {
            write.detail(PayloadKeys.EXPIRES_AT, expiresAt.toString());
        }
        AtomicReference<QuarantineRecord> created = new AtomicReference<>();
        ledger.commit(write.build(), recorded -> {
            agentRegistry.changeStatus(agentId, AgentStatus.QUARANTINED, recorded);
            QuarantineRecord fresh = QuarantineRecord.builder()
                    .agentId(agentId)
                    .triggerRule(rule)
                    .reason(reason)
                    .createdAt(recorded.timestamp())
                    .status(QuarantineStatus.ACTIVE)
                    .expiresAt(expiresAt)
                    .ledgerSequence(recorded.sequence())
                    .build();
            quarantines.put(agentId, fresh);
            created.set(fresh);
        });
        return new Placement(created.get(), quarantineCounts.merge(agentId, 1, Integer::sum), true);
    }

    private Optional<QuarantineRecord> quarantineIfActive(String agentId, String rule, String reason) {
        Optional<Agent> agent = agentRegistry.find(agentId);
        if (agent.isEmpty() || !agent.get().isActive()) {
            log.debug("[Guardian] Rule {} fired for {} which is not active, ignoring", rule, agentId);
            return Optional.empty();
        }
        return Optional.of(quarantine(Caller.SYSTEM_GUARDIAN, agentId, rule, reason));
    }

    private ReviewFlag flagForReview(String agentId, AnomalySignal signal) {
        Instant now = clock.instant();
        Duration deadline = settings.getReviewDeadline();
        String flagId = UUID.randomUUID().toString();
        LedgerEntry entry = ledger.append(LedgerWrite.builder()
                .actor(Caller.SYSTEM_GUARDIAN)
                .actionKind(LedgerActions.REVIEW_FLAGGED)
                .detail(PayloadKeys.FLAG_ID, flagId)
                .detail(PayloadKeys.AGENT_ID, agentId)
                .detail(PayloadKeys.SIGNAL, signal.type().name())
                .detail(PayloadKeys.DEADLINE, now.plus(deadline).toString())
                .build());
        ReviewFlag flag = ReviewFlag.builder()
                .id(flagId)
                .agentId(agentId)
                .signalType(signal.type())
                .flaggedAt(entry.timestamp())
                .deadline(now.plus(deadline))
                .ledgerSequence(entry.sequence())
                .build();
        reviewFlags.put(flagId, flag);
        log.warn("[Guardian] Rule evaluation for {} exceeded {}; action allowed, flagged for review (ledger #{})",
                agentId, settings.getEvaluationTimeout(), entry.sequence());
        return flag;
    }

    private void resolveReview(ReviewFlag flag, Optional<RuleFiring> verdict, Throwable error) {
        if (error != null) {
            log.warn("[Guardian] Deferred evaluation for {} failed, flag {} left for the sweeper: {}",
                    flag.agentId(), flag.id(), error.getMessage());
            return;
        }
        if (reviewFlags.remove(flag.id()) == null) {
            return;
        }
        boolean fired = verdict != null && verdict.isPresent();
        recordReviewResolution(flag, fired ? "QUARANTINED" : "CLEARED");
        if (fired) {
            quarantineIfActive(flag.agentId(), verdict.get().rule(), verdict.get().reason());
        }
    }

    private void recordReviewResolution(ReviewFlag flag, String verdict) {
        LedgerEntry entry = ledger.append(LedgerWrite.builder()
                .actor(Caller.SYSTEM_GUARDIAN)
                .actionKind(LedgerActions.REVIEW_RESOLVED)
                .detail(PayloadKeys.FLAG_ID, flag.id())
                .detail(PayloadKeys.AGENT_ID, flag.agentId())
                .detail(PayloadKeys.VERDICT, verdict)
                .build());
        log.info("[Guardian] Review {} of {} resolved as {} (ledger #{})", flag.id(), flag.agentId(), verdict,
                entry.sequence());
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[Guardian] Sweep failed", e);
        }
    }

    private record Placement(QuarantineRecord record, int count, boolean fresh) {
    }
}
