package me.golemcore.substrate.domain.arbiter;

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
import me.golemcore.substrate.domain.ledger.Ledger;
import me.golemcore.substrate.domain.ledger.LedgerWrite;
import me.golemcore.substrate.domain.model.AnomalySignal;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.ConflictResolution;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.ModeChangeRequest;
import me.golemcore.substrate.domain.model.ModeState;
import me.golemcore.substrate.domain.model.PayloadKeys;
import me.golemcore.substrate.domain.model.SignalType;
import me.golemcore.substrate.domain.model.SystemMode;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import me.golemcore.substrate.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sole authority over the system's operational mode.
 *
 * <p>
 * Every mode change goes through
 * {@link #requestModeChange(Caller, SystemMode, String)}. The request is
 * recorded, evaluated by {@link ArbitrationPolicy} and resolved exactly once;
 * an approval mutates the mode in the same step as its ledger entry, under the
 * {@link GlobalTransitionLock}. Denials are never retried by the kernel.
 *
 * <p>
 * The Arbiter also records operator decisions on conflicts between agents.
 * Those are ledgered and listed but change no state.
 */
@Service
@Slf4j
public class Arbiter {

    public static final String ACTOR = "system:arbiter";

    private final Ledger ledger;
    private final AgentRegistry agentRegistry;
    private final ArbitrationPolicy policy;
    private final GlobalTransitionLock transitionLock;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final Duration thrashWindow;

    // Guarded by transitionLock.
    private ModeState state;
    private final Deque<Instant> transitions = new ArrayDeque<>();
    private final List<ModeChangeRequest> history = new ArrayList<>();
    private final List<ConflictResolution> conflicts = new ArrayList<>();

    public Arbiter(Ledger ledger, AgentRegistry agentRegistry, ArbitrationPolicy policy,
            GlobalTransitionLock transitionLock, SpringEventBus eventBus, SubstrateProperties properties,
            Clock clock) {
        this.ledger = ledger;
        this.agentRegistry = agentRegistry;
        this.policy = policy;
        this.transitionLock = transitionLock;
        this.eventBus = eventBus;
        this.clock = clock;
        this.thrashWindow = properties.getArbiter().getThrashWindow();
        this.state = ModeState.initial(clock.instant());
    }

    /**
     * Submit and resolve a mode-change request.
     *
     * @return the resolved request; call {@link ModeChangeRequest#orThrow()} to
     *         turn a denial into an exception
     */
    public ModeChangeRequest requestModeChange(Caller requester, SystemMode target, String justification) {
        if (target == null) {
            throw new IllegalArgumentException("target mode is required");
        }
        String operation = "mode change to " + target;
        if (requester.isAgent()) {
            agentRegistry.admit(requester.getId(), operation);
        }
        ModeChangeRequest resolved = transitionLock.execute(() -> {
            // Quarantine takes this lock too; check again now that it is held.
            if (requester.isAgent()) {
                agentRegistry.admit(requester.getId(), operation);
            }
            return resolve(requester, target, justification);
        });
        if (requester.isAgent()) {
            SignalType type = resolved.isApproved() ? SignalType.MODE_REQUEST_APPROVED : SignalType.MODE_REQUEST_DENIED;
            eventBus.publish(new AnomalySignal(requester.getId(), type, resolved.getReason(), resolved.getResolvedAt(),
                    resolved.getResolutionLedgerSequence()));
        }
        return resolved;
    }

    private ModeChangeRequest resolve(Caller requester, SystemMode target, String justification) {
        Instant now = clock.instant();
        pruneWindow(now);
        SystemMode from = state.getMode();
        String requestId = UUID.randomUUID().toString();
        String why = justification == null ? "" : justification;

        LedgerEntry requested = ledger.append(LedgerWrite.builder()
                .actor(requester.getId())
                .actionKind(LedgerActions.MODE_REQUESTED)
                .detail(PayloadKeys.REQUEST_ID, requestId)
                .detail(PayloadKeys.FROM_MODE, from.name())
                .detail(PayloadKeys.TARGET_MODE, target.name())
                .detail(PayloadKeys.PRIVILEGE, requester.getPrivilege().name())
                .detail(PayloadKeys.JUSTIFICATION, why)
                .outcome(EntryOutcome.INTENT)
                .build());
        ModeChangeRequest pending = ModeChangeRequest.builder()
                .id(requestId)
                .requesterId(requester.getId())
                .requesterPrivilege(requester.getPrivilege())
                .fromMode(from)
                .targetMode(target)
                .justification(why)
                .submittedAt(requested.timestamp())
                .requestLedgerSequence(requested.sequence())
                .build();

        ArbitrationPolicy.Decision decision = policy.evaluate(from, target, transitions.size(),
                requester.getPrivilege());
        LedgerWrite.LedgerWriteBuilder resolution = LedgerWrite.builder()
                .actor(ACTOR)
                .actionKind(LedgerActions.MODE_RESOLVED)
                .detail(PayloadKeys.REQUEST_ID, requestId)
                .detail(PayloadKeys.FROM_MODE, from.name())
                .detail(PayloadKeys.TARGET_MODE, target.name())
                .detail(PayloadKeys.RESOLUTION, decision.approved() ? "APPROVED" : "DENIED")
                .detail(PayloadKeys.REASON, decision.reason());

        ModeChangeRequest resolved;
        if (decision.approved()) {
            LedgerEntry entry = ledger.commit(resolution.build(), recorded -> {
                transitions.addLast(recorded.timestamp());
                state = ModeState.builder()
                        .mode(target)
                        .enteredAt(recorded.timestamp())
                        .transitionsInWindow(transitions.size())
                        .ledgerSequence(recorded.sequence())
                        .build();
            });
            resolved = pending.approve(entry.actor(), entry.timestamp(), entry.sequence());
            log.info("[Arbiter] Mode {} -> {} approved for {} (ledger #{})", from, target, requester.getId(),
                    entry.sequence());
        } else {
            LedgerEntry entry = ledger.append(resolution
                    .detail(PayloadKeys.DENIAL_KIND, decision.denialKind().name())
                    .outcome(EntryOutcome.FAILED)
                    .build());
            resolved = pending.deny(decision.denialKind(), decision.reason(), entry.actor(), entry.timestamp(),
                    entry.sequence());
            log.warn("[Arbiter] Mode {} -> {} denied for {}: {} (ledger #{})", from, target, requester.getId(),
                    decision.reason(), entry.sequence());
        }
        history.add(resolved);
        return resolved;
    }

    /**
     * Record how an operator settled a conflict between agents.
     *
     * @throws IllegalArgumentException
     *             if the type or resolution is blank, no agent is named, or an
     *             agent is unknown
     */
    public ConflictResolution resolveConflict(String resolvedBy, String conflictType, List<String> agentIds,
            String resolution) {
        if (conflictType == null || conflictType.isBlank()) {
            throw new IllegalArgumentException("conflict type is required");
        }
        if (resolution == null || resolution.isBlank()) {
            throw new IllegalArgumentException("resolution is required");
        }
        if (agentIds == null || agentIds.isEmpty()) {
            throw new IllegalArgumentException("a conflict involves at least one agent");
        }
        List<String> involved = agentIds.stream().distinct().toList();
        involved.forEach(agentId -> agentRegistry.find(agentId)
                .orElseThrow(() -> new IllegalArgumentException("unknown agent in conflict: " + agentId)));
        return transitionLock.execute(() -> {
            String id = UUID.randomUUID().toString();
            AtomicReference<ConflictResolution> recorded = new AtomicReference<>();
            ledger.commit(LedgerWrite.builder()
                    .actor(resolvedBy)
                    .actionKind(LedgerActions.CONFLICT_RESOLVED)
                    .detail(PayloadKeys.CONFLICT_ID, id)
                    .detail(PayloadKeys.CONFLICT_TYPE, conflictType)
                    .detail(PayloadKeys.AGENT_IDS, involved)
                    .detail(PayloadKeys.RESOLUTION, resolution)
                    .build(), entry -> {
                        ConflictResolution conflict = ConflictResolution.builder()
                                .id(id)
                                .conflictType(conflictType)
                                .agentIds(involved)
                                .resolution(resolution)
                                .resolvedBy(resolvedBy)
                                .resolvedAt(entry.timestamp())
                                .ledgerSequence(entry.sequence())
                                .build();
                        conflicts.add(conflict);
                        recorded.set(conflict);
                    });
            ConflictResolution conflict = recorded.get();
            log.info("[Arbiter] Conflict {} between {} resolved by {} (ledger #{})", conflictType, involved,
                    resolvedBy, conflict.ledgerSequence());
            return conflict;
        });
    }

    public List<ConflictResolution> listConflictResolutions() {
        return transitionLock.execute(() -> List.copyOf(conflicts));
    }

    /**
     * Replace the recorded conflict resolutions with replayed ones.
     */
    public void restoreConflicts(Collection<ConflictResolution> replayed) {
        transitionLock.execute(() -> {
            conflicts.clear();
            conflicts.addAll(replayed);
            return conflicts.size();
        });
    }

    /**
     * Snapshot of the current mode, with the transition count of the current
     * anti-thrash window.
     */
    public ModeState currentMode() {
        return transitionLock.execute(() -> {
            pruneWindow(clock.instant());
            return state.toBuilder().transitionsInWindow(transitions.size()).build();
        });
    }

    public List<ModeChangeRequest> listRequests() {
        return transitionLock.execute(() -> List.copyOf(history));
    }

    /**
     * Install a replayed mode. Rollback calls this while already holding the
     * global lock; the anti-thrash window is left as is.
     */
    public void restoreMode(ModeState replayed, LedgerEntry recordedBy) {
        if (recordedBy == null) {
            throw new IllegalArgumentException("restore requires its ledger entry");
        }
        transitionLock.execute(() -> {
            state = replayed.toBuilder().transitionsInWindow(transitions.size()).build();
            log.info("[Arbiter] Mode restored to {} (ledger #{})", replayed.getMode(), recordedBy.sequence());
            return state;
        });
    }

    /**
     * Seed the anti-thrash window with the times of past transitions.
     */
    public void restoreWindow(Collection<Instant> transitionTimes) {
        transitionLock.execute(() -> {
            transitions.clear();
            transitionTimes.stream().sorted().forEach(transitions::addLast);
            pruneWindow(clock.instant());
            return transitions.size();
        });
    }

    private void pruneWindow(Instant now) {
        Instant cutoff = now.minus(thrashWindow);
        while (!transitions.isEmpty() && !transitions.peekFirst().isAfter(cutoff)) {
            transitions.pollFirst();
        }
    }
}
