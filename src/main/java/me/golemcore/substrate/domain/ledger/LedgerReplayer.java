package me.golemcore.substrate.domain.ledger;

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
import me.golemcore.substrate.domain.model.Agent;
import me.golemcore.substrate.domain.model.AgentStatus;
import me.golemcore.substrate.domain.model.AgentType;
import me.golemcore.substrate.domain.model.BudgetAccount;
import me.golemcore.substrate.domain.model.Checkpoint;
import me.golemcore.substrate.domain.model.ConflictResolution;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.ModeState;
import me.golemcore.substrate.domain.model.QuarantineRecord;
import me.golemcore.substrate.domain.model.QuarantineStatus;
import me.golemcore.substrate.domain.model.SystemMode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static me.golemcore.substrate.domain.model.PayloadKeys.AGENT_ID;
import static me.golemcore.substrate.domain.model.PayloadKeys.AGENT_IDS;
import static me.golemcore.substrate.domain.model.PayloadKeys.AGENT_TYPE;
import static me.golemcore.substrate.domain.model.PayloadKeys.ALLOCATION;
import static me.golemcore.substrate.domain.model.PayloadKeys.AMOUNT;
import static me.golemcore.substrate.domain.model.PayloadKeys.CHECKPOINT_ID;
import static me.golemcore.substrate.domain.model.PayloadKeys.CONFLICT_ID;
import static me.golemcore.substrate.domain.model.PayloadKeys.CONFLICT_TYPE;
import static me.golemcore.substrate.domain.model.PayloadKeys.COST_TYPE;
import static me.golemcore.substrate.domain.model.PayloadKeys.DESCRIPTION;
import static me.golemcore.substrate.domain.model.PayloadKeys.EXPIRES_AT;
import static me.golemcore.substrate.domain.model.PayloadKeys.INTENT_SEQUENCE;
import static me.golemcore.substrate.domain.model.PayloadKeys.REASON;
import static me.golemcore.substrate.domain.model.PayloadKeys.RESOLUTION;
import static me.golemcore.substrate.domain.model.PayloadKeys.RULE;
import static me.golemcore.substrate.domain.model.PayloadKeys.TARGET_MODE;
import static me.golemcore.substrate.domain.model.PayloadKeys.TARGET_SEQUENCE;
import static me.golemcore.substrate.domain.model.PayloadKeys.WINDOW_ENDS_AT;
import static me.golemcore.substrate.domain.model.PayloadKeys.number;
import static me.golemcore.substrate.domain.model.PayloadKeys.string;

/**
 * Rebuilds kernel state by folding over ledger entries.
 *
 * <p>
 * The authoritative branch is the ledger read in order where every committed
 * {@code guardian.rollback} entry resets the branch to exactly what it was
 * right after its target sequence was written, then continues from there.
 * Rolling back to an older checkpoint and later to a newer one therefore
 * restores the newer checkpoint's state. Rollback is a pointer change: no entry
 * is ever removed from storage.
 */
@Component
@Slf4j
public class LedgerReplayer {

    public ReplayState replay(List<LedgerEntry> entries) {
        List<LedgerEntry> branch = authoritativeBranch(entries);
        Map<String, Agent> agents = new LinkedHashMap<>();
        Map<String, QuarantineRecord> quarantines = new LinkedHashMap<>();
        Map<String, Integer> quarantineCounts = new LinkedHashMap<>();
        List<Checkpoint> checkpoints = new ArrayList<>();
        List<Instant> transitionTimes = new ArrayList<>();
        List<ConflictResolution> conflicts = new ArrayList<>();
        for (LedgerEntry entry : entries) {
            if (entry.outcome() != EntryOutcome.COMMITTED) {
                continue;
            }
            applyLifecycle(entry, agents, quarantines, quarantineCounts, checkpoints, transitionTimes);
            if (LedgerActions.CONFLICT_RESOLVED.equals(entry.actionKind())) {
                conflicts.add(conflict(entry));
            }
        }

        Map<String, BudgetAccount> accounts = new LinkedHashMap<>();
        // Registrations survive rollback; accounts restart from the registered allocation.
        for (LedgerEntry entry : entries) {
            if (isCommitted(entry, LedgerActions.AGENT_REGISTERED)) {
                String agentId = string(entry, AGENT_ID);
                accounts.put(agentId, BudgetAccount.open(agentId, number(entry, ALLOCATION)));
            }
        }
        Set<Long> paidIntents = new LinkedHashSet<>();
        ModeState mode = null;
        for (LedgerEntry entry : branch) {
            if (isCommitted(entry, LedgerActions.BUDGET_ALLOCATED)) {
                accounts.computeIfPresent(string(entry, AGENT_ID), (id, account) -> allocate(account, entry));
            } else if (isCommitted(entry, LedgerActions.BUDGET_DEBIT)) {
                accounts.computeIfPresent(string(entry, AGENT_ID),
                        (id, account) -> debit(account, number(entry, AMOUNT), entry));
                long intentSequence = number(entry, INTENT_SEQUENCE);
                if (intentSequence > 0) {
                    paidIntents.add(intentSequence);
                }
            } else if (isCommitted(entry, LedgerActions.MODE_RESOLVED)) {
                mode = ModeState.builder()
                        .mode(SystemMode.valueOf(string(entry, TARGET_MODE)))
                        .enteredAt(entry.timestamp())
                        .ledgerSequence(entry.sequence())
                        .build();
            }
        }
        if (mode == null) {
            Instant bootedAt = entries.isEmpty() ? Instant.EPOCH : entries.get(0).timestamp();
            mode = ModeState.initial(bootedAt);
        }

        return ReplayState.builder()
                .accounts(accounts)
                .paidIntents(paidIntents)
                .mode(mode)
                .agents(agents)
                .quarantines(quarantines)
                .quarantineCounts(quarantineCounts)
                .checkpoints(checkpoints)
                .transitionTimes(transitionTimes)
                .conflicts(conflicts)
                .build();
    }

    /**
     * Entries that downstream readers treat as authoritative, in ledger order.
     */
    public List<LedgerEntry> authoritativeBranch(List<LedgerEntry> entries) {
        Map<Long, BranchLink> headAfter = new HashMap<>();
        BranchLink head = null;
        for (LedgerEntry entry : entries) {
            if (isCommitted(entry, LedgerActions.ROLLBACK)) {
                head = headAfter.get(number(entry, TARGET_SEQUENCE));
            }
            head = new BranchLink(entry, head);
            headAfter.put(entry.sequence(), head);
        }
        Deque<LedgerEntry> branch = new ArrayDeque<>();
        for (BranchLink link = head; link != null; link = link.previous()) {
            branch.addFirst(link.entry());
        }
        return new ArrayList<>(branch);
    }

    private void applyLifecycle(LedgerEntry entry, Map<String, Agent> agents,
            Map<String, QuarantineRecord> quarantines, Map<String, Integer> quarantineCounts,
            List<Checkpoint> checkpoints, List<Instant> transitionTimes) {
        String agentId = string(entry, AGENT_ID);
        switch (entry.actionKind()) {
        case LedgerActions.AGENT_REGISTERED -> agents.put(agentId, Agent.builder()
                .id(agentId)
                .type(AgentType.valueOf(string(entry, AGENT_TYPE)))
                .status(AgentStatus.ACTIVE)
                .registeredAt(entry.timestamp())
                .statusChangedAt(entry.timestamp())
                .statusLedgerSequence(entry.sequence())
                .build());
        case LedgerActions.AGENT_QUARANTINED -> {
            setStatus(agents, agentId, AgentStatus.QUARANTINED, entry);
            String expiresAt = string(entry, EXPIRES_AT);
            quarantines.put(agentId, QuarantineRecord.builder()
                    .agentId(agentId)
                    .triggerRule(string(entry, RULE))
                    .reason(string(entry, REASON))
                    .createdAt(entry.timestamp())
                    .status(QuarantineStatus.ACTIVE)
                    .expiresAt(expiresAt == null ? null : Instant.parse(expiresAt))
                    .ledgerSequence(entry.sequence())
                    .build());
            quarantineCounts.merge(agentId, 1, Integer::sum);
        }
        case LedgerActions.AGENT_RELEASED -> {
            setStatus(agents, agentId, AgentStatus.ACTIVE, entry);
            quarantines.computeIfPresent(agentId, (id, record) -> record.close(QuarantineStatus.RELEASED,
                    entry.actor(), entry.timestamp()));
        }
        case LedgerActions.AGENT_TERMINATED -> {
            setStatus(agents, agentId, AgentStatus.TERMINATED, entry);
            quarantines.computeIfPresent(agentId, (id, record) -> record.isActive()
                    ? record.close(QuarantineStatus.ESCALATED_TO_TERMINATION, entry.actor(), entry.timestamp())
                    : record);
        }
        case LedgerActions.CHECKPOINT_CREATED -> checkpoints.add(Checkpoint.builder()
                .id(string(entry, CHECKPOINT_ID))
                .sequence(number(entry, TARGET_SEQUENCE))
                .createdBy(entry.actor())
                .createdAt(entry.timestamp())
                .description(string(entry, DESCRIPTION))
                .build());
        case LedgerActions.MODE_RESOLVED -> transitionTimes.add(entry.timestamp());
        default -> {
            // no lifecycle effect
        }
        }
    }

    private void setStatus(Map<String, Agent> agents, String agentId, AgentStatus status, LedgerEntry entry) {
        agents.computeIfPresent(agentId, (id, agent) -> agent.toBuilder()
                .status(status)
                .statusChangedAt(entry.timestamp())
                .statusLedgerSequence(entry.sequence())
                .build());
    }

    private BudgetAccount allocate(BudgetAccount account, LedgerEntry entry) {
        BudgetAccount replenished = account.withAllocation(number(entry, AMOUNT));
        String windowEndsAt = string(entry, WINDOW_ENDS_AT);
        return windowEndsAt == null ? replenished : replenished.withWindow(Instant.parse(windowEndsAt));
    }

    private BudgetAccount debit(BudgetAccount account, long amount, LedgerEntry entry) {
        String costType = string(entry, COST_TYPE);
        if (!account.covers(amount)) {
            log.warn("[Ledger] Replayed debit #{} exceeds remaining budget of {}, clamping", entry.sequence(),
                    account.getAgentId());
            return account.withDebit(account.getRemaining(), costType);
        }
        return account.withDebit(amount, costType);
    }

    private ConflictResolution conflict(LedgerEntry entry) {
        Object agentIds = entry.payload().get(AGENT_IDS);
        List<String> involved = agentIds instanceof Collection<?> ids
                ? ids.stream().map(String::valueOf).toList()
                : List.of();
        return ConflictResolution.builder()
                .id(string(entry, CONFLICT_ID))
                .conflictType(string(entry, CONFLICT_TYPE))
                .agentIds(involved)
                .resolution(string(entry, RESOLUTION))
                .resolvedBy(entry.actor())
                .resolvedAt(entry.timestamp())
                .ledgerSequence(entry.sequence())
                .build();
    }

    private boolean isCommitted(LedgerEntry entry, String actionKind) {
        return entry.outcome() == EntryOutcome.COMMITTED && actionKind.equals(entry.actionKind());
    }

    private record BranchLink(LedgerEntry entry, BranchLink previous) {
    }
}
