package me.golemcore.substrate.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.agent.AgentRegistry;
import me.golemcore.substrate.domain.arbiter.Arbiter;
import me.golemcore.substrate.domain.budget.BudgetRegister;
import me.golemcore.substrate.domain.guardian.Guardian;
import me.golemcore.substrate.domain.ledger.Ledger;
import me.golemcore.substrate.domain.ledger.LedgerWrite;
import me.golemcore.substrate.domain.model.ActionIntent;
import me.golemcore.substrate.domain.model.Agent;
import me.golemcore.substrate.domain.model.AgentType;
import me.golemcore.substrate.domain.model.AnomalySignal;
import me.golemcore.substrate.domain.model.BudgetAccount;
import me.golemcore.substrate.domain.model.BudgetSummary;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.ChainVerification;
import me.golemcore.substrate.domain.model.Checkpoint;
import me.golemcore.substrate.domain.model.ConflictResolution;
import me.golemcore.substrate.domain.model.DebitResult;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.ExecutedAction;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.ModeChangeRequest;
import me.golemcore.substrate.domain.model.ModeState;
import me.golemcore.substrate.domain.model.PayloadKeys;
import me.golemcore.substrate.domain.model.Privilege;
import me.golemcore.substrate.domain.model.QuarantineRecord;
import me.golemcore.substrate.domain.model.SignalType;
import me.golemcore.substrate.domain.model.SystemMode;
import me.golemcore.substrate.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The narrow contract through which agents and operators reach the kernel.
 *
 * <p>
 * Agent runtimes call {@link #submitIntent}, {@link #debit}, perform the
 * effect, then {@link #submitOutcome}; {@link #execute} runs that sequence
 * in-process. Mode changes go through {@link #requestModeChange}. Operator and
 * auditor operations are checked against {@link AccessPolicy} first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KernelService {

    private final Ledger ledger;
    private final AgentRegistry agentRegistry;
    private final BudgetRegister budgetRegister;
    private final Arbiter arbiter;
    private final Guardian guardian;
    private final AccessPolicy accessPolicy;
    private final SpringEventBus eventBus;

    // ===== Agent runtime =====

    public ActionIntent submitIntent(Caller caller, String actionKind, Map<String, Object> details) {
        String operation = "intent " + actionKind;
        agentRegistry.admit(caller.getId(), operation);
        long cost = budgetRegister.quote(actionKind);
        LedgerEntry entry = budgetRegister.underAccountLock(caller.getId(), () -> {
            agentRegistry.admit(caller.getId(), operation);
            return ledger.append(LedgerWrite.builder()
                    .actor(caller.getId())
                    .actionKind(LedgerActions.ACTION_INTENT)
                    .detail(PayloadKeys.ACTION_KIND, actionKind)
                    .detail(PayloadKeys.COST, cost)
                    .detail(PayloadKeys.DETAILS, details == null ? Map.of() : new LinkedHashMap<>(details))
                    .outcome(EntryOutcome.INTENT)
                    .build());
        });
        log.debug("[Kernel] Intent #{} {} by {} (cost {})", entry.sequence(), actionKind, caller.getId(), cost);
        return ActionIntent.builder()
                .intentSequence(entry.sequence())
                .agentId(caller.getId())
                .actionKind(actionKind)
                .cost(cost)
                .build();
    }

    /**
     * Debit the caller's account. With a positive {@code intentSequence} the
     * debit pays that intent: it must be the caller's own, the amount must be
     * the quoted cost, and it can be paid only once. A sequence of zero is a
     * charge bound to no intent.
     */
    public DebitResult debit(Caller caller, long amount, long intentSequence) {
        if (intentSequence <= 0) {
            return budgetRegister.debit(caller.getId(), amount);
        }
        agentRegistry.admit(caller.getId(), "debit of intent #" + intentSequence);
        LedgerEntry intent = requireOwnIntent(caller, intentSequence);
        long quoted = PayloadKeys.number(intent, PayloadKeys.COST);
        if (amount != quoted) {
            throw new IllegalArgumentException(
                    "intent #" + intentSequence + " was quoted at " + quoted + ", not " + amount);
        }
        return budgetRegister.debit(caller.getId(), amount, intentSequence,
                PayloadKeys.string(intent, PayloadKeys.ACTION_KIND));
    }

    /**
     * Record how an action ended. Quarantined agents may still report; the
     * outcome of paid work belongs in the ledger. Only a paid intent can end
     * in success.
     */
    public LedgerEntry submitOutcome(Caller caller, long intentSequence, boolean success, String result) {
        agentRegistry.admitReport(caller.getId(), "outcome of #" + intentSequence);
        LedgerEntry intent = requireOwnIntent(caller, intentSequence);
        if (success && !budgetRegister.isPaid(intentSequence)) {
            throw new IllegalArgumentException("intent #" + intentSequence + " was never paid");
        }
        LedgerEntry outcome = ledger.append(LedgerWrite.builder()
                .actor(caller.getId())
                .actionKind(LedgerActions.ACTION_OUTCOME)
                .detail(PayloadKeys.INTENT_SEQUENCE, intentSequence)
                .detail(PayloadKeys.ACTION_KIND, PayloadKeys.string(intent, PayloadKeys.ACTION_KIND))
                .detail(PayloadKeys.SUCCESS, success)
                .detail(PayloadKeys.RESULT, result == null ? "" : result)
                .outcome(success ? EntryOutcome.COMMITTED : EntryOutcome.FAILED)
                .build());
        SignalType type = success ? SignalType.ACTION_SUCCEEDED : SignalType.ACTION_FAILED;
        eventBus.publish(new AnomalySignal(caller.getId(), type,
                PayloadKeys.string(intent, PayloadKeys.ACTION_KIND) + " #" + intentSequence
                        + (result == null ? "" : ": " + result),
                outcome.timestamp(), outcome.sequence()));
        return outcome;
    }

    /**
     * Intent, debit, effect and outcome in one call. The effect never runs when
     * the debit is rejected; an effect failure is recorded and rethrown.
     *
     * @throws me.golemcore.substrate.domain.exception.InsufficientBudgetException
     *             if the debit is rejected
     */
    public ExecutedAction execute(Caller caller, String actionKind, Map<String, Object> details,
            ActionEffect effect) {
        ActionIntent intent = submitIntent(caller, actionKind, details);
        DebitResult debit = debit(caller, intent.cost(), intent.intentSequence()).orThrow();
        Object result;
        try {
            result = effect.perform();
        } catch (RuntimeException e) {
            submitOutcome(caller, intent.intentSequence(), false, e.getMessage());
            throw e;
        }
        LedgerEntry outcome = submitOutcome(caller, intent.intentSequence(), true,
                result == null ? null : String.valueOf(result));
        return new ExecutedAction(intent, debit, outcome, result);
    }

    public ModeChangeRequest requestModeChange(Caller caller, SystemMode target, String justification) {
        return arbiter.requestModeChange(caller, target, justification);
    }

    public ModeState currentMode() {
        return arbiter.currentMode();
    }

    // ===== Operator =====

    public Agent registerAgent(Caller operator, String agentId, AgentType type, long initialAllocation) {
        accessPolicy.require(operator, Privilege.OPERATOR, "register agent");
        return agentRegistry.register(operator.getId(), agentId, type, initialAllocation,
                entry -> budgetRegister.openAccount(agentId, initialAllocation, entry));
    }

    public BudgetAccount allocate(Caller operator, String agentId, long amount) {
        return allocate(operator, agentId, amount, null);
    }

    /**
     * Allocation that also starts a budget window; debits are refused once it
     * ends. A null window keeps the current one.
     */
    public BudgetAccount allocate(Caller operator, String agentId, long amount, Duration window) {
        accessPolicy.require(operator, Privilege.OPERATOR, "allocate budget");
        return budgetRegister.allocate(operator.getId(), agentId, amount, window);
    }

    public ConflictResolution resolveConflict(Caller operator, String conflictType, List<String> agentIds,
            String resolution) {
        accessPolicy.require(operator, Privilege.OPERATOR, "resolve conflict");
        return arbiter.resolveConflict(operator.getId(), conflictType, agentIds, resolution);
    }

    public QuarantineRecord quarantine(Caller operator, String agentId, String reason) {
        accessPolicy.require(operator, Privilege.OPERATOR, "quarantine agent");
        return guardian.quarantine(operator.getId(), agentId, "manual", reason == null ? "manual override" : reason);
    }

    public QuarantineRecord release(Caller operator, String agentId, String reason) {
        accessPolicy.require(operator, Privilege.OPERATOR, "release agent");
        return guardian.release(operator.getId(), agentId, reason == null ? "manual override" : reason);
    }

    public Agent terminate(Caller operator, String agentId, String reason) {
        accessPolicy.require(operator, Privilege.OPERATOR, "terminate agent");
        return guardian.terminate(operator.getId(), agentId, reason == null ? "manual termination" : reason);
    }

    public Checkpoint createCheckpoint(Caller operator, String description) {
        accessPolicy.require(operator, Privilege.OPERATOR, "create checkpoint");
        return guardian.createCheckpoint(operator.getId(), description);
    }

    public LedgerEntry rollback(Caller operator, String checkpointId) {
        accessPolicy.require(operator, Privilege.OPERATOR, "rollback");
        return guardian.rollback(operator.getId(), checkpointId);
    }

    // ===== Auditor =====

    public ChainVerification verifyChain(Caller auditor, long from, long to) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "verify chain");
        return ledger.verifyChain(from, to);
    }

    public long ledgerTailSequence() {
        return ledger.tailSequence();
    }

    public List<LedgerEntry> getLedgerRange(Caller auditor, long from, long to) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "read ledger");
        return ledger.range(from, to);
    }

    public BudgetSummary getBudgetSummary(Caller auditor) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "read budget summary");
        return budgetRegister.getSummary();
    }

    /**
     * An agent may read its own account; anyone else needs AUDITOR.
     */
    public BudgetAccount getBudgetAccount(Caller caller, String agentId) {
        if (!caller.getId().equals(agentId)) {
            accessPolicy.require(caller, Privilege.AUDITOR, "read budget of " + agentId);
        }
        return budgetRegister.getAccount(agentId);
    }

    /**
     * Consumption of one cost type, or of all types when {@code costType} is
     * null. Same access rule as {@link #getBudgetAccount}.
     */
    public long getTotalCost(Caller caller, String agentId, String costType) {
        if (!caller.getId().equals(agentId)) {
            accessPolicy.require(caller, Privilege.AUDITOR, "read costs of " + agentId);
        }
        return budgetRegister.getTotalCost(agentId, costType);
    }

    public List<ConflictResolution> listConflictResolutions(Caller auditor) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "list conflict resolutions");
        return arbiter.listConflictResolutions();
    }

    public List<ModeChangeRequest> listModeRequests(Caller auditor) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "list mode requests");
        return arbiter.listRequests();
    }

    public List<QuarantineRecord> listQuarantines(Caller auditor) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "list quarantines");
        return guardian.listQuarantines();
    }

    public List<Checkpoint> listCheckpoints(Caller auditor) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "list checkpoints");
        return guardian.listCheckpoints();
    }

    public List<Agent> listAgents(Caller auditor) {
        accessPolicy.require(auditor, Privilege.AUDITOR, "list agents");
        return agentRegistry.list();
    }

    private LedgerEntry requireOwnIntent(Caller caller, long intentSequence) {
        LedgerEntry intent = ledger.get(intentSequence)
                .filter(entry -> LedgerActions.ACTION_INTENT.equals(entry.actionKind()))
                .orElseThrow(() -> new IllegalArgumentException("no action intent at ledger #" + intentSequence));
        if (!intent.actor().equals(caller.getId())) {
            throw new IllegalArgumentException(
                    "intent #" + intentSequence + " belongs to " + intent.actor() + ", not " + caller.getId());
        }
        return intent;
    }
}
