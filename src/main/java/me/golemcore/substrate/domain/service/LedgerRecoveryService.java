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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.agent.AgentRegistry;
import me.golemcore.substrate.domain.arbiter.Arbiter;
import me.golemcore.substrate.domain.budget.BudgetRegister;
import me.golemcore.substrate.domain.guardian.Guardian;
import me.golemcore.substrate.domain.ledger.Ledger;
import me.golemcore.substrate.domain.ledger.LedgerReplayer;
import me.golemcore.substrate.domain.ledger.ReplayState;
import me.golemcore.substrate.domain.model.ChainVerification;
import me.golemcore.substrate.domain.model.LedgerEntry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds in-memory kernel state from a persisted ledger at start.
 *
 * <p>
 * A broken chain is reported but never repaired; the kernel still starts so
 * that auditors can inspect the ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerRecoveryService {

    private final Ledger ledger;
    private final LedgerReplayer replayer;
    private final AgentRegistry agentRegistry;
    private final BudgetRegister budgetRegister;
    private final Arbiter arbiter;
    private final Guardian guardian;

    @PostConstruct
    public void recover() {
        LedgerEntry tail = ledger.tail().orElse(null);
        if (tail == null) {
            log.info("[Kernel] Empty ledger, starting in OBSERVE");
            return;
        }
        ChainVerification verification = ledger.verifyChain();
        if (!verification.isIntact()) {
            log.warn("[Kernel] Ledger chain is broken at #{}: {}. State is replayed as stored; investigate",
                    verification.getFirstBrokenSequence(), verification.getReason());
        }
        List<LedgerEntry> entries = ledger.all();
        ReplayState state = replayer.replay(entries);
        agentRegistry.restore(state.getAgents().values());
        budgetRegister.restore(() -> state, tail);
        arbiter.restoreMode(state.getMode(), tail);
        arbiter.restoreWindow(state.getTransitionTimes());
        arbiter.restoreConflicts(state.getConflicts());
        guardian.restore(state);
        log.info("[Kernel] Replayed {} ledger entries: {} agents, mode {}", entries.size(),
                state.getAgents().size(), state.getMode().getMode());
    }
}
