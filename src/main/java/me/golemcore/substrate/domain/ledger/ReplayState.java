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

import lombok.Builder;
import lombok.Value;
import me.golemcore.substrate.domain.model.Agent;
import me.golemcore.substrate.domain.model.BudgetAccount;
import me.golemcore.substrate.domain.model.Checkpoint;
import me.golemcore.substrate.domain.model.ConflictResolution;
import me.golemcore.substrate.domain.model.ModeState;
import me.golemcore.substrate.domain.model.QuarantineRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kernel state reconstructed from the ledger.
 *
 * <p>
 * {@code accounts}, {@code paidIntents} and {@code mode} follow the
 * authoritative branch, i.e. they honor rollbacks. Agents, quarantines,
 * checkpoints, conflict resolutions and the transition history are read from
 * the full ledger because rollback never reverts them.
 */
@Value
@Builder
public class ReplayState {

    Map<String, BudgetAccount> accounts;
    Set<Long> paidIntents;
    ModeState mode;
    Map<String, Agent> agents;
    Map<String, QuarantineRecord> quarantines;
    Map<String, Integer> quarantineCounts;
    List<Checkpoint> checkpoints;
    List<Instant> transitionTimes;
    List<ConflictResolution> conflicts;
}
