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

import me.golemcore.substrate.domain.model.AnomalySignal;

import java.util.Optional;

/**
 * A behavioral rule evaluated by the Guardian for every anomaly signal.
 * Implementations keep their own per-agent state and must be thread-safe.
 */
public interface GuardianRule {

    String getName();

    /**
     * @return a firing when the agent should be quarantined
     */
    Optional<RuleFiring> evaluate(AnomalySignal signal);

    /**
     * Forget accumulated state for the agent, e.g. after a release.
     */
    void reset(String agentId);
}
