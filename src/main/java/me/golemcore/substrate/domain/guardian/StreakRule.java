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
import me.golemcore.substrate.domain.model.SignalType;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts consecutive signals of one type, reset by a signal of the opposite
 * type. Fires when the streak reaches the limit.
 */
abstract class StreakRule implements GuardianRule {

    private final SignalType counted;
    private final SignalType resetBy;
    private final int limit;
    private final Map<String, Integer> streaks = new ConcurrentHashMap<>();

    protected StreakRule(SignalType counted, SignalType resetBy, int limit) {
        this.counted = counted;
        this.resetBy = resetBy;
        this.limit = limit;
    }

    @Override
    public Optional<RuleFiring> evaluate(AnomalySignal signal) {
        if (signal.type() == resetBy) {
            streaks.remove(signal.agentId());
            return Optional.empty();
        }
        if (signal.type() != counted || limit <= 0) {
            return Optional.empty();
        }
        int streak = streaks.merge(signal.agentId(), 1, Integer::sum);
        if (streak < limit) {
            return Optional.empty();
        }
        streaks.remove(signal.agentId());
        return Optional.of(new RuleFiring(getName(), describe(streak, signal)));
    }

    @Override
    public void reset(String agentId) {
        streaks.remove(agentId);
    }

    protected abstract String describe(int streak, AnomalySignal last);
}
