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
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fires when an agent collects {@code velocity-strikes} debit velocity signals
 * within {@code strike-window}.
 */
@Component
public class VelocityStrikeRule implements GuardianRule {

    private final int strikes;
    private final Duration window;
    private final Map<String, Deque<Instant>> strikesByAgent = new ConcurrentHashMap<>();

    public VelocityStrikeRule(SubstrateProperties properties) {
        this.strikes = properties.getGuardian().getVelocityStrikes();
        this.window = properties.getGuardian().getStrikeWindow();
    }

    @Override
    public String getName() {
        return "debit-velocity";
    }

    @Override
    public Optional<RuleFiring> evaluate(AnomalySignal signal) {
        if (signal.type() != SignalType.DEBIT_VELOCITY) {
            return Optional.empty();
        }
        Deque<Instant> deque = strikesByAgent.computeIfAbsent(signal.agentId(), id -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(signal.observedAt());
            Instant cutoff = signal.observedAt().minus(window);
            while (!deque.isEmpty() && deque.peekFirst().isBefore(cutoff)) {
                deque.pollFirst();
            }
            if (deque.size() < strikes) {
                return Optional.empty();
            }
            int count = deque.size();
            deque.clear();
            return Optional.of(new RuleFiring(getName(),
                    count + " debit velocity strikes within " + window + ": " + signal.detail()));
        }
    }

    @Override
    public void reset(String agentId) {
        strikesByAgent.remove(agentId);
    }
}
