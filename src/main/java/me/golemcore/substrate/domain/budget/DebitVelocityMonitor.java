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

import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window count of debit attempts per agent.
 */
@Component
public class DebitVelocityMonitor {

    private final Duration window;
    private final int threshold;
    private final Map<String, Deque<Instant>> attempts = new ConcurrentHashMap<>();

    public DebitVelocityMonitor(SubstrateProperties properties) {
        this.window = properties.getBudget().getVelocityWindow();
        this.threshold = properties.getBudget().getVelocityThreshold();
    }

    /**
     * Record an attempt and return the number of attempts inside the window,
     * including this one.
     */
    public int record(String agentId, Instant at) {
        Deque<Instant> deque = attempts.computeIfAbsent(agentId, id -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(at);
            Instant cutoff = at.minus(window);
            while (!deque.isEmpty() && deque.peekFirst().isBefore(cutoff)) {
                deque.pollFirst();
            }
            return deque.size();
        }
    }

    public boolean exceeds(int attemptsInWindow) {
        return attemptsInWindow > threshold;
    }

    public Duration getWindow() {
        return window;
    }

    public int getThreshold() {
        return threshold;
    }
}
