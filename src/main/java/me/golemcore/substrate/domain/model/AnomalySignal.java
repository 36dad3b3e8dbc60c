package me.golemcore.substrate.domain.model;

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

import java.time.Instant;

/**
 * Behavioral signal about an agent, consumed by the Guardian. Signals are
 * advisory: emitting one never rejects the operation that produced it.
 *
 * @param ledgerSequence
 *            entry that recorded the operation behind the signal
 */
public record AnomalySignal(String agentId, SignalType type, String detail, Instant observedAt,
        long ledgerSequence) {
}
