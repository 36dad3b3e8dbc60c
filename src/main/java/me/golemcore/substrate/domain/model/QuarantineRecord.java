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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Isolation record created by the Guardian.
 */
@Value
@Builder(toBuilder = true)
public class QuarantineRecord {

    String agentId;
    String triggerRule;
    String reason;
    Instant createdAt;
    QuarantineStatus status;

    /** When the expiry policy releases the agent; null if only a manual release applies. */
    Instant expiresAt;

    Instant closedAt;
    String closedBy;
    long ledgerSequence;

    public boolean isActive() {
        return status == QuarantineStatus.ACTIVE;
    }

    public boolean isExpired(Instant now) {
        return isActive() && expiresAt != null && !now.isBefore(expiresAt);
    }

    public QuarantineRecord close(QuarantineStatus newStatus, String by, Instant at) {
        return toBuilder().status(newStatus).closedBy(by).closedAt(at).build();
    }
}
