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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, hash-chained ledger record.
 *
 * @param sequence
 *            monotonically assigned position, starting at 1
 * @param hash
 *            SHA-256 over the canonical encoding of this entry
 * @param prevHash
 *            hash of the previous entry, or {@link #GENESIS_HASH} for the first
 * @param actor
 *            agent id, operator id or internal component that caused the entry
 * @param actionKind
 *            dotted kind, see {@link LedgerActions}
 * @param payload
 *            structured details used for replay and audit
 * @param payloadDigest
 *            SHA-256 over the canonical JSON encoding of {@code payload}
 */
@Builder(toBuilder = true)
public record LedgerEntry(long sequence, String hash, String prevHash, String actor, String actionKind,
        Map<String, Object> payload, String payloadDigest, Instant timestamp, EntryOutcome outcome) {

    public static final String GENESIS_HASH = "0".repeat(64);

    public LedgerEntry {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
