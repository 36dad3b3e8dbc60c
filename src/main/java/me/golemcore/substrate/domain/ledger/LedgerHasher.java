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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.golemcore.substrate.domain.model.LedgerEntry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Canonical encoding and SHA-256 hashing of ledger entries.
 *
 * <p>
 * The entry hash covers
 * {@code sequence|actor|actionKind|outcome|payloadDigest|timestamp|prevHash}.
 * The payload digest is taken over the payload's JSON form with map keys
 * sorted, so it survives a round trip through storage.
 */
public class LedgerHasher {

    private static final char SEPARATOR = '|';

    private final ObjectMapper canonicalMapper;

    public LedgerHasher(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String payloadDigest(Map<String, Object> payload) {
        try {
            return sha256(canonicalMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public String entryHash(LedgerEntry entry) {
        String canonical = new StringBuilder()
                .append(entry.sequence()).append(SEPARATOR)
                .append(entry.actor()).append(SEPARATOR)
                .append(entry.actionKind()).append(SEPARATOR)
                .append(entry.outcome()).append(SEPARATOR)
                .append(entry.payloadDigest()).append(SEPARATOR)
                .append(entry.timestamp()).append(SEPARATOR)
                .append(entry.prevHash())
                .toString();
        return sha256(canonical);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
