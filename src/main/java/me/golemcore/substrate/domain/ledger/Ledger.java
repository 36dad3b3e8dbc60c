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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.exception.ChainVerificationFailureException;
import me.golemcore.substrate.domain.exception.ConcurrentAppendConflictException;
import me.golemcore.substrate.domain.model.ChainVerification;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import me.golemcore.substrate.port.outbound.LedgerStoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Append-only, hash-chained record of every kernel decision.
 *
 * <p>
 * Appends are compare-and-set operations against the tail sequence the
 * caller observed; the tail therefore acts as the kernel's logical clock.
 * Components never mutate Budget, Mode or Quarantine state directly: they go
 * through {@link #commit(LedgerWrite, Consumer)}, which applies the mutation
 * only after its entry is durable.
 */
@Service
@Slf4j
public class Ledger {

    private final LedgerStoragePort storage;
    private final LedgerHasher hasher;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration backoff;

    public Ledger(LedgerStoragePort storage, ObjectMapper objectMapper, SubstrateProperties properties,
            Clock clock) {
        this.storage = storage;
        this.hasher = new LedgerHasher(objectMapper);
        this.clock = clock;
        this.maxAttempts = Math.max(1, properties.getLedger().getAppendMaxAttempts());
        this.backoff = properties.getLedger().getAppendBackoff();
    }

    /**
     * Sequence of the current tail, 0 for an empty ledger.
     */
    public long tailSequence() {
        return storage.size();
    }

    public Optional<LedgerEntry> tail() {
        return storage.tail();
    }

    /**
     * Single compare-and-set append.
     *
     * @param observedTail
     *            tail sequence the caller last saw
     * @throws ConcurrentAppendConflictException
     *             if another writer advanced the tail in the meantime
     */
    public LedgerEntry append(long observedTail, LedgerWrite write) {
        Optional<LedgerEntry> tail = storage.tail();
        long actualTail = tail.map(LedgerEntry::sequence).orElse(0L);
        if (actualTail != observedTail) {
            throw new ConcurrentAppendConflictException(observedTail, actualTail);
        }
        LedgerEntry entry = buildEntry(actualTail, tail.map(LedgerEntry::hash).orElse(LedgerEntry.GENESIS_HASH),
                write);
        if (!storage.appendIfTail(observedTail, entry)) {
            throw new ConcurrentAppendConflictException(observedTail, storage.size());
        }
        log.debug("[Ledger] #{} {} by {} ({})", entry.sequence(), entry.actionKind(), entry.actor(),
                entry.outcome());
        return entry;
    }

    /**
     * Append against the freshest tail, retrying conflicts with linear backoff
     * up to {@code substrate.ledger.append-max-attempts} times.
     */
    public LedgerEntry append(LedgerWrite write) {
        ConcurrentAppendConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return append(storage.size(), write);
            } catch (ConcurrentAppendConflictException e) {
                lastConflict = e;
                if (attempt < maxAttempts) {
                    pause(attempt);
                }
            }
        }
        log.warn("[Ledger] Append of {} by {} gave up after {} attempts", write.getActionKind(), write.getActor(),
                maxAttempts);
        throw lastConflict;
    }

    public LedgerEntry append(String actor, String actionKind, Map<String, Object> payload, EntryOutcome outcome) {
        return append(LedgerWrite.of(actor, actionKind, payload, outcome));
    }

    /**
     * Record {@code write} and then apply {@code mutation} with the entry that
     * recorded it. Callers hold the lock guarding the mutated state, so no
     * reader sees the mutation before its entry exists. A failed append leaves
     * the state untouched.
     */
    public LedgerEntry commit(LedgerWrite write, Consumer<LedgerEntry> mutation) {
        LedgerEntry entry = append(write);
        mutation.accept(entry);
        return entry;
    }

    public Optional<LedgerEntry> get(long sequence) {
        return storage.get(sequence);
    }

    public List<LedgerEntry> range(long from, long to) {
        if (from < 1 || to < from) {
            throw new IllegalArgumentException("Invalid ledger range [" + from + ", " + to + "]");
        }
        return storage.range(from, to);
    }

    public List<LedgerEntry> all() {
        long size = storage.size();
        return size == 0 ? List.of() : storage.range(1, size);
    }

    /**
     * Recompute digests, hashes and links over {@code [from, to]} and report
     * the first break. The bound {@code to} is clamped to the tail.
     */
    public ChainVerification verifyChain(long from, long to) {
        if (from < 1 || to < from) {
            throw new IllegalArgumentException("Invalid ledger range [" + from + ", " + to + "]");
        }
        long end = Math.min(to, storage.size());
        String expectedPrev = from == 1
                ? LedgerEntry.GENESIS_HASH
                : storage.get(from - 1).map(LedgerEntry::hash).orElse(null);
        long checked = 0;
        long expectedSequence = from;
        for (LedgerEntry entry : storage.range(from, end)) {
            String problem = check(entry, expectedSequence, expectedPrev);
            if (problem != null) {
                log.warn("[Ledger] Chain broken at #{}: {}", expectedSequence, problem);
                return ChainVerification.broken(from, end, checked, expectedSequence, problem);
            }
            checked++;
            expectedSequence++;
            expectedPrev = entry.hash();
        }
        return ChainVerification.intact(from, end, checked);
    }

    public ChainVerification verifyChain() {
        return verifyChain(1, Math.max(1, storage.size()));
    }

    /**
     * Same as {@link #verifyChain(long, long)} but raises
     * {@link ChainVerificationFailureException} on a break.
     */
    public ChainVerification requireIntact(long from, long to) {
        ChainVerification verification = verifyChain(from, to);
        if (!verification.isIntact()) {
            throw new ChainVerificationFailureException(
                    "Ledger chain broken at #" + verification.getFirstBrokenSequence() + ": "
                            + verification.getReason(),
                    verification.getFirstBrokenSequence());
        }
        return verification;
    }

    private String check(LedgerEntry entry, long expectedSequence, String expectedPrev) {
        if (entry.sequence() != expectedSequence) {
            return "sequence " + entry.sequence() + " found where " + expectedSequence + " was expected";
        }
        if (!hasher.payloadDigest(entry.payload()).equals(entry.payloadDigest())) {
            return "payload digest mismatch";
        }
        if (!hasher.entryHash(entry).equals(entry.hash())) {
            return "entry hash mismatch";
        }
        if (expectedPrev == null || !expectedPrev.equals(entry.prevHash())) {
            return "previous hash does not match the preceding entry";
        }
        return null;
    }

    private LedgerEntry buildEntry(long tailSequence, String prevHash, LedgerWrite write) {
        if (write.getActor() == null || write.getActor().isBlank()) {
            throw new IllegalArgumentException("Ledger actor is required");
        }
        if (write.getActionKind() == null || write.getActionKind().isBlank()) {
            throw new IllegalArgumentException("Ledger action kind is required");
        }
        LedgerEntry unsigned = LedgerEntry.builder()
                .sequence(tailSequence + 1)
                .prevHash(prevHash)
                .actor(write.getActor())
                .actionKind(write.getActionKind())
                .payload(write.getPayload())
                .payloadDigest(hasher.payloadDigest(write.getPayload()))
                .timestamp(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .outcome(write.getOutcome())
                .build();
        return unsigned.toBuilder().hash(hasher.entryHash(unsigned)).build();
    }

    private void pause(int attempt) {
        long millis = backoff.toMillis() * attempt;
        if (millis <= 0) {
            Thread.yield();
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying ledger append", e);
        }
    }
}
