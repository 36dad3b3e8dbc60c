package me.golemcore.substrate.port.outbound;

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

import me.golemcore.substrate.domain.model.LedgerEntry;

import java.util.List;
import java.util.Optional;

/**
 * Port for the append-only ledger store. Implementations must make
 * {@link #appendIfTail(long, LedgerEntry)} atomic: it is the only write and the
 * only global mutual exclusion in the kernel.
 */
public interface LedgerStoragePort {

    /**
     * Entry currently at the chain tail, empty for a fresh ledger.
     */
    Optional<LedgerEntry> tail();

    /**
     * Append {@code entry} if the tail sequence is still
     * {@code expectedTailSequence} (0 for an empty ledger).
     *
     * @return false when another writer advanced the tail first
     */
    boolean appendIfTail(long expectedTailSequence, LedgerEntry entry);

    /**
     * Look up a single entry.
     */
    Optional<LedgerEntry> get(long sequence);

    /**
     * Entries with {@code from <= sequence <= to}, in sequence order.
     */
    List<LedgerEntry> range(long from, long to);

    /**
     * Number of stored entries, which is also the tail sequence.
     */
    long size();
}
