package me.golemcore.substrate.adapter.outbound.storage;

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
import me.golemcore.substrate.port.outbound.LedgerStoragePort;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Volatile ledger store backed by a list. Entry {@code n} lives at index
 * {@code n - 1}.
 */
public class InMemoryLedgerStorageAdapter implements LedgerStoragePort {

    private final List<LedgerEntry> entries = new ArrayList<>();

    @Override
    public synchronized Optional<LedgerEntry> tail() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(entries.size() - 1));
    }

    @Override
    public synchronized boolean appendIfTail(long expectedTailSequence, LedgerEntry entry) {
        if (entries.size() != expectedTailSequence) {
            return false;
        }
        if (entry.sequence() != expectedTailSequence + 1) {
            throw new IllegalArgumentException("Entry sequence " + entry.sequence()
                    + " does not follow tail " + expectedTailSequence);
        }
        entries.add(entry);
        return true;
    }

    @Override
    public synchronized Optional<LedgerEntry> get(long sequence) {
        if (sequence < 1 || sequence > entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get((int) sequence - 1));
    }

    @Override
    public synchronized List<LedgerEntry> range(long from, long to) {
        long start = Math.max(1, from);
        long end = Math.min(entries.size(), to);
        if (start > end) {
            return List.of();
        }
        return List.copyOf(entries.subList((int) start - 1, (int) end));
    }

    @Override
    public synchronized long size() {
        return entries.size();
    }
}
