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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.port.outbound.LedgerStoragePort;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;

/**
 * Ledger store persisted as a JSONL file, one entry per line.
 *
 * <p>
 * Existing lines are loaded on construction and kept in memory for reads;
 * appends go to the file first and become visible only once written. Path
 * configured via {@code substrate.ledger.local-path}.
 */
@Slf4j
public class LocalLedgerStorageAdapter implements LedgerStoragePort {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final InMemoryLedgerStorageAdapter cache = new InMemoryLedgerStorageAdapter();

    public LocalLedgerStorageAdapter(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        load();
    }

    private void load() {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                log.info("[Ledger] Local ledger file created at {}", file);
                return;
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                LedgerEntry entry = objectMapper.readValue(line, LedgerEntry.class);
                if (!cache.appendIfTail(cache.size(), entry)) {
                    throw new IllegalStateException("Ledger file out of order at sequence " + entry.sequence());
                }
            }
            log.info("[Ledger] Loaded {} entries from {}", cache.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load ledger from " + file, e);
        }
    }

    @Override
    public Optional<LedgerEntry> tail() {
        return cache.tail();
    }

    @Override
    public synchronized boolean appendIfTail(long expectedTailSequence, LedgerEntry entry) {
        if (cache.size() != expectedTailSequence) {
            return false;
        }
        try {
            String line = objectMapper.writeValueAsString(entry) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger entry is not serializable: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to ledger file " + file, e);
        }
        return cache.appendIfTail(expectedTailSequence, entry);
    }

    @Override
    public Optional<LedgerEntry> get(long sequence) {
        return cache.get(sequence);
    }

    @Override
    public List<LedgerEntry> range(long from, long to) {
        return cache.range(from, to);
    }

    @Override
    public long size() {
        return cache.size();
    }
}
