package me.golemcore.substrate.adapter.outbound.storage;

import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryLedgerStorageAdapterTest {

    private InMemoryLedgerStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryLedgerStorageAdapter();
    }

    @Test
    void shouldAppendOnlyOnExpectedTail() {
        assertTrue(adapter.appendIfTail(0, entry(1)));
        assertFalse(adapter.appendIfTail(0, entry(2)));
        assertTrue(adapter.appendIfTail(1, entry(2)));

        assertEquals(2, adapter.size());
        assertEquals(2, adapter.tail().orElseThrow().sequence());
    }

    @Test
    void shouldRejectEntryThatDoesNotFollowTail() {
        assertThrows(IllegalArgumentException.class, () -> adapter.appendIfTail(0, entry(3)));
        assertEquals(0, adapter.size());
    }

    @Test
    void shouldClampRangeToStoredEntries() {
        adapter.appendIfTail(0, entry(1));
        adapter.appendIfTail(1, entry(2));

        assertEquals(2, adapter.range(1, 10).size());
        assertTrue(adapter.range(3, 5).isEmpty());
        assertTrue(adapter.get(0).isEmpty());
        assertTrue(adapter.get(3).isEmpty());
        assertTrue(adapter.tail().isPresent());
    }

    @Test
    void shouldReportEmptyTail() {
        assertTrue(adapter.tail().isEmpty());
        assertEquals(0, adapter.size());
    }

    static LedgerEntry entry(long sequence) {
        return LedgerEntry.builder()
                .sequence(sequence)
                .hash("h" + sequence)
                .prevHash(sequence == 1 ? LedgerEntry.GENESIS_HASH : "h" + (sequence - 1))
                .actor("agent-a")
                .actionKind("budget.debit")
                .payload(Map.of("amount", sequence))
                .payloadDigest("d" + sequence)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z").plusSeconds(sequence))
                .outcome(EntryOutcome.COMMITTED)
                .build();
    }
}
