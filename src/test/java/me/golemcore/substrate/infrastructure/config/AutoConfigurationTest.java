package me.golemcore.substrate.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.substrate.adapter.outbound.storage.InMemoryLedgerStorageAdapter;
import me.golemcore.substrate.adapter.outbound.storage.LocalLedgerStorageAdapter;
import me.golemcore.substrate.port.outbound.LedgerStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    private SubstrateProperties properties;
    private AutoConfiguration configuration;

    @BeforeEach
    void setUp() {
        properties = new SubstrateProperties();
        configuration = new AutoConfiguration(properties);
    }

    @Test
    void shouldUseInMemoryStorageByDefault() {
        LedgerStoragePort port = configuration.ledgerStoragePort(AutoConfiguration.objectMapper());

        assertInstanceOf(InMemoryLedgerStorageAdapter.class, port);
    }

    @Test
    void shouldUseLocalStorageWhenConfigured(@TempDir Path tempDir) {
        properties.getLedger().setStorage("LOCAL");
        properties.getLedger().setLocalPath(tempDir.resolve("ledger.jsonl").toString());

        LedgerStoragePort port = configuration.ledgerStoragePort(AutoConfiguration.objectMapper());

        assertInstanceOf(LocalLedgerStorageAdapter.class, port);
    }

    @Test
    void shouldRejectUnknownStorage() {
        properties.getLedger().setStorage("s3");

        ObjectMapper mapper = AutoConfiguration.objectMapper();
        assertThrows(IllegalArgumentException.class, () -> configuration.ledgerStoragePort(mapper));
    }

    @Test
    void shouldExpandUserHomeInPath() {
        Path resolved = AutoConfiguration.resolvePath("${user.home}/.substrate/ledger.jsonl");

        assertTrue(resolved.isAbsolute());
        assertTrue(resolved.startsWith(Path.of(System.getProperty("user.home")).toAbsolutePath().normalize()));
        assertFalse(resolved.toString().contains("${"));
    }

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Instant.parse("2026-03-01T10:00:00Z"));
        assertEquals("\"2026-03-01T10:00:00Z\"", json);
    }

    @Test
    void shouldProvideUtcClock() {
        assertEquals(ZoneOffset.UTC, AutoConfiguration.clock().getZone());
    }

    @Test
    void shouldLogConfigurationOnInit() {
        assertDoesNotThrow(configuration::init);
    }
}
