package me.golemcore.substrate.domain.service;

import me.golemcore.substrate.adapter.outbound.storage.LocalLedgerStorageAdapter;
import me.golemcore.substrate.domain.exception.AgentTerminatedException;
import me.golemcore.substrate.domain.model.AgentStatus;
import me.golemcore.substrate.domain.model.AgentType;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.Checkpoint;
import me.golemcore.substrate.domain.model.DenialKind;
import me.golemcore.substrate.domain.model.SystemMode;
import me.golemcore.substrate.testsupport.KernelFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerRecoveryServiceTest {

    private static final Caller OPERATOR = Caller.operator("ops");

    @TempDir
    Path tempDir;

    private final List<KernelFixture> fixtures = new ArrayList<>();

    @AfterEach
    void tearDown() {
        fixtures.forEach(KernelFixture::shutdown);
    }

    @Test
    void shouldStartEmptyLedgerInObserve() {
        KernelFixture fresh = open();

        recover(fresh);

        assertEquals(SystemMode.OBSERVE, fresh.arbiter.currentMode().getMode());
        assertTrue(fresh.agentRegistry.list().isEmpty());
    }

    @Test
    void shouldRestoreStateWrittenByPreviousRun() {
        KernelFixture first = open();
        first.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 100);
        first.kernel.registerAgent(OPERATOR, "agent-b", AgentType.REFLEX, 30);
        first.budgetRegister.debit("agent-a", 25);
        first.kernel.allocate(OPERATOR, "agent-b", 5);
        first.kernel.requestModeChange(OPERATOR, SystemMode.ALERT, "incident");
        first.kernel.quarantine(OPERATOR, "agent-a", "suspicious");
        first.kernel.terminate(OPERATOR, "agent-b", "retired");
        Checkpoint checkpoint = first.kernel.createCheckpoint(OPERATOR, "after incident");

        KernelFixture second = open();
        recover(second);

        assertEquals(first.budgetRegister.getSummary(), second.budgetRegister.getSummary());
        assertEquals(SystemMode.ALERT, second.arbiter.currentMode().getMode());
        assertEquals(AgentStatus.QUARANTINED, second.agentRegistry.require("agent-a").getStatus());
        assertEquals(AgentStatus.TERMINATED, second.agentRegistry.require("agent-b").getStatus());
        assertEquals("suspicious", second.guardian.findQuarantine("agent-a").orElseThrow().getReason());
        assertEquals(List.of(checkpoint), second.guardian.listCheckpoints());
        assertThrows(AgentTerminatedException.class, () -> second.budgetRegister.debit("agent-b", 1));
    }

    @Test
    void shouldRestoreThrashWindow() {
        KernelFixture first = open();
        first.kernel.requestModeChange(OPERATOR, SystemMode.ALERT, "1");
        first.kernel.requestModeChange(OPERATOR, SystemMode.OBSERVE, "2");
        first.kernel.requestModeChange(OPERATOR, SystemMode.ALERT, "3");

        KernelFixture second = open();
        second.clock.advance(Duration.ofSeconds(10));
        recover(second);

        assertEquals(DenialKind.THRASH_LIMIT,
                second.kernel.requestModeChange(OPERATOR, SystemMode.OBSERVE, "4").getDenialKind());
    }

    @Test
    void shouldRestoreRolledBackBranch() {
        KernelFixture first = open();
        first.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 100);
        Checkpoint checkpoint = first.kernel.createCheckpoint(OPERATOR, "clean");
        first.budgetRegister.debit("agent-a", 60);
        first.kernel.rollback(OPERATOR, checkpoint.id());

        KernelFixture second = open();
        recover(second);

        assertEquals(100, second.budgetRegister.getAccount("agent-a").getRemaining());
    }

    @Test
    void shouldStillStartWhenChainIsBroken() throws IOException {
        KernelFixture first = open();
        first.kernel.registerAgent(OPERATOR, "agent-a", AgentType.TASK, 100);
        first.budgetRegister.debit("agent-a", 10);
        Path file = ledgerFile();
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, content.replace("\"amount\":10", "\"amount\":1"), StandardCharsets.UTF_8);

        KernelFixture second = open();
        recover(second);

        assertFalse(second.ledger.verifyChain().isIntact());
        assertEquals(99, second.budgetRegister.getAccount("agent-a").getRemaining());
    }

    private KernelFixture open() {
        KernelFixture fixture = KernelFixture.create(properties -> {
        }, new LocalLedgerStorageAdapter(ledgerFile(), KernelFixture.objectMapper()), List.of());
        fixtures.add(fixture);
        return fixture;
    }

    private void recover(KernelFixture fixture) {
        new LedgerRecoveryService(fixture.ledger, fixture.replayer, fixture.agentRegistry, fixture.budgetRegister,
                fixture.arbiter, fixture.guardian).recover();
    }

    private Path ledgerFile() {
        return tempDir.resolve("ledger.jsonl");
    }
}
