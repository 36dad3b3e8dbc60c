package me.golemcore.substrate.domain.guardian;

import me.golemcore.substrate.domain.model.AnomalySignal;
import me.golemcore.substrate.domain.model.SignalType;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VelocityStrikeRuleTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private VelocityStrikeRule rule;

    @BeforeEach
    void setUp() {
        SubstrateProperties properties = new SubstrateProperties();
        properties.getGuardian().setVelocityStrikes(3);
        properties.getGuardian().setStrikeWindow(Duration.ofSeconds(3));
        rule = new VelocityStrikeRule(properties);
    }

    @Test
    void shouldFireOnThirdStrikeInsideWindow() {
        assertTrue(rule.evaluate(velocity("agent-a", T0)).isEmpty());
        assertTrue(rule.evaluate(velocity("agent-a", T0.plusSeconds(1))).isEmpty());

        Optional<RuleFiring> firing = rule.evaluate(velocity("agent-a", T0.plusSeconds(2)));

        assertTrue(firing.isPresent());
        assertEquals("debit-velocity", firing.get().rule());
    }

    @Test
    void shouldDropStrikesOutsideWindow() {
        rule.evaluate(velocity("agent-a", T0));
        rule.evaluate(velocity("agent-a", T0.plusSeconds(1)));

        assertTrue(rule.evaluate(velocity("agent-a", T0.plusSeconds(5))).isEmpty());
    }

    @Test
    void shouldIgnoreOtherSignalsAndAgents() {
        rule.evaluate(velocity("agent-a", T0));
        rule.evaluate(velocity("agent-a", T0));

        assertTrue(rule.evaluate(new AnomalySignal("agent-a", SignalType.ACTION_FAILED, "x", T0, 1)).isEmpty());
        assertTrue(rule.evaluate(velocity("agent-b", T0)).isEmpty());
        assertTrue(rule.evaluate(velocity("agent-a", T0)).isPresent());
    }

    @Test
    void shouldStartOverAfterReset() {
        rule.evaluate(velocity("agent-a", T0));
        rule.evaluate(velocity("agent-a", T0));
        rule.reset("agent-a");

        assertTrue(rule.evaluate(velocity("agent-a", T0)).isEmpty());
    }

    private static AnomalySignal velocity(String agentId, Instant at) {
        return new AnomalySignal(agentId, SignalType.DEBIT_VELOCITY, "burst", at, 1);
    }
}
