package me.golemcore.substrate.domain.model;

/**
 * Lifecycle status of an agent. Only the Guardian moves an agent between
 * statuses; {@link #TERMINATED} is final.
 */
public enum AgentStatus {
    ACTIVE, QUARANTINED, TERMINATED
}
