package me.golemcore.substrate.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Marks an action that was provisionally allowed because rule evaluation ran
 * past its time budget.
 */
@Builder
public record ReviewFlag(String id, String agentId, SignalType signalType, Instant flaggedAt, Instant deadline,
        long ledgerSequence) {

    public boolean isOverdue(Instant now) {
        return !now.isBefore(deadline);
    }
}
