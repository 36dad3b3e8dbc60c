package me.golemcore.substrate.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Operator decision settling a disagreement between agents. Recorded in the
 * ledger and kept by the Arbiter; it never changes agent or mode state.
 *
 * @param conflictType
 *            free-form category, e.g. {@code action_disagreement}
 */
@Builder
public record ConflictResolution(String id, String conflictType, List<String> agentIds, String resolution,
        String resolvedBy, Instant resolvedAt, long ledgerSequence) {
}
