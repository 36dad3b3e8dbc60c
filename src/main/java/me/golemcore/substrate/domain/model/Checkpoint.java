package me.golemcore.substrate.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Designated "last known good" ledger position. Immutable once created.
 *
 * @param sequence
 *            last ledger sequence covered by the checkpoint
 */
@Builder
public record Checkpoint(String id, long sequence, String createdBy, Instant createdAt, String description) {
}
