package me.golemcore.substrate.domain.model;

import lombok.Builder;

/**
 * Receipt for a recorded action intent. The agent runtime debits {@code cost}
 * next and reports the outcome against {@code intentSequence}.
 */
@Builder
public record ActionIntent(long intentSequence, String agentId, String actionKind, long cost) {
}
