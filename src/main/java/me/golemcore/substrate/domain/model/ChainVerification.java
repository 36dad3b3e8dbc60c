package me.golemcore.substrate.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of recomputing the hash chain over a ledger range.
 */
@Value
@Builder
public class ChainVerification {

    boolean intact;
    long fromSequence;
    long toSequence;
    long checkedEntries;

    /** First sequence whose hash or link did not match; null when intact. */
    Long firstBrokenSequence;
    String reason;

    public static ChainVerification intact(long from, long to, long checked) {
        return ChainVerification.builder()
                .intact(true)
                .fromSequence(from)
                .toSequence(to)
                .checkedEntries(checked)
                .build();
    }

    public static ChainVerification broken(long from, long to, long checked, long brokenAt, String reason) {
        return ChainVerification.builder()
                .intact(false)
                .fromSequence(from)
                .toSequence(to)
                .checkedEntries(checked)
                .firstBrokenSequence(brokenAt)
                .reason(reason)
                .build();
    }
}
