package me.golemcore.substrate.domain.model;

/**
 * Outcome recorded on a ledger entry.
 */
public enum EntryOutcome {
    /** The actor announced an action that has not completed yet. */
    INTENT,
    /** The recorded decision or effect took place. */
    COMMITTED,
    /** The attempt was rejected or the effect failed. */
    FAILED
}
