package me.golemcore.substrate.domain.model;

/**
 * Trace of one action run through the full intent, debit, effect, outcome
 * sequence.
 */
public record ExecutedAction(ActionIntent intent, DebitResult debit, LedgerEntry outcome, Object result) {
}
