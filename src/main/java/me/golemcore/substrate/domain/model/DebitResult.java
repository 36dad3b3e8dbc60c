package me.golemcore.substrate.domain.model;

import lombok.Builder;
import lombok.Value;
import me.golemcore.substrate.domain.exception.InsufficientBudgetException;

/**
 * Result of a debit attempt.
 *
 * <p>
 * A rejected debit leaves the account unchanged; the caller must not execute
 * the underlying action. Both outcomes reference the ledger entry that
 * recorded the attempt.
 */
@Value
@Builder
public class DebitResult {

    boolean accepted;
    String agentId;
    long amount;
    long remaining;
    long ledgerSequence;
    String reason;

    public static DebitResult accepted(String agentId, long amount, long remaining, long ledgerSequence) {
        return DebitResult.builder()
                .accepted(true)
                .agentId(agentId)
                .amount(amount)
                .remaining(remaining)
                .ledgerSequence(ledgerSequence)
                .build();
    }

    public static DebitResult rejected(String agentId, long amount, long remaining, long ledgerSequence,
            String reason) {
        return DebitResult.builder()
                .accepted(false)
                .agentId(agentId)
                .amount(amount)
                .remaining(remaining)
                .ledgerSequence(ledgerSequence)
                .reason(reason)
                .build();
    }

    /**
     * Returns this result when accepted, otherwise raises
     * {@link InsufficientBudgetException}.
     */
    public DebitResult orThrow() {
        if (!accepted) {
            throw new InsufficientBudgetException(reason, ledgerSequence);
        }
        return this;
    }
}
