package me.golemcore.substrate.domain.exception;

/**
 * A debit would have driven the remaining budget below zero. Not retryable
 * without a new allocation.
 */
public class InsufficientBudgetException extends KernelException {

    private static final long serialVersionUID = 1L;

    public InsufficientBudgetException(String reason, Long ledgerSequence) {
        super(ErrorKind.INSUFFICIENT_BUDGET, reason, ledgerSequence);
    }
}
