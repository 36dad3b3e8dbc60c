package me.golemcore.substrate.domain.exception;

/**
 * Another writer advanced the ledger tail since the caller observed it. Retry
 * with the refreshed tail.
 */
public class ConcurrentAppendConflictException extends KernelException {

    private static final long serialVersionUID = 1L;

    public ConcurrentAppendConflictException(String reason, Long ledgerSequence) {
        super(ErrorKind.CONCURRENT_APPEND_CONFLICT, reason, ledgerSequence, true);
    }

    public ConcurrentAppendConflictException(long observedTail, long actualTail) {
        this("ledger tail moved from " + observedTail + " to " + actualTail, null);
    }
}
