package me.golemcore.substrate.domain.exception;

import lombok.Getter;

/**
 * Base type for every rejection or failure raised by the kernel.
 *
 * <p>
 * Each instance carries a human-readable reason and, when the attempt was
 * recorded, the sequence of the ledger entry that recorded it.
 */
@Getter
public abstract class KernelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String reason;
    private final Long ledgerSequence;
    private final boolean retryable;

    protected KernelException(ErrorKind kind, String reason, Long ledgerSequence, boolean retryable) {
        super(describe(reason, ledgerSequence));
        this.kind = kind;
        this.reason = reason;
        this.ledgerSequence = ledgerSequence;
        this.retryable = retryable;
    }

    protected KernelException(ErrorKind kind, String reason, Long ledgerSequence) {
        this(kind, reason, ledgerSequence, false);
    }

    private static String describe(String reason, Long ledgerSequence) {
        if (ledgerSequence == null || ledgerSequence <= 0) {
            return reason;
        }
        return reason + " (ledger #" + ledgerSequence + ")";
    }
}
