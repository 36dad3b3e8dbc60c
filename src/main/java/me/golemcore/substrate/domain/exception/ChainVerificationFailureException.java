package me.golemcore.substrate.domain.exception;

/**
 * The hash chain is broken. Reported for human investigation, never repaired.
 */
public class ChainVerificationFailureException extends KernelException {

    private static final long serialVersionUID = 1L;

    public ChainVerificationFailureException(String reason, Long ledgerSequence) {
        super(ErrorKind.CHAIN_VERIFICATION_FAILURE, reason, ledgerSequence);
    }
}
