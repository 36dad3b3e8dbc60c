package me.golemcore.substrate.domain.exception;

/**
 * The Arbiter denied a mode change on policy grounds.
 */
public class ArbitrationDeniedException extends KernelException {

    private static final long serialVersionUID = 1L;

    public ArbitrationDeniedException(String reason, Long ledgerSequence) {
        super(ErrorKind.ARBITRATION_DENIED, reason, ledgerSequence);
    }
}
