package me.golemcore.substrate.domain.exception;

/**
 * The requested mode is not reachable from the current mode.
 */
public class InvalidTransitionException extends KernelException {

    private static final long serialVersionUID = 1L;

    public InvalidTransitionException(String reason, Long ledgerSequence) {
        super(ErrorKind.INVALID_TRANSITION, reason, ledgerSequence);
    }
}
