package me.golemcore.substrate.domain.exception;

/**
 * The caller does not hold the privilege an operation requires.
 */
public class PrivilegeRequiredException extends KernelException {

    private static final long serialVersionUID = 1L;

    public PrivilegeRequiredException(String reason, Long ledgerSequence) {
        super(ErrorKind.PRIVILEGE_REQUIRED, reason, ledgerSequence);
    }
}
