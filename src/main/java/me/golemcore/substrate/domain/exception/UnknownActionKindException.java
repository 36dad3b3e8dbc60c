package me.golemcore.substrate.domain.exception;

public class UnknownActionKindException extends KernelException {

    private static final long serialVersionUID = 1L;

    public UnknownActionKindException(String reason, Long ledgerSequence) {
        super(ErrorKind.UNKNOWN_ACTION_KIND, reason, ledgerSequence);
    }

    public UnknownActionKindException(String actionKind) {
        this("unknown action kind: " + actionKind, null);
    }
}
