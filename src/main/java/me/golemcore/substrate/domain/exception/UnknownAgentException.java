package me.golemcore.substrate.domain.exception;

public class UnknownAgentException extends KernelException {

    private static final long serialVersionUID = 1L;

    public UnknownAgentException(String reason, Long ledgerSequence) {
        super(ErrorKind.UNKNOWN_AGENT, reason, ledgerSequence);
    }
}
