package me.golemcore.substrate.domain.exception;

/**
 * The agent was terminated. Permanent.
 */
public class AgentTerminatedException extends KernelException {

    private static final long serialVersionUID = 1L;

    public AgentTerminatedException(String reason, Long ledgerSequence) {
        super(ErrorKind.AGENT_TERMINATED, reason, ledgerSequence);
    }
}
