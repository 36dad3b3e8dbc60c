package me.golemcore.substrate.domain.exception;

/**
 * The agent is quarantined; debits and mode requests are refused until release.
 */
public class AgentQuarantinedException extends KernelException {

    private static final long serialVersionUID = 1L;

    public AgentQuarantinedException(String reason, Long ledgerSequence) {
        super(ErrorKind.AGENT_QUARANTINED, reason, ledgerSequence);
    }
}
