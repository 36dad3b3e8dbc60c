package me.golemcore.substrate.domain.exception;

/**
 * Machine-readable classification of kernel errors.
 */
public enum ErrorKind {
    CONCURRENT_APPEND_CONFLICT,
    INSUFFICIENT_BUDGET,
    INVALID_TRANSITION,
    ARBITRATION_DENIED,
    AGENT_QUARANTINED,
    AGENT_TERMINATED,
    CHAIN_VERIFICATION_FAILURE,
    UNKNOWN_ACTION_KIND,
    UNKNOWN_AGENT,
    UNKNOWN_CHECKPOINT,
    PRIVILEGE_REQUIRED
}
