package me.golemcore.substrate.domain.model;

public enum QuarantineStatus {
    ACTIVE, RELEASED, ESCALATED_TO_TERMINATION
}
