package me.golemcore.substrate.domain.model;

public enum RequestResolution {
    PENDING, APPROVED, DENIED
}
