package me.golemcore.gateway.domain.model;

public enum SessionStatus {
    ACTIVE, COMPACTING, ENDED
}
