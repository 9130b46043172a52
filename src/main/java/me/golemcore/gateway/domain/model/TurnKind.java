package me.golemcore.gateway.domain.model;

public enum TurnKind {
    VERBATIM, COMPACTION_SUMMARY
}
