package me.golemcore.gateway.domain.model.guardrail;

/**
 * What happens once a session's diff exceeds its thresholds.
 */
public enum GuardrailAction {
    WARN, BLOCK
}
