package me.golemcore.gateway.domain.model.guardrail;

/**
 * How a blast-radius violation is handled: {@code STRICT} blocks the tool
 * call, {@code ADVISORY} only logs it.
 */
public enum GuardrailMode {
    STRICT, ADVISORY
}
