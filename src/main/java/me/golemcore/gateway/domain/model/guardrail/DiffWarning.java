package me.golemcore.gateway.domain.model.guardrail;

/**
 * Raised when a session's diff crosses a configured threshold.
 */
public record DiffWarning(String message, DiffStats stats, GuardrailAction action) {

    public boolean blocking() {
        return action == GuardrailAction.BLOCK;
    }
}
