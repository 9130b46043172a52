package me.golemcore.gateway.domain.model.guardrail;

/**
 * Outcome of one quality check. {@code exitCode} is {@code -1} when the
 * command could not be started or was killed on timeout.
 */
public record QualityCheckResult(
        String name,
        String command,
        boolean passed,
        int exitCode,
        String stdout,
        String stderr,
        boolean required) {

    public boolean blocking() {
        return required && !passed;
    }
}
