package me.golemcore.gateway.domain.model.guardrail;

/**
 * A named shell check. A failing required check fails the gate run.
 */
public record QualityCheck(String name, String command, boolean required) {
}
