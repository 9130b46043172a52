package me.golemcore.gateway.domain.model.hook;

/**
 * @param failureReason
 *            why the exchange stopped abnormally, {@code null} on a normal
 *            finish
 */
public record StopPayload(String finishReason, String failureReason) implements HookPayload {
}
