package me.golemcore.gateway.domain.model.hook;

/**
 * @param source
 *            {@code startup}, {@code resume} or {@code clear}
 */
public record SessionStartPayload(String source) implements HookPayload {
}
