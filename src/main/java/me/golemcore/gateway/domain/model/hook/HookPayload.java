package me.golemcore.gateway.domain.model.hook;

/**
 * Event-specific part of a {@link HookEvent}. Each {@link HookEventKind}
 * accepts exactly one payload type.
 */
public interface HookPayload {

    /**
     * Text that hook matchers are tested against when the payload names no tool
     * and carries no prompt. {@code null} means "use the event key".
     */
    default String matchTarget() {
        return null;
    }
}
