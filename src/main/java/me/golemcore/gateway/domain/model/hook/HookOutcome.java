package me.golemcore.gateway.domain.model.hook;

import java.time.Duration;

/**
 * What happened to one handler during a dispatch.
 */
public record HookOutcome(String handlerName, Status status, Duration elapsed, String detail) {

    public enum Status {
        SUCCEEDED, BLOCKED, FAILED, TIMED_OUT
    }
}
