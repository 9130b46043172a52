package me.golemcore.gateway.domain.model.hook;

import java.time.Duration;

public class HookTimeoutException extends HookExecutionException {

    public HookTimeoutException(String handlerName, Duration timeout) {
        super("Hook " + handlerName + " timed out after " + timeout.toMillis() + " ms");
    }
}
