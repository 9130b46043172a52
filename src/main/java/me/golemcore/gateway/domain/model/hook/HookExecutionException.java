package me.golemcore.gateway.domain.model.hook;

/**
 * Non-blocking handler failure: the handler crashed, exited with an
 * unexpected status, or produced unusable output. The event proceeds without
 * this handler's contribution.
 */
public class HookExecutionException extends Exception {

    public HookExecutionException(String message) {
        super(message);
    }

    public HookExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
