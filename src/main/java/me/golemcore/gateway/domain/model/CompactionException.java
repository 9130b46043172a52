package me.golemcore.gateway.domain.model;

/**
 * Summarization could not produce a usable summary. Compaction is deferred and
 * history stays untouched.
 */
public class CompactionException extends GatewayException {

    public CompactionException(String message) {
        super(message);
    }

    public CompactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
