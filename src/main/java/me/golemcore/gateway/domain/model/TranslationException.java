package me.golemcore.gateway.domain.model;

import lombok.Getter;

/**
 * The gateway could not interpret an upstream payload. Recoverable: the caller
 * may retry or surface it.
 */
@Getter
public class TranslationException extends GatewayException {

    private final String providerId;

    public TranslationException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public TranslationException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }
}
