package me.golemcore.gateway.domain.model;

/**
 * Base of the gateway's runtime error taxonomy.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
