package me.golemcore.gateway.domain.model;

/**
 * Invalid configuration detected before any request is sent, e.g. an unknown
 * provider identifier. Fatal at startup.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
