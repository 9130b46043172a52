package me.golemcore.gateway.domain.model;

import lombok.Getter;

/**
 * Upstream provider rejected the request or could not be reached. A status of
 * {@code 0} means a transport failure with no HTTP response.
 */
@Getter
public class UpstreamException extends GatewayException {

    private final String providerId;
    private final int status;
    private final String body;

    public UpstreamException(String providerId, int status, String body) {
        super("Upstream " + providerId + " returned HTTP " + status);
        this.providerId = providerId;
        this.status = status;
        this.body = body;
    }

    public UpstreamException(String providerId, String message, Throwable cause) {
        super("Upstream " + providerId + " unreachable: " + message, cause);
        this.providerId = providerId;
        this.status = 0;
        this.body = null;
    }

    public boolean isTransportFailure() {
        return status == 0;
    }
}
