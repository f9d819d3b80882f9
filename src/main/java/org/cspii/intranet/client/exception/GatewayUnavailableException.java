package org.cspii.intranet.client.exception;

import org.cspii.intranet.model.dto.ErrorKind;

/**
 * Transport-level failure. Not retried here; callers decide.
 */
public class GatewayUnavailableException extends GatewayException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.GATEWAY_UNAVAILABLE;
    }
}
