package org.cspii.intranet.client.exception;

import org.cspii.intranet.model.dto.ErrorKind;

/**
 * Base type for failures reported by the directory and folder gateways.
 * Each subtype maps to exactly one {@link ErrorKind}.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
