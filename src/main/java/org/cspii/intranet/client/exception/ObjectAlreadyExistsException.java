package org.cspii.intranet.client.exception;

import org.cspii.intranet.model.dto.ErrorKind;

/**
 * The entry, or the membership, is already present.
 */
public class ObjectAlreadyExistsException extends GatewayException {

    public ObjectAlreadyExistsException(String message) {
        super(message);
    }

    public ObjectAlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.ALREADY_EXISTS;
    }
}
