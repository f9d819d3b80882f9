package org.cspii.intranet.client.exception;

import org.cspii.intranet.model.dto.ErrorKind;

public class ObjectNotFoundException extends GatewayException {

    public ObjectNotFoundException(String message) {
        super(message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
