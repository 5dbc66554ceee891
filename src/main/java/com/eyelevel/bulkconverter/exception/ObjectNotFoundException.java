package com.eyelevel.bulkconverter.exception;

import java.io.Serial;

/**
 * Thrown when a requested object does not exist in the store.
 */
public class ObjectNotFoundException extends StorageException {
    @Serial
    private static final long serialVersionUID = -6062393124577702211L;

    public ObjectNotFoundException(String message) {
        super(message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
