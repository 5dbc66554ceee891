package com.eyelevel.bulkconverter.exception;

import java.io.Serial;

/**
 * Thrown when a raw storage-location descriptor cannot be parsed into a root container and path.
 * This is fatal for the job that referenced the descriptor.
 */
public class MalformedLocationException extends BulkConversionException {
    @Serial
    private static final long serialVersionUID = -2286418470383957120L;

    public MalformedLocationException(String message) {
        super(message);
    }

    public MalformedLocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
