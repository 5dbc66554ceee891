package com.eyelevel.bulkconverter.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur while orchestrating a bulk conversion job.
 */
public class BulkConversionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public BulkConversionException(String message) {
        super(message);
    }

    public BulkConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
