package com.eyelevel.bulkconverter.exception;

import java.io.Serial;

/**
 * Thrown when a job cannot proceed at all, e.g. its source folder cannot be listed.
 * No work item is attempted after this is raised.
 */
public class JobAbortedException extends BulkConversionException {
    @Serial
    private static final long serialVersionUID = 2745190032415761035L;

    public JobAbortedException(String message) {
        super(message);
    }

    public JobAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
