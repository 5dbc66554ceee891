package com.eyelevel.bulkconverter.exception;

import java.io.Serial;

/**
 * Base type for failures raised by an object-store binding.
 */
public class StorageException extends BulkConversionException {
    @Serial
    private static final long serialVersionUID = 1931187466038720118L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
