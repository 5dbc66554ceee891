package com.eyelevel.bulkconverter.exception;

import java.io.Serial;

/**
 * Thrown when a storage call fails after the transport exhausted its own retries
 * (timeouts, throttling, connection resets).
 */
public class TransientStorageException extends StorageException {
    @Serial
    private static final long serialVersionUID = 8805405123385611440L;

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
