package com.eyelevel.bulkconverter.exception;

import java.io.Serial;

/**
 * Thrown when a document fails to be converted to PDF (e.g., DOCX to PDF).
 */
public class FileConversionException extends BulkConversionException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public FileConversionException(String message) {
        super(message);
    }

    public FileConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
