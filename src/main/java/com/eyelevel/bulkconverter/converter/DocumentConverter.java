package com.eyelevel.bulkconverter.converter;

import com.eyelevel.bulkconverter.exception.FileConversionException;
import com.eyelevel.bulkconverter.model.FormatHint;

/**
 * Converts the bytes of one document into a PDF.
 * <p>
 * Implementations may hold mutable state and are not required to be thread-safe: each conversion worker
 * obtains its own instance from a {@link DocumentConverterFactory} and never shares it.
 */
public interface DocumentConverter {

    /**
     * @param content    The source document.
     * @param formatHint The format derived from the source name.
     * @param sourceName The source object name, used for logging and format detection.
     * @return The PDF bytes.
     * @throws FileConversionException if the document cannot be converted.
     */
    byte[] convert(byte[] content, FormatHint formatHint, String sourceName) throws FileConversionException;
}
