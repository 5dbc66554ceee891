package com.eyelevel.bulkconverter.converter;

/**
 * Creates a fresh {@link DocumentConverter} for each conversion worker.
 */
@FunctionalInterface
public interface DocumentConverterFactory {

    DocumentConverter create();
}
