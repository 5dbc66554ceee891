package com.eyelevel.bulkconverter.converter.office;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.converter.DocumentConverter;
import com.eyelevel.bulkconverter.converter.DocumentConverterFactory;
import lombok.RequiredArgsConstructor;
import org.jodconverter.core.office.OfficeManager;
import org.springframework.stereotype.Component;

/**
 * Hands every conversion worker its own {@link OfficeDocumentConverter}.
 */
@Component
@RequiredArgsConstructor
public class OfficeDocumentConverterFactory implements DocumentConverterFactory {

    private final OfficeManager officeManager;
    private final ConversionProperties properties;

    @Override
    public DocumentConverter create() {
        return new OfficeDocumentConverter(officeManager, properties.processing().tempDir().resolve("converter"));
    }
}
