package com.eyelevel.bulkconverter.converter.office;

import com.eyelevel.bulkconverter.converter.DocumentConverter;
import com.eyelevel.bulkconverter.exception.FileConversionException;
import com.eyelevel.bulkconverter.model.FormatHint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.jodconverter.core.office.OfficeException;
import org.jodconverter.core.office.OfficeManager;
import org.jodconverter.local.LocalConverter;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts Word, text and HTML documents through a managed LibreOffice process and images through PDFBox.
 * <p>
 * An instance keeps its own {@link LocalConverter} and is confined to one worker thread. The shared
 * {@link OfficeManager} queues tasks across instances.
 */
@Slf4j
public class OfficeDocumentConverter implements DocumentConverter {

    private final LocalConverter localConverter;
    private final Path scratchRoot;

    public OfficeDocumentConverter(final OfficeManager officeManager, final Path scratchRoot) {
        this.localConverter = LocalConverter.make(officeManager);
        this.scratchRoot = scratchRoot;
    }

    @Override
    public byte[] convert(final byte[] content, final FormatHint formatHint, final String sourceName)
    throws FileConversionException {
        return switch (formatHint) {
            case WORD, TEXT, HTML -> convertWithOffice(content, sourceName);
            case IMAGE -> convertImage(content, sourceName);
            default -> throw new FileConversionException(
                    "Format " + formatHint + " cannot be converted to PDF: " + sourceName);
        };
    }

    private byte[] convertWithOffice(final byte[] content, final String sourceName) {
        Path scratchDir = null;
        try {
            Files.createDirectories(scratchRoot);
            scratchDir = Files.createTempDirectory(scratchRoot, "office-");
            // LibreOffice picks the import filter from the extension, so the original name is kept.
            final File inputFile = scratchDir.resolve(FilenameUtils.getName(sourceName)).toFile();
            final File outputFile = scratchDir.resolve(FilenameUtils.getBaseName(sourceName) + "-out.pdf").toFile();
            Files.write(inputFile.toPath(), content);

            log.debug("Attempting LibreOffice conversion for '{}'.", sourceName);
            localConverter.convert(inputFile).to(outputFile).execute();

            if (!outputFile.exists() || outputFile.length() == 0) {
                throw new FileConversionException(
                        "Conversion resulted in an empty or missing file for: " + sourceName);
            }
            return Files.readAllBytes(outputFile.toPath());
        } catch (OfficeException e) {
            throw new FileConversionException("LibreOffice conversion failed for: " + sourceName, e);
        } catch (IOException e) {
            throw new FileConversionException("I/O error while converting: " + sourceName, e);
        } finally {
            if (scratchDir != null) {
                FileUtils.deleteQuietly(scratchDir.toFile());
            }
        }
    }

    private byte[] convertImage(final byte[] content, final String sourceName) {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            final PDImageXObject image = PDImageXObject.createFromByteArray(document, content, sourceName);
            final PDPage page = new PDPage(new PDRectangle(image.getWidth(), image.getHeight()));
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.drawImage(image, 0, 0);
            }
            document.save(out);
            return out.toByteArray();
        } catch (IOException | IllegalArgumentException e) {
            throw new FileConversionException("Image conversion failed for: " + sourceName, e);
        }
    }
}
