package com.eyelevel.bulkconverter.converter.office;

import com.eyelevel.bulkconverter.exception.FileConversionException;
import com.eyelevel.bulkconverter.model.FormatHint;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jodconverter.core.office.OfficeManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class OfficeDocumentConverterTest {

    @TempDir
    Path scratch;

    private OfficeDocumentConverter converter() {
        return new OfficeDocumentConverter(mock(OfficeManager.class), scratch);
    }

    @Test
    void imageBecomesASinglePagePdfOfTheImageSize() throws Exception {
        BufferedImage image = new BufferedImage(120, 80, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(image, "png", png);

        byte[] pdf = converter().convert(png.toByteArray(), FormatHint.IMAGE, "photo.png");

        try (PDDocument document = Loader.loadPDF(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            assertThat(document.getPage(0).getMediaBox().getWidth()).isEqualTo(120f);
            assertThat(document.getPage(0).getMediaBox().getHeight()).isEqualTo(80f);
        }
    }

    @Test
    void unreadableImageIsAConversionFailure() {
        assertThatThrownBy(() -> converter().convert(new byte[]{1, 2, 3}, FormatHint.IMAGE, "broken.jpg"))
                .isInstanceOf(FileConversionException.class)
                .hasMessageContaining("broken.jpg");
    }

    @Test
    void verbatimFormatsAreNotConverted() {
        assertThatThrownBy(() -> converter().convert(new byte[0], FormatHint.PDF, "a.pdf"))
                .isInstanceOf(FileConversionException.class);
        assertThatThrownBy(() -> converter().convert(new byte[0], FormatHint.UNSUPPORTED, "a.zip"))
                .isInstanceOf(FileConversionException.class);
    }
}
