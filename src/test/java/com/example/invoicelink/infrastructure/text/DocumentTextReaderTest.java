package com.example.invoicelink.infrastructure.text;

import com.example.invoicelink.config.InvoiceLinkProperties;
import com.example.invoicelink.domain.exception.DocumentFileRequiredException;
import com.example.invoicelink.domain.exception.DocumentNotFoundException;
import com.example.invoicelink.domain.exception.UnsupportedDocumentFormatException;
import com.example.invoicelink.infrastructure.exception.DocumentReadException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;

/**
 * Unit tests covering text-layer extraction, OCR fallback and input validation.
 */
class DocumentTextReaderTest {

    @TempDir
    Path tempDir;

    private OcrService ocrService;
    private DocumentTextReader reader;

    @BeforeEach
    void setUp() {
        ocrService = mock(OcrService.class);
        reader = newReader(true);
    }

    /**
     * Verifies that a PDF with a text layer is read without OCR.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void readsPdfTextLayer() throws Exception {
        String text = reader.readText(createPdf("Invoice No: A1001"), "invoice.pdf");

        assertThat(text).contains("Invoice No: A1001");
        then(ocrService).should(never()).extractText(any());
    }

    /**
     * Verifies that a PDF without a text layer falls back to OCR on its rendered pages.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void scannedPdfFallsBackToOcr() throws Exception {
        given(ocrService.extractText(any())).willReturn("Invoice No: 77");

        String text = reader.readText(createPdf(null), "scan.pdf");

        assertThat(text).contains("Invoice No: 77");
    }

    /**
     * Verifies that no page of a scanned PDF is rendered or recognized while OCR is switched off.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void scannedPdfIsNotRenderedWhenOcrIsDisabled() throws Exception {
        DocumentTextReader disabledReader = newReader(false);

        String text = disabledReader.readText(createBlankPdf(3), "scan.pdf");

        assertThat(text).isEmpty();
        then(ocrService).should(never()).extractText(any());
    }

    @Test
    void imagesGoThroughOcr() throws Exception {
        given(ocrService.extractText(any())).willReturn("PURCHASE ORDER");
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB), "png", png);

        assertThat(reader.readText(png.toByteArray(), "scan.PNG")).isEqualTo("PURCHASE ORDER");
    }

    @Test
    void undecodableImageIsAReadFailure() {
        byte[] garbage = "not an image".getBytes(StandardCharsets.UTF_8);

        assertThrows(DocumentReadException.class, () -> reader.readText(garbage, "scan.png"));
    }

    @Test
    void corruptPdfIsAReadFailure() {
        byte[] garbage = "%PDF-broken".getBytes(StandardCharsets.UTF_8);

        assertThrows(DocumentReadException.class, () -> reader.readText(garbage, "broken.pdf"));
    }

    @Test
    void readsDocumentFromDisk() throws Exception {
        Path file = Files.write(tempDir.resolve("invoice.pdf"), createPdf("PO NO: 4500012345"));

        assertThat(reader.readText(file)).contains("PO NO: 4500012345");
    }

    @Test
    void missingOrUnsupportedFilesAreRejected() throws IOException {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "plain text");

        assertThrows(DocumentNotFoundException.class, () -> reader.readText(tempDir.resolve("missing.pdf")));
        assertThrows(UnsupportedDocumentFormatException.class, () -> reader.readText(notes));
        assertThat(DocumentTextReader.isSupported("scan.TIFF")).isTrue();
        assertThat(DocumentTextReader.isSupported("invoice")).isFalse();
    }

    /**
     * Ensures empty uploads are rejected.
     */
    @Test
    void uploadRequiresContent() {
        MockMultipartFile file = new MockMultipartFile("file", new byte[0]);

        assertThrows(DocumentFileRequiredException.class, () -> reader.readText(file));
    }

    private DocumentTextReader newReader(boolean ocrEnabled) {
        InvoiceLinkProperties properties = new InvoiceLinkProperties();
        properties.getOcr().setEnabled(ocrEnabled);
        properties.getOcr().setRenderDpi(72);
        return new DocumentTextReader(new PdfOcrExtractor(properties, ocrService), ocrService);
    }

    private byte[] createBlankPdf(int pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            for (int i = 0; i < pages; i++) {
                document.addPage(new PDPage(PDRectangle.A6));
            }
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    private byte[] createPdf(String text) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            PDPage page = new PDPage(PDRectangle.A6);
            document.addPage(page);

            if (text != null) {
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 10);
                    contentStream.newLineAtOffset(20, 300);
                    contentStream.showText(text);
                    contentStream.endText();
                }
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
