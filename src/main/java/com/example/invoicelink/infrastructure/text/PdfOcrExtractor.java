package com.example.invoicelink.infrastructure.text;

import com.example.invoicelink.config.InvoiceLinkProperties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Renders PDF pages to images and runs OCR on them, for scans that carry no text layer.
 */
@Service
public class PdfOcrExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfOcrExtractor.class);

    private final InvoiceLinkProperties properties;
    private final OcrService ocrService;

    public PdfOcrExtractor(InvoiceLinkProperties properties, OcrService ocrService) {
        this.properties = properties;
        this.ocrService = ocrService;
    }

    /**
     * Runs OCR on up to {@code invoicelink.ocr.max-pages} pages. Nothing is rendered while OCR is disabled.
     *
     * @param document loaded PDF
     * @param fileName name used in log lines
     * @return concatenated page text, one page per block; empty when OCR is disabled
     * @throws IOException when PDFBox cannot render a page
     */
    public String extractText(PDDocument document, String fileName) throws IOException {
        if (!properties.getOcr().isEnabled()) {
            log.warn("No text layer in {} and OCR is disabled (invoicelink.ocr.enabled=false)", fileName);
            return "";
        }
        int dpi = Math.max(72, properties.getOcr().getRenderDpi());
        int pagesToProcess = Math.min(document.getNumberOfPages(), Math.max(1, properties.getOcr().getMaxPages()));

        PDFRenderer renderer = new PDFRenderer(document);
        StringBuilder text = new StringBuilder();
        for (int pageIndex = 0; pageIndex < pagesToProcess; pageIndex++) {
            log.info("OCR processing page {} of {}", pageIndex + 1, fileName);
            BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
            try {
                String pageText = ocrService.extractText(image);
                if (pageText != null && !pageText.isBlank()) {
                    text.append(pageText).append('\n');
                }
            } finally {
                image.flush();
            }
        }
        return text.toString();
    }
}
