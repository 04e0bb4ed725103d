package com.example.invoicelink.infrastructure.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Stand-in used while {@code invoicelink.ocr.enabled=false}; scanned pages yield no text.
 */
public class DisabledOcrService implements OcrService {

    private static final Logger log = LoggerFactory.getLogger(DisabledOcrService.class);

    @Override
    public String extractText(BufferedImage image) {
        log.warn("OCR requested but disabled. Enable it with invoicelink.ocr.enabled=true");
        return "";
    }
}
