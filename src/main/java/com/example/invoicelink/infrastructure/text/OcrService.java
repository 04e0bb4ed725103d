package com.example.invoicelink.infrastructure.text;

import java.awt.image.BufferedImage;

public interface OcrService {

    /**
     * Extracts text from a page or photo using OCR.
     *
     * @param image rendered page or decoded image
     * @return recognized text, empty when nothing was recognized
     */
    String extractText(BufferedImage image);
}
