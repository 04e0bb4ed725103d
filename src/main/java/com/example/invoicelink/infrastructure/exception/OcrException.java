package com.example.invoicelink.infrastructure.exception;

/**
 * Signals a Tesseract failure while recognizing a page image.
 */
public class OcrException extends InfrastructureException {

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
