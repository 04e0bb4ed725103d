package com.example.invoicelink.domain.exception;

/**
 * Raised when neither the text layer nor OCR produced any text for a document.
 */
public class DocumentTextMissingException extends DomainException {

    public DocumentTextMissingException(String fileName) {
        super("No text could be extracted from " + fileName);
    }
}
