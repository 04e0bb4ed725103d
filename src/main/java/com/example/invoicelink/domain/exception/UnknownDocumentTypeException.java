package com.example.invoicelink.domain.exception;

/**
 * Raised when the text carries neither invoice nor purchase order signal phrases.
 */
public class UnknownDocumentTypeException extends DomainException {

    public UnknownDocumentTypeException(String fileName) {
        super("Unknown document type: " + fileName);
    }
}
