package com.example.invoicelink.application.exception;

/**
 * Base unchecked exception for use-case failures that are neither a property of the document
 * nor an adapter fault, such as exporting a collection that holds no records.
 */
public abstract class ApplicationException extends RuntimeException {

    protected ApplicationException(String message) {
        super(message);
    }
}
