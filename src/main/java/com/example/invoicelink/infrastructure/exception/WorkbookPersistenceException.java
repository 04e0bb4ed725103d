package com.example.invoicelink.infrastructure.exception;

/**
 * Signals that the workbook could not be loaded from or written to disk.
 */
public class WorkbookPersistenceException extends InfrastructureException {

    public WorkbookPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
