package com.example.invoicelink.domain.exception;

/**
 * Base type for all domain-level exceptions in the core model.
 * Subclasses describe why a source document cannot become a record.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation of which rule rejected the input
	 */
    protected DomainException(String message) {
        super(message);
    }
}
