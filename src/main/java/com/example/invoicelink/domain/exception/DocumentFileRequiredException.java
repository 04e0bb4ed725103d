package com.example.invoicelink.domain.exception;

/**
 * Raised when an upload request arrives without a document.
 */
public class DocumentFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public DocumentFileRequiredException() {
        super("Please choose a PDF or image file to upload.");
    }
}
