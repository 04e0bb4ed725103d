package com.example.invoicelink.infrastructure.exception;

/**
 * Signals issues while reading a PDF or image from disk or memory.
 */
public class DocumentReadException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox or ImageIO exception
	 */
    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
