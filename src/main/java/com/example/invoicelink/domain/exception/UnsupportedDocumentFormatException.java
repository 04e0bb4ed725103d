package com.example.invoicelink.domain.exception;

/**
 * Raised when the file is neither a PDF nor one of the supported image formats.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Unsupported file format" + (fileName != null ? ": " + fileName : "."));
    }
}
