package com.example.invoicelink.application.exception;

/**
 * Thrown when a CSV export is requested for a collection that holds no records.
 */
public class CsvExportValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public CsvExportValidationException(String message) {
        super(message);
    }
}
