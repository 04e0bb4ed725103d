package com.example.invoicelink.domain.exception;

import com.example.invoicelink.domain.model.DocumentType;

/**
 * Raised when a classified document yields no usable fields.
 */
public class UnparsableDocumentException extends DomainException {

    private final DocumentType documentType;

	/**
	 * @param fileName source file name
	 * @param type     classification the document was parsed as
	 */
    public UnparsableDocumentException(String fileName, DocumentType type) {
        super("Failed to parse " + (type == DocumentType.PURCHASE_ORDER ? "PO" : "invoice") + " data from " + fileName);
        this.documentType = type;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }
}
