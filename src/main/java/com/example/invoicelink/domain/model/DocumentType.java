package com.example.invoicelink.domain.model;

/**
 * Kind of business document recognized from extracted text.
 */
public enum DocumentType {
    INVOICE,
    PURCHASE_ORDER,
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
