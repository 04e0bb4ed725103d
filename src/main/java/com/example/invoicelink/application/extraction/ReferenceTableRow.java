package com.example.invoicelink.application.extraction;

/**
 * Raw values read from a {@code PO NO | PO DATE | GR NO | GR DATE} table row.
 */
public record ReferenceTableRow(String poNumber, String poDate, String grId, String grDate) {
}
