package com.example.invoicelink.domain.model;

import java.util.List;

/**
 * The two persisted collections and their column layout.
 */
public enum RecordSheet {
    PO_DETAILS("PO_Details", List.of("Serial Number", "PO Number", "PO Date", "PO Amount", "Department")),
    INVOICE_DETAILS("Invoice_Details", List.of(
            "Serial Number", "Invoice Number", "Invoice Date", "PO Number",
            "PO Date", "Department", "GR ID", "GR Date", "Subtotal",
            "Tax 12%", "Grand Total", "Status"));

    private final String sheetName;
    private final List<String> headers;

    RecordSheet(String sheetName, List<String> headers) {
        this.sheetName = sheetName;
        this.headers = headers;
    }

    public String sheetName() {
        return sheetName;
    }

    public List<String> headers() {
        return headers;
    }
}
