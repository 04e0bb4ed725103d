package com.example.invoicelink.domain.model;

/**
 * Named fields that can be recovered from invoice and purchase order text.
 */
public enum DocumentField {
    INVOICE_NUMBER("invoice_number", FieldKind.IDENTIFIER),
    INVOICE_DATE("invoice_date", FieldKind.DATE),
    PO_NUMBER("po_number", FieldKind.IDENTIFIER),
    PO_DATE("po_date", FieldKind.DATE),
    PO_AMOUNT("po_amount", FieldKind.AMOUNT),
    DEPARTMENT("department", FieldKind.TEXT),
    GR_ID("gr_id", FieldKind.IDENTIFIER),
    GR_DATE("gr_date", FieldKind.DATE),
    SUBTOTAL("subtotal", FieldKind.AMOUNT),
    TAX("tax", FieldKind.AMOUNT),
    GRAND_TOTAL("grand_total", FieldKind.AMOUNT),
    STATUS("status", FieldKind.TEXT);

    private final String key;
    private final FieldKind kind;

    DocumentField(String key, FieldKind kind) {
        this.key = key;
        this.kind = kind;
    }

    /**
     * @return stable snake_case name used in logs and API payloads
     */
    public String key() {
        return key;
    }

    public FieldKind kind() {
        return kind;
    }
}
