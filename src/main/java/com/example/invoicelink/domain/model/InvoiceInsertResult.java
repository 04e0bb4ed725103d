package com.example.invoicelink.domain.model;

/**
 * Outcome of linking an invoice into the store.
 *
 * @param invoice          stored record, or {@code null} when the invoice number was already present
 * @param createdStub      purchase order auto-created for an unseen PO number, or {@code null}
 */
public record InvoiceInsertResult(Invoice invoice, PurchaseOrder createdStub) {

    public static InvoiceInsertResult duplicate() {
        return new InvoiceInsertResult(null, null);
    }

    public boolean inserted() {
        return invoice != null;
    }

    public boolean stubCreated() {
        return createdStub != null;
    }
}
