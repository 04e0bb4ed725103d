package com.example.invoicelink.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Invoice row stored in the {@link RecordSheet#INVOICE_DETAILS} collection.
 * {@code poDate} and {@code department} are copies resolved from the linked purchase order at insert time.
 */
public record Invoice(
        int serial,
        String invoiceNumber,
        String invoiceDate,
        String poNumber,
        String poDate,
        String department,
        String grId,
        String grDate,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal grandTotal,
        InvoiceStatus status
) {

    /**
     * @return values in the column order of {@link RecordSheet#INVOICE_DETAILS}
     */
    public List<Object> toRow() {
        return List.of(serial, invoiceNumber, invoiceDate, poNumber, poDate, department,
                grId, grDate, subtotal, tax, grandTotal, status.label());
    }

    /**
     * Maps a stored row back to the record.
     *
     * @param row values in sheet column order
     * @return parsed invoice
     */
    public static Invoice fromRow(List<Object> row) {
        return new Invoice(
                RowValues.serial(row, 0),
                RowValues.text(row, 1),
                RowValues.text(row, 2),
                RowValues.text(row, 3),
                RowValues.text(row, 4),
                RowValues.text(row, 5),
                RowValues.text(row, 6),
                RowValues.text(row, 7),
                RowValues.amount(row, 8),
                RowValues.amount(row, 9),
                RowValues.amount(row, 10),
                InvoiceStatus.fromLabel(RowValues.text(row, 11))
        );
    }
}
