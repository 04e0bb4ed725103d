package com.example.invoicelink.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Purchase order row stored in the {@link RecordSheet#PO_DETAILS} collection.
 * The PO number is a business key only; duplicates may coexist and the serial is the identity.
 */
public record PurchaseOrder(
        int serial,
        String poNumber,
        String poDate,
        BigDecimal poAmount,
        String department
) {

    public static final String UNKNOWN_DEPARTMENT = "N/A";

    /**
     * @return values in the column order of {@link RecordSheet#PO_DETAILS}
     */
    public List<Object> toRow() {
        return List.of(serial, poNumber, poDate, poAmount, department);
    }

    /**
     * Maps a stored row back to the record.
     *
     * @param row values in sheet column order
     * @return parsed purchase order
     */
    public static PurchaseOrder fromRow(List<Object> row) {
        String department = RowValues.text(row, 4);
        return new PurchaseOrder(
                RowValues.serial(row, 0),
                RowValues.text(row, 1),
                RowValues.text(row, 2),
                RowValues.amount(row, 3),
                department.isEmpty() ? UNKNOWN_DEPARTMENT : department
        );
    }
}
