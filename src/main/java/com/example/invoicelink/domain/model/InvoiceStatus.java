package com.example.invoicelink.domain.model;

import java.util.Arrays;

/**
 * Payment status of an invoice. Records are always created as {@link #UNPAID}.
 */
public enum InvoiceStatus {
    UNPAID("UnPaid"),
    PAID("Paid");

    private final String label;

    InvoiceStatus(String label) {
        this.label = label;
    }

    /**
     * @return label written to the Status column
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a stored label, falling back to {@link #UNPAID} for blank or unknown values.
     *
     * @param label value read back from a sheet
     * @return matching status
     */
    public static InvoiceStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNPAID;
        }
        return Arrays.stream(values())
                .filter(status -> status.label.equalsIgnoreCase(label.trim()))
                .findFirst()
                .orElse(UNPAID);
    }
}
