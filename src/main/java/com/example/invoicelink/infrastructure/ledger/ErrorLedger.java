package com.example.invoicelink.infrastructure.ledger;

/**
 * Append-only record of documents that could not be turned into records.
 */
public interface ErrorLedger {

    /**
     * @param source  file name, or a pseudo-source such as {@code "Excel Save"}
     * @param message failure reason
     */
    void record(String source, String message);
}
