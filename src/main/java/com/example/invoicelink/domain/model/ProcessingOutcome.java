package com.example.invoicelink.domain.model;

/**
 * Terminal state reached by a single source document.
 */
public enum ProcessingOutcome {
    INSERTED,
    SKIPPED_DUPLICATE,
    REJECTED_NO_TEXT,
    REJECTED_UNKNOWN_TYPE,
    REJECTED_UNPARSED,
    FAILED;

    public boolean isRejection() {
        return this != INSERTED && this != SKIPPED_DUPLICATE;
    }
}
