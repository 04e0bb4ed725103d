package com.example.invoicelink.domain.model;

import java.util.List;

/**
 * Summary of a folder run.
 *
 * @param folder    scanned input folder
 * @param results   per-document results in processing order
 * @param persisted whether the tabular store was flushed successfully
 */
public record BatchProcessingReport(
        String folder,
        List<DocumentProcessingResult> results,
        boolean persisted
) {

    public long count(ProcessingOutcome outcome) {
        return results.stream().filter(result -> result.outcome() == outcome).count();
    }

    public long rejectedCount() {
        return results.stream().filter(result -> result.outcome().isRejection()).count();
    }
}
