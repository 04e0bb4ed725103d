package com.example.invoicelink.domain.model;

import java.util.Map;

/**
 * Per-document report returned by the processing pipeline.
 *
 * @param fileName     source file name
 * @param documentType classification result, {@code null} when no text was available
 * @param outcome      terminal state
 * @param message      human readable reason
 * @param fields       extracted and derived fields keyed by snake_case name
 * @param serial       serial of the inserted record, {@code null} unless {@link ProcessingOutcome#INSERTED}
 */
public record DocumentProcessingResult(
        String fileName,
        DocumentType documentType,
        ProcessingOutcome outcome,
        String message,
        Map<String, String> fields,
        Integer serial
) {

    public static DocumentProcessingResult rejected(String fileName, DocumentType type,
                                                    ProcessingOutcome outcome, String message) {
        return new DocumentProcessingResult(fileName, type, outcome, message, Map.of(), null);
    }
}
