package com.example.invoicelink.application.service;

import com.example.invoicelink.domain.model.DocumentType;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Decides from signal phrases whether a text blob is an invoice, a purchase order, or neither.
 * The invoice rule is evaluated first, so text that satisfies both rules is an invoice.
 */
@Service
public class DocumentClassifier {

    private static final String INVOICE_PHRASE = "invoice";
    private static final String INVOICE_NUMBER_PHRASE = "invoice no";
    private static final String PURCHASE_ORDER_PHRASE = "purchase order";
    private static final String PO_NUMBER_PHRASE = "po no";

    public DocumentType classify(String text) {
        if (text == null || text.isBlank()) {
            return DocumentType.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        boolean mentionsInvoice = lower.contains(INVOICE_PHRASE);
        if (mentionsInvoice && lower.contains(INVOICE_NUMBER_PHRASE)) {
            return DocumentType.INVOICE;
        }
        if (lower.contains(PURCHASE_ORDER_PHRASE) || (lower.contains(PO_NUMBER_PHRASE) && !mentionsInvoice)) {
            return DocumentType.PURCHASE_ORDER;
        }
        return DocumentType.UNKNOWN;
    }
}
