package com.example.invoicelink.application.service;

import com.example.invoicelink.domain.model.DocumentField;
import com.example.invoicelink.domain.model.DocumentType;
import com.example.invoicelink.domain.model.ExtractedFields;
import com.example.invoicelink.domain.model.InvoiceStatus;
import com.example.invoicelink.domain.model.PurchaseOrder;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Fills computed fields that the document did not state explicitly.
 */
@Service
public class FieldDerivationService {

    /**
     * Flat sales tax applied when an invoice states only its subtotal.
     */
    public static final BigDecimal DEFAULT_TAX_RATE = new BigDecimal("0.12");

    /**
     * Returns a copy of the fields completed with tax, grand total, status or department defaults.
     *
     * @param fields extracted fields, left untouched
     * @param type   document type the fields were extracted for
     * @return completed copy
     */
    public ExtractedFields derive(ExtractedFields fields, DocumentType type) {
        ExtractedFields derived = fields.copy();
        if (type == DocumentType.INVOICE) {
            deriveInvoiceTotals(derived);
            derived.putIfAbsent(DocumentField.STATUS, InvoiceStatus.UNPAID.label());
        } else if (type == DocumentType.PURCHASE_ORDER) {
            derived.putIfAbsent(DocumentField.DEPARTMENT, PurchaseOrder.UNKNOWN_DEPARTMENT);
        }
        return derived;
    }

    private void deriveInvoiceTotals(ExtractedFields fields) {
        Optional<BigDecimal> subtotal = fields.amount(DocumentField.SUBTOTAL);
        if (subtotal.isEmpty()) {
            return;
        }
        if (!fields.contains(DocumentField.TAX)) {
            BigDecimal tax = subtotal.get().multiply(DEFAULT_TAX_RATE).setScale(2, RoundingMode.HALF_UP);
            fields.putIfAbsent(DocumentField.TAX, tax.toPlainString());
        }
        if (!fields.contains(DocumentField.GRAND_TOTAL)) {
            BigDecimal tax = fields.amount(DocumentField.TAX).orElse(BigDecimal.ZERO);
            fields.putIfAbsent(DocumentField.GRAND_TOTAL, subtotal.get().add(tax).toPlainString());
        }
    }
}
