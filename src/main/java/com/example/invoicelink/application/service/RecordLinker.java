package com.example.invoicelink.application.service;

import com.example.invoicelink.domain.model.DocumentField;
import com.example.invoicelink.domain.model.ExtractedFields;
import com.example.invoicelink.domain.model.Invoice;
import com.example.invoicelink.domain.model.InvoiceInsertResult;
import com.example.invoicelink.domain.model.InvoiceStatus;
import com.example.invoicelink.domain.model.PurchaseOrder;
import com.example.invoicelink.domain.model.RecordSheet;
import com.example.invoicelink.infrastructure.store.TabularStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational core over the two record collections: assigns serials, deduplicates invoices by number
 * and links every invoice to a purchase order, creating a stub order when the number is unseen.
 * <p>
 * Lookups scan the stored rows and the first exact match on the business key wins. Every public
 * operation holds the linker monitor, so a read-then-append sequence cannot interleave with another.
 */
@Service
public class RecordLinker {

    private static final Logger log = LoggerFactory.getLogger(RecordLinker.class);

    private final TabularStore store;

    public RecordLinker(TabularStore store) {
        this.store = store;
    }

    /**
     * Computes the serial for the next row of a collection.
     *
     * @param sheet target collection
     * @return 1 for an empty collection, otherwise one past the highest stored serial (never below count + 1)
     */
    public synchronized int nextSerial(RecordSheet sheet) {
        List<List<Object>> rows = store.rows(sheet);
        int highest = rows.stream()
                .mapToInt(row -> sheet == RecordSheet.PO_DETAILS
                        ? PurchaseOrder.fromRow(row).serial()
                        : Invoice.fromRow(row).serial())
                .max()
                .orElse(0);
        return Math.max(highest, rows.size()) + 1;
    }

    /**
     * @param poNumber business key to look up
     * @return first purchase order stored with exactly this number
     */
    public synchronized Optional<PurchaseOrder> findPurchaseOrder(String poNumber) {
        if (poNumber == null || poNumber.isEmpty()) {
            return Optional.empty();
        }
        return purchaseOrders().stream()
                .filter(order -> order.poNumber().equals(poNumber))
                .findFirst();
    }

    public synchronized boolean invoiceExists(String invoiceNumber) {
        if (invoiceNumber == null || invoiceNumber.isEmpty()) {
            return false;
        }
        return invoices().stream().anyMatch(invoice -> invoice.invoiceNumber().equals(invoiceNumber));
    }

    /**
     * Appends a purchase order unconditionally; orders sharing a PO number coexist.
     *
     * @param fields parsed purchase order fields
     * @return stored record
     */
    public synchronized PurchaseOrder insertPurchaseOrder(ExtractedFields fields) {
        PurchaseOrder order = new PurchaseOrder(
                nextSerial(RecordSheet.PO_DETAILS),
                fields.getOrDefault(DocumentField.PO_NUMBER, ""),
                fields.getOrDefault(DocumentField.PO_DATE, ""),
                fields.amount(DocumentField.PO_AMOUNT).orElse(BigDecimal.ZERO),
                fields.getOrDefault(DocumentField.DEPARTMENT, PurchaseOrder.UNKNOWN_DEPARTMENT)
        );
        store.appendRow(RecordSheet.PO_DETAILS, order.toRow());
        log.info("Added PO record: {}", order.poNumber());
        return order;
    }

    /**
     * Links and appends an invoice unless its number is already stored.
     *
     * @param fields parsed and derived invoice fields
     * @return inserted invoice plus the auto-created stub order, or {@link InvoiceInsertResult#duplicate()}
     */
    public synchronized InvoiceInsertResult insertInvoice(ExtractedFields fields) {
        String invoiceNumber = fields.getOrDefault(DocumentField.INVOICE_NUMBER, "");
        if (invoiceExists(invoiceNumber)) {
            log.info("Invoice {} already exists - skipping", invoiceNumber);
            return InvoiceInsertResult.duplicate();
        }

        String poNumber = fields.getOrDefault(DocumentField.PO_NUMBER, "");
        Optional<PurchaseOrder> linked = findPurchaseOrder(poNumber);
        PurchaseOrder stub = null;
        if (linked.isEmpty() && !poNumber.isEmpty()) {
            log.info("PO Number {} not found in {} - auto-creating from invoice data",
                    poNumber, RecordSheet.PO_DETAILS.sheetName());
            stub = insertPurchaseOrder(ExtractedFields.of(Map.of(
                    DocumentField.PO_NUMBER, poNumber,
                    DocumentField.PO_DATE, fields.getOrDefault(DocumentField.PO_DATE, ""))));
            linked = findPurchaseOrder(poNumber);
        }

        String poDate = linked.map(PurchaseOrder::poDate)
                .filter(date -> !date.isEmpty())
                .orElseGet(() -> fields.getOrDefault(DocumentField.PO_DATE, ""));
        String department = linked.map(PurchaseOrder::department)
                .filter(value -> !value.isEmpty())
                .orElseGet(() -> fields.getOrDefault(DocumentField.DEPARTMENT, PurchaseOrder.UNKNOWN_DEPARTMENT));

        Invoice invoice = new Invoice(
                nextSerial(RecordSheet.INVOICE_DETAILS),
                invoiceNumber,
                fields.getOrDefault(DocumentField.INVOICE_DATE, ""),
                poNumber,
                poDate,
                department,
                fields.getOrDefault(DocumentField.GR_ID, ""),
                fields.getOrDefault(DocumentField.GR_DATE, ""),
                fields.amount(DocumentField.SUBTOTAL).orElse(BigDecimal.ZERO),
                fields.amount(DocumentField.TAX).orElse(BigDecimal.ZERO),
                fields.amount(DocumentField.GRAND_TOTAL).orElse(BigDecimal.ZERO),
                InvoiceStatus.fromLabel(fields.getOrDefault(DocumentField.STATUS, InvoiceStatus.UNPAID.label()))
        );
        store.appendRow(RecordSheet.INVOICE_DETAILS, invoice.toRow());
        log.info("Added invoice record: {}", invoiceNumber);
        return new InvoiceInsertResult(invoice, stub);
    }

    public synchronized List<PurchaseOrder> purchaseOrders() {
        return store.rows(RecordSheet.PO_DETAILS).stream().map(PurchaseOrder::fromRow).toList();
    }

    public synchronized List<Invoice> invoices() {
        return store.rows(RecordSheet.INVOICE_DETAILS).stream().map(Invoice::fromRow).toList();
    }
}
