package com.example.invoicelink.application.service;

import com.example.invoicelink.domain.model.DocumentField;
import com.example.invoicelink.domain.model.ExtractedFields;
import com.example.invoicelink.domain.model.Invoice;
import com.example.invoicelink.domain.model.InvoiceInsertResult;
import com.example.invoicelink.domain.model.InvoiceStatus;
import com.example.invoicelink.domain.model.PurchaseOrder;
import com.example.invoicelink.domain.model.RecordSheet;
import com.example.invoicelink.infrastructure.store.InMemoryTabularStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for serial assignment, invoice deduplication and purchase order linking.
 */
class RecordLinkerTest {

    private InMemoryTabularStore store;
    private RecordLinker linker;

    @BeforeEach
    void setUp() {
        store = new InMemoryTabularStore();
        linker = new RecordLinker(store);
    }

    @Test
    void serialsStartAtOneAndIncrement() {
        assertThat(linker.nextSerial(RecordSheet.PO_DETAILS)).isEqualTo(1);

        PurchaseOrder first = linker.insertPurchaseOrder(purchaseOrder("100", "500", "Finance"));
        PurchaseOrder second = linker.insertPurchaseOrder(purchaseOrder("200", "700", "Stores"));

        assertThat(first.serial()).isEqualTo(1);
        assertThat(second.serial()).isEqualTo(2);
        assertThat(linker.nextSerial(RecordSheet.PO_DETAILS)).isEqualTo(3);
        assertThat(linker.nextSerial(RecordSheet.INVOICE_DETAILS)).isEqualTo(1);
    }

    /**
     * Verifies that serials never collide when the stored serials have gaps.
     */
    @Test
    void nextSerialFollowsTheHighestStoredSerial() {
        store.appendRow(RecordSheet.PO_DETAILS, List.of(1, "100", "", BigDecimal.ZERO, "N/A"));
        store.appendRow(RecordSheet.PO_DETAILS, List.of(5, "200", "", BigDecimal.ZERO, "N/A"));

        assertThat(linker.nextSerial(RecordSheet.PO_DETAILS)).isEqualTo(6);
    }

    @Test
    void purchaseOrderDefaultsAmountAndDepartment() {
        PurchaseOrder order = linker.insertPurchaseOrder(ExtractedFields.of(Map.of(DocumentField.PO_NUMBER, "300")));

        assertThat(order.poAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(order.department()).isEqualTo("N/A");
        assertThat(order.poDate()).isEmpty();
    }

    @Test
    void duplicateInvoiceNumberIsSkipped() {
        ExtractedFields fields = invoice("A1001", "");

        InvoiceInsertResult first = linker.insertInvoice(fields);
        InvoiceInsertResult second = linker.insertInvoice(fields);

        assertThat(first.inserted()).isTrue();
        assertThat(second.inserted()).isFalse();
        assertThat(linker.invoices()).hasSize(1);
        assertThat(linker.invoiceExists("A1001")).isTrue();
    }

    @Test
    void invoicesWithoutNumberAreNeverDeduplicated() {
        linker.insertInvoice(ExtractedFields.of(Map.of(DocumentField.SUBTOTAL, "10")));
        linker.insertInvoice(ExtractedFields.of(Map.of(DocumentField.SUBTOTAL, "10")));

        assertThat(linker.invoices()).hasSize(2);
        assertThat(linker.invoices()).extracting(Invoice::serial).containsExactly(1, 2);
    }

    /**
     * Verifies that an unseen PO number creates exactly one stub order carrying the invoice's PO date.
     */
    @Test
    void unknownPoNumberCreatesStubPurchaseOrder() {
        ExtractedFields fields = invoice("A1001", "1234567890");
        fields.putIfAbsent(DocumentField.PO_DATE, "01-Jan-2024");

        InvoiceInsertResult result = linker.insertInvoice(fields);

        assertThat(result.stubCreated()).isTrue();
        List<PurchaseOrder> orders = linker.purchaseOrders();
        assertThat(orders).hasSize(1);
        PurchaseOrder stub = orders.get(0);
        assertThat(stub.poNumber()).isEqualTo("1234567890");
        assertThat(stub.poDate()).isEqualTo("01-Jan-2024");
        assertThat(stub.poAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(stub.department()).isEqualTo("N/A");

        Invoice invoice = result.invoice();
        assertThat(invoice.poNumber()).isEqualTo("1234567890");
        assertThat(invoice.poDate()).isEqualTo("01-Jan-2024");
        assertThat(invoice.department()).isEqualTo("N/A");
        assertThat(invoice.status()).isEqualTo(InvoiceStatus.UNPAID);
    }

    @Test
    void stubIsCreatedOnlyOncePerPoNumber() {
        linker.insertInvoice(invoice("A1", "777"));
        InvoiceInsertResult second = linker.insertInvoice(invoice("A2", "777"));

        assertThat(second.stubCreated()).isFalse();
        assertThat(linker.purchaseOrders()).hasSize(1);
        assertThat(linker.invoices()).hasSize(2);
    }

    /**
     * Verifies that a stored purchase order supplies the department and date of a later invoice.
     */
    @Test
    void invoiceCopiesDepartmentFromStoredPurchaseOrder() {
        ExtractedFields order = purchaseOrder("9999", "500", "Finance");
        order.putIfAbsent(DocumentField.PO_DATE, "15-Mar-2024");
        linker.insertPurchaseOrder(order);

        InvoiceInsertResult result = linker.insertInvoice(invoice("INV-1", "9999"));

        assertThat(result.stubCreated()).isFalse();
        assertThat(result.invoice().department()).isEqualTo("Finance");
        assertThat(result.invoice().poDate()).isEqualTo("15-Mar-2024");
        assertThat(linker.purchaseOrders()).hasSize(1);
    }

    @Test
    void invoicePoDateIsUsedWhenStoredOrderHasNone() {
        linker.insertPurchaseOrder(purchaseOrder("4242", "100", "Stores"));
        ExtractedFields fields = invoice("B7", "4242");
        fields.putIfAbsent(DocumentField.PO_DATE, "02-Feb-2024");

        Invoice invoice = linker.insertInvoice(fields).invoice();

        assertThat(invoice.poDate()).isEqualTo("02-Feb-2024");
        assertThat(invoice.department()).isEqualTo("Stores");
    }

    @Test
    void firstStoredOrderWinsWhenPoNumbersRepeat() {
        linker.insertPurchaseOrder(purchaseOrder("5000", "10", "Finance"));
        linker.insertPurchaseOrder(purchaseOrder("5000", "20", "Stores"));

        assertThat(linker.findPurchaseOrder("5000")).get()
                .extracting(PurchaseOrder::department)
                .isEqualTo("Finance");
        assertThat(linker.insertInvoice(invoice("C1", "5000")).invoice().department()).isEqualTo("Finance");
    }

    @Test
    void invoiceWithoutPoNumberIsStoredUnlinked() {
        InvoiceInsertResult result = linker.insertInvoice(invoice("D1", ""));

        assertThat(result.stubCreated()).isFalse();
        assertThat(result.invoice().poNumber()).isEmpty();
        assertThat(result.invoice().department()).isEqualTo("N/A");
        assertThat(linker.purchaseOrders()).isEmpty();
    }

    @Test
    void amountsAndStatusAreStored() {
        ExtractedFields fields = invoice("E1", "");
        fields.putIfAbsent(DocumentField.SUBTOTAL, "1000.00");
        fields.putIfAbsent(DocumentField.TAX, "120.00");
        fields.putIfAbsent(DocumentField.GRAND_TOTAL, "1120.00");
        fields.putIfAbsent(DocumentField.STATUS, "Paid");

        Invoice stored = linker.insertInvoice(fields).invoice();

        assertThat(stored.subtotal()).isEqualByComparingTo("1000");
        assertThat(stored.tax()).isEqualByComparingTo("120");
        assertThat(stored.grandTotal()).isEqualByComparingTo("1120");
        assertThat(stored.status()).isEqualTo(InvoiceStatus.PAID);
        assertThat(linker.invoices()).containsExactly(stored);
    }

    private static ExtractedFields purchaseOrder(String number, String amount, String department) {
        return ExtractedFields.of(Map.of(
                DocumentField.PO_NUMBER, number,
                DocumentField.PO_AMOUNT, amount,
                DocumentField.DEPARTMENT, department));
    }

    private static ExtractedFields invoice(String number, String poNumber) {
        ExtractedFields fields = ExtractedFields.empty();
        fields.putIfAbsent(DocumentField.INVOICE_NUMBER, number);
        fields.putIfAbsent(DocumentField.PO_NUMBER, poNumber);
        return fields;
    }
}
