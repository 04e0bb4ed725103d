package com.example.invoicelink.application.service;

import com.example.invoicelink.application.exception.CsvExportValidationException;
import com.example.invoicelink.domain.model.DocumentField;
import com.example.invoicelink.domain.model.ExtractedFields;
import com.example.invoicelink.domain.model.RecordSheet;
import com.example.invoicelink.infrastructure.store.InMemoryTabularStore;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the CSV export that backs the download endpoints.
 */
class CsvExportServiceTest {

    private final RecordLinker linker = new RecordLinker(new InMemoryTabularStore());
    private final CsvExportService service = new CsvExportService(linker);

    /**
     * Ensures that exporting an empty collection raises the validation error.
     */
    @Test
    void exportWithoutRecordsThrows() {
        CsvExportValidationException ex = assertThrows(CsvExportValidationException.class,
                () -> service.export(RecordSheet.INVOICE_DETAILS));

        assertThat(ex.getMessage()).isEqualTo("No Invoice_Details records available for export.");
    }

    /**
     * Ensures that the header row comes first and values containing commas are quoted.
     */
    @Test
    void exportWritesHeaderAndQuotedValues() {
        linker.insertPurchaseOrder(ExtractedFields.of(Map.of(
                DocumentField.PO_NUMBER, "9999",
                DocumentField.PO_DATE, "15-Mar-2024",
                DocumentField.PO_AMOUNT, "500",
                DocumentField.DEPARTMENT, "Finance, East")));

        String csv = service.export(RecordSheet.PO_DETAILS);

        assertThat(csv.split("\n")).containsExactly(
                "Serial Number,PO Number,PO Date,PO Amount,Department",
                "1,9999,15-Mar-2024,500,\"Finance, East\"");
    }

    @Test
    void invoiceExportUsesStatusLabel() {
        linker.insertInvoice(ExtractedFields.of(Map.of(
                DocumentField.INVOICE_NUMBER, "A1001",
                DocumentField.SUBTOTAL, "1000.00",
                DocumentField.TAX, "120.00",
                DocumentField.GRAND_TOTAL, "1120.00")));

        String csv = service.export(RecordSheet.INVOICE_DETAILS);

        assertThat(csv).startsWith("Serial Number,Invoice Number,");
        assertThat(csv).contains("1,A1001,,,,N/A,,,1000.00,120.00,1120.00,UnPaid");
    }
}
