package com.example.invoicelink.interfaces.api;

import com.example.invoicelink.application.service.CsvExportService;
import com.example.invoicelink.application.service.DocumentProcessingService;
import com.example.invoicelink.application.service.RecordLinker;
import com.example.invoicelink.config.InvoiceLinkProperties;
import com.example.invoicelink.domain.model.BatchProcessingReport;
import com.example.invoicelink.domain.model.DocumentProcessingResult;
import com.example.invoicelink.domain.model.Invoice;
import com.example.invoicelink.domain.model.PurchaseOrder;
import com.example.invoicelink.domain.model.RecordSheet;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Interfaces-layer controller for document ingestion, record listing and CSV export.
 */
@RestController
public class DocumentController {

    private final DocumentProcessingService processingService;
    private final RecordLinker linker;
    private final CsvExportService csvExportService;
    private final InvoiceLinkProperties properties;

    public DocumentController(DocumentProcessingService processingService,
                              RecordLinker linker,
                              CsvExportService csvExportService,
                              InvoiceLinkProperties properties) {
        this.processingService = processingService;
        this.linker = linker;
        this.csvExportService = csvExportService;
        this.properties = properties;
    }

    /**
     * Ingests one uploaded PDF or image.
     *
     * @param file uploaded document
     * @return processing result, including rejections
     */
    @PostMapping(value = "/api/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DocumentProcessingResult> uploadDocument(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(processingService.processUpload(file));
    }

    /**
     * Ingests text that was extracted by another system.
     *
     * @param fileName logical document name used in logs and the error ledger
     * @param text     extracted text
     * @return processing result, including rejections
     */
    @PostMapping(value = "/api/documents/text", consumes = MediaType.TEXT_PLAIN_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DocumentProcessingResult> submitText(
            @RequestParam(value = "fileName", defaultValue = "submitted.txt") String fileName,
            @RequestBody String text) {
        return ResponseEntity.ok(processingService.processText(fileName, text));
    }

    /**
     * Processes every document in the configured input folder.
     *
     * @return batch summary
     */
    @PostMapping(value = "/api/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchProcessingReport> runBatch() {
        return ResponseEntity.ok(processingService.processFolder(Path.of(properties.getInputFolder())));
    }

    @GetMapping(value = "/api/purchase-orders", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PurchaseOrder> purchaseOrders() {
        return linker.purchaseOrders();
    }

    @GetMapping(value = "/api/invoices", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Invoice> invoices() {
        return linker.invoices();
    }

    @GetMapping("/export/purchase-orders.csv")
    public ResponseEntity<byte[]> exportPurchaseOrders() {
        return csvDownload(RecordSheet.PO_DETAILS, "purchase-orders.csv");
    }

    @GetMapping("/export/invoices.csv")
    public ResponseEntity<byte[]> exportInvoices() {
        return csvDownload(RecordSheet.INVOICE_DETAILS, "invoices.csv");
    }

    private ResponseEntity<byte[]> csvDownload(RecordSheet sheet, String downloadName) {
        String csv = csvExportService.export(sheet);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + downloadName + "\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
