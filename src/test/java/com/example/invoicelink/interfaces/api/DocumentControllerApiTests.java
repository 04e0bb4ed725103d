package com.example.invoicelink.interfaces.api;

import com.example.invoicelink.application.exception.CsvExportValidationException;
import com.example.invoicelink.application.service.CsvExportService;
import com.example.invoicelink.application.service.DocumentProcessingService;
import com.example.invoicelink.application.service.RecordLinker;
import com.example.invoicelink.config.InvoiceLinkProperties;
import com.example.invoicelink.domain.exception.DocumentFileRequiredException;
import com.example.invoicelink.domain.exception.UnsupportedDocumentFormatException;
import com.example.invoicelink.domain.model.DocumentProcessingResult;
import com.example.invoicelink.domain.model.DocumentType;
import com.example.invoicelink.domain.model.ProcessingOutcome;
import com.example.invoicelink.domain.model.PurchaseOrder;
import com.example.invoicelink.domain.model.RecordSheet;
import com.example.invoicelink.infrastructure.exception.DocumentReadException;
import com.example.invoicelink.interfaces.api.error.GlobalExceptionHandler;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = DocumentController.class)
@Import(GlobalExceptionHandler.class)
class DocumentControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocumentProcessingService processingService;

    @MockBean
    private RecordLinker linker;

    @MockBean
    private CsvExportService csvExportService;

    @MockBean
    private InvoiceLinkProperties properties;

    /**
     * Verifies that an uploaded document returns its processing result.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void uploadReturnsProcessingResult() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "invoice.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(processingService.processUpload(BDDMockito.any(MultipartFile.class)))
                .willReturn(new DocumentProcessingResult("invoice.pdf", DocumentType.INVOICE,
                        ProcessingOutcome.INSERTED, "Added invoice record: A1001",
                        Map.of("invoice_number", "A1001"), 1));

        mockMvc.perform(multipart("/api/documents").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("INSERTED"))
                .andExpect(jsonPath("$.documentType").value("INVOICE"))
                .andExpect(jsonPath("$.fields.invoice_number").value("A1001"))
                .andExpect(jsonPath("$.serial").value(1));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "invoice.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(processingService.processUpload(BDDMockito.any(MultipartFile.class)))
                .willThrow(new DocumentFileRequiredException());

        mockMvc.perform(multipart("/api/documents").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    @Test
    void unsupportedUploadListsAcceptedExtensions() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "data".getBytes());
        BDDMockito.given(processingService.processUpload(BDDMockito.any(MultipartFile.class)))
                .willThrow(new UnsupportedDocumentFormatException("notes.txt"));

        mockMvc.perform(multipart("/api/documents").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNSUPPORTED_DOCUMENT_FORMAT"))
                .andExpect(jsonPath("$.details.pdfExtensions[0]").value(".pdf"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "invoice.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(processingService.processUpload(BDDMockito.any(MultipartFile.class)))
                .willThrow(new DocumentReadException("Unable", new IOException("boom")));

        mockMvc.perform(multipart("/api/documents").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void submittedTextIsProcessedUnderItsFileName() throws Exception {
        BDDMockito.given(processingService.processText("memo.txt", "Delivery note"))
                .willReturn(DocumentProcessingResult.rejected("memo.txt", DocumentType.UNKNOWN,
                        ProcessingOutcome.REJECTED_UNKNOWN_TYPE, "Unknown document type: memo.txt"));

        mockMvc.perform(post("/api/documents/text")
                        .param("fileName", "memo.txt")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("Delivery note"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("REJECTED_UNKNOWN_TYPE"))
                .andExpect(jsonPath("$.message").value("Unknown document type: memo.txt"));
    }

    @Test
    void listsPurchaseOrders() throws Exception {
        BDDMockito.given(linker.purchaseOrders())
                .willReturn(List.of(new PurchaseOrder(1, "9999", "15-Mar-2024", new BigDecimal("500"), "Finance")));

        mockMvc.perform(get("/api/purchase-orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].poNumber").value("9999"))
                .andExpect(jsonPath("$[0].department").value("Finance"));
    }

    /**
     * Verifies that the CSV download carries an attachment header.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void exportsPurchaseOrdersAsCsv() throws Exception {
        BDDMockito.given(csvExportService.export(RecordSheet.PO_DETAILS))
                .willReturn("Serial Number,PO Number,PO Date,PO Amount,Department\n1,9999,15-Mar-2024,500,Finance\n");

        mockMvc.perform(get("/export/purchase-orders.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"purchase-orders.csv\""))
                .andExpect(content().string(Matchers.containsString("1,9999,15-Mar-2024,500,Finance")));
    }

    /**
     * Verifies that CSV export validation errors translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void csvExportValidationExceptionMappedTo422() throws Exception {
        BDDMockito.given(csvExportService.export(RecordSheet.INVOICE_DETAILS))
                .willThrow(new CsvExportValidationException("No Invoice_Details records available for export."));

        mockMvc.perform(get("/export/invoices.csv"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("CSV_EXPORT_VALIDATION_ERROR"));
    }
}
