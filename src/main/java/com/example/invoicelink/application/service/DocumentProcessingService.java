package com.example.invoicelink.application.service;

import com.example.invoicelink.application.extraction.FieldExtractionEngine;
import com.example.invoicelink.domain.exception.DocumentFileRequiredException;
import com.example.invoicelink.domain.exception.DocumentTextMissingException;
import com.example.invoicelink.domain.exception.UnknownDocumentTypeException;
import com.example.invoicelink.domain.exception.UnparsableDocumentException;
import com.example.invoicelink.domain.exception.UnsupportedDocumentFormatException;
import com.example.invoicelink.domain.model.BatchProcessingReport;
import com.example.invoicelink.domain.model.DocumentField;
import com.example.invoicelink.domain.model.DocumentProcessingResult;
import com.example.invoicelink.domain.model.DocumentType;
import com.example.invoicelink.domain.model.ExtractedFields;
import com.example.invoicelink.domain.model.InvoiceInsertResult;
import com.example.invoicelink.domain.model.ProcessingOutcome;
import com.example.invoicelink.domain.model.PurchaseOrder;
import com.example.invoicelink.infrastructure.exception.DocumentReadException;
import com.example.invoicelink.infrastructure.exception.OcrException;
import com.example.invoicelink.infrastructure.exception.WorkbookPersistenceException;
import com.example.invoicelink.infrastructure.ledger.ErrorLedger;
import com.example.invoicelink.infrastructure.store.TabularStore;
import com.example.invoicelink.infrastructure.text.DocumentTextReader;
import com.example.invoicelink.infrastructure.text.ExtractedTextArchive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Application-layer service that runs one document at a time through
 * classification, extraction, derivation and linking.
 * <p>
 * Every per-document failure is caught here, logged with the file name, written to the error ledger
 * and reported as a {@link ProcessingOutcome}; it never aborts a batch.
 */
@Service
public class DocumentProcessingService {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessingService.class);
    static final String PERSISTENCE_SOURCE = "Excel Save";

    private final DocumentTextReader textReader;
    private final ExtractedTextArchive textArchive;
    private final DocumentClassifier classifier;
    private final FieldExtractionEngine extractionEngine;
    private final FieldDerivationService derivationService;
    private final RecordLinker linker;
    private final TabularStore store;
    private final ErrorLedger errorLedger;

    public DocumentProcessingService(DocumentTextReader textReader,
                                     ExtractedTextArchive textArchive,
                                     DocumentClassifier classifier,
                                     FieldExtractionEngine extractionEngine,
                                     FieldDerivationService derivationService,
                                     RecordLinker linker,
                                     TabularStore store,
                                     ErrorLedger errorLedger) {
        this.textReader = textReader;
        this.textArchive = textArchive;
        this.classifier = classifier;
        this.extractionEngine = extractionEngine;
        this.derivationService = derivationService;
        this.linker = linker;
        this.store = store;
        this.errorLedger = errorLedger;
    }

    /**
     * Processes every supported document in the folder, in file name order, then saves the store.
     *
     * @param folder input folder; created when missing
     * @return per-document results and whether the store was saved
     */
    public BatchProcessingReport processFolder(Path folder) {
        if (!Files.isDirectory(folder)) {
            log.error("Invoices folder not found: {}", folder);
            try {
                Files.createDirectories(folder);
                log.info("Created invoices folder: {}", folder);
            } catch (IOException e) {
                log.error("Unable to create invoices folder {}", folder, e);
            }
            return new BatchProcessingReport(folder.toString(), List.of(), false);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> DocumentTextReader.isSupported(path.getFileName().toString()))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new DocumentReadException("Unable to list " + folder, e);
        }
        if (files.isEmpty()) {
            log.warn("No files found in {}", folder);
            return new BatchProcessingReport(folder.toString(), List.of(), false);
        }

        log.info("Found {} files to process", files.size());
        List<DocumentProcessingResult> results = new ArrayList<>(files.size());
        for (Path file : files) {
            results.add(processFile(file));
        }
        return new BatchProcessingReport(folder.toString(), results, persist());
    }

    /**
     * Processes a single document from disk without saving the store.
     *
     * @param file PDF or image path
     * @return result for the document
     */
    public DocumentProcessingResult processFile(Path file) {
        String fileName = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        return processDocument(fileName, () -> textReader.readText(file));
    }

    /**
     * Processes an uploaded document and saves the store afterwards.
     *
     * @param file multipart upload
     * @return result for the document
     * @throws DocumentFileRequiredException      when the upload is missing or empty
     * @throws UnsupportedDocumentFormatException when the upload is neither a PDF nor a supported image
     */
    public DocumentProcessingResult processUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentFileRequiredException();
        }
        String fileName = DocumentTextReader.resolveFileName(file);
        if (!DocumentTextReader.isSupported(fileName)) {
            throw new UnsupportedDocumentFormatException(fileName);
        }
        DocumentProcessingResult result = processDocument(fileName, () -> textReader.readText(file));
        persist();
        return result;
    }

    /**
     * Processes text that was already extracted elsewhere and saves the store afterwards.
     *
     * @param fileName logical document name
     * @param text     extracted text
     * @return result for the document
     */
    public DocumentProcessingResult processText(String fileName, String text) {
        DocumentProcessingResult result = processDocument(fileName, () -> text);
        persist();
        return result;
    }

    /**
     * Saves the store. Failure is logged and recorded but never retried.
     *
     * @return {@code true} when the store was written
     */
    public boolean persist() {
        try {
            store.flush();
            return true;
        } catch (WorkbookPersistenceException e) {
            log.error("Error saving Excel file: {}", e.getMessage(), e);
            errorLedger.record(PERSISTENCE_SOURCE, e.getMessage());
            return false;
        }
    }

    private DocumentProcessingResult processDocument(String fileName, Supplier<String> textSource) {
        log.info("Processing file: {}", fileName);
        try {
            String text = textSource.get();
            if (text == null || text.isBlank()) {
                throw new DocumentTextMissingException(fileName);
            }
            textArchive.archive(fileName, text);
            return link(fileName, text);
        } catch (DocumentTextMissingException e) {
            return reject(fileName, null, ProcessingOutcome.REJECTED_NO_TEXT, e.getMessage());
        } catch (DocumentReadException | OcrException e) {
            log.error("Error extracting text from {}: {}", fileName, e.getMessage(), e);
            return reject(fileName, null, ProcessingOutcome.REJECTED_NO_TEXT, e.getMessage());
        } catch (UnknownDocumentTypeException e) {
            return reject(fileName, DocumentType.UNKNOWN, ProcessingOutcome.REJECTED_UNKNOWN_TYPE, e.getMessage());
        } catch (UnparsableDocumentException e) {
            return reject(fileName, e.getDocumentType(), ProcessingOutcome.REJECTED_UNPARSED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing {}: {}", fileName, e.getMessage(), e);
            return reject(fileName, null, ProcessingOutcome.FAILED, String.valueOf(e.getMessage()));
        }
    }

    private DocumentProcessingResult link(String fileName, String text) {
        DocumentType type = classifier.classify(text);
        if (!type.isKnown()) {
            throw new UnknownDocumentTypeException(fileName);
        }
        ExtractedFields extracted = extractionEngine.extractFields(text, type);
        if (!isUsable(extracted, type)) {
            throw new UnparsableDocumentException(fileName, type);
        }
        ExtractedFields fields = derivationService.derive(extracted, type);

        if (type == DocumentType.INVOICE) {
            log.info("Parsed data: Invoice={}, Date={}, PO={}, GR={}",
                    fields.getOrDefault(DocumentField.INVOICE_NUMBER, "N/A"),
                    fields.getOrDefault(DocumentField.INVOICE_DATE, "N/A"),
                    fields.getOrDefault(DocumentField.PO_NUMBER, "N/A"),
                    fields.getOrDefault(DocumentField.GR_ID, "N/A"));
            InvoiceInsertResult inserted = linker.insertInvoice(fields);
            if (!inserted.inserted()) {
                return new DocumentProcessingResult(fileName, type, ProcessingOutcome.SKIPPED_DUPLICATE,
                        "Invoice " + fields.getOrDefault(DocumentField.INVOICE_NUMBER, "") + " already exists",
                        fields.asMap(), null);
            }
            return new DocumentProcessingResult(fileName, type, ProcessingOutcome.INSERTED,
                    "Added invoice record: " + inserted.invoice().invoiceNumber(),
                    fields.asMap(), inserted.invoice().serial());
        }

        PurchaseOrder order = linker.insertPurchaseOrder(fields);
        return new DocumentProcessingResult(fileName, type, ProcessingOutcome.INSERTED,
                "Added PO record: " + order.poNumber(), fields.asMap(), order.serial());
    }

    /**
     * Invoices need at least one recognized field; purchase orders need their PO number.
     */
    private static boolean isUsable(ExtractedFields fields, DocumentType type) {
        if (type == DocumentType.PURCHASE_ORDER) {
            return fields.contains(DocumentField.PO_NUMBER);
        }
        return !fields.isEmpty();
    }

    private DocumentProcessingResult reject(String fileName, DocumentType type, ProcessingOutcome outcome, String message) {
        log.warn("{} ({})", message, outcome);
        errorLedger.record(fileName, message);
        return DocumentProcessingResult.rejected(fileName, type, outcome, message);
    }
}
