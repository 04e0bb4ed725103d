package com.example.invoicelink.interfaces.batch;

import com.example.invoicelink.application.service.DocumentProcessingService;
import com.example.invoicelink.config.InvoiceLinkProperties;
import com.example.invoicelink.domain.model.BatchProcessingReport;
import com.example.invoicelink.domain.model.ProcessingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Processes the configured input folder once at startup when
 * {@code invoicelink.batch.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "invoicelink.batch", name = "run-on-startup", havingValue = "true")
public class FolderBatchRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(FolderBatchRunner.class);

    private final DocumentProcessingService processingService;
    private final InvoiceLinkProperties properties;

    public FolderBatchRunner(DocumentProcessingService processingService, InvoiceLinkProperties properties) {
        this.processingService = processingService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        BatchProcessingReport report = processingService.processFolder(Path.of(properties.getInputFolder()));
        log.info("Processing complete: {} inserted, {} duplicates, {} rejected. Results saved to: {}",
                report.count(ProcessingOutcome.INSERTED),
                report.count(ProcessingOutcome.SKIPPED_DUPLICATE),
                report.rejectedCount(),
                properties.getWorkbookFile());
    }
}
