package com.example.invoicelink.config;

import com.example.invoicelink.infrastructure.ledger.ErrorLedger;
import com.example.invoicelink.infrastructure.ledger.FileErrorLedger;
import com.example.invoicelink.infrastructure.store.ExcelWorkbookStore;
import com.example.invoicelink.infrastructure.store.InMemoryTabularStore;
import com.example.invoicelink.infrastructure.store.TabularStore;
import com.example.invoicelink.infrastructure.text.DisabledOcrService;
import com.example.invoicelink.infrastructure.text.OcrService;
import com.example.invoicelink.infrastructure.text.TesseractOcrService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the external collaborators of the linking engine: record store, error ledger and OCR.
 */
@Configuration
@EnableConfigurationProperties(InvoiceLinkProperties.class)
public class InvoiceLinkConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InvoiceLinkConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(TabularStore.class)
    public TabularStore tabularStore(InvoiceLinkProperties properties) {
        String workbookFile = properties.getWorkbookFile();
        if (workbookFile == null || workbookFile.isBlank()) {
            log.info("No workbook file configured; records are kept in memory");
            return new InMemoryTabularStore();
        }
        return new ExcelWorkbookStore(Path.of(workbookFile));
    }

    @Bean
    @ConditionalOnMissingBean(ErrorLedger.class)
    public ErrorLedger errorLedger(InvoiceLinkProperties properties) {
        return new FileErrorLedger(Path.of(properties.getErrorLogFile()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "invoicelink.ocr", name = "enabled", havingValue = "true")
    public OcrService tesseractOcrService(InvoiceLinkProperties properties) {
        InvoiceLinkProperties.Ocr ocr = properties.getOcr();
        log.info("[OCR] Enabled: language='{}' tessdataPath='{}' renderDpi={} maxPages={}",
                ocr.getLanguage(), ocr.getTessdataPath(), ocr.getRenderDpi(), ocr.getMaxPages());
        return new TesseractOcrService(ocr);
    }

    @Bean
    @ConditionalOnMissingBean(OcrService.class)
    public OcrService disabledOcrService() {
        log.info("[OCR] Disabled (invoicelink.ocr.enabled=false)");
        return new DisabledOcrService();
    }
}
