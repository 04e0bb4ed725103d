package com.example.invoicelink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from {@code invoicelink.*} in {@code application.properties}.
 */
@ConfigurationProperties(prefix = "invoicelink")
public class InvoiceLinkProperties {

    /**
     * Folder scanned for PDF and image documents by the batch run.
     */
    private String inputFolder = "invoices";

    /**
     * Workbook holding the PO_Details and Invoice_Details sheets. Blank keeps records in memory only.
     */
    private String workbookFile = "invoices.xlsx";

    /**
     * File receiving one timestamped line per rejected document.
     */
    private String errorLogFile = "log.txt";

    /**
     * Folder receiving the extracted text of every document. Blank disables the dump.
     */
    private String debugTextDir = "";

    private Batch batch = new Batch();

    private Ocr ocr = new Ocr();

    public String getInputFolder() {
        return inputFolder;
    }

    public void setInputFolder(String inputFolder) {
        this.inputFolder = inputFolder;
    }

    public String getWorkbookFile() {
        return workbookFile;
    }

    public void setWorkbookFile(String workbookFile) {
        this.workbookFile = workbookFile;
    }

    public String getErrorLogFile() {
        return errorLogFile;
    }

    public void setErrorLogFile(String errorLogFile) {
        this.errorLogFile = errorLogFile;
    }

    public String getDebugTextDir() {
        return debugTextDir;
    }

    public void setDebugTextDir(String debugTextDir) {
        this.debugTextDir = debugTextDir;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public void setOcr(Ocr ocr) {
        this.ocr = ocr;
    }

    public static class Batch {

        /**
         * Processes the input folder once the application has started.
         */
        private boolean runOnStartup = false;

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }
    }

    public static class Ocr {

        /**
         * Enables Tesseract for images and for PDFs without a text layer.
         */
        private boolean enabled = false;

        private String language = "eng";

        /**
         * Optional path that contains the "tessdata" directory.
         */
        private String tessdataPath = "";

        private int renderDpi = 300;

        private int maxPages = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getTessdataPath() {
            return tessdataPath;
        }

        public void setTessdataPath(String tessdataPath) {
            this.tessdataPath = tessdataPath;
        }

        public int getRenderDpi() {
            return renderDpi;
        }

        public void setRenderDpi(int renderDpi) {
            this.renderDpi = renderDpi;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }
    }
}
