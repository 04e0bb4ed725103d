package com.example.invoicelink.infrastructure.text;

import com.example.invoicelink.config.InvoiceLinkProperties;
import com.example.invoicelink.infrastructure.exception.OcrException;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

import java.awt.image.BufferedImage;

public class TesseractOcrService implements OcrService {

    private final InvoiceLinkProperties.Ocr settings;

    /**
     * Tess4J's {@link Tesseract} is not thread-safe. Keep one instance per thread.
     */
    private final ThreadLocal<Tesseract> threadLocalTesseract;

    public TesseractOcrService(InvoiceLinkProperties.Ocr settings) {
        this.settings = settings;
        this.threadLocalTesseract = ThreadLocal.withInitial(this::createTesseract);
    }

    @Override
    public String extractText(BufferedImage image) {
        if (image == null) {
            return "";
        }
        try {
            String text = threadLocalTesseract.get().doOCR(image);
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed to recognize the image", e);
        }
    }

    private Tesseract createTesseract() {
        Tesseract tesseract = new Tesseract();
        String datapath = settings.getTessdataPath();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }
        String language = settings.getLanguage();
        if (language != null && !language.isBlank()) {
            tesseract.setLanguage(language);
        }
        return tesseract;
    }
}
