package com.example.invoicelink.infrastructure.text;

import com.example.invoicelink.domain.exception.DocumentFileRequiredException;
import com.example.invoicelink.domain.exception.DocumentNotFoundException;
import com.example.invoicelink.domain.exception.UnsupportedDocumentFormatException;
import com.example.invoicelink.infrastructure.exception.DocumentReadException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Infrastructure service that turns PDFs and images into plain text.
 * PDFs are read through their text layer first; pages without one fall back to OCR, as do images.
 */
@Service
public class DocumentTextReader {

    private static final Logger log = LoggerFactory.getLogger(DocumentTextReader.class);

    public static final Set<String> PDF_EXTENSIONS = Set.of(".pdf");
    public static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".tiff", ".tif", ".bmp");

    private final PdfOcrExtractor pdfOcrExtractor;
    private final OcrService ocrService;

    public DocumentTextReader(PdfOcrExtractor pdfOcrExtractor, OcrService ocrService) {
        this.pdfOcrExtractor = pdfOcrExtractor;
        this.ocrService = ocrService;
    }

    /**
     * @param fileName file name or path
     * @return {@code true} for PDF and supported image extensions
     */
    public static boolean isSupported(String fileName) {
        String extension = extensionOf(fileName);
        return PDF_EXTENSIONS.contains(extension) || IMAGE_EXTENSIONS.contains(extension);
    }

    /**
     * Reads a document from the filesystem.
     *
     * @param file PDF or image path
     * @return extracted text, possibly empty
     * @throws DocumentFileRequiredException       when {@code file} is null
     * @throws DocumentNotFoundException           when the path does not exist
     * @throws UnsupportedDocumentFormatException  when the extension is not supported
     * @throws DocumentReadException               when the file cannot be decoded
     */
    public String readText(Path file) {
        if (file == null) {
            throw new DocumentFileRequiredException();
        }
        if (!Files.exists(file)) {
            throw new DocumentNotFoundException(file.toAbsolutePath().toString());
        }
        String fileName = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        if (!isSupported(fileName)) {
            throw new UnsupportedDocumentFormatException(fileName);
        }
        try {
            return readText(Files.readAllBytes(file), fileName);
        } catch (IOException e) {
            throw new DocumentReadException("Unable to read " + file, e);
        }
    }

    /**
     * Reads an uploaded document.
     *
     * @param file multipart upload
     * @return extracted text, possibly empty
     */
    public String readText(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentFileRequiredException();
        }
        try {
            return readText(file.getBytes(), resolveFileName(file));
        } catch (IOException e) {
            throw new DocumentReadException("Unable to process the uploaded file.", e);
        }
    }

    /**
     * Extracts text from raw bytes, dispatching on the file extension.
     *
     * @param bytes    document content
     * @param fileName name carrying the extension
     * @return extracted text, possibly empty
     */
    public String readText(byte[] bytes, String fileName) {
        String extension = extensionOf(fileName);
        try {
            if (PDF_EXTENSIONS.contains(extension)) {
                return readPdf(bytes, fileName);
            }
            if (IMAGE_EXTENSIONS.contains(extension)) {
                return readImage(bytes, fileName);
            }
        } catch (IOException e) {
            throw new DocumentReadException("Error extracting text from " + fileName, e);
        }
        throw new UnsupportedDocumentFormatException(fileName);
    }

    /**
     * Determines a display name for an upload.
     *
     * @param file uploaded file
     * @return original filename or a default placeholder
     */
    public static String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }

    private String readPdf(byte[] bytes, String fileName) throws IOException {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setShouldSeparateByBeads(true);
            stripper.setLineSeparator("\n");
            String text = stripper.getText(document);
            if (text != null && !text.isBlank()) {
                log.info("Extracted text from {} using PDFBox", fileName);
                return text;
            }
            log.info("No text layer found in {}, using OCR", fileName);
            return pdfOcrExtractor.extractText(document, fileName);
        }
    }

    private String readImage(byte[] bytes, String fileName) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("No image reader accepts " + fileName);
        }
        try {
            String text = ocrService.extractText(image);
            log.info("OCR extracted text from {}", fileName);
            return text;
        } finally {
            image.flush();
        }
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
