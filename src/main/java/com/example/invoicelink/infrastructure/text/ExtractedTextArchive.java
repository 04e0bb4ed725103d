package com.example.invoicelink.infrastructure.text;

import com.example.invoicelink.config.InvoiceLinkProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps a copy of every extracted text as {@code <stem>_extracted.txt} for pattern debugging.
 * Disabled while {@code invoicelink.debug-text-dir} is blank.
 */
@Component
public class ExtractedTextArchive {

    private static final Logger log = LoggerFactory.getLogger(ExtractedTextArchive.class);

    private final InvoiceLinkProperties properties;

    public ExtractedTextArchive(InvoiceLinkProperties properties) {
        this.properties = properties;
    }

    /**
     * @param fileName source document name
     * @param text     extracted text
     * @return written file, empty when archiving is disabled or the write failed
     */
    public Optional<Path> archive(String fileName, String text) {
        String directory = properties.getDebugTextDir();
        if (directory == null || directory.isBlank()) {
            return Optional.empty();
        }
        Path target = Path.of(directory).resolve(stem(fileName) + "_extracted.txt");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, text, StandardCharsets.UTF_8);
            log.info("Saved extracted text to: {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Could not save extracted text for {}", fileName, e);
            return Optional.empty();
        }
    }

    private static String stem(String fileName) {
        String name = Path.of(fileName).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
