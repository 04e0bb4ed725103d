package com.example.invoicelink.infrastructure.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Appends {@code [yyyy-MM-dd HH:mm:ss] source: message} lines to a plain text file.
 */
public class FileErrorLedger implements ErrorLedger {

    private static final Logger log = LoggerFactory.getLogger(FileErrorLedger.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final Clock clock;

    public FileErrorLedger(Path file) {
        this(file, Clock.systemDefaultZone());
    }

    public FileErrorLedger(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    @Override
    public synchronized void record(String source, String message) {
        String line = "[" + LocalDateTime.now(clock).format(TIMESTAMP) + "] " + source + ": " + message + System.lineSeparator();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Unable to append to error ledger {}", file, e);
        }
    }
}
