package com.example.invoicelink.infrastructure.store;

import com.example.invoicelink.domain.model.RecordSheet;
import com.example.invoicelink.infrastructure.exception.WorkbookPersistenceException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Apache POI backed store that keeps one {@code .xlsx} workbook with a sheet per record collection.
 * An existing workbook is loaded on startup and missing sheets are created with a styled header row.
 */
public class ExcelWorkbookStore implements TabularStore, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ExcelWorkbookStore.class);
    private static final byte[] HEADER_FILL_RGB = {0x36, 0x60, (byte) 0x92};

    private final Path workbookFile;
    private final XSSFWorkbook workbook;

    /**
     * Opens the workbook at the given path, or starts a new one when the file does not exist yet.
     *
     * @param workbookFile target {@code .xlsx} file
     * @throws WorkbookPersistenceException when an existing file cannot be read
     */
    public ExcelWorkbookStore(Path workbookFile) {
        this.workbookFile = workbookFile;
        this.workbook = openWorkbook(workbookFile);
        for (RecordSheet sheet : RecordSheet.values()) {
            Sheet existing = workbook.getSheet(sheet.sheetName());
            if (existing == null) {
                createSheet(sheet);
            } else if (existing.getRow(0) == null) {
                log.warn("{} sheet has no header row; writing it", sheet.sheetName());
                writeHeader(existing, sheet);
            }
        }
    }

    @Override
    public synchronized void appendRow(RecordSheet sheet, List<Object> values) {
        Sheet target = workbook.getSheet(sheet.sheetName());
        Row row = target.createRow(target.getLastRowNum() + 1);
        for (int i = 0; i < values.size(); i++) {
            writeCell(row.createCell(i), values.get(i));
        }
    }

    @Override
    public synchronized List<List<Object>> rows(RecordSheet sheet) {
        Sheet source = workbook.getSheet(sheet.sheetName());
        List<List<Object>> rows = new ArrayList<>();
        int columns = sheet.headers().size();
        for (int rowIndex = 1; rowIndex <= source.getLastRowNum(); rowIndex++) {
            Row row = source.getRow(rowIndex);
            if (row == null) {
                continue;
            }
            List<Object> values = new ArrayList<>(columns);
            for (int column = 0; column < columns; column++) {
                values.add(readCell(row.getCell(column)));
            }
            rows.add(values);
        }
        return rows;
    }

    /**
     * Saves the workbook to disk, creating parent directories as needed.
     *
     * @throws WorkbookPersistenceException when the file cannot be written
     */
    @Override
    public synchronized void flush() {
        try {
            Path parent = workbookFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(workbookFile)) {
                workbook.write(out);
            }
            log.info("Excel file saved: {}", workbookFile);
        } catch (IOException e) {
            throw new WorkbookPersistenceException("Unable to save workbook " + workbookFile, e);
        }
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }

    private static XSSFWorkbook openWorkbook(Path file) {
        if (!Files.exists(file)) {
            log.info("Creating new Excel file: {}", file);
            return new XSSFWorkbook();
        }
        log.info("Loading existing Excel file: {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return new XSSFWorkbook(in);
        } catch (IOException | UnsupportedFileFormatException e) {
            throw new WorkbookPersistenceException("Unable to load workbook " + file, e);
        }
    }

    private void createSheet(RecordSheet sheet) {
        writeHeader(workbook.createSheet(sheet.sheetName()), sheet);
        log.info("Created {} sheet", sheet.sheetName());
    }

    private void writeHeader(Sheet target, RecordSheet sheet) {
        Row header = target.createRow(0);
        XSSFCellStyle style = headerStyle();
        List<String> headers = sheet.headers();
        for (int i = 0; i < headers.size(); i++) {
            Cell cell = header.createCell(i);
            cell.setCellValue(headers.get(i));
            cell.setCellStyle(style);
        }
    }

    private XSSFCellStyle headerStyle() {
        XSSFFont font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());

        XSSFCellStyle style = workbook.createCellStyle();
        style.setFillForegroundColor(new XSSFColor(HEADER_FILL_RGB, null));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setFont(font);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        return style;
    }

    private static void writeCell(Cell cell, Object value) {
        if (value instanceof BigDecimal decimal) {
            cell.setCellValue(decimal.doubleValue());
        } else if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        } else if (value != null) {
            cell.setCellValue(value.toString());
        } else {
            cell.setBlank();
        }
    }

    private static Object readCell(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case NUMERIC -> cell.getNumericCellValue();
            case STRING -> cell.getStringCellValue();
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> "";
        };
    }
}
