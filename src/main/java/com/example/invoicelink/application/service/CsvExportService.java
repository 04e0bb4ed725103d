package com.example.invoicelink.application.service;

import com.example.invoicelink.application.exception.CsvExportValidationException;
import com.example.invoicelink.domain.model.Invoice;
import com.example.invoicelink.domain.model.PurchaseOrder;
import com.example.invoicelink.domain.model.RecordSheet;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Application-layer service that turns a stored record collection into downloadable CSV content.
 */
@Service
public class CsvExportService {

    private final RecordLinker linker;

    public CsvExportService(RecordLinker linker) {
        this.linker = linker;
    }

	/**
	 * Builds a CSV document with the sheet's header row followed by every stored record.
	 *
	 * @param sheet collection to export
	 * @return CSV content ready to stream to the browser
	 * @throws CsvExportValidationException when the collection holds no records
	 */
    public String export(RecordSheet sheet) {
        List<List<Object>> rows = switch (sheet) {
            case PO_DETAILS -> linker.purchaseOrders().stream().map(PurchaseOrder::toRow).toList();
            case INVOICE_DETAILS -> linker.invoices().stream().map(Invoice::toRow).toList();
        };
        if (rows.isEmpty()) {
            throw new CsvExportValidationException("No " + sheet.sheetName() + " records available for export.");
        }
        return buildCsv(sheet.headers(), rows);
    }

    private String buildCsv(List<String> headers, List<List<Object>> rows) {
        StringBuilder builder = new StringBuilder();
        appendLine(builder, List.copyOf(headers));
        for (List<Object> row : rows) {
            appendLine(builder, row);
        }
        return builder.toString();
    }

    private void appendLine(StringBuilder builder, List<?> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(escape(values.get(i)));
        }
        builder.append('\n');
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
        String sanitized = text.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
