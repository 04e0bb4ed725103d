package com.example.invoicelink.infrastructure.store;

import com.example.invoicelink.domain.model.RecordSheet;

import java.util.List;

/**
 * Spreadsheet-like persistence with one named sheet per record collection.
 * Rows are ordered value lists matching {@link RecordSheet#headers()}; header rows are not returned.
 */
public interface TabularStore {

    /**
     * Appends one record row to the sheet.
     *
     * @param sheet  target collection
     * @param values cell values in column order
     */
    void appendRow(RecordSheet sheet, List<Object> values);

    /**
     * @param sheet collection to scan
     * @return committed data rows in insertion order
     */
    List<List<Object>> rows(RecordSheet sheet);

    /**
     * Writes pending rows to durable storage. In-memory stores treat this as a no-op.
     */
    void flush();
}
