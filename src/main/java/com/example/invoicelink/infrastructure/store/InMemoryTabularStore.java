package com.example.invoicelink.infrastructure.store;

import com.example.invoicelink.domain.model.RecordSheet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Non-persistent store used when no workbook file is configured, and in tests.
 */
public class InMemoryTabularStore implements TabularStore {

    private final Map<RecordSheet, List<List<Object>>> sheets = new EnumMap<>(RecordSheet.class);

    public InMemoryTabularStore() {
        for (RecordSheet sheet : RecordSheet.values()) {
            sheets.put(sheet, new ArrayList<>());
        }
    }

    @Override
    public synchronized void appendRow(RecordSheet sheet, List<Object> values) {
        sheets.get(sheet).add(List.copyOf(values));
    }

    @Override
    public synchronized List<List<Object>> rows(RecordSheet sheet) {
        return Collections.unmodifiableList(new ArrayList<>(sheets.get(sheet)));
    }

    @Override
    public void flush() {
        // nothing to persist
    }
}
