package com.example.invoicelink.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Lenient readers for sheet cells, which may come back as strings or numbers depending on the store.
 */
final class RowValues {

    private RowValues() {
    }

    static Object cell(List<Object> row, int index) {
        return row != null && index < row.size() ? row.get(index) : null;
    }

    static String text(List<Object> row, int index) {
        Object value = cell(row, index);
        if (value == null) {
            return "";
        }
        if (value instanceof Double number && number == Math.rint(number) && !Double.isInfinite(number)) {
            return String.valueOf(number.longValue());
        }
        return value.toString().trim();
    }

    static int serial(List<Object> row, int index) {
        Object value = cell(row, index);
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return value == null ? 0 : (int) Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    static BigDecimal amount(List<Object> row, int index) {
        Object value = cell(row, index);
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        try {
            return value == null || value.toString().isBlank()
                    ? BigDecimal.ZERO
                    : new BigDecimal(value.toString().replace(",", "").trim());
        } catch (NumberFormatException ex) {
            return BigDecimal.ZERO;
        }
    }
}
