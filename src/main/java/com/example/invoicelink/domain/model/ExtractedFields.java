package com.example.invoicelink.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable field map produced by extraction and completed by derivation.
 * An absent key means the field was not found; values are never {@code null} or blank.
 */
public final class ExtractedFields {

    private final EnumMap<DocumentField, String> values = new EnumMap<>(DocumentField.class);

    public static ExtractedFields empty() {
        return new ExtractedFields();
    }

    /**
     * Builds a field map from known values, applying the same rules as {@link #putIfAbsent}.
     *
     * @param source field values, blank entries are ignored
     * @return populated field map
     */
    public static ExtractedFields of(Map<DocumentField, String> source) {
        ExtractedFields fields = new ExtractedFields();
        source.forEach(fields::putIfAbsent);
        return fields;
    }

    /**
     * Stores the value only when the field is still absent.
     *
     * @param field target field
     * @param value captured value
     * @return {@code true} when the value was stored
     */
    public boolean putIfAbsent(DocumentField field, String value) {
        if (value == null || value.isBlank() || values.containsKey(field)) {
            return false;
        }
        values.put(field, value.trim());
        return true;
    }

    public boolean contains(DocumentField field) {
        return values.containsKey(field);
    }

    public Optional<String> get(DocumentField field) {
        return Optional.ofNullable(values.get(field));
    }

    public String getOrDefault(DocumentField field, String fallback) {
        return values.getOrDefault(field, fallback);
    }

    /**
     * Reads an amount field stored as a plain decimal string.
     *
     * @param field amount field
     * @return decimal value, empty when absent or malformed
     */
    public Optional<BigDecimal> amount(DocumentField field) {
        return get(field).flatMap(raw -> {
            try {
                return Optional.of(new BigDecimal(raw));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        });
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return read-only view keyed by the snake_case field names, in field declaration order
     */
    public Map<String, String> asMap() {
        Map<String, String> view = new LinkedHashMap<>();
        values.forEach((field, value) -> view.put(field.key(), value));
        return Collections.unmodifiableMap(view);
    }

    public ExtractedFields copy() {
        ExtractedFields copy = new ExtractedFields();
        copy.values.putAll(values);
        return copy;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
