package com.example.invoicelink.application.extraction;

import com.example.invoicelink.domain.model.DocumentField;

import java.util.List;
import java.util.Optional;

/**
 * Ordered strategies for one field. The first strategy that matches wins, so stricter
 * patterns must precede looser ones.
 *
 * @param field    field populated by this chain
 * @param patterns strategies in priority order
 */
public record FieldPatternChain(DocumentField field, List<FieldPattern> patterns) {

    public FieldPatternChain {
        patterns = List.copyOf(patterns);
    }

    public static FieldPatternChain of(DocumentField field, FieldPattern... patterns) {
        return new FieldPatternChain(field, List.of(patterns));
    }

    public Optional<String> firstMatch(String text) {
        for (FieldPattern pattern : patterns) {
            Optional<String> value = pattern.match(text);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
