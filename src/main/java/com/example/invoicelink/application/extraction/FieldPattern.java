package com.example.invoicelink.application.extraction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single extraction strategy: a compiled pattern whose capture group holds the field value.
 *
 * @param name    short label used in debug logs
 * @param pattern compiled pattern, always case-insensitive
 * @param group   capture group holding the value
 */
public record FieldPattern(String name, Pattern pattern, int group) {

    /**
     * Compiles a case-insensitive strategy capturing group 1.
     *
     * @param name  label for logs
     * @param regex pattern source
     * @param flags extra {@link Pattern} flags such as {@link Pattern#MULTILINE}
     * @return compiled strategy
     */
    public static FieldPattern of(String name, String regex, int flags) {
        return new FieldPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | flags), 1);
    }

    public static FieldPattern of(String name, String regex) {
        return of(name, regex, 0);
    }

    /**
     * @param text document text
     * @return trimmed captured value of the first occurrence, empty when the pattern does not occur
     */
    public Optional<String> match(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(group);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
