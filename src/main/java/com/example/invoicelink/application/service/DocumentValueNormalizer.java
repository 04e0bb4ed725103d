package com.example.invoicelink.application.service;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;

/**
 * Converts the date and currency spellings found on invoices into canonical values.
 * Neither operation fails: unparseable dates pass through and unparseable amounts become zero.
 */
@Service
public class DocumentValueNormalizer {

    /**
     * Two-digit years resolve into 1969-2068.
     */
    private static final int TWO_DIGIT_YEAR_BASE = 1969;

    private static final DateTimeFormatter CANONICAL_FORMAT =
            DateTimeFormatter.ofPattern("dd-MMM-uuuu", Locale.ENGLISH);

    private static final List<DateTimeFormatter> INPUT_FORMATS = List.of(
            dayMonthYear("-", "MMM", true),
            dayMonthYear("-", "MMM", false),
            dayMonthYear("/", "MMM", true),
            dayMonthYear("/", "MMM", false),
            dayMonthYear("-", "M", true),
            dayMonthYear("-", "M", false),
            dayMonthYear("/", "M", true),
            dayMonthYear("/", "M", false)
    );

    /**
     * Parses the first matching day-month-year format and renders it as {@code dd-MMM-yyyy}.
     *
     * @param raw date as captured from the document
     * @return canonical date, or the input unchanged when no format matches
     */
    public String normalizeDate(String raw) {
        if (raw == null) {
            return "";
        }
        String candidate = raw.trim();
        for (DateTimeFormatter format : INPUT_FORMATS) {
            try {
                return LocalDate.parse(candidate, format).format(CANONICAL_FORMAT);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return raw;
    }

    /**
     * Strips grouping separators and parses the remainder as a decimal.
     *
     * @param raw amount as captured from the document
     * @return parsed amount or {@link BigDecimal#ZERO}
     */
    public BigDecimal normalizeAmount(String raw) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        String cleaned = raw.replace(",", "").replaceAll("\\s+", "");
        if (cleaned.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            return BigDecimal.ZERO;
        }
    }

    private static DateTimeFormatter dayMonthYear(String separator, String monthPattern, boolean twoDigitYear) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern("d" + separator + monthPattern + separator);
        if (twoDigitYear) {
            builder.appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE);
        } else {
            builder.appendValue(ChronoField.YEAR, 4);
        }
        return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
