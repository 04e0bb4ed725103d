package com.example.invoicelink.application.extraction;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the purchase order / goods receipt reference table printed on many invoices, where the
 * four headers share one line and the values follow on the next one with irregular spacing or pipes.
 */
public class ReferenceTableExtractor {

    private static final String HEADER = "PO\\s*NO[\\s|]*PO\\s*DATE[\\s|]*GR\\s*NO[\\s|]*GR\\s*DATE";
    private static final String DATE = "([\\d-]+[-/]\\w+[-/]\\d+)";

    private static final List<Pattern> TABLE_PATTERNS = List.of(
            // values on the line right after the header
            compile(HEADER + ".*?\\n\\s*(\\d+)\\s+" + DATE + "[\\s|]*(\\d+)\\s+" + DATE),
            // pipes between every column
            compile(HEADER + ".*?\\n\\s*(\\d+)[\\s|]+" + DATE + "[\\s|]+(\\d+)[\\s|]+" + DATE),
            // fixed-width PO and GR numbers anywhere below the header
            compile("PO\\s*NO[\\s|]+PO\\s*DATE[\\s|]+GR\\s*NO[\\s|]+GR\\s*DATE[\\s\\S]*?(\\d{10})[\\s|]+"
                    + DATE + "[\\s|]+(\\d{7})[\\s|]+" + DATE),
            // PODATE printed without a space
            compile("PO\\s*NO[\\s|]*PODATE[\\s|]*GR\\s*NO[\\s\\S]*?(\\d{10})\\s+" + DATE + "[\\s|]+(\\d{7})\\s+" + DATE)
    );

    /**
     * @param text document text
     * @return the first row found by the strategies, in order
     */
    public Optional<ReferenceTableRow> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : TABLE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(new ReferenceTableRow(
                        matcher.group(1).trim(),
                        matcher.group(2).trim(),
                        matcher.group(3).trim(),
                        matcher.group(4).trim()));
            }
        }
        return Optional.empty();
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
