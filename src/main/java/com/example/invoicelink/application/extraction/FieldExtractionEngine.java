package com.example.invoicelink.application.extraction;

import com.example.invoicelink.application.service.DocumentValueNormalizer;
import com.example.invoicelink.domain.model.DocumentField;
import com.example.invoicelink.domain.model.DocumentType;
import com.example.invoicelink.domain.model.ExtractedFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Applies the ordered pattern chains to document text and returns whatever subset of fields was found.
 * Captured dates and amounts are normalized on the way in; the engine never throws for bad input.
 */
@Service
public class FieldExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractionEngine.class);
    private static final int PREVIEW_LENGTH = 500;

    private final DocumentValueNormalizer normalizer;
    private final ReferenceTableExtractor tableExtractor = new ReferenceTableExtractor();

    public FieldExtractionEngine(DocumentValueNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Extracts the fields relevant to the document type.
     *
     * @param text extracted document text
     * @param type classification of the text
     * @return found fields; empty for {@link DocumentType#UNKNOWN} or blank text
     */
    public ExtractedFields extractFields(String text, DocumentType type) {
        ExtractedFields fields = ExtractedFields.empty();
        if (text == null || text.isBlank() || type == null || !type.isKnown()) {
            return fields;
        }
        if (log.isDebugEnabled()) {
            log.debug("Extracted text preview: {}...", text.substring(0, Math.min(PREVIEW_LENGTH, text.length())));
        }

        if (type == DocumentType.INVOICE) {
            tableExtractor.extract(text).ifPresent(row -> {
                fields.putIfAbsent(DocumentField.PO_NUMBER, row.poNumber());
                fields.putIfAbsent(DocumentField.PO_DATE, normalizer.normalizeDate(row.poDate()));
                fields.putIfAbsent(DocumentField.GR_ID, row.grId());
                fields.putIfAbsent(DocumentField.GR_DATE, normalizer.normalizeDate(row.grDate()));
                log.info("Extracted from table: PO={}, GR={}", row.poNumber(), row.grId());
            });
        }

        for (FieldPatternChain chain : chainsFor(type)) {
            if (fields.contains(chain.field())) {
                continue;
            }
            Optional<String> value = chain.firstMatch(text);
            value.ifPresent(raw -> fields.putIfAbsent(chain.field(), normalize(chain.field(), raw)));
        }
        return fields;
    }

    private List<FieldPatternChain> chainsFor(DocumentType type) {
        return type == DocumentType.INVOICE
                ? ExtractionPatterns.INVOICE_CHAINS
                : ExtractionPatterns.PURCHASE_ORDER_CHAINS;
    }

    private String normalize(DocumentField field, String raw) {
        return switch (field.kind()) {
            case DATE -> normalizer.normalizeDate(raw);
            case AMOUNT -> normalizer.normalizeAmount(raw).toPlainString();
            case IDENTIFIER, TEXT -> raw;
        };
    }
}
