package com.example.invoicelink.application.extraction;

import com.example.invoicelink.domain.model.DocumentField;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pattern chains for every field, per document type. Each chain is ordered from the most specific
 * label spelling to the loosest one.
 */
public final class ExtractionPatterns {

    private static final String TEXT_DATE = "(\\d{1,2}[-/]\\w+[-/]\\d{2,4})";
    private static final String NUMERIC_DATE = "(\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4})";
    private static final String AMOUNT = "([0-9,]+\\.?\\d*)";
    private static final String INVOICE_ID = "([A-Z]?\\d+)";

    static final FieldPatternChain DEPARTMENT = FieldPatternChain.of(DocumentField.DEPARTMENT,
            FieldPattern.of("department label", "Department[:\\s]+([A-Z][A-Z &]*)"));

    static final List<FieldPatternChain> INVOICE_CHAINS = List.of(
            FieldPatternChain.of(DocumentField.INVOICE_NUMBER,
                    FieldPattern.of("invoice no", "Invoice\\s*No[:\\s.]*" + INVOICE_ID),
                    FieldPattern.of("invoice #", "Invoice\\s*#[:\\s]*" + INVOICE_ID),
                    FieldPattern.of("inv no", "Inv[\\s.]*No[:\\s.]*" + INVOICE_ID),
                    FieldPattern.of("invoice number", "Invoice\\s*Number[:\\s]*" + INVOICE_ID),
                    // value alone at the start of the line right below the label
                    FieldPattern.of("invoice no, value on the next line",
                            "Invoice\\s*No[:.\\h]*\\R\\h*([A-Z]?\\d{4,})")),
            FieldPatternChain.of(DocumentField.INVOICE_DATE,
                    FieldPattern.of("invoice date", "Invoice\\s*Date[:\\s.]*" + TEXT_DATE),
                    FieldPattern.of("invoice date numeric", "Invoice\\s*Date[:\\s.]*" + NUMERIC_DATE),
                    FieldPattern.of("invoice ... date", "Invoice[\\s\\S]{0,30}Date[:\\s]*" + TEXT_DATE),
                    // OCR misreads of "Invoice"
                    FieldPattern.of("iwoie ... date", "Iwoie[\\s\\S]{0,20}Date[:\\s]*" + TEXT_DATE),
                    FieldPattern.of("iavoie ... date", "iavoie[\\s\\S]{0,20}Date[:\\s]*" + TEXT_DATE),
                    FieldPattern.of("date near invoice no", "Invoice\\s*No[:\\s]*\\d+[\\s\\S]{0,100}?" + TEXT_DATE)),
            FieldPatternChain.of(DocumentField.PO_NUMBER,
                    FieldPattern.of("po no", "PO\\s*NO[:\\s.]*(\\d+)"),
                    FieldPattern.of("po number", "PO\\s*Number[:\\s]*(\\d+)"),
                    FieldPattern.of("p.o.", "P\\.?O\\.?[:\\s]*(\\d+)"),
                    FieldPattern.of("purchase order", "Purchase\\s*Order[:\\s]*(\\d+)")),
            FieldPatternChain.of(DocumentField.PO_DATE,
                    FieldPattern.of("po date", "PO\\s*DATE[:\\s.]*" + TEXT_DATE),
                    FieldPattern.of("po date numeric", "PO\\s*DATE[:\\s.]*" + NUMERIC_DATE),
                    FieldPattern.of("p.o. date", "P\\.?O\\.?\\s*Date[:\\s]*" + TEXT_DATE)),
            FieldPatternChain.of(DocumentField.GR_ID,
                    FieldPattern.of("gr no", "GR\\s*NO[:\\s.]*(\\d+)"),
                    FieldPattern.of("gr number", "GR\\s*Number[:\\s]*(\\d+)"),
                    FieldPattern.of("g.r.", "G\\.?R\\.?[:\\s]*(\\d+)"),
                    FieldPattern.of("goods receipt", "Goods\\s*Receipt[:\\s]*(\\d+)")),
            FieldPatternChain.of(DocumentField.GR_DATE,
                    FieldPattern.of("gr date", "GR\\s*DATE[:\\s.]*" + TEXT_DATE),
                    FieldPattern.of("gr date numeric", "GR\\s*DATE[:\\s.]*" + NUMERIC_DATE),
                    FieldPattern.of("g.r. date", "G\\.?R\\.?\\s*Date[:\\s]*" + TEXT_DATE)),
            FieldPatternChain.of(DocumentField.SUBTOTAL,
                    FieldPattern.of("total at line start", "^\\s*TOTAL[:\\s]+" + AMOUNT, Pattern.MULTILINE),
                    FieldPattern.of("sub total", "Sub\\s*Total[:\\s]+" + AMOUNT),
                    FieldPattern.of("amount", "Amount[:\\s]+" + AMOUNT)),
            FieldPatternChain.of(DocumentField.TAX,
                    FieldPattern.of("tax with rate", "(?:KPRA|Tax)\\s*\\d+%[:\\s]+" + AMOUNT),
                    FieldPattern.of("tax", "(?:KPRA|Tax)[:\\s]+" + AMOUNT),
                    FieldPattern.of("vat with rate", "VAT\\s*\\d+%[:\\s]+" + AMOUNT)),
            FieldPatternChain.of(DocumentField.GRAND_TOTAL,
                    FieldPattern.of("grand total", "GRAND\\s*TOTAL[:\\s]+" + AMOUNT),
                    FieldPattern.of("total amount", "Total\\s*Amount[:\\s]+" + AMOUNT),
                    FieldPattern.of("net total", "Net\\s*Total[:\\s]+" + AMOUNT)),
            DEPARTMENT
    );

    static final List<FieldPatternChain> PURCHASE_ORDER_CHAINS = List.of(
            FieldPatternChain.of(DocumentField.PO_NUMBER,
                    FieldPattern.of("po number", "PO\\s*(?:Number|NO)[:\\s.]+(\\d+)"),
                    FieldPattern.of("purchase order number", "Purchase\\s*Order\\s*(?:Number|No|#)[:\\s.]*(\\d+)")),
            FieldPatternChain.of(DocumentField.PO_DATE,
                    FieldPattern.of("po date", "PO\\s*DATE[:\\s.]+" + TEXT_DATE),
                    FieldPattern.of("order date", "Order\\s*Date[:\\s.]+" + TEXT_DATE)),
            FieldPatternChain.of(DocumentField.PO_AMOUNT,
                    FieldPattern.of("amount or total", "(?:Amount|Total)[:\\s]+" + AMOUNT)),
            DEPARTMENT
    );

    private ExtractionPatterns() {
    }
}
