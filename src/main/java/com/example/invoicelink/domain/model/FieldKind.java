package com.example.invoicelink.domain.model;

/**
 * Value shape of a {@link DocumentField}, used to pick the normalization applied on capture.
 */
public enum FieldKind {
    IDENTIFIER,
    DATE,
    AMOUNT,
    TEXT
}
