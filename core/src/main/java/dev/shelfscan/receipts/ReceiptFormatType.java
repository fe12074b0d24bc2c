package dev.shelfscan.receipts;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Layout detected while parsing receipt lines.
 */
public enum ReceiptFormatType {
    TABULAR("tabular"),
    SIMPLE_LIST("simple_list"),
    UNKNOWN("unknown");

    private final String tag;

    ReceiptFormatType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
