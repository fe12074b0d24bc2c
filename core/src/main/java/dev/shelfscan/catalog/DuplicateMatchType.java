package dev.shelfscan.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DuplicateMatchType {
    NONE,
    EXACT,
    SIMILAR;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
