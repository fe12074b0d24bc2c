package dev.shelfscan.inventory.categorization;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CategorizationSource {
    RULE,
    AI,
    NONE;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
