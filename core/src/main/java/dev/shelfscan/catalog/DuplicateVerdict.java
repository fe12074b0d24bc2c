package dev.shelfscan.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DuplicateVerdict(
    @JsonProperty("isDuplicate") boolean isDuplicate,
    String reason,
    String matchedProductId,
    DuplicateMatchType matchType
) {

    private static final DuplicateVerdict NOT_DUPLICATE = new DuplicateVerdict(false, null, null, DuplicateMatchType.NONE);

    public static DuplicateVerdict notDuplicate() {
        return NOT_DUPLICATE;
    }

    public static DuplicateVerdict exact(ExistingProduct product) {
        return new DuplicateVerdict(true,
            String.format("Product \"%s\" already exists for this seller", product.name()),
            product.id(), DuplicateMatchType.EXACT);
    }

    public static DuplicateVerdict similar(String candidateName, ExistingProduct product) {
        return new DuplicateVerdict(true,
            String.format("Product \"%s\" is very similar to existing product \"%s\"", candidateName, product.name()),
            product.id(), DuplicateMatchType.SIMILAR);
    }
}
