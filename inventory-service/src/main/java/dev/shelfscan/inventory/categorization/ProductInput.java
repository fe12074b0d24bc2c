package dev.shelfscan.inventory.categorization;

import java.math.BigDecimal;

/**
 * Product submitted for categorization. Only {@code name} is required.
 */
public record ProductInput(
    String name,
    BigDecimal price,
    BigDecimal quantity,
    String unit,
    String brand,
    Double confidence
) {

    public static ProductInput named(String name) {
        return new ProductInput(name, null, null, null, null, null);
    }
}
