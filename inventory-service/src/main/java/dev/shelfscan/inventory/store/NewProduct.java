package dev.shelfscan.inventory.store;

import java.math.BigDecimal;

public record NewProduct(
    String sellerId,
    String name,
    BigDecimal price,
    int minOrderQuantity,
    String unit,
    String brand,
    String categoryId,
    String subcategoryId
) {
}
