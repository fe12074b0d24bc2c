package dev.shelfscan.inventory.store;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Product as persisted in a seller's catalog.
 */
public record StoredProduct(
    String id,
    String sellerId,
    String name,
    BigDecimal price,
    int minOrderQuantity,
    String unit,
    String brand,
    String categoryId,
    String subcategoryId,
    Instant createdAt,
    Instant updatedAt
) {

    public StoredProduct withCategory(String newCategoryId, String newSubcategoryId, Instant now) {
        return new StoredProduct(id, sellerId, name, price, minOrderQuantity, unit, brand, newCategoryId,
            newSubcategoryId, createdAt, now);
    }

    /**
     * Details of this product under a different category, ready to be stored as a separate product.
     */
    public NewProduct copyInto(String targetCategoryId, String targetSubcategoryId) {
        return new NewProduct(sellerId, name, price, minOrderQuantity, unit, brand, targetCategoryId,
            targetSubcategoryId);
    }
}
