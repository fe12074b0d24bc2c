package dev.shelfscan.catalog;

/**
 * Second level classification. Always belongs to exactly one {@link Category}.
 */
public record Subcategory(String id, String categoryId, String name, String slug) {
}
