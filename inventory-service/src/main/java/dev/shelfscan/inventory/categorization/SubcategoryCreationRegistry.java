package dev.shelfscan.inventory.categorization;

import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.catalog.SubcategorySlugs;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Batch scoped record of subcategories already resolved, keyed by category id and normalized name.
 * Concurrent requests for the same key collapse into a single call to the creator. A creator that
 * throws leaves the key unresolved.
 */
public final class SubcategoryCreationRegistry {

    private final Map<Key, Subcategory> resolved = new ConcurrentHashMap<>();

    public Subcategory resolve(String categoryId, String name, Supplier<Subcategory> creator) {
        Objects.requireNonNull(creator, "creator");
        return resolved.computeIfAbsent(new Key(categoryId, SubcategorySlugs.normalizedName(name)),
            key -> creator.get());
    }

    public int size() {
        return resolved.size();
    }

    private record Key(String categoryId, String normalizedName) { }
}
