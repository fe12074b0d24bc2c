package dev.shelfscan.inventory.importer;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.NotFoundException;
import dev.shelfscan.inventory.store.CategoryStore;
import dev.shelfscan.inventory.store.ProductCatalogStore;
import dev.shelfscan.inventory.store.StoredProduct;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Moves or copies existing products into another category. Each product id is handled on its own: an
 * unknown id or a failed write is reported for that id and the remaining ids are still processed.
 */
public class BulkProductOperations {

    private static final Logger LOGGER = LoggerFactory.getLogger(BulkProductOperations.class);

    static final String PRODUCT_NOT_FOUND = "Product not found";

    private final CategoryStore categoryStore;
    private final ProductCatalogStore catalogStore;
    private final Clock clock;

    public BulkProductOperations(CategoryStore categoryStore, ProductCatalogStore catalogStore, Clock clock) {
        this.categoryStore = Objects.requireNonNull(categoryStore, "categoryStore");
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BulkMoveResult move(List<String> productIds, String categoryRef, String subcategoryRef) {
        Set<String> ids = requireIds(productIds);
        Target target = resolveTarget(categoryRef, subcategoryRef);

        try (ImportMdc.Context ignored = ImportMdc.open("bulk-move", UUID.randomUUID().toString())) {
            int moved = 0;
            List<FailedProduct> failures = new ArrayList<>();
            for (String id : ids) {
                try {
                    Optional<StoredProduct> product = catalogStore.findById(id);
                    if (product.isEmpty()) {
                        failures.add(new FailedProduct(id, PRODUCT_NOT_FOUND));
                        continue;
                    }
                    catalogStore.update(product.get().withCategory(target.categoryId(), target.subcategoryId(),
                        clock.instant()));
                    moved++;
                } catch (RuntimeException ex) {
                    LOGGER.warn("Failed to move product {}: {}", id, ex.getMessage());
                    failures.add(new FailedProduct(id, messageOf(ex)));
                }
            }
            LOGGER.info("Moved {} of {} products to category {}", moved, ids.size(), target.categoryId());
            return new BulkMoveResult(failures.isEmpty(), moved, failures, target.categoryId(), target.subcategoryId());
        }
    }

    public BulkCopyResult copy(List<String> productIds, String categoryRef, String subcategoryRef) {
        Set<String> ids = requireIds(productIds);
        Target target = resolveTarget(categoryRef, subcategoryRef);

        try (ImportMdc.Context ignored = ImportMdc.open("bulk-copy", UUID.randomUUID().toString())) {
            List<StoredProduct> copies = new ArrayList<>();
            List<FailedProduct> failures = new ArrayList<>();
            for (String id : ids) {
                try {
                    Optional<StoredProduct> product = catalogStore.findById(id);
                    if (product.isEmpty()) {
                        failures.add(new FailedProduct(id, PRODUCT_NOT_FOUND));
                        continue;
                    }
                    copies.add(catalogStore.createProduct(
                        product.get().copyInto(target.categoryId(), target.subcategoryId())));
                } catch (RuntimeException ex) {
                    LOGGER.warn("Failed to copy product {}: {}", id, ex.getMessage());
                    failures.add(new FailedProduct(id, messageOf(ex)));
                }
            }
            LOGGER.info("Copied {} of {} products to category {}", copies.size(), ids.size(), target.categoryId());
            return new BulkCopyResult(failures.isEmpty(), copies.size(), copies, failures);
        }
    }

    private static Set<String> requireIds(List<String> productIds) {
        if (productIds == null || productIds.isEmpty()) {
            throw new InputValidationException("Product IDs are required");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : productIds) {
            if (!StringUtils.hasText(id)) {
                throw new InputValidationException("Product IDs must not be blank");
            }
            ids.add(id.trim());
        }
        return ids;
    }

    private Target resolveTarget(String categoryRef, String subcategoryRef) {
        if (!StringUtils.hasText(categoryRef)) {
            throw new InputValidationException("Category is required");
        }
        Category category = categoryStore.findCategory(categoryRef)
            .orElseThrow(() -> new NotFoundException("Category not found: " + categoryRef.trim()));
        if (!StringUtils.hasText(subcategoryRef)) {
            return new Target(category.id(), null);
        }
        Subcategory subcategory = categoryStore.findSubcategory(category.id(), subcategoryRef)
            .orElseThrow(() -> new NotFoundException(
                "Subcategory not found in category " + category.name() + ": " + subcategoryRef.trim()));
        return new Target(category.id(), subcategory.id());
    }

    private static String messageOf(RuntimeException ex) {
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private record Target(String categoryId, String subcategoryId) { }
}
