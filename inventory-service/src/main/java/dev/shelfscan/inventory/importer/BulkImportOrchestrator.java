package dev.shelfscan.inventory.importer;

import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.store.NewProduct;
import dev.shelfscan.inventory.store.ProductCatalogStore;
import dev.shelfscan.inventory.store.StoredProduct;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;

/**
 * Writes a batch of products through the catalog store, one item at a time or through a bounded
 * executor. Every item is attempted: invalid items fail without reaching the store, and a store error
 * for one item is recorded against that item only.
 */
public class BulkImportOrchestrator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BulkImportOrchestrator.class);

    private final ProductCatalogStore catalogStore;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    public BulkImportOrchestrator(ProductCatalogStore catalogStore) {
        this(catalogStore, null, null);
    }

    /**
     * @param executor executor used to write items concurrently, or {@code null} to write sequentially
     */
    public BulkImportOrchestrator(ProductCatalogStore catalogStore, Executor executor) {
        this(catalogStore, executor, null);
    }

    private BulkImportOrchestrator(ProductCatalogStore catalogStore, Executor executor,
        ExecutorService ownedExecutor) {
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore");
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
    }

    /**
     * Creates an orchestrator that writes sequentially when {@code parallelism} is 1 or less, and otherwise
     * through its own fixed pool of that size, released by {@link #close()}.
     */
    public static BulkImportOrchestrator withParallelism(ProductCatalogStore catalogStore, int parallelism) {
        if (parallelism <= 1) {
            return new BulkImportOrchestrator(catalogStore);
        }
        ExecutorService pool = Executors.newFixedThreadPool(parallelism,
            new CustomizableThreadFactory("bulk-import-"));
        return new BulkImportOrchestrator(catalogStore, pool, pool);
    }

    boolean isConcurrent() {
        return executor != null;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    public BulkImportResult importAll(List<BulkImportItem> items) {
        if (items == null) {
            throw new InputValidationException("Products array is required");
        }

        String batchId = UUID.randomUUID().toString();
        try (ImportMdc.Context ignored = ImportMdc.open("bulk-import", batchId)) {
            LOGGER.info("Importing {} products", items.size());

            List<ItemOutcome> outcomes = executor == null ? importSequentially(items) : importConcurrently(items);

            List<ImportError> errors = new ArrayList<>();
            List<String> createdIds = new ArrayList<>();
            for (ItemOutcome outcome : outcomes) {
                if (outcome.succeeded()) {
                    createdIds.add(outcome.productId());
                } else {
                    errors.add(outcome.error());
                }
            }

            BulkImportResult result = new BulkImportResult(createdIds.size(), errors.size(), errors, createdIds);
            LOGGER.info("Bulk import finished: {} successful, {} failed", result.successful(), result.failed());
            return result;
        }
    }

    private List<ItemOutcome> importSequentially(List<BulkImportItem> items) {
        List<ItemOutcome> outcomes = new ArrayList<>(items.size());
        for (BulkImportItem item : items) {
            outcomes.add(attempt(item));
        }
        return outcomes;
    }

    private List<ItemOutcome> importConcurrently(List<BulkImportItem> items) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(items.size());
        for (BulkImportItem item : items) {
            CompletableFuture<ItemOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(() -> ImportMdc.callWith(context, () -> attempt(item)), executor);
            } catch (RejectedExecutionException ex) {
                LOGGER.warn("Import of '{}' was rejected by the executor", item == null ? "" : item.label());
                future = CompletableFuture.completedFuture(ItemOutcome.failed(item, "Import rejected: executor is busy"));
            }
            futures.add(future);
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    ItemOutcome attempt(BulkImportItem item) {
        if (item == null) {
            return ItemOutcome.failed(null, "Product is required");
        }
        String validationError = validate(item);
        if (validationError != null) {
            LOGGER.warn("Skipping product '{}': {}", item.label(), validationError);
            return ItemOutcome.failed(item, validationError);
        }

        ImportMdc.attachSeller(item.sellerId());
        try {
            StoredProduct stored = catalogStore.createProduct(toNewProduct(item));
            if (stored == null || !StringUtils.hasText(stored.id())) {
                LOGGER.warn("Catalog store returned no id for product '{}'", item.name());
                return ItemOutcome.failed(item, "Catalog store returned no product id");
            }
            LOGGER.debug("Imported product '{}' as {}", item.name(), stored.id());
            return ItemOutcome.succeeded(stored.id());
        } catch (RuntimeException ex) {
            String message = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
            LOGGER.warn("Failed to import product '{}': {}", item.name(), message);
            return ItemOutcome.failed(item, message);
        }
    }

    static String validate(BulkImportItem item) {
        if (!StringUtils.hasText(item.name())) {
            return "Product name is required";
        }
        if (!StringUtils.hasText(item.sellerId())) {
            return "Seller id is required";
        }
        if (item.price() == null) {
            return "Price is required";
        }
        if (item.price().compareTo(BigDecimal.ZERO) < 0) {
            return "Price must be zero or greater";
        }
        if (item.minOrderQuantity() != null && item.minOrderQuantity() < 1) {
            return "Minimum order quantity must be at least 1";
        }
        if (item.duplicate() != null && item.duplicate().isDuplicate() && !item.duplicateConfirmed()) {
            return "Duplicate product requires confirmation: " + item.duplicate().reason();
        }
        return null;
    }

    private static NewProduct toNewProduct(BulkImportItem item) {
        return new NewProduct(
            item.sellerId().trim(),
            item.name().trim(),
            item.price(),
            item.minOrderQuantity() == null ? 1 : item.minOrderQuantity(),
            item.unit(),
            item.brand(),
            item.categoryId(),
            item.subcategoryId());
    }

    record ItemOutcome(String productId, ImportError error) {

        static ItemOutcome succeeded(String productId) {
            return new ItemOutcome(productId, null);
        }

        static ItemOutcome failed(BulkImportItem item, String message) {
            return new ItemOutcome(null, new ImportError(item == null ? "" : item.label(), message));
        }

        boolean succeeded() {
            return error == null;
        }
    }
}
