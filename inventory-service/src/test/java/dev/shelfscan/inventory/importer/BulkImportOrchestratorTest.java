package dev.shelfscan.inventory.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.shelfscan.catalog.DuplicateVerdict;
import dev.shelfscan.catalog.ExistingProduct;
import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.store.InMemoryProductCatalogStore;
import dev.shelfscan.inventory.store.NewProduct;
import dev.shelfscan.inventory.store.StoredProduct;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class BulkImportOrchestratorTest {

    private final InMemoryProductCatalogStore store = new InMemoryProductCatalogStore();

    @Test
    void importsValidItemsAndReportsInvalidOnes() {
        BulkImportOrchestrator orchestrator = new BulkImportOrchestrator(store);

        BulkImportResult result = orchestrator.importAll(List.of(
            item("Dairy Milk Chocolate", "20.00"),
            item("", "10.00")));

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errors()).containsExactly(new ImportError("", "Product name is required"));
        assertThat(result.createdProductIds()).hasSize(1);
        assertThat(store.listProductsForSeller("seller-1"))
            .extracting(StoredProduct::name)
            .containsExactly("Dairy Milk Chocolate");
    }

    @Test
    void countsEveryItemExactlyOnceRegardlessOfOrder() {
        List<BulkImportItem> items = List.of(
            item("Tea", "5"),
            item(null, "1"),
            item("Coffee", "-1"),
            item("Soap", "3"));
        List<BulkImportItem> reversed = new ArrayList<>(items);
        Collections.reverse(reversed);

        BulkImportResult forward = new BulkImportOrchestrator(new InMemoryProductCatalogStore()).importAll(items);
        BulkImportResult backward = new BulkImportOrchestrator(new InMemoryProductCatalogStore()).importAll(reversed);

        assertThat(forward.total()).isEqualTo(items.size());
        assertThat(forward.successful()).isEqualTo(backward.successful()).isEqualTo(2);
        assertThat(forward.failed()).isEqualTo(backward.failed()).isEqualTo(2);
        assertThat(forward.errors()).containsExactlyInAnyOrderElementsOf(backward.errors());
    }

    @Test
    void continuesAfterStoreFailure() {
        InMemoryProductCatalogStore failingStore = new InMemoryProductCatalogStore() {
            @Override
            public StoredProduct createProduct(NewProduct product) {
                if (product.name().equals("Broken")) {
                    throw new IllegalStateException("write rejected");
                }
                return super.createProduct(product);
            }
        };

        BulkImportResult result = new BulkImportOrchestrator(failingStore).importAll(List.of(
            item("Broken", "1"), item("Working", "2")));

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.errors()).containsExactly(new ImportError("Broken", "write rejected"));
        assertThat(failingStore.listAll()).extracting(StoredProduct::name).containsExactly("Working");
    }

    @Test
    void failsItemWhenStoreReturnsNoId() {
        InMemoryProductCatalogStore idlessStore = new InMemoryProductCatalogStore() {
            @Override
            public StoredProduct createProduct(NewProduct product) {
                StoredProduct stored = super.createProduct(product);
                if (product.name().equals("Ghost")) {
                    return new StoredProduct(null, stored.sellerId(), stored.name(), stored.price(),
                        stored.minOrderQuantity(), stored.unit(), stored.brand(), stored.categoryId(),
                        stored.subcategoryId(), stored.createdAt(), stored.updatedAt());
                }
                if (product.name().equals("Blank")) {
                    return null;
                }
                return stored;
            }
        };

        BulkImportResult result = new BulkImportOrchestrator(idlessStore).importAll(List.of(
            item("Ghost", "1"), item("Blank", "1"), item("Working", "2")));

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.createdProductIds()).doesNotContainNull().hasSize(1);
        assertThat(result.errors()).containsExactly(
            new ImportError("Ghost", "Catalog store returned no product id"),
            new ImportError("Blank", "Catalog store returned no product id"));
    }

    @Test
    void rejectsUnconfirmedDuplicates() {
        DuplicateVerdict verdict = DuplicateVerdict.exact(new ExistingProduct("p-1", "Tea", BigDecimal.ONE));
        BulkImportItem unconfirmed = item("Tea", "5").withDuplicate(verdict);
        BulkImportItem confirmed = new BulkImportItem("seller-1", "Tea", new BigDecimal("5"), 2, "box", null,
            null, null, verdict, true);

        BulkImportResult result = new BulkImportOrchestrator(store).importAll(List.of(unconfirmed, confirmed));

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.errors()).singleElement()
            .satisfies(error -> assertThat(error.error())
                .isEqualTo("Duplicate product requires confirmation: Product \"Tea\" already exists for this seller"));
        assertThat(store.listAll()).singleElement()
            .satisfies(product -> assertThat(product.minOrderQuantity()).isEqualTo(2));
    }

    @Test
    void validatesRequiredFields() {
        assertThat(BulkImportOrchestrator.validate(item("Tea", null))).isEqualTo("Price is required");
        assertThat(BulkImportOrchestrator.validate(item("Tea", "-0.01"))).isEqualTo("Price must be zero or greater");
        assertThat(BulkImportOrchestrator.validate(new BulkImportItem(" ", "Tea", BigDecimal.ONE, null, null, null,
            null, null, null, false))).isEqualTo("Seller id is required");
        assertThat(BulkImportOrchestrator.validate(new BulkImportItem("seller-1", "Tea", BigDecimal.ONE, 0, null,
            null, null, null, null, false))).isEqualTo("Minimum order quantity must be at least 1");
        assertThat(BulkImportOrchestrator.validate(item("Tea", "0"))).isNull();
    }

    @Test
    void defaultsMinimumOrderQuantityToOne() {
        new BulkImportOrchestrator(store).importAll(List.of(item("Tea", "5")));

        assertThat(store.listAll()).singleElement()
            .satisfies(product -> assertThat(product.minOrderQuantity()).isEqualTo(1));
    }

    @Test
    void recordsNullItemsAsFailures() {
        BulkImportResult result = new BulkImportOrchestrator(store).importAll(Arrays.asList(item("Tea", "1"), null));

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.errors()).containsExactly(new ImportError("", "Product is required"));
    }

    @Test
    void rejectsMissingItemList() {
        assertThatThrownBy(() -> new BulkImportOrchestrator(store).importAll(null))
            .isInstanceOf(InputValidationException.class)
            .hasMessage("Products array is required");
    }

    @Test
    void importsConcurrentlyThroughExecutor() {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<BulkImportItem> items = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                items.add(item("Product " + i, String.valueOf(i)));
            }
            items.add(item("", "1"));

            BulkImportResult result = new BulkImportOrchestrator(store, executor).importAll(items);

            assertThat(result.successful()).isEqualTo(20);
            assertThat(result.failed()).isEqualTo(1);
            assertThat(store.listAll()).hasSize(20);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void writesSequentiallyWithoutPoolAtParallelismOne() {
        try (BulkImportOrchestrator orchestrator = BulkImportOrchestrator.withParallelism(store, 1)) {
            assertThat(orchestrator.isConcurrent()).isFalse();
            assertThat(orchestrator.importAll(List.of(item("Tea", "1"))).successful()).isEqualTo(1);
        }
    }

    @Test
    void ownsAndReleasesPoolAboveParallelismOne() {
        BulkImportOrchestrator orchestrator = BulkImportOrchestrator.withParallelism(store, 3);
        assertThat(orchestrator.isConcurrent()).isTrue();
        assertThat(orchestrator.importAll(List.of(item("Tea", "1"), item("Soap", "2"))).successful()).isEqualTo(2);

        orchestrator.close();

        BulkImportResult afterClose = orchestrator.importAll(List.of(item("Coffee", "3")));
        assertThat(afterClose.successful()).isZero();
        assertThat(afterClose.errors()).containsExactly(new ImportError("Coffee", "Import rejected: executor is busy"));
    }

    private static BulkImportItem item(String name, String price) {
        return new BulkImportItem("seller-1", name, price == null ? null : new BigDecimal(price), null, "pcs",
            null, null, null, null, false);
    }
}
