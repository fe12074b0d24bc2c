package dev.shelfscan.inventory.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.shelfscan.catalog.DuplicateDetector;
import dev.shelfscan.catalog.DuplicateMatchType;
import dev.shelfscan.catalog.DuplicateVerdict;
import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.store.InMemoryProductCatalogStore;
import dev.shelfscan.inventory.store.NewProduct;
import dev.shelfscan.inventory.store.StoredProduct;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DuplicateCheckServiceTest {

    private InMemoryProductCatalogStore store;
    private DuplicateCheckService service;
    private StoredProduct existing;

    @BeforeEach
    void setUp() {
        store = new InMemoryProductCatalogStore();
        existing = store.createProduct(new NewProduct("seller-1", "Surf Excel Detergent", BigDecimal.TEN, 1, null,
            null, null, null));
        store.createProduct(new NewProduct("seller-2", "Green Tea", BigDecimal.ONE, 1, null, null, null, null));
        service = new DuplicateCheckService(store, new DuplicateDetector());
    }

    @Test
    void checksAgainstTheSellersOwnCatalogOnly() {
        DuplicateVerdict exact = service.check("seller-1", "surf excel detergent");
        DuplicateVerdict otherSeller = service.check("seller-1", "Green Tea");

        assertThat(exact.isDuplicate()).isTrue();
        assertThat(exact.matchType()).isEqualTo(DuplicateMatchType.EXACT);
        assertThat(exact.matchedProductId()).isEqualTo(existing.id());
        assertThat(otherSeller.isDuplicate()).isFalse();
    }

    @Test
    void checksSeveralNames() {
        List<DuplicateCheck> checks = service.checkAll("seller-1", List.of("Surf Excel", "Basmati Rice"));

        assertThat(checks).extracting(DuplicateCheck::name).containsExactly("Surf Excel", "Basmati Rice");
        assertThat(checks.get(0).verdict().isDuplicate()).isFalse();
        assertThat(checks.get(1).verdict().isDuplicate()).isFalse();
    }

    @Test
    void annotatesImportItemsWithoutVerdict() {
        BulkImportItem fresh = new BulkImportItem("seller-1", "Surf Excel Detergent", BigDecimal.ONE, null, null,
            null, null, null, null, false);
        BulkImportItem alreadyChecked = fresh.withDuplicate(DuplicateVerdict.notDuplicate());

        List<BulkImportItem> annotated = service.annotate(List.of(fresh, alreadyChecked));

        assertThat(annotated.get(0).duplicate().isDuplicate()).isTrue();
        assertThat(annotated.get(1)).isSameAs(alreadyChecked);
    }

    @Test
    void requiresSellerId() {
        assertThatThrownBy(() -> service.check(" ", "Tea"))
            .isInstanceOf(InputValidationException.class)
            .hasMessage("Seller id is required");
    }
}
