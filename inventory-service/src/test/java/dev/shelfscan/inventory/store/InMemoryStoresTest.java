package dev.shelfscan.inventory.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryStoresTest {

    @Test
    void seedsCategoriesWithSlugIds() {
        InMemoryCategoryStore store = InMemoryCategoryStore.withDefaultCategories(List.of("Food", "Personal Care"));

        assertThat(store.listCategories()).containsExactly(
            new Category("food", "Food", "food"),
            new Category("personal-care", "Personal Care", "personal-care"));
        assertThat(store.findCategory("personal care")).map(Category::id).contains("personal-care");
        assertThat(store.findCategory("food")).map(Category::name).contains("Food");
        assertThat(store.findCategory(" ")).isEmpty();
    }

    @Test
    void givesSubcategoriesUniqueSlugsWithinCategory() {
        InMemoryCategoryStore store = InMemoryCategoryStore.withDefaultCategories(List.of("Food", "Dairy"));

        Subcategory first = store.createSubcategory("Snacks", "food");
        Subcategory second = store.createSubcategory("Snacks!", "food");
        Subcategory other = store.createSubcategory("Snacks", "dairy");

        assertThat(first.slug()).isEqualTo("snacks");
        assertThat(second.slug()).isEqualTo("snacks-1");
        assertThat(other.slug()).isEqualTo("snacks");
        assertThat(store.findSubcategory("food", first.id())).contains(first);
        assertThat(store.findSubcategory("dairy", "snacks")).contains(other);
    }

    @Test
    void productCatalogFiltersBySellerAndRejectsUnknownUpdates() {
        InMemoryProductCatalogStore store = new InMemoryProductCatalogStore();
        StoredProduct tea = store.createProduct(new NewProduct("seller-1", "Tea", BigDecimal.ONE, 1, null, null,
            null, null));
        store.createProduct(new NewProduct("seller-2", "Coffee", BigDecimal.TEN, 1, null, null, null, null));

        assertThat(store.listProductsForSeller("seller-1")).containsExactly(tea);
        assertThat(store.findById(null)).isEmpty();
        StoredProduct ghost = new StoredProduct("ghost", "seller-1", "Ghost", BigDecimal.ONE, 1, null, null, null,
            null, null, null);
        assertThatThrownBy(() -> store.update(ghost)).isInstanceOf(IllegalStateException.class);
    }
}
