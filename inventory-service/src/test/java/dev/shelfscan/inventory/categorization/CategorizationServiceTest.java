package dev.shelfscan.inventory.categorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.CategoryMatcher;
import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.NotFoundException;
import dev.shelfscan.inventory.store.CategoryStore;
import dev.shelfscan.receipts.ConfidenceScorer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategorizationServiceTest {

    private static final Category FOOD = new Category("food", "Food", "food");
    private static final Category HOME_CARE = new Category("home-care", "Home Care", "home-care");
    private static final Category ELECTRONICS = new Category("electronics", "Electronics", "electronics");
    private static final List<Category> CATEGORIES = List.of(FOOD, HOME_CARE, ELECTRONICS);

    @Mock
    private CategoryStore categoryStore;

    @Mock
    private CategorySuggester suggester;

    private CategorizationService service;

    @BeforeEach
    void setUp() {
        service = new CategorizationService(categoryStore, new CategoryMatcher(), suggester, new ConfidenceScorer(),
            0.7);
    }

    @Test
    void createsSharedSubcategoryOnlyOncePerBatch() {
        when(categoryStore.listCategories()).thenReturn(CATEGORIES);
        when(categoryStore.listSubcategories()).thenReturn(List.of());
        Subcategory detergent = new Subcategory("sub-1", "home-care", "Detergent", "detergent");
        when(categoryStore.createSubcategory("Detergent", "home-care")).thenReturn(detergent);

        CategorizationOutcome outcome = service.categorize(
            List.of(ProductInput.named("Surf Excel 1kg"), ProductInput.named("Ariel Matic")), null);

        verify(categoryStore, times(1)).createSubcategory("Detergent", "home-care");
        verifyNoInteractions(suggester);
        assertThat(outcome.newSubcategoriesCreated()).containsExactly(detergent);
        assertThat(outcome.subcategories()).containsExactly(detergent);
        assertThat(outcome.products()).allSatisfy(product -> {
            assertThat(product.source()).isEqualTo(CategorizationSource.RULE);
            assertThat(product.category().category()).isEqualTo(HOME_CARE);
            assertThat(product.subcategory().isNew()).isFalse();
            assertThat(product.subcategory().subcategory()).isEqualTo(detergent);
        });
    }

    @Test
    void sendsUnmatchedProductsToTheSuggesterInOneBatch() {
        when(categoryStore.listCategories()).thenReturn(CATEGORIES);
        when(categoryStore.listSubcategories()).thenReturn(List.of());
        when(suggester.suggestBatch(anyList(), anyList(), anyList())).thenReturn(List.of(
            List.of(new AiCategorySuggestion("Food", 0.4, null, null),
                new AiCategorySuggestion("electronics", 0.8, "Gadgets", 0.9)),
            List.of(new AiCategorySuggestion("Toys", 0.9, null, null))));
        Subcategory gadgets = new Subcategory("sub-2", "electronics", "Gadgets", "gadgets");
        when(categoryStore.createSubcategory("Gadgets", "electronics")).thenReturn(gadgets);

        CategorizationOutcome outcome = service.categorize(
            List.of(ProductInput.named("Mystery Gadget"), ProductInput.named("Unknown Widget")), true);

        CategorizedProduct gadget = outcome.products().get(0);
        assertThat(gadget.source()).isEqualTo(CategorizationSource.AI);
        assertThat(gadget.category().category()).isEqualTo(ELECTRONICS);
        assertThat(gadget.category().confidence()).isEqualTo(0.8);
        assertThat(gadget.subcategory().subcategory()).isEqualTo(gadgets);

        CategorizedProduct widget = outcome.products().get(1);
        assertThat(widget.source()).isEqualTo(CategorizationSource.NONE);
        assertThat(widget.category()).isNull();
        assertThat(widget.subcategory()).isNull();
        verify(suggester, never()).suggest(any(), anyList(), anyList());
    }

    @Test
    void fallsBackToSingleSuggestionsWhenBatchFails() {
        when(categoryStore.listCategories()).thenReturn(CATEGORIES);
        when(categoryStore.listSubcategories()).thenReturn(List.of());
        when(suggester.suggestBatch(anyList(), anyList(), anyList()))
            .thenThrow(new CategorizationException("AI categorization failed: quota"));
        when(suggester.suggest(any(), anyList(), anyList()))
            .thenReturn(List.of(new AiCategorySuggestion("Electronics", 0.75, null, null)))
            .thenThrow(new CategorizationException("AI categorization failed: timeout"));

        CategorizationOutcome outcome = service.categorize(
            List.of(ProductInput.named("Mystery Gadget"), ProductInput.named("Unknown Widget")), null);

        verify(suggester, times(2)).suggest(any(), anyList(), anyList());
        assertThat(outcome.products().get(0).category().category()).isEqualTo(ELECTRONICS);
        assertThat(outcome.products().get(0).subcategory()).isNull();
        assertThat(outcome.products().get(1).source()).isEqualTo(CategorizationSource.NONE);
    }

    @Test
    void skipsBatchCallWhenBatchingIsOff() {
        when(categoryStore.listCategories()).thenReturn(CATEGORIES);
        when(categoryStore.listSubcategories()).thenReturn(List.of());
        when(suggester.suggest(any(), anyList(), anyList())).thenReturn(List.of());

        service.categorize(List.of(ProductInput.named("Mystery Gadget"), ProductInput.named("Unknown Widget")),
            false);

        verify(suggester, never()).suggestBatch(anyList(), anyList(), anyList());
        verify(suggester, times(2)).suggest(any(), anyList(), anyList());
    }

    @Test
    void keepsLowConfidenceSubcategoryAsProposal() {
        when(categoryStore.listCategories()).thenReturn(CATEGORIES);
        when(categoryStore.listSubcategories()).thenReturn(List.of());
        when(suggester.suggest(any(), anyList(), anyList()))
            .thenReturn(List.of(new AiCategorySuggestion("Electronics", 0.9, "Gadgets", 0.5)));

        CategorizationOutcome outcome = service.categorize(List.of(ProductInput.named("Mystery Gadget")), null);

        CategorizedProduct product = outcome.products().get(0);
        assertThat(product.subcategory().isNew()).isTrue();
        assertThat(product.subcategory().suggestedName()).isEqualTo("Gadgets");
        assertThat(product.subcategory().subcategory()).isNull();
        assertThat(outcome.newSubcategoriesCreated()).isEmpty();
        verify(categoryStore, never()).createSubcategory(any(), any());
    }

    @Test
    void scoresProductsWithDefaultConfidences() {
        when(categoryStore.listCategories()).thenReturn(CATEGORIES);
        when(categoryStore.listSubcategories()).thenReturn(List.of(
            new Subcategory("sub-1", "home-care", "Detergent", "detergent")));

        CategorizationOutcome outcome = service.categorize(List.of(
            new ProductInput("Surf Excel", new BigDecimal("99.00"), null, "kg", null, null)), null);

        CategorizedProduct product = outcome.products().get(0);
        assertThat(product.product().name()).isEqualTo("Surf Excel");
        assertThat(product.product().confidence().price()).isEqualTo(0.8);
        assertThat(product.product().confidence().quantity()).isEqualTo(0.5);
        assertThat(product.product().confidence().overall()).isEqualTo(0.6);
        assertThat(product.product().needsReview()).isTrue();
        verify(categoryStore, never()).createSubcategory(any(), any());
    }

    @Test
    void validatesInput() {
        assertThatThrownBy(() -> service.categorize(null, null))
            .isInstanceOf(InputValidationException.class)
            .hasMessage("Products array is required");
        assertThatThrownBy(() -> service.categorize(List.of(), null))
            .isInstanceOf(InputValidationException.class)
            .hasMessage("At least one product is required");
        List<ProductInput> withBlank = new ArrayList<>(List.of(ProductInput.named("Tea"), ProductInput.named(" ")));
        assertThatThrownBy(() -> service.categorize(withBlank, null))
            .isInstanceOf(InputValidationException.class)
            .hasMessage("All products must have a name");
    }

    @Test
    void requiresCategories() {
        when(categoryStore.listCategories()).thenReturn(List.of());

        assertThatThrownBy(() -> service.categorize(List.of(ProductInput.named("Tea")), null))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("No categories found. Please create categories first.");
    }

    @Test
    void rejectsSubcategoryThatAlreadyExists() {
        when(categoryStore.findCategory("Home Care")).thenReturn(Optional.of(HOME_CARE));
        when(categoryStore.listSubcategories()).thenReturn(List.of(
            new Subcategory("sub-1", "home-care", "Detergent", "detergent")));

        assertThatThrownBy(() -> service.addSubcategory(" detergent ", "Home Care"))
            .isInstanceOf(InputValidationException.class)
            .hasMessage("Subcategory \"detergent\" already exists in this category");
    }
}
