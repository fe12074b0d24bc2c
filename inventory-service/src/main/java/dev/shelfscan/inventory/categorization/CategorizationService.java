package dev.shelfscan.inventory.categorization;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.CategoryMatch;
import dev.shelfscan.catalog.CategoryMatcher;
import dev.shelfscan.catalog.CategorySuggestion;
import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.catalog.SubcategorySlugs;
import dev.shelfscan.catalog.SubcategorySuggestion;
import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.NotFoundException;
import dev.shelfscan.inventory.store.CategoryStore;
import dev.shelfscan.receipts.CandidateDraft;
import dev.shelfscan.receipts.ConfidenceHints;
import dev.shelfscan.receipts.ConfidenceScorer;
import dev.shelfscan.receipts.ExtractedCandidate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Categorizes a batch of products.
 *
 * <p>Keyword rules are tried first. Products they cannot place go to the {@link CategorySuggester}, in a
 * single batch call when there are several, falling back to one call per product when the batch call
 * fails. Suggested subcategories that do not exist yet are created when their confidence reaches the
 * creation threshold, at most once per category and name within the batch.</p>
 */
public class CategorizationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CategorizationService.class);

    static final double DEFAULT_NAME_CONFIDENCE = 0.8;
    static final double PRESENT_FIELD_CONFIDENCE = 0.8;
    static final double MISSING_PRICE_CONFIDENCE = 0.3;
    static final double MISSING_QUANTITY_CONFIDENCE = 0.5;
    static final double DEFAULT_OVERALL_CONFIDENCE = 0.6;

    private final CategoryStore categoryStore;
    private final CategoryMatcher matcher;
    private final CategorySuggester suggester;
    private final ConfidenceScorer scorer;
    private final double creationThreshold;

    public CategorizationService(CategoryStore categoryStore, CategoryMatcher matcher, CategorySuggester suggester,
        ConfidenceScorer scorer, double creationThreshold) {
        this.categoryStore = Objects.requireNonNull(categoryStore, "categoryStore");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.suggester = Objects.requireNonNull(suggester, "suggester");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.creationThreshold = creationThreshold;
    }

    public CategorizationOutcome categorize(List<ProductInput> products, Boolean batch) {
        validate(products);

        List<Category> categories = categoryStore.listCategories();
        if (categories.isEmpty()) {
            throw new NotFoundException("No categories found. Please create categories first.");
        }
        List<Subcategory> subcategories = categoryStore.listSubcategories();

        int size = products.size();
        List<CategoryMatch> matches = new ArrayList<>(Collections.nCopies(size, CategoryMatch.unclassified()));
        List<CategorizationSource> sources = new ArrayList<>(Collections.nCopies(size, CategorizationSource.NONE));
        List<Integer> unmatched = new ArrayList<>();

        for (int i = 0; i < size; i++) {
            ProductInput product = products.get(i);
            CategoryMatch match = matcher.match(product.name(), product.brand(), categories, subcategories);
            if (match.isClassified()) {
                matches.set(i, match);
                sources.set(i, CategorizationSource.RULE);
            } else {
                unmatched.add(i);
            }
        }
        LOGGER.info("Keyword rules categorized {} of {} products", size - unmatched.size(), size);

        if (!unmatched.isEmpty()) {
            List<List<AiCategorySuggestion>> suggestions =
                suggestUnmatched(products, unmatched, batch, categories, subcategories);
            for (int k = 0; k < unmatched.size(); k++) {
                int index = unmatched.get(k);
                CategoryMatch match = toMatch(suggestions.get(k), categories, subcategories);
                if (match.isClassified()) {
                    matches.set(index, match);
                    sources.set(index, CategorizationSource.AI);
                }
            }
        }

        SubcategoryCreationRegistry registry = new SubcategoryCreationRegistry();
        List<Subcategory> created = Collections.synchronizedList(new ArrayList<>());
        List<CategorizedProduct> categorized = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            CategoryMatch match = createSubcategoryIfNeeded(matches.get(i), registry, subcategories, created);
            categorized.add(new CategorizedProduct(toCandidate(products.get(i)), match.category(),
                match.subcategory(), sources.get(i)));
        }

        List<Subcategory> allSubcategories = new ArrayList<>(subcategories);
        allSubcategories.addAll(created);
        if (!created.isEmpty()) {
            LOGGER.info("Created {} new subcategories while categorizing {} products", created.size(), size);
        }
        return new CategorizationOutcome(categorized, categories, allSubcategories, created);
    }

    public CategoryCatalog catalog() {
        return new CategoryCatalog(categoryStore.listCategories(), categoryStore.listSubcategories());
    }

    public Subcategory addSubcategory(String name, String categoryRef) {
        if (!StringUtils.hasText(name)) {
            throw new InputValidationException("Subcategory name is required");
        }
        if (!StringUtils.hasText(categoryRef)) {
            throw new InputValidationException("Category is required");
        }
        Category category = categoryStore.findCategory(categoryRef)
            .orElseThrow(() -> new NotFoundException("Category not found"));

        String normalized = SubcategorySlugs.normalizedName(name);
        boolean exists = categoryStore.listSubcategories().stream()
            .anyMatch(subcategory -> category.id().equals(subcategory.categoryId())
                && SubcategorySlugs.normalizedName(subcategory.name()).equals(normalized));
        if (exists) {
            throw new InputValidationException("Subcategory \"" + name.trim() + "\" already exists in this category");
        }
        return categoryStore.createSubcategory(name.trim(), category.id());
    }

    private static void validate(List<ProductInput> products) {
        if (products == null) {
            throw new InputValidationException("Products array is required");
        }
        if (products.isEmpty()) {
            throw new InputValidationException("At least one product is required");
        }
        for (ProductInput product : products) {
            if (product == null || !StringUtils.hasText(product.name())) {
                throw new InputValidationException("All products must have a name");
            }
        }
    }

    private List<List<AiCategorySuggestion>> suggestUnmatched(List<ProductInput> products, List<Integer> unmatched,
        Boolean batch, List<Category> categories, List<Subcategory> subcategories) {

        List<ProductInput> pending = unmatched.stream().map(products::get).toList();

        if (!Boolean.FALSE.equals(batch) && pending.size() > 1) {
            try {
                List<List<AiCategorySuggestion>> suggestions =
                    suggester.suggestBatch(pending, categories, subcategories);
                if (suggestions != null && suggestions.size() == pending.size()) {
                    return suggestions;
                }
                LOGGER.warn("Batch categorization returned {} results for {} products; categorizing individually",
                    suggestions == null ? 0 : suggestions.size(), pending.size());
            } catch (RuntimeException ex) {
                LOGGER.warn("Batch categorization failed, categorizing {} products individually: {}",
                    pending.size(), ex.getMessage());
            }
        }

        List<List<AiCategorySuggestion>> suggestions = new ArrayList<>(pending.size());
        for (ProductInput product : pending) {
            try {
                List<AiCategorySuggestion> single = suggester.suggest(product, categories, subcategories);
                suggestions.add(single == null ? List.of() : single);
            } catch (RuntimeException ex) {
                LOGGER.warn("Categorization failed for product '{}': {}", product.name(), ex.getMessage());
                suggestions.add(List.of());
            }
        }
        return suggestions;
    }

    static CategoryMatch toMatch(List<AiCategorySuggestion> suggestions, List<Category> categories,
        List<Subcategory> subcategories) {

        if (suggestions == null || suggestions.isEmpty()) {
            return CategoryMatch.unclassified();
        }
        List<AiCategorySuggestion> ranked = suggestions.stream()
            .filter(Objects::nonNull)
            .sorted(Comparator.comparingDouble(AiCategorySuggestion::confidence).reversed())
            .toList();

        for (AiCategorySuggestion suggestion : ranked) {
            Optional<Category> category = findByName(categories, suggestion.categoryName());
            if (category.isEmpty()) {
                continue;
            }
            double confidence = clamp(suggestion.confidence());
            CategorySuggestion categorySuggestion = new CategorySuggestion(category.get(), confidence);
            if (!StringUtils.hasText(suggestion.subcategoryName())) {
                return new CategoryMatch(categorySuggestion, null);
            }
            double subcategoryConfidence = suggestion.subcategoryConfidence() != null
                ? clamp(suggestion.subcategoryConfidence())
                : confidence;
            String wanted = SubcategorySlugs.normalizedName(suggestion.subcategoryName());
            SubcategorySuggestion subcategorySuggestion = subcategories.stream()
                .filter(subcategory -> category.get().id().equals(subcategory.categoryId()))
                .filter(subcategory -> SubcategorySlugs.normalizedName(subcategory.name()).equals(wanted))
                .findFirst()
                .map(subcategory -> SubcategorySuggestion.existing(subcategory, subcategoryConfidence))
                .orElseGet(() -> SubcategorySuggestion.proposed(suggestion.subcategoryName().trim(),
                    subcategoryConfidence));
            return new CategoryMatch(categorySuggestion, subcategorySuggestion);
        }
        return CategoryMatch.unclassified();
    }

    private CategoryMatch createSubcategoryIfNeeded(CategoryMatch match, SubcategoryCreationRegistry registry,
        List<Subcategory> existing, List<Subcategory> created) {

        SubcategorySuggestion suggestion = match.subcategory();
        if (suggestion == null || !suggestion.isNew() || !StringUtils.hasText(suggestion.suggestedName())
            || suggestion.confidence() < creationThreshold) {
            return match;
        }

        Category category = match.category().category();
        String name = suggestion.suggestedName().trim();
        try {
            Subcategory subcategory = registry.resolve(category.id(), name, () -> existing.stream()
                .filter(candidate -> category.id().equals(candidate.categoryId()))
                .filter(candidate -> SubcategorySlugs.normalizedName(candidate.name())
                    .equals(SubcategorySlugs.normalizedName(name)))
                .findFirst()
                .orElseGet(() -> {
                    Subcategory newSubcategory = categoryStore.createSubcategory(name, category.id());
                    created.add(newSubcategory);
                    return newSubcategory;
                }));
            return new CategoryMatch(match.category(),
                SubcategorySuggestion.existing(subcategory, suggestion.confidence()));
        } catch (RuntimeException ex) {
            LOGGER.warn("Could not create subcategory '{}' under category '{}': {}", name, category.name(),
                ex.getMessage());
            return match;
        }
    }

    private ExtractedCandidate toCandidate(ProductInput product) {
        ConfidenceHints hints = new ConfidenceHints(
            DEFAULT_NAME_CONFIDENCE,
            product.price() != null ? PRESENT_FIELD_CONFIDENCE : MISSING_PRICE_CONFIDENCE,
            product.quantity() != null ? PRESENT_FIELD_CONFIDENCE : MISSING_QUANTITY_CONFIDENCE,
            StringUtils.hasText(product.brand()) ? PRESENT_FIELD_CONFIDENCE : 0.0,
            product.confidence() != null ? product.confidence() : DEFAULT_OVERALL_CONFIDENCE);
        return scorer.score(CandidateDraft.builder()
            .name(product.name())
            .price(product.price())
            .quantity(product.quantity())
            .unit(product.unit())
            .brand(product.brand())
            .hints(hints)
            .originalText(product.name())
            .build());
    }

    private static Optional<Category> findByName(List<Category> categories, String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        String wanted = name.trim();
        return categories.stream()
            .filter(category -> category.name() != null && category.name().trim().equalsIgnoreCase(wanted))
            .findFirst();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
