package dev.shelfscan.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Assigns products to categories using the ordered keyword table.
 *
 * <p>Matching is case-insensitive and a pure function of its inputs. A keyword matches when it occurs
 * in the product text at the start of a word, so {@code "tea"} matches "Green Tea Bags" and "Teabags" but
 * not "Steak". Rules whose category is not among the known categories are passed over.</p>
 */
public class CategoryMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final CategoryKeywordTable table;

    public CategoryMatcher() {
        this(CategoryKeywordTable.defaultTable());
    }

    public CategoryMatcher(CategoryKeywordTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public CategoryMatch match(String name, List<Category> categories, List<Subcategory> subcategories) {
        return match(name, null, categories, subcategories);
    }

    public CategoryMatch match(String name, String brand, List<Category> categories,
        List<Subcategory> subcategories) {

        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(categories, "categories");
        Objects.requireNonNull(subcategories, "subcategories");

        if (categories.isEmpty()) {
            return CategoryMatch.unclassified();
        }

        String text = normalize(brand == null ? name : name + " " + brand);
        if (text.isEmpty()) {
            return CategoryMatch.unclassified();
        }

        for (CategoryKeywordRule rule : table.rules()) {
            if (!containsWord(text, rule.keyword())) {
                continue;
            }
            Optional<Category> category = findCategory(categories, rule.categoryName());
            if (category.isEmpty()) {
                continue;
            }
            CategorySuggestion categorySuggestion = new CategorySuggestion(category.get(), rule.confidence());
            return new CategoryMatch(categorySuggestion,
                matchSubcategory(text, rule, category.get(), subcategories));
        }
        return CategoryMatch.unclassified();
    }

    private static SubcategorySuggestion matchSubcategory(String text, CategoryKeywordRule rule,
        Category category, List<Subcategory> subcategories) {

        Subcategory labelMatch = null;
        for (Subcategory subcategory : subcategories) {
            if (subcategory == null || !Objects.equals(subcategory.categoryId(), category.id())) {
                continue;
            }
            String subcategoryName = normalize(subcategory.name());
            if (subcategoryName.isEmpty()) {
                continue;
            }
            if (containsWord(text, subcategoryName)) {
                return SubcategorySuggestion.existing(subcategory, rule.confidence());
            }
            if (labelMatch == null && rule.subcategoryLabel() != null
                && subcategoryName.equals(normalize(rule.subcategoryLabel()))) {
                labelMatch = subcategory;
            }
        }
        if (labelMatch != null) {
            return SubcategorySuggestion.existing(labelMatch, rule.confidence());
        }
        if (rule.subcategoryLabel() == null) {
            return null;
        }
        return SubcategorySuggestion.proposed(rule.subcategoryLabel(), rule.confidence());
    }

    static Optional<Category> findCategory(List<Category> categories, String name) {
        String wanted = normalize(name);
        return categories.stream()
            .filter(Objects::nonNull)
            .filter(category -> normalize(category.name()).equals(wanted))
            .findFirst();
    }

    static boolean containsWord(String text, String keyword) {
        int from = 0;
        while (true) {
            int index = text.indexOf(keyword, from);
            if (index < 0) {
                return false;
            }
            if (index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1))) {
                return true;
            }
            from = index + 1;
        }
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
