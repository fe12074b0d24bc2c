package dev.shelfscan.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered keyword table used by {@link CategoryMatcher}. Iteration order is significant: the first rule
 * whose keyword occurs in a product name wins, even when a later rule would also match.
 */
public final class CategoryKeywordTable {

    private static final CategoryKeywordTable DEFAULT = builder()
        .group("Food", "Chocolates", 1, "chocolate", "dairy milk", "kitkat", "cadbury", "5 star", "munch")
        .group("Food", "Biscuits & Cookies", 1, "biscuit", "cookie", "cracker", "parle", "oreo", "bourbon",
            "good day", "marie")
        .group("Food", "Breakfast Cereals", 2, "cornflakes", "corn flakes", "oats", "muesli", "cereal", "chocos")
        .group("Food", "Instant Food", 2, "noodle", "maggi", "pasta", "yippee", "cup noodles", "instant")
        .group("Food", "Snacks", 3, "chips", "namkeen", "popcorn", "wafer", "kurkure", "lays", "bhujia")
        .group("Dairy", "Dairy Products", 1, "milk", "butter", "cheese", "paneer", "curd", "yogurt", "ghee")
        .group("Personal Care", "Bath Soaps", 1, "soap", "body wash", "shower gel", "lifebuoy", "lux")
        .group("Personal Care", "Hair Care", 1, "shampoo", "conditioner", "hair oil", "clinic plus")
        .group("Personal Care", "Oral Care", 1, "toothpaste", "toothbrush", "mouthwash", "colgate")
        .group("Personal Care", "Health & Hygiene", 2, "sanitizer", "handwash", "hand wash", "dettol", "savlon")
        .group("Home Care", "Detergent", 1, "detergent", "washing powder", "surf", "rin", "tide", "ariel", "wheel")
        .group("Home Care", "Cleaning Products", 2, "cleaner", "vim", "harpic", "lizol", "dishwash", "floor")
        .group("Home Care", "Air Fresheners", 2, "air freshener", "odonil", "room spray")
        .group("Home Care", "Pest Control", 2, "mosquito", "insect", "repellent", "good knight", "all out",
            "hit spray")
        .group("Hardware", "Adhesives", 1, "fevicol", "fevikwik", "adhesive", "glue")
        .group("Beverages", "Hot Beverages", 1, "tea", "coffee", "green tea", "nescafe", "bru")
        .group("Beverages", "Soft Drinks", 2, "cola", "soda", "juice", "soft drink", "sprite", "pepsi")
        .group("Electronics", "Mobile Phones", 1, "phone", "mobile", "smartphone")
        .group("Electronics", "Accessories", 2, "charger", "cable", "earphone", "headphone", "power bank")
        .group("Stationery", "Writing Supplies", 2, "pen", "pencil", "notebook", "eraser", "marker")
        .build();

    private final List<CategoryKeywordRule> rules;

    private CategoryKeywordTable(List<CategoryKeywordRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static CategoryKeywordTable defaultTable() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<CategoryKeywordRule> rules() {
        return rules;
    }

    public static final class Builder {

        private final List<CategoryKeywordRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder rule(CategoryKeywordRule rule) {
            rules.add(rule);
            return this;
        }

        /**
         * Adds one rule per keyword. Lower priority numbers map to higher confidence.
         */
        public Builder group(String categoryName, String subcategoryLabel, int priority, String... keywords) {
            double confidence = Math.max(0.7, 1.0 - priority * 0.05);
            for (String keyword : keywords) {
                rules.add(new CategoryKeywordRule(keyword, categoryName, subcategoryLabel, confidence));
            }
            return this;
        }

        public CategoryKeywordTable build() {
            return new CategoryKeywordTable(rules);
        }
    }
}
