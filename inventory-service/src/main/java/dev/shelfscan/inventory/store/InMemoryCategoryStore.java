package dev.shelfscan.inventory.store;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.catalog.SubcategorySlugs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process local category store used when Firestore is not configured.
 */
public class InMemoryCategoryStore implements CategoryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryCategoryStore.class);

    private final List<Category> categories = new CopyOnWriteArrayList<>();
    private final List<Subcategory> subcategories = new CopyOnWriteArrayList<>();

    public InMemoryCategoryStore() {
        this(List.of(), List.of());
    }

    public InMemoryCategoryStore(List<Category> categories, List<Subcategory> subcategories) {
        this.categories.addAll(categories);
        this.subcategories.addAll(subcategories);
    }

    public static InMemoryCategoryStore withDefaultCategories(List<String> names) {
        List<Category> defaults = new ArrayList<>();
        for (String name : names) {
            String slug = SubcategorySlugs.slugify(name);
            defaults.add(new Category(slug, name, slug));
        }
        return new InMemoryCategoryStore(defaults, List.of());
    }

    @Override
    public List<Category> listCategories() {
        return List.copyOf(categories);
    }

    @Override
    public List<Subcategory> listSubcategories() {
        return List.copyOf(subcategories);
    }

    @Override
    public synchronized Subcategory createSubcategory(String name, String categoryId) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(categoryId, "categoryId");
        Set<String> takenSlugs = subcategories.stream()
            .filter(subcategory -> categoryId.equals(subcategory.categoryId()))
            .map(Subcategory::slug)
            .collect(Collectors.toSet());
        Subcategory created = new Subcategory(UUID.randomUUID().toString(), categoryId, name.trim(),
            SubcategorySlugs.uniqueSlug(name, takenSlugs));
        subcategories.add(created);
        LOGGER.info("Created subcategory '{}' ({}) under category {}", created.name(), created.id(), categoryId);
        return created;
    }
}
