package dev.shelfscan.inventory.store;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.catalog.SubcategorySlugs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Firestore backed {@link CategoryStore}. Categories and subcategories live in separate collections;
 * subcategory documents reference their category through {@code categoryId}.
 */
public class FirestoreCategoryStore implements CategoryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreCategoryStore.class);

    private final Firestore firestore;
    private final String categoriesCollection;
    private final String subcategoriesCollection;

    public FirestoreCategoryStore(Firestore firestore, String categoriesCollection, String subcategoriesCollection) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.categoriesCollection = categoriesCollection;
        this.subcategoriesCollection = subcategoriesCollection;
    }

    @Override
    public List<Category> listCategories() {
        QuerySnapshot snapshot = await(firestore.collection(categoriesCollection).orderBy("name").get(),
            "load categories");
        List<Category> categories = new ArrayList<>();
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            Category category = toCategory(document.getId(), document.getData());
            if (category != null) {
                categories.add(category);
            }
        }
        LOGGER.debug("Loaded {} categories from collection '{}'", categories.size(), categoriesCollection);
        return Collections.unmodifiableList(categories);
    }

    @Override
    public List<Subcategory> listSubcategories() {
        QuerySnapshot snapshot = await(firestore.collection(subcategoriesCollection).orderBy("name").get(),
            "load subcategories");
        List<Subcategory> subcategories = new ArrayList<>();
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            Subcategory subcategory = toSubcategory(document.getId(), document.getData());
            if (subcategory != null) {
                subcategories.add(subcategory);
            }
        }
        return Collections.unmodifiableList(subcategories);
    }

    @Override
    public Subcategory createSubcategory(String name, String categoryId) {
        if (!StringUtils.hasText(name) || !StringUtils.hasText(categoryId)) {
            throw new IllegalArgumentException("Subcategory name and category id are required");
        }
        Set<String> takenSlugs = listSubcategories().stream()
            .filter(subcategory -> categoryId.equals(subcategory.categoryId()))
            .map(Subcategory::slug)
            .collect(Collectors.toSet());
        String slug = SubcategorySlugs.uniqueSlug(name, takenSlugs);

        DocumentReference reference = firestore.collection(subcategoriesCollection).document();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name.trim());
        data.put("slug", slug);
        data.put("categoryId", categoryId);
        data.put("createdAt", Timestamp.now());
        await(reference.set(data), "create subcategory '" + name + "'");

        LOGGER.info("Created subcategory '{}' ({}) under category {}", name.trim(), reference.getId(), categoryId);
        return new Subcategory(reference.getId(), categoryId, name.trim(), slug);
    }

    static Category toCategory(String id, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String name = stringValue(data.get("name"));
        if (!StringUtils.hasText(name)) {
            return null;
        }
        String slug = stringValue(data.get("slug"));
        return new Category(id, name, StringUtils.hasText(slug) ? slug : SubcategorySlugs.slugify(name));
    }

    static Subcategory toSubcategory(String id, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String name = stringValue(data.get("name"));
        String categoryId = stringValue(data.get("categoryId"));
        if (!StringUtils.hasText(name) || !StringUtils.hasText(categoryId)) {
            return null;
        }
        String slug = stringValue(data.get("slug"));
        return new Subcategory(id, categoryId, name, StringUtils.hasText(slug) ? slug : SubcategorySlugs.slugify(name));
    }

    private static String stringValue(Object value) {
        return value instanceof String text ? text : null;
    }

    static <T> T await(ApiFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CatalogStoreException("Interrupted while trying to " + operation, ex);
        } catch (ExecutionException ex) {
            throw new CatalogStoreException("Failed to " + operation + " in Firestore", ex.getCause());
        }
    }
}
