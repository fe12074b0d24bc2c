package dev.shelfscan.inventory;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore project and collection names resolved from configuration and the runtime environment.
 */
public record FirestoreSettings(
    String projectId,
    String categoriesCollection,
    String subcategoriesCollection,
    String productsCollection
) {

    static FirestoreSettings resolve(InventoryFirestoreProperties properties, Map<String, String> env,
        Supplier<String> defaultProjectSupplier) {

        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        String projectId = firstNonEmpty(
            properties.getProjectId(),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            defaultProjectSupplier.get());

        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via inventory.firestore.project-id "
                + "or available from the Cloud environment.");
        }

        return new FirestoreSettings(
            projectId,
            firstNonEmpty(properties.getCategoriesCollection(), "categories"),
            firstNonEmpty(properties.getSubcategoriesCollection(), "subcategories"),
            firstNonEmpty(properties.getProductsCollection(), "products"));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
