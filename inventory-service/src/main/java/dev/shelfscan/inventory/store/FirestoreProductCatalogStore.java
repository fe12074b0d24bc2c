package dev.shelfscan.inventory.store;

import static dev.shelfscan.inventory.store.FirestoreCategoryStore.await;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

public class FirestoreProductCatalogStore implements ProductCatalogStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreProductCatalogStore.class);

    private final Firestore firestore;
    private final String productsCollection;

    public FirestoreProductCatalogStore(Firestore firestore, String productsCollection) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.productsCollection = productsCollection;
    }

    @Override
    public List<StoredProduct> listProductsForSeller(String sellerId) {
        if (!StringUtils.hasText(sellerId)) {
            return List.of();
        }
        QuerySnapshot snapshot = await(firestore.collection(productsCollection)
            .whereEqualTo("sellerId", sellerId)
            .get(), "load products for seller " + sellerId);
        List<StoredProduct> products = new ArrayList<>();
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            StoredProduct product = toProduct(document.getId(), document.getData());
            if (product != null) {
                products.add(product);
            }
        }
        LOGGER.debug("Loaded {} products for seller {}", products.size(), sellerId);
        return List.copyOf(products);
    }

    @Override
    public Optional<StoredProduct> findById(String productId) {
        if (!StringUtils.hasText(productId)) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(firestore.collection(productsCollection).document(productId).get(),
            "load product " + productId);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.ofNullable(toProduct(snapshot.getId(), snapshot.getData()));
    }

    @Override
    public StoredProduct createProduct(NewProduct product) {
        Objects.requireNonNull(product, "product");
        DocumentReference reference = firestore.collection(productsCollection).document();
        Instant now = Instant.now();
        StoredProduct stored = new StoredProduct(reference.getId(), product.sellerId(), product.name(),
            product.price(), product.minOrderQuantity(), product.unit(), product.brand(), product.categoryId(),
            product.subcategoryId(), now, now);
        await(reference.set(toDocument(stored)), "create product '" + product.name() + "'");
        return stored;
    }

    @Override
    public StoredProduct update(StoredProduct product) {
        Objects.requireNonNull(product, "product");
        await(firestore.collection(productsCollection).document(product.id()).set(toDocument(product)),
            "update product " + product.id());
        return product;
    }

    static Map<String, Object> toDocument(StoredProduct product) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sellerId", product.sellerId());
        data.put("name", product.name());
        data.put("price", product.price() != null ? product.price().toPlainString() : null);
        data.put("minOrderQuantity", product.minOrderQuantity());
        data.put("unit", product.unit());
        data.put("brand", product.brand());
        data.put("categoryId", product.categoryId());
        data.put("subcategoryId", product.subcategoryId());
        data.put("createdAt", toTimestamp(product.createdAt()));
        data.put("updatedAt", toTimestamp(product.updatedAt()));
        return data;
    }

    static StoredProduct toProduct(String id, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String name = data.get("name") instanceof String text ? text : null;
        if (!StringUtils.hasText(name)) {
            LOGGER.warn("Skipping product document {} without a name", id);
            return null;
        }
        return new StoredProduct(
            id,
            asString(data.get("sellerId")),
            name,
            asDecimal(data.get("price")),
            asInt(data.get("minOrderQuantity"), 1),
            asString(data.get("unit")),
            asString(data.get("brand")),
            asString(data.get("categoryId")),
            asString(data.get("subcategoryId")),
            asInstant(data.get("createdAt")),
            asInstant(data.get("updatedAt")));
    }

    private static String asString(Object value) {
        return value instanceof String text ? text : null;
    }

    private static BigDecimal asDecimal(Object value) {
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                LOGGER.warn("Ignoring unparseable price '{}'", text);
                return null;
            }
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return null;
    }

    private static int asInt(Object value, int fallback) {
        return value instanceof Number number ? number.intValue() : fallback;
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        return null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        if (instant == null) {
            return null;
        }
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }
}
