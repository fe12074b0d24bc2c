package dev.shelfscan.inventory.store;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process local product catalog used when Firestore is not configured.
 */
public class InMemoryProductCatalogStore implements ProductCatalogStore {

    private final Map<String, StoredProduct> products = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryProductCatalogStore() {
        this(Clock.systemUTC());
    }

    public InMemoryProductCatalogStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<StoredProduct> listProductsForSeller(String sellerId) {
        return products.values().stream()
            .filter(product -> Objects.equals(sellerId, product.sellerId()))
            .sorted((left, right) -> left.createdAt().compareTo(right.createdAt()))
            .toList();
    }

    @Override
    public Optional<StoredProduct> findById(String productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public StoredProduct createProduct(NewProduct product) {
        Objects.requireNonNull(product, "product");
        Instant now = clock.instant();
        String id = UUID.randomUUID().toString();
        while (products.containsKey(id)) {
            id = UUID.randomUUID().toString();
        }
        StoredProduct stored = new StoredProduct(id, product.sellerId(), product.name(), product.price(),
            product.minOrderQuantity(), product.unit(), product.brand(), product.categoryId(),
            product.subcategoryId(), now, now);
        products.put(id, stored);
        return stored;
    }

    @Override
    public StoredProduct update(StoredProduct product) {
        Objects.requireNonNull(product, "product");
        if (!products.containsKey(product.id())) {
            throw new IllegalStateException("Product " + product.id() + " does not exist");
        }
        products.put(product.id(), product);
        return product;
    }

    public List<StoredProduct> listAll() {
        return List.copyOf(products.values());
    }
}
