package dev.shelfscan.inventory.store;

import java.util.List;
import java.util.Optional;

public interface ProductCatalogStore {

    List<StoredProduct> listProductsForSeller(String sellerId);

    Optional<StoredProduct> findById(String productId);

    /**
     * Stores a new product and returns it with its assigned id and timestamps.
     */
    StoredProduct createProduct(NewProduct product);

    StoredProduct update(StoredProduct product);
}
