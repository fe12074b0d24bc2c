package dev.shelfscan.inventory.importer;

import dev.shelfscan.catalog.DuplicateDetector;
import dev.shelfscan.catalog.DuplicateVerdict;
import dev.shelfscan.catalog.ExistingProduct;
import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.store.ProductCatalogStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Checks product names against one seller's catalog. The catalog is loaded once per call.
 */
public class DuplicateCheckService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateCheckService.class);

    private final ProductCatalogStore catalogStore;
    private final DuplicateDetector detector;

    public DuplicateCheckService(ProductCatalogStore catalogStore, DuplicateDetector detector) {
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore");
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    public DuplicateVerdict check(String sellerId, String name) {
        if (name == null) {
            throw new InputValidationException("Product name is required");
        }
        return detector.check(name, existingProducts(sellerId));
    }

    public List<DuplicateCheck> checkAll(String sellerId, List<String> names) {
        if (names == null) {
            throw new InputValidationException("Product names are required");
        }
        List<ExistingProduct> existing = existingProducts(sellerId);
        List<DuplicateCheck> checks = new ArrayList<>(names.size());
        for (String name : names) {
            if (name == null) {
                throw new InputValidationException("All products must have a name");
            }
            checks.add(new DuplicateCheck(name, detector.check(name, existing)));
        }
        LOGGER.info("Checked {} names against {} products of seller {} ({} duplicates)", names.size(),
            existing.size(), sellerId, checks.stream().filter(check -> check.verdict().isDuplicate()).count());
        return checks;
    }

    /**
     * Fills in a duplicate verdict for every item that does not carry one yet.
     */
    public List<BulkImportItem> annotate(List<BulkImportItem> items) {
        List<BulkImportItem> annotated = new ArrayList<>(items.size());
        Map<String, List<ExistingProduct>> catalogs = new HashMap<>();
        for (BulkImportItem item : items) {
            if (item == null || item.duplicate() != null || item.name() == null
                || !StringUtils.hasText(item.sellerId())) {
                annotated.add(item);
                continue;
            }
            try {
                List<ExistingProduct> existing = catalogs.computeIfAbsent(item.sellerId(), this::existingProducts);
                annotated.add(item.withDuplicate(detector.check(item.name(), existing)));
            } catch (RuntimeException ex) {
                LOGGER.warn("Duplicate check skipped for '{}': {}", item.name(), ex.getMessage());
                annotated.add(item);
            }
        }
        return annotated;
    }

    private List<ExistingProduct> existingProducts(String sellerId) {
        if (!StringUtils.hasText(sellerId)) {
            throw new InputValidationException("Seller id is required");
        }
        return catalogStore.listProductsForSeller(sellerId.trim()).stream()
            .map(product -> new ExistingProduct(product.id(), product.name(), product.price()))
            .toList();
    }
}
