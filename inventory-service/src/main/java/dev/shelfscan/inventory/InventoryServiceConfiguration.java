package dev.shelfscan.inventory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.ServiceOptions;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.shelfscan.catalog.CategoryMatcher;
import dev.shelfscan.catalog.DuplicateDetector;
import dev.shelfscan.inventory.categorization.CategorizationService;
import dev.shelfscan.inventory.categorization.CategorySuggester;
import dev.shelfscan.inventory.categorization.ChatModelCategorySuggester;
import dev.shelfscan.inventory.categorization.DisabledCategorySuggester;
import dev.shelfscan.inventory.extraction.ChatModelReceiptExtractor;
import dev.shelfscan.inventory.extraction.DisabledReceiptExtractor;
import dev.shelfscan.inventory.extraction.ReceiptExtractor;
import dev.shelfscan.inventory.extraction.ReceiptImageValidator;
import dev.shelfscan.inventory.extraction.ReceiptScanService;
import dev.shelfscan.inventory.importer.BulkImportOrchestrator;
import dev.shelfscan.inventory.importer.BulkImportService;
import dev.shelfscan.inventory.importer.BulkProductOperations;
import dev.shelfscan.inventory.importer.DuplicateCheckService;
import dev.shelfscan.inventory.store.CategoryStore;
import dev.shelfscan.inventory.store.FirestoreCategoryStore;
import dev.shelfscan.inventory.store.FirestoreProductCatalogStore;
import dev.shelfscan.inventory.store.InMemoryCategoryStore;
import dev.shelfscan.inventory.store.InMemoryProductCatalogStore;
import dev.shelfscan.inventory.store.ProductCatalogStore;
import dev.shelfscan.receipts.ConfidenceScorer;
import dev.shelfscan.receipts.ProductNameCleaner;
import dev.shelfscan.receipts.ReceiptLineParser;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the receipt to inventory pipeline. Firestore backs the stores when enabled; otherwise the
 * in-memory stores are used. Without a {@link ChatModel} the AI collaborators are replaced by disabled ones.
 */
@Configuration
@EnableConfigurationProperties({InventoryPipelineProperties.class, InventoryAiProperties.class,
    InventoryFirestoreProperties.class})
public class InventoryServiceConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(InventoryServiceConfiguration.class);

    @Bean
    public Clock inventoryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConfidenceScorer confidenceScorer(InventoryPipelineProperties properties) {
        return new ConfidenceScorer(properties.getReviewThreshold());
    }

    @Bean
    public ProductNameCleaner productNameCleaner() {
        return new ProductNameCleaner();
    }

    @Bean
    public ReceiptLineParser receiptLineParser(ProductNameCleaner productNameCleaner,
        ConfidenceScorer confidenceScorer) {
        return new ReceiptLineParser(productNameCleaner, confidenceScorer);
    }

    @Bean
    public CategoryMatcher categoryMatcher() {
        return new CategoryMatcher();
    }

    @Bean
    public DuplicateDetector duplicateDetector(InventoryPipelineProperties properties) {
        return new DuplicateDetector(properties.getDuplicateSimilarityThreshold());
    }

    @Bean
    @ConditionalOnProperty(prefix = "inventory.firestore", name = "enabled", havingValue = "true")
    public FirestoreSettings firestoreSettings(InventoryFirestoreProperties properties) {
        return FirestoreSettings.resolve(properties, System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    @Bean
    @ConditionalOnProperty(prefix = "inventory.firestore", name = "enabled", havingValue = "true")
    public Firestore firestore(FirestoreSettings firestoreSettings) {
        Firestore firestore = FirestoreOptions.getDefaultInstance().toBuilder()
            .setProjectId(firestoreSettings.projectId())
            .build()
            .getService();
        LOGGER.info("Initialized Firestore client for project '{}' (collections '{}', '{}', '{}')",
            firestore.getOptions().getProjectId(), firestoreSettings.categoriesCollection(),
            firestoreSettings.subcategoriesCollection(), firestoreSettings.productsCollection());
        return firestore;
    }

    @Bean
    public CategoryStore categoryStore(ObjectProvider<Firestore> firestore,
        ObjectProvider<FirestoreSettings> firestoreSettings, InventoryPipelineProperties properties) {
        Firestore client = firestore.getIfAvailable();
        if (client != null) {
            FirestoreSettings settings = firestoreSettings.getObject();
            return new FirestoreCategoryStore(client, settings.categoriesCollection(),
                settings.subcategoriesCollection());
        }
        LOGGER.info("Firestore disabled; using in-memory categories {}", properties.getSeedCategories());
        return InMemoryCategoryStore.withDefaultCategories(properties.getSeedCategories());
    }

    @Bean
    public ProductCatalogStore productCatalogStore(ObjectProvider<Firestore> firestore,
        ObjectProvider<FirestoreSettings> firestoreSettings, Clock inventoryClock) {
        Firestore client = firestore.getIfAvailable();
        if (client != null) {
            return new FirestoreProductCatalogStore(client, firestoreSettings.getObject().productsCollection());
        }
        LOGGER.info("Firestore disabled; products are kept in memory");
        return new InMemoryProductCatalogStore(inventoryClock);
    }

    @Bean
    public CallPacer aiCallPacer(InventoryAiProperties properties) {
        return new CallPacer(properties.getMinInterval());
    }

    @Bean
    public ReceiptExtractor receiptExtractor(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper,
        CallPacer aiCallPacer, InventoryAiProperties properties) {
        ChatModel model = properties.isEnabled() ? chatModel.getIfAvailable() : null;
        if (model == null) {
            LOGGER.warn("No chat model available; receipt extraction is disabled");
            return new DisabledReceiptExtractor();
        }
        return new ChatModelReceiptExtractor(model, objectMapper, aiCallPacer);
    }

    @Bean
    public CategorySuggester categorySuggester(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper,
        CallPacer aiCallPacer, InventoryAiProperties properties) {
        ChatModel model = properties.isEnabled() ? chatModel.getIfAvailable() : null;
        if (model == null) {
            LOGGER.warn("No chat model available; products are categorized by keyword rules only");
            return new DisabledCategorySuggester();
        }
        return new ChatModelCategorySuggester(model, objectMapper, aiCallPacer);
    }

    @Bean
    public ReceiptImageValidator receiptImageValidator(InventoryPipelineProperties properties) {
        return new ReceiptImageValidator(properties.getMaxImageBytes());
    }

    @Bean
    public ReceiptScanService receiptScanService(ReceiptImageValidator receiptImageValidator,
        ReceiptExtractor receiptExtractor, ReceiptLineParser receiptLineParser, ConfidenceScorer confidenceScorer) {
        return new ReceiptScanService(receiptImageValidator, receiptExtractor, receiptLineParser, confidenceScorer);
    }

    @Bean
    public CategorizationService categorizationService(CategoryStore categoryStore, CategoryMatcher categoryMatcher,
        CategorySuggester categorySuggester, ConfidenceScorer confidenceScorer,
        InventoryPipelineProperties properties) {
        return new CategorizationService(categoryStore, categoryMatcher, categorySuggester, confidenceScorer,
            properties.getSubcategoryCreationThreshold());
    }

    @Bean
    public DuplicateCheckService duplicateCheckService(ProductCatalogStore productCatalogStore,
        DuplicateDetector duplicateDetector) {
        return new DuplicateCheckService(productCatalogStore, duplicateDetector);
    }

    @Bean(destroyMethod = "close")
    public BulkImportOrchestrator bulkImportOrchestrator(ProductCatalogStore productCatalogStore,
        InventoryPipelineProperties properties) {
        if (properties.getImportParallelism() > 1) {
            LOGGER.info("Bulk imports write up to {} products concurrently", properties.getImportParallelism());
        }
        return BulkImportOrchestrator.withParallelism(productCatalogStore, properties.getImportParallelism());
    }

    @Bean
    public BulkImportService bulkImportService(DuplicateCheckService duplicateCheckService,
        BulkImportOrchestrator bulkImportOrchestrator) {
        return new BulkImportService(duplicateCheckService, bulkImportOrchestrator);
    }

    @Bean
    public BulkProductOperations bulkProductOperations(CategoryStore categoryStore,
        ProductCatalogStore productCatalogStore, Clock inventoryClock) {
        return new BulkProductOperations(categoryStore, productCatalogStore, inventoryClock);
    }
}
