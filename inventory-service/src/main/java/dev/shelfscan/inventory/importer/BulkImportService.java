package dev.shelfscan.inventory.importer;

import dev.shelfscan.inventory.InputValidationException;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for bulk imports: optionally runs the duplicate check for items that arrive without a
 * verdict, then hands the batch to the {@link BulkImportOrchestrator}.
 */
public class BulkImportService {

    private final DuplicateCheckService duplicateCheckService;
    private final BulkImportOrchestrator orchestrator;

    public BulkImportService(DuplicateCheckService duplicateCheckService, BulkImportOrchestrator orchestrator) {
        this.duplicateCheckService = Objects.requireNonNull(duplicateCheckService, "duplicateCheckService");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    public BulkImportResult importProducts(List<BulkImportItem> items, boolean checkDuplicates) {
        if (items == null) {
            throw new InputValidationException("Products array is required");
        }
        if (items.isEmpty()) {
            throw new InputValidationException("At least one product is required");
        }
        List<BulkImportItem> prepared = checkDuplicates ? duplicateCheckService.annotate(items) : items;
        return orchestrator.importAll(prepared);
    }
}
