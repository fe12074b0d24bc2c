package dev.shelfscan.inventory.web;

import dev.shelfscan.catalog.DuplicateVerdict;
import dev.shelfscan.inventory.importer.BulkCopyResult;
import dev.shelfscan.inventory.importer.BulkImportItem;
import dev.shelfscan.inventory.importer.BulkImportResult;
import dev.shelfscan.inventory.importer.BulkImportService;
import dev.shelfscan.inventory.importer.BulkMoveResult;
import dev.shelfscan.inventory.importer.BulkProductOperations;
import dev.shelfscan.inventory.importer.DuplicateCheck;
import dev.shelfscan.inventory.importer.DuplicateCheckService;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Catalog write endpoints: bulk import, bulk move and copy, and duplicate checks.
 */
@RestController
@RequestMapping(path = "/api/products", produces = MediaType.APPLICATION_JSON_VALUE)
public class ProductImportController {

    private final BulkImportService importService;
    private final BulkProductOperations productOperations;
    private final DuplicateCheckService duplicateCheckService;

    public ProductImportController(BulkImportService importService, BulkProductOperations productOperations,
        DuplicateCheckService duplicateCheckService) {
        this.importService = importService;
        this.productOperations = productOperations;
        this.duplicateCheckService = duplicateCheckService;
    }

    @PostMapping(path = "/bulk-import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiResponse<BulkImportResult> bulkImport(@RequestBody BulkImportRequest request) {
        BulkImportRequest body = request == null ? new BulkImportRequest(null, null) : request;
        return ApiResponse.ok(importService.importProducts(body.products(), Boolean.TRUE.equals(body.checkDuplicates())));
    }

    @PostMapping(path = "/bulk-move", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BulkMoveResult bulkMove(@RequestBody BulkTransferRequest request) {
        BulkTransferRequest body = request == null ? BulkTransferRequest.EMPTY : request;
        return productOperations.move(body.productIds(), body.category(), body.subcategory());
    }

    @PostMapping(path = "/bulk-copy", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BulkCopyResult bulkCopy(@RequestBody BulkTransferRequest request) {
        BulkTransferRequest body = request == null ? BulkTransferRequest.EMPTY : request;
        return productOperations.copy(body.productIds(), body.category(), body.subcategory());
    }

    @PostMapping(path = "/check-duplicate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiResponse<DuplicateVerdict> checkDuplicate(@RequestBody DuplicateCheckRequest request) {
        DuplicateCheckRequest body = request == null ? new DuplicateCheckRequest(null, null) : request;
        return ApiResponse.ok(duplicateCheckService.check(body.sellerId(), body.name()));
    }

    @PostMapping(path = "/check-duplicates", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiResponse<List<DuplicateCheck>> checkDuplicates(@RequestBody DuplicateBatchCheckRequest request) {
        DuplicateBatchCheckRequest body = request == null ? new DuplicateBatchCheckRequest(null, null) : request;
        return ApiResponse.ok(duplicateCheckService.checkAll(body.sellerId(), body.names()));
    }

    public record BulkImportRequest(List<BulkImportItem> products, Boolean checkDuplicates) { }

    public record BulkTransferRequest(List<String> productIds, String category, String subcategory) {

        static final BulkTransferRequest EMPTY = new BulkTransferRequest(null, null, null);
    }

    public record DuplicateCheckRequest(String sellerId, String name) { }

    public record DuplicateBatchCheckRequest(String sellerId, List<String> names) { }
}
