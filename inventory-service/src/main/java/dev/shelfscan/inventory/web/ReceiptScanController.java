package dev.shelfscan.inventory.web;

import dev.shelfscan.inventory.extraction.ReceiptScanResult;
import dev.shelfscan.inventory.extraction.ReceiptScanService;
import dev.shelfscan.receipts.ExtractedCandidate;
import dev.shelfscan.receipts.ReceiptMetadata;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receipt scanning endpoint. Accepts a base64 image or data URL and returns scored product candidates.
 */
@RestController
@RequestMapping(path = "/api/receipts", produces = MediaType.APPLICATION_JSON_VALUE)
public class ReceiptScanController {

    private final ReceiptScanService scanService;

    public ReceiptScanController(ReceiptScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping(path = "/scan", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<ScanData>> scan(@RequestBody ScanRequest request) {
        ReceiptScanResult result = scanService.scan(request == null ? null : request.image());
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.failure(result.error()));
        }
        return ResponseEntity.ok(ApiResponse.ok(new ScanData(result.products(), result.metadata())));
    }

    public record ScanRequest(String image) { }

    public record ScanData(List<ExtractedCandidate> products, ReceiptMetadata metadata) { }
}
