package dev.shelfscan.inventory.importer;

public record FailedProduct(String id, String error) {
}
