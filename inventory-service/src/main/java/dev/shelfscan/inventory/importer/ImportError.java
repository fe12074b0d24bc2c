package dev.shelfscan.inventory.importer;

public record ImportError(String product, String error) {
}
