package dev.shelfscan.inventory.importer;

import dev.shelfscan.catalog.DuplicateVerdict;

public record DuplicateCheck(String name, DuplicateVerdict verdict) {
}
