package dev.shelfscan.catalog;

public record Category(String id, String name, String slug) {
}
