package dev.shelfscan.catalog;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Slug and key helpers for subcategory names.
 */
public final class SubcategorySlugs {

    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SubcategorySlugs() {
    }

    public static String slugify(String name) {
        if (name == null) {
            return "";
        }
        String lower = name.trim().toLowerCase(Locale.ROOT).replace("&", " and ");
        String slug = NON_SLUG.matcher(lower).replaceAll("-");
        return EDGE_DASHES.matcher(slug).replaceAll("");
    }

    /**
     * Returns {@code slugify(name)} or, when taken, the first free {@code slug-1}, {@code slug-2}, ...
     */
    public static String uniqueSlug(String name, Collection<String> takenSlugs) {
        String base = slugify(name);
        if (!takenSlugs.contains(base)) {
            return base;
        }
        int counter = 1;
        while (takenSlugs.contains(base + "-" + counter)) {
            counter++;
        }
        return base + "-" + counter;
    }

    /**
     * Key used to recognise the same subcategory name regardless of case and spacing.
     */
    public static String normalizedName(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
