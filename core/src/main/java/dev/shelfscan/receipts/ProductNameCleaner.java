package dev.shelfscan.receipts;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Tidies product name fragments taken from receipt lines: drops item codes and size suffixes, strips
 * stray symbols and title-cases shouted words.
 */
public class ProductNameCleaner {

    private static final Pattern LEADING_CODE = Pattern.compile(
        "^(?:#?\\d{1,6}[.):]\\s*(?=\\p{L})|\\d{3,}\\s+|[A-Z]{1,4}-?\\d{3,}\\s+)");
    private static final Pattern TRAILING_SIZE = Pattern.compile(
        "\\s+(?:\\d+(?:\\.\\d+)?\\s*(?:g|gm|gms|kg|mg|ml|l|ltr|pc|pcs|pack|nos)|x\\s?\\d+|\\d+\\s?x)$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}\\s&'\\-.]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s\\-.']+|[\\s\\-.']+$");

    public String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String value = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        value = LEADING_CODE.matcher(value).replaceFirst("");

        String previous;
        do {
            previous = value;
            value = TRAILING_SIZE.matcher(value).replaceFirst("");
        } while (!value.equals(previous) && !value.isEmpty());

        value = DISALLOWED.matcher(value).replaceAll(" ");
        value = WHITESPACE.matcher(value).replaceAll(" ");
        value = EDGE_PUNCTUATION.matcher(value).replaceAll("");
        return titleCaseShouting(value);
    }

    private static String titleCaseShouting(String value) {
        if (value.isEmpty()) {
            return value;
        }
        String[] words = value.split(" ");
        StringBuilder builder = new StringBuilder(value.length());
        for (String word : words) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(isShouting(word) ? capitalize(word) : word);
        }
        return builder.toString();
    }

    private static boolean isShouting(String word) {
        int letters = 0;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c)) {
                if (!Character.isUpperCase(c)) {
                    return false;
                }
                letters++;
            }
        }
        return letters > 3;
    }

    private static String capitalize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
