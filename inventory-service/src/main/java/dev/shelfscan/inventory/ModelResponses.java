package dev.shelfscan.inventory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for cleaning up free-form chat model output before JSON parsing.
 */
public final class ModelResponses {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelResponses.class);
    private static final int PREVIEW_LENGTH = 256;

    private ModelResponses() {
    }

    /**
     * Removes Markdown code fences (with or without a language tag) and surrounding single backticks.
     */
    public static String stripCodeFences(String response) {
        if (response == null) {
            return "";
        }
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                LOGGER.debug("Model response declared fenced language '{}'", trimmed.substring(3, firstBreak).trim());
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    public static String preview(String response) {
        if (response == null) {
            return "<null>";
        }
        return response.substring(0, Math.min(response.length(), PREVIEW_LENGTH));
    }
}
