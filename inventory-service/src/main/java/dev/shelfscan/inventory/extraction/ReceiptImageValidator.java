package dev.shelfscan.inventory.extraction;

import dev.shelfscan.inventory.InputValidationException;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Decodes base64 or data URL image payloads and rejects anything that is not a JPEG, PNG or WebP image
 * within the configured size limit.
 */
public class ReceiptImageValidator {

    private static final Pattern DATA_URL = Pattern.compile("^data:(?<type>[^;,]*)(?<params>(?:;[^,]*)?),(?<data>.*)$",
        Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final long maxBytes;

    public ReceiptImageValidator(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.maxBytes = maxBytes;
    }

    public ReceiptImage decode(String payload) {
        if (!StringUtils.hasText(payload)) {
            throw new InputValidationException("Image data is required");
        }

        String encoded = payload.trim();
        if (encoded.startsWith("data:")) {
            Matcher matcher = DATA_URL.matcher(encoded);
            if (!matcher.matches() || !matcher.group("params").contains(";base64")) {
                throw new InputValidationException("Invalid image data format");
            }
            encoded = matcher.group("data");
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(WHITESPACE.matcher(encoded).replaceAll(""));
        } catch (IllegalArgumentException ex) {
            throw new InputValidationException("Invalid image data format");
        }

        if (bytes.length == 0) {
            throw new InputValidationException("Empty image data");
        }
        if (bytes.length > maxBytes) {
            throw new InputValidationException(
                "Image size exceeds maximum allowed (" + (maxBytes / (1024 * 1024)) + "MB)");
        }

        ImageFormat format = ImageFormat.detect(bytes)
            .orElseThrow(() -> new InputValidationException("Invalid image format. Supported formats: JPEG, PNG, WebP"));
        return new ReceiptImage(bytes, format);
    }
}
