package dev.shelfscan.inventory.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.shelfscan.inventory.CallPacer;
import dev.shelfscan.inventory.ModelResponses;
import dev.shelfscan.receipts.CandidateDraft;
import dev.shelfscan.receipts.ConfidenceHints;
import dev.shelfscan.receipts.ReceiptFormatType;
import dev.shelfscan.receipts.ReceiptMetadata;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.util.StringUtils;

/**
 * Extracts receipt contents by sending the image to a Spring AI {@link ChatModel} and reading back a JSON
 * document with either structured items or plain text lines.
 */
public class ChatModelReceiptExtractor implements ReceiptExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelReceiptExtractor.class);

    private static final int CHUNK_SIZE = 8_000;

    private static final String FORMAT_INSTRUCTIONS = """
        Return a JSON object with the following structure:
        {
          "merchantName": string|null,
          "invoiceNumber": string|null,
          "date": string|null,
          "totalAmount": number|null,
          "items": [
            {
              "name": string,
              "price": number|null,
              "quantity": number|null,
              "unit": string|null,
              "brand": string|null,
              "confidence": {
                "name": number|null,
                "price": number|null,
                "quantity": number|null,
                "brand": number|null,
                "overall": number|null
              }
            }
          ],
          "lines": [string] | null
        }
        Prices are unit prices. Confidence values are between 0 and 1.
        When individual products cannot be identified, leave "items" empty and put every text line of the
        receipt in "lines" in reading order.
        Use null for unknown values and a dot (.) as the decimal separator.
        Do not add code fences or commentary; return only the JSON document.
        """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final CallPacer pacer;

    public ChatModelReceiptExtractor(ChatModel chatModel, ObjectMapper objectMapper, CallPacer pacer) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
    }

    @Override
    public ReceiptExtraction extract(ReceiptImage image) {
        if (image == null || image.bytes() == null || image.bytes().length == 0) {
            throw new ReceiptExtractionException("Cannot extract receipt data from an empty image");
        }

        String encoded = Base64.getEncoder().encodeToString(image.bytes());
        String prompt = buildPrompt(encoded, image.format());
        LOGGER.info("Requesting receipt extraction for {} image ({} bytes, prompt {} characters)",
            image.format(), image.size(), prompt.length());

        String response;
        try {
            pacer.awaitTurn();
            response = chatModel.call(prompt);
        } catch (ReceiptExtractionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            LOGGER.warn("Receipt extraction model call failed: {}", ex.getMessage());
            throw new ReceiptExtractionException("Receipt extraction failed: " + ex.getMessage(), ex);
        }

        if (!StringUtils.hasText(response)) {
            throw new ReceiptExtractionException("Receipt extraction returned an empty response");
        }
        return toExtraction(parse(ModelResponses.stripCodeFences(response)));
    }

    private String buildPrompt(String encodedImage, ImageFormat format) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert system that extracts purchased products from shop receipts.\n");
        prompt.append("The receipt is a ").append(format.mimeType())
            .append(" image provided as base64 data between <receipt> tags.\n");
        prompt.append(FORMAT_INSTRUCTIONS).append('\n');
        prompt.append("<receipt>\n");
        prompt.append(chunk(encodedImage));
        prompt.append("\n</receipt>");
        return prompt.toString();
    }

    private ExtractionResponse parse(String response) {
        try {
            return objectMapper.readValue(response, ExtractionResponse.class);
        } catch (IOException ex) {
            LOGGER.error("Failed to parse extraction response. Payload begins with: {}", ModelResponses.preview(response));
            throw new ReceiptExtractionException(
                "Receipt extraction returned a response that could not be parsed into the expected structure", ex);
        }
    }

    private static ReceiptExtraction toExtraction(ExtractionResponse response) {
        if (response.items() != null && !response.items().isEmpty()) {
            List<CandidateDraft> candidates = new ArrayList<>();
            for (ExtractionItem item : response.items()) {
                if (item == null) {
                    continue;
                }
                ExtractionConfidence confidence = item.confidence();
                candidates.add(CandidateDraft.builder()
                    .name(item.name())
                    .price(item.price())
                    .quantity(item.quantity())
                    .unit(item.unit())
                    .brand(item.brand())
                    .hints(confidence == null ? ConfidenceHints.none() : new ConfidenceHints(confidence.name(),
                        confidence.price(), confidence.quantity(), confidence.brand(), confidence.overall()))
                    .originalText(item.name())
                    .build());
            }
            ReceiptMetadata metadata = new ReceiptMetadata(response.merchantName(), response.invoiceNumber(),
                response.date(), response.totalAmount(), ReceiptFormatType.UNKNOWN);
            return ReceiptExtraction.ofCandidates(candidates, metadata);
        }
        if (response.lines() != null && !response.lines().isEmpty()) {
            return ReceiptExtraction.ofLines(response.lines());
        }
        throw new ReceiptExtractionException("Receipt extraction response contained neither items nor lines");
    }

    private static String chunk(String encoded) {
        if (encoded.length() <= CHUNK_SIZE) {
            return encoded;
        }
        StringBuilder builder = new StringBuilder(encoded.length() + encoded.length() / CHUNK_SIZE + 1);
        for (int index = 0; index < encoded.length(); index += CHUNK_SIZE) {
            builder.append(encoded, index, Math.min(index + CHUNK_SIZE, encoded.length())).append('\n');
        }
        return builder.toString();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractionResponse(
        String merchantName,
        String invoiceNumber,
        String date,
        BigDecimal totalAmount,
        List<ExtractionItem> items,
        List<String> lines
    ) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractionItem(
        String name,
        BigDecimal price,
        BigDecimal quantity,
        String unit,
        String brand,
        ExtractionConfidence confidence
    ) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractionConfidence(Double name, Double price, Double quantity, Double brand, Double overall) { }
}
