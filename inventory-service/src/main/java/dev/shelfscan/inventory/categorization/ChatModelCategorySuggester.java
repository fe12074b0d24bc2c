package dev.shelfscan.inventory.categorization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.inventory.CallPacer;
import dev.shelfscan.inventory.ModelResponses;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.util.StringUtils;

/**
 * Asks a Spring AI {@link ChatModel} to place products into the known categories. Calls are spaced by the
 * configured {@link CallPacer}.
 */
public class ChatModelCategorySuggester implements CategorySuggester {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelCategorySuggester.class);

    private static final TypeReference<List<ProductSuggestions>> RESPONSE_TYPE = new TypeReference<>() { };

    private static final String FORMAT_INSTRUCTIONS = """
        Return a JSON array with one element per product:
        [
          {
            "index": number,
            "suggestions": [
              {
                "category": string,
                "confidence": number,
                "subcategory": string|null,
                "subcategoryConfidence": number|null
              }
            ]
          }
        ]
        "index" is the product number from the list above. Give at most three suggestions per product,
        best first. "category" must be one of the listed categories. Prefer a listed subcategory of that
        category; otherwise propose a short new subcategory name. Confidence values are between 0 and 1.
        Do not add code fences or commentary; return only the JSON document.
        """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final CallPacer pacer;

    public ChatModelCategorySuggester(ChatModel chatModel, ObjectMapper objectMapper, CallPacer pacer) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
    }

    @Override
    public List<List<AiCategorySuggestion>> suggestBatch(List<ProductInput> products, List<Category> categories,
        List<Subcategory> subcategories) {

        LOGGER.info("Requesting AI categorization for {} products", products.size());
        List<ProductSuggestions> response = request(buildPrompt(products, categories, subcategories));

        Map<Integer, List<AiCategorySuggestion>> byIndex = response.stream()
            .filter(Objects::nonNull)
            .filter(entry -> entry.index() != null)
            .collect(Collectors.toMap(ProductSuggestions::index, ChatModelCategorySuggester::toSuggestions,
                (first, second) -> first));

        List<List<AiCategorySuggestion>> result = new ArrayList<>(products.size());
        for (int i = 0; i < products.size(); i++) {
            result.add(byIndex.getOrDefault(i, List.of()));
        }
        return result;
    }

    @Override
    public List<AiCategorySuggestion> suggest(ProductInput product, List<Category> categories,
        List<Subcategory> subcategories) {
        return suggestBatch(List.of(product), categories, subcategories).get(0);
    }

    private List<ProductSuggestions> request(String prompt) {
        String response;
        try {
            pacer.awaitTurn();
            response = chatModel.call(prompt);
        } catch (RuntimeException ex) {
            throw new CategorizationException("AI categorization failed: " + ex.getMessage(), ex);
        }
        if (!StringUtils.hasText(response)) {
            throw new CategorizationException("AI categorization returned an empty response");
        }

        String sanitised = ModelResponses.stripCodeFences(response);
        try {
            List<ProductSuggestions> parsed = objectMapper.readValue(sanitised, RESPONSE_TYPE);
            if (parsed == null) {
                throw new CategorizationException("AI categorization returned no suggestions");
            }
            return parsed;
        } catch (IOException ex) {
            LOGGER.error("Failed to parse categorization response. Payload begins with: {}",
                ModelResponses.preview(sanitised));
            throw new CategorizationException("AI categorization returned a response that could not be parsed", ex);
        }
    }

    static String buildPrompt(List<ProductInput> products, List<Category> categories,
        List<Subcategory> subcategories) {

        StringBuilder prompt = new StringBuilder();
        prompt.append("You categorize retail products into an existing two-level catalog.\n");
        prompt.append("Categories and their subcategories:\n");
        for (Category category : categories) {
            prompt.append("- ").append(category.name());
            List<String> names = subcategories.stream()
                .filter(subcategory -> category.id().equals(subcategory.categoryId()))
                .map(Subcategory::name)
                .toList();
            if (!names.isEmpty()) {
                prompt.append(": ").append(String.join(", ", names));
            }
            prompt.append('\n');
        }
        prompt.append("Products:\n");
        for (int i = 0; i < products.size(); i++) {
            ProductInput product = products.get(i);
            prompt.append(i).append(". ").append(product.name());
            if (StringUtils.hasText(product.brand())) {
                prompt.append(" (brand: ").append(product.brand()).append(')');
            }
            prompt.append('\n');
        }
        prompt.append(FORMAT_INSTRUCTIONS);
        return prompt.toString();
    }

    private static List<AiCategorySuggestion> toSuggestions(ProductSuggestions entry) {
        if (entry.suggestions() == null) {
            return List.of();
        }
        return entry.suggestions().stream()
            .filter(Objects::nonNull)
            .filter(suggestion -> StringUtils.hasText(suggestion.category()))
            .map(suggestion -> new AiCategorySuggestion(
                suggestion.category(),
                suggestion.confidence() == null ? 0.0 : suggestion.confidence(),
                suggestion.subcategory(),
                suggestion.subcategoryConfidence()))
            .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProductSuggestions(Integer index, List<SuggestionEntry> suggestions) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SuggestionEntry(String category, Double confidence, String subcategory, Double subcategoryConfidence) { }
}
