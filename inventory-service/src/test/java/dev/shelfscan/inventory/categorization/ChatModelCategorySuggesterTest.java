package dev.shelfscan.inventory.categorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.inventory.CallPacer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.model.ChatModel;

@ExtendWith(MockitoExtension.class)
class ChatModelCategorySuggesterTest {

    private static final List<Category> CATEGORIES = List.of(
        new Category("food", "Food", "food"),
        new Category("beverages", "Beverages", "beverages"));
    private static final List<Subcategory> SUBCATEGORIES = List.of(
        new Subcategory("hot", "beverages", "Hot Beverages", "hot-beverages"));

    @Mock
    private ChatModel chatModel;

    private ChatModelCategorySuggester suggester;

    @BeforeEach
    void setUp() {
        suggester = new ChatModelCategorySuggester(chatModel, new ObjectMapper(), CallPacer.unpaced());
    }

    @Test
    void mapsSuggestionsBackToProductPositions() {
        when(chatModel.call(anyString())).thenReturn("""
            ```json
            [
              {"index": 1, "suggestions": [{"category": "Beverages", "confidence": 0.9,
                "subcategory": "Hot Beverages", "subcategoryConfidence": 0.8, "reason": "tea"}]},
              {"index": 7, "suggestions": [{"category": "Food", "confidence": 0.5}]}
            ]
            ```
            """);

        List<List<AiCategorySuggestion>> result = suggester.suggestBatch(
            List.of(ProductInput.named("Mystery Item"), ProductInput.named("Assam Leaf")), CATEGORIES, SUBCATEGORIES);

        assertThat(result).hasSize(2);
        assertThat(result.get(0)).isEmpty();
        assertThat(result.get(1)).containsExactly(new AiCategorySuggestion("Beverages", 0.9, "Hot Beverages", 0.8));
    }

    @Test
    void wrapsModelFailures() {
        when(chatModel.call(anyString())).thenThrow(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> suggester.suggest(ProductInput.named("Tea"), CATEGORIES, SUBCATEGORIES))
            .isInstanceOf(CategorizationException.class)
            .hasMessage("AI categorization failed: quota exceeded");
    }

    @Test
    void rejectsUnparseableResponses() {
        when(chatModel.call(anyString())).thenReturn("I am not sure about these products.");

        assertThatThrownBy(() -> suggester.suggest(ProductInput.named("Tea"), CATEGORIES, SUBCATEGORIES))
            .isInstanceOf(CategorizationException.class)
            .hasMessage("AI categorization returned a response that could not be parsed");
    }

    @Test
    void promptListsCategoriesAndNumberedProducts() {
        String prompt = ChatModelCategorySuggester.buildPrompt(
            List.of(ProductInput.named("Assam Leaf"),
                new ProductInput("Instant Mix", null, null, null, "Bru", null)),
            CATEGORIES, SUBCATEGORIES);

        assertThat(prompt)
            .contains("- Food\n")
            .contains("- Beverages: Hot Beverages\n")
            .contains("0. Assam Leaf\n")
            .contains("1. Instant Mix (brand: Bru)\n");
    }
}
