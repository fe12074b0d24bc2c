package dev.shelfscan.inventory.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.shelfscan.inventory.CallPacer;
import dev.shelfscan.receipts.CandidateDraft;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.model.ChatModel;

@ExtendWith(MockitoExtension.class)
class ChatModelReceiptExtractorTest {

    private static final ReceiptImage IMAGE = new ReceiptImage(ReceiptImageValidatorTest.PNG_HEADER, ImageFormat.PNG);

    @Mock
    private ChatModel chatModel;

    private ChatModelReceiptExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ChatModelReceiptExtractor(chatModel, new ObjectMapper(), CallPacer.unpaced());
    }

    @Test
    void readsStructuredItemsFromFencedResponse() {
        when(chatModel.call(anyString())).thenReturn("""
            ```json
            {
              "merchantName": "Fresh Mart",
              "invoiceNumber": "INV-42",
              "date": "2024-03-12",
              "totalAmount": 120.50,
              "currency": "INR",
              "items": [
                {"name": "Amul Butter", "price": 56.00, "quantity": 2, "unit": "pcs", "brand": "Amul",
                 "confidence": {"name": 0.95, "price": 0.9, "overall": 0.92}}
              ]
            }
            ```
            """);

        ReceiptExtraction extraction = extractor.extract(IMAGE);

        assertThat(extraction.hasLines()).isFalse();
        assertThat(extraction.metadata().merchantName()).isEqualTo("Fresh Mart");
        assertThat(extraction.metadata().invoiceNumber()).isEqualTo("INV-42");
        assertThat(extraction.metadata().totalAmount()).isEqualByComparingTo("120.50");
        CandidateDraft butter = extraction.candidates().get(0);
        assertThat(butter.name()).isEqualTo("Amul Butter");
        assertThat(butter.quantity()).isEqualByComparingTo("2");
        assertThat(butter.hints().name()).isEqualTo(0.95);
        assertThat(butter.hints().quantity()).isNull();
        assertThat(butter.hints().overall()).isEqualTo(0.92);
    }

    @Test
    void fallsBackToTextLines() {
        when(chatModel.call(anyString())).thenReturn("{\"items\": [], \"lines\": [\"Fresh Mart\", \"Tea 20.00\"]}");

        ReceiptExtraction extraction = extractor.extract(IMAGE);

        assertThat(extraction.hasLines()).isTrue();
        assertThat(extraction.lines()).containsExactly("Fresh Mart", "Tea 20.00");
    }

    @Test
    void embedsImageInPrompt() {
        when(chatModel.call(anyString())).thenReturn("{\"lines\": [\"Tea 20.00\"]}");

        extractor.extract(IMAGE);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).call(prompt.capture());
        assertThat(prompt.getValue())
            .contains("image/png")
            .contains(Base64.getEncoder().encodeToString(ReceiptImageValidatorTest.PNG_HEADER));
    }

    @Test
    void failsOnResponsesWithoutContent() {
        when(chatModel.call(anyString())).thenReturn("{\"items\": []}");

        assertThatThrownBy(() -> extractor.extract(IMAGE))
            .isInstanceOf(ReceiptExtractionException.class)
            .hasMessage("Receipt extraction response contained neither items nor lines");
    }

    @Test
    void failsOnUnparseableResponses() {
        when(chatModel.call(anyString())).thenReturn("Sorry, I cannot read this receipt.");

        assertThatThrownBy(() -> extractor.extract(IMAGE))
            .isInstanceOf(ReceiptExtractionException.class)
            .hasMessageContaining("could not be parsed");
    }

    @Test
    void wrapsModelErrors() {
        when(chatModel.call(anyString())).thenThrow(new IllegalStateException("503 Service Unavailable"));

        assertThatThrownBy(() -> extractor.extract(IMAGE))
            .isInstanceOf(ReceiptExtractionException.class)
            .hasMessage("Receipt extraction failed: 503 Service Unavailable");
    }
}
