package fr.lapetina.advisor.llm.catalog;

import fr.lapetina.advisor.llm.domain.model.ChatMessage;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NarrationPromptsTest {

    @Test
    @DisplayName("should build a stock analysis with the analyst system prompt")
    void shouldBuildStockAnalysis() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("symbol", "AAPL");
        data.put("pe_ratio", 28.4);
        data.put("as_of", LocalDate.of(2024, 5, 17));

        GenerationRequest request = new NarrationPrompts(0.2).analyzeStock(data);

        assertThat(request.temperature()).isEqualTo(0.2);
        assertThat(request.messages()).hasSize(2);
        assertThat(request.messages().get(0)).isEqualTo(ChatMessage.system(NarrationPrompts.STOCK_SYSTEM_PROMPT));
        ChatMessage user = request.messages().get(1);
        assertThat(user.role()).isEqualTo(ChatMessage.USER);
        assertThat(user.content())
                .startsWith("Analyze the following stock data")
                .contains("\"symbol\" : \"AAPL\"")
                .contains("\"as_of\" : \"2024-05-17\"");
    }

    @Test
    @DisplayName("should build a portfolio summary with the asset management system prompt")
    void shouldBuildPortfolioSummary() {
        GenerationRequest request = new NarrationPrompts().summarizePortfolio(
                Map.of("holdings", List.of(Map.of("symbol", "MSFT", "weight", 0.4))));

        assertThat(request.temperature()).isEqualTo(GenerationRequest.DEFAULT_TEMPERATURE);
        assertThat(request.messages().get(0).content()).isEqualTo(NarrationPrompts.PORTFOLIO_SYSTEM_PROMPT);
        assertThat(request.messages().get(1).content())
                .contains("risk assessment")
                .contains("\"MSFT\"");
    }

    @Test
    @DisplayName("should ask for the three stock headings")
    void shouldListStockHeadings() {
        assertThat(NarrationPrompts.STOCK_SYSTEM_PROMPT)
                .contains("### Investment summary", "### Risk factors", "### Points to watch");
    }
}
