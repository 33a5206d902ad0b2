package fr.lapetina.advisor.llm.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;

import java.util.Map;

/**
 * Builds the dashboard's narration requests: a fixed system prompt plus the
 * caller's data pretty-printed as JSON.
 */
public final class NarrationPrompts {

    public static final String STOCK_SYSTEM_PROMPT = """
            You are an equity research analyst.
            Using only the financial data provided, write a summary that helps an investor reach a decision.

            Output format (start each of these three headings with ###):
            ### Investment summary
            ### Risk factors
            ### Points to watch

            Rules:
            - Base the analysis only on the data provided
            - State that this is information, not investment advice
            - Balance positive and negative aspects
            - Add a short explanation whenever you use a technical term""";

    public static final String PORTFOLIO_SYSTEM_PROMPT = """
            You are an asset management specialist.
            Using the portfolio data provided, write a summary focused on risk and diversification.
            State that this is information, not investment advice.""";

    private final ObjectMapper objectMapper;
    private final double temperature;

    public NarrationPrompts(double temperature) {
        this.temperature = temperature;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public NarrationPrompts() {
        this(GenerationRequest.DEFAULT_TEMPERATURE);
    }

    public GenerationRequest analyzeStock(Map<String, ?> stockData) {
        String prompt = "Analyze the following stock data and write a summary for investors:\n\n"
                + toJson(stockData);
        return GenerationRequest.ofPrompt(STOCK_SYSTEM_PROMPT, prompt, temperature);
    }

    public GenerationRequest summarizePortfolio(Map<String, ?> portfolioData) {
        String prompt = "Analyze the following portfolio data and write a risk assessment with suggestions for improvement:\n\n"
                + toJson(portfolioData);
        return GenerationRequest.ofPrompt(PORTFOLIO_SYSTEM_PROMPT, prompt, temperature);
    }

    private String toJson(Map<String, ?> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Narration data is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
