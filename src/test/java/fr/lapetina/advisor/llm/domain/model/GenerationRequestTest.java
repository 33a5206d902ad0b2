package fr.lapetina.advisor.llm.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationRequestTest {

    @Test
    @DisplayName("should prepend the system prompt to the turns")
    void shouldPrependSystemPrompt() {
        GenerationRequest request = GenerationRequest.ofChat("Be brief.",
                List.of(ChatMessage.user("Hi"), ChatMessage.assistant("Hello"), ChatMessage.user("AAPL?")), 0.0);

        assertThat(request.messages()).containsExactly(
                ChatMessage.system("Be brief."),
                ChatMessage.user("Hi"),
                ChatMessage.assistant("Hello"),
                ChatMessage.user("AAPL?"));
        assertThat(request.isGreedy()).isTrue();
    }

    @Test
    @DisplayName("should skip a blank system prompt")
    void shouldSkipBlankSystemPrompt() {
        GenerationRequest request = GenerationRequest.ofPrompt("  ", "AAPL?", 0.7);

        assertThat(request.messages()).containsExactly(ChatMessage.user("AAPL?"));
        assertThat(request.isGreedy()).isFalse();
    }

    @Test
    @DisplayName("should default the temperature, request id and overrides")
    void shouldApplyDefaults() {
        GenerationRequest request = GenerationRequest.ofPrompt("AAPL?");

        assertThat(request.temperature()).isEqualTo(GenerationRequest.DEFAULT_TEMPERATURE);
        assertThat(request.requestId()).isNotBlank();
        assertThat(request.maxNewTokensOverride()).isEmpty();
        assertThat(request.seedOverride()).isEmpty();
    }

    @Test
    @DisplayName("should expose explicit overrides")
    void shouldExposeOverrides() {
        GenerationRequest request = GenerationRequest.builder()
                .requestId("req-1")
                .user("AAPL?")
                .maxNewTokens(12)
                .seed(42L)
                .build();

        assertThat(request.requestId()).isEqualTo("req-1");
        assertThat(request.maxNewTokensOverride()).hasValue(12);
        assertThat(request.seedOverride()).hasValue(42L);
    }

    @Test
    @DisplayName("should reject invalid requests")
    void shouldRejectInvalid() {
        assertThatThrownBy(() -> GenerationRequest.builder().build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationRequest.builder().user("x").temperature(-0.1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationRequest.builder().user("x").temperature(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationRequest.builder().user("x").maxNewTokens(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should not be affected by later changes to the source list")
    void shouldCopyMessages() {
        List<ChatMessage> turns = new java.util.ArrayList<>(List.of(ChatMessage.user("AAPL?")));
        GenerationRequest request = GenerationRequest.ofChat(null, turns, 0.0);
        turns.add(ChatMessage.user("MSFT?"));

        assertThat(request.messages()).hasSize(1);
    }
}
