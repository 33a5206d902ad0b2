package fr.lapetina.advisor.llm.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * A conversation to be completed by the loaded model.
 * Immutable and thread-safe once built.
 *
 * @param requestId    identifier used in logs and events
 * @param messages     ordered role/content turns, never empty
 * @param temperature  sampling temperature; 0 selects greedy decoding
 * @param maxNewTokens optional cap on produced tokens, 0 means the engine default
 * @param seed         optional sampling seed, {@code null} for a random seed
 */
public record GenerationRequest(
        String requestId,
        List<ChatMessage> messages,
        double temperature,
        int maxNewTokens,
        Long seed
) {
    public static final double DEFAULT_TEMPERATURE = 0.3;

    public GenerationRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        if (temperature < 0 || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("Temperature must be >= 0: " + temperature);
        }
        if (maxNewTokens < 0) {
            throw new IllegalArgumentException("maxNewTokens must be >= 0: " + maxNewTokens);
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        messages = List.copyOf(messages);
    }

    public boolean isGreedy() {
        return temperature == 0.0;
    }

    public OptionalInt maxNewTokensOverride() {
        return maxNewTokens > 0 ? OptionalInt.of(maxNewTokens) : OptionalInt.empty();
    }

    public OptionalLong seedOverride() {
        return seed != null ? OptionalLong.of(seed) : OptionalLong.empty();
    }

    /**
     * Single-turn request with an optional system prompt.
     */
    public static GenerationRequest ofPrompt(String system, String prompt, double temperature) {
        return ofChat(system, List.of(ChatMessage.user(prompt)), temperature);
    }

    public static GenerationRequest ofPrompt(String prompt) {
        return ofPrompt(null, prompt, DEFAULT_TEMPERATURE);
    }

    /**
     * Multi-turn request; the system prompt, if any, is prepended to the turns.
     */
    public static GenerationRequest ofChat(String system, List<ChatMessage> turns, double temperature) {
        return builder()
                .system(system)
                .messages(turns)
                .temperature(temperature)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String system;
        private final List<ChatMessage> messages = new ArrayList<>();
        private double temperature = DEFAULT_TEMPERATURE;
        private int maxNewTokens;
        private Long seed;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder system(String system) {
            this.system = system;
            return this;
        }

        public Builder message(ChatMessage message) {
            this.messages.add(Objects.requireNonNull(message));
            return this;
        }

        public Builder user(String content) {
            return message(ChatMessage.user(content));
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages.addAll(messages);
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxNewTokens(int maxNewTokens) {
            this.maxNewTokens = maxNewTokens;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public GenerationRequest build() {
            List<ChatMessage> all = new ArrayList<>(messages.size() + 1);
            if (system != null && !system.isBlank()) {
                all.add(ChatMessage.system(system));
            }
            all.addAll(messages);
            return new GenerationRequest(requestId, all, temperature, maxNewTokens, seed);
        }
    }
}
