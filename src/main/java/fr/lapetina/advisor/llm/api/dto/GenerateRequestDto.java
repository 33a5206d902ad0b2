package fr.lapetina.advisor.llm.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.advisor.llm.domain.model.ChatMessage;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;

import java.util.List;

/**
 * Body of {@code POST /generate} and {@code POST /generate/stream}.
 * Either {@code prompt} or {@code messages} must be present; when both are,
 * the prompt is appended as a final user turn.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerateRequestDto {

    private String system;
    private String prompt;
    private List<Message> messages;
    private Double temperature;
    private Long seed;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("request_id")
    private String requestId;

    public String getSystem() { return system; }
    public void setSystem(String system) { this.system = system; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public List<Message> getMessages() { return messages; }
    public void setMessages(List<Message> messages) { this.messages = messages; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    /**
     * Converts to a domain request.
     *
     * @throws IllegalArgumentException if the body has no content or invalid parameters
     */
    public GenerationRequest toGenerationRequest(String fallbackRequestId, double defaultTemperature) {
        boolean hasPrompt = prompt != null && !prompt.isBlank();
        if (!hasPrompt && (messages == null || messages.isEmpty())) {
            throw new IllegalArgumentException("Either 'prompt' or 'messages' is required");
        }
        GenerationRequest.Builder builder = GenerationRequest.builder()
                .requestId(requestId != null ? requestId : fallbackRequestId)
                .system(system)
                .temperature(temperature != null ? temperature : defaultTemperature)
                .maxNewTokens(maxTokens != null ? maxTokens : 0)
                .seed(seed);
        if (messages != null) {
            for (Message m : messages) {
                if (m.getRole() == null || m.getContent() == null) {
                    throw new IllegalArgumentException("Messages need a role and a content");
                }
                builder.message(new ChatMessage(m.getRole(), m.getContent()));
            }
        }
        if (hasPrompt) {
            builder.user(prompt);
        }
        return builder.build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }
}
