package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ChatMessage;

import java.util.List;

/**
 * Renders a conversation into the prompt text a model was trained on.
 */
@FunctionalInterface
public interface ChatTemplate {

    /**
     * @param messages            ordered conversation turns
     * @param addGenerationPrompt append the header that opens the assistant turn
     */
    String render(List<ChatMessage> messages, boolean addGenerationPrompt);

    /**
     * Chat Markup Language template used by the Qwen family:
     * <pre>
     * &lt;|im_start|&gt;user
     * Hello&lt;|im_end|&gt;
     * &lt;|im_start|&gt;assistant
     * </pre>
     */
    ChatTemplate CHATML = (messages, addGenerationPrompt) -> {
        StringBuilder sb = new StringBuilder();
        for (ChatMessage message : messages) {
            sb.append("<|im_start|>").append(message.role()).append('\n')
                    .append(message.content())
                    .append("<|im_end|>\n");
        }
        if (addGenerationPrompt) {
            sb.append("<|im_start|>").append(ChatMessage.ASSISTANT).append('\n');
        }
        return sb.toString();
    };
}
