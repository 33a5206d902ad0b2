package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ErrorType;

/**
 * Outcome of a blocking generation.
 *
 * @param text       trimmed output, empty on failure
 * @param tokenCount number of tokens produced
 * @param error      failure classification, {@code null} on success
 */
public record Completion(String text, int tokenCount, ErrorType error) {

    public Completion {
        text = text != null ? text : "";
    }

    public static Completion success(String text, int tokenCount) {
        return new Completion(text, tokenCount, null);
    }

    public static Completion failure(ErrorType error) {
        return new Completion("", 0, error);
    }

    public boolean failed() {
        return error != null;
    }
}
