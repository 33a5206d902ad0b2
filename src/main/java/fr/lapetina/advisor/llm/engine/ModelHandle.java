package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ModelId;

/**
 * In-memory representation of one loaded model: tokenizer, weights and
 * their placement on a compute device.
 *
 * Handles are exclusively owned by the lifecycle manager and are only used
 * while a generation holds a lease on them. {@link #close()} releases the
 * weights and any device memory; a closed handle must reject further use.
 */
public interface ModelHandle extends AutoCloseable {

    ModelId modelId();

    /**
     * Template turning a conversation into the model's expected input text.
     */
    ChatTemplate chatTemplate();

    int[] encode(String text);

    /**
     * Decodes the first {@code length} tokens, skipping special tokens.
     */
    String decode(int[] tokens, int length);

    /**
     * Runs inference from the given prompt, passing every produced token to
     * the sink until end-of-sequence, the token budget, or the sink returning
     * {@code false}.
     *
     * @throws InferenceException on engine fault, including use after close
     */
    void generate(int[] promptTokens, SamplingParams params, TokenSink sink);

    /**
     * Approximate memory held by the weights, in bytes.
     */
    long memoryFootprintBytes();

    /**
     * Releases the weights. Idempotent.
     */
    @Override
    void close();

    /**
     * Receives produced tokens one at a time.
     */
    @FunctionalInterface
    interface TokenSink {
        /**
         * @return {@code false} to stop generation
         */
        boolean accept(int token);
    }
}
