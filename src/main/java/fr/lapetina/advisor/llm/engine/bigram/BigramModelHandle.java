package fr.lapetina.advisor.llm.engine.bigram;

import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.engine.ChatTemplate;
import fr.lapetina.advisor.llm.engine.InferenceException;
import fr.lapetina.advisor.llm.engine.ModelHandle;
import fr.lapetina.advisor.llm.engine.SamplingParams;
import fr.lapetina.advisor.llm.engine.sampler.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Handle over a bigram language model: the next token depends only on the
 * previous one. Generation starts from the last prompt token.
 *
 * Weights are read-only, so the handle itself is safe for concurrent reads;
 * exclusion is still enforced by the lifecycle manager.
 */
public final class BigramModelHandle implements ModelHandle {

    private static final Logger log = LoggerFactory.getLogger(BigramModelHandle.class);

    private final ModelId modelId;
    private final Vocabulary vocabulary;
    private final BigramWeights weights;
    private final ChatTemplate chatTemplate;
    private volatile boolean closed;

    public BigramModelHandle(ModelId modelId, Vocabulary vocabulary, BigramWeights weights, ChatTemplate chatTemplate) {
        this.modelId = Objects.requireNonNull(modelId, "Model id is required");
        this.vocabulary = Objects.requireNonNull(vocabulary, "Vocabulary is required");
        this.weights = Objects.requireNonNull(weights, "Weights are required");
        this.chatTemplate = Objects.requireNonNull(chatTemplate, "Chat template is required");
        if (weights.rows() != vocabulary.size()) {
            throw new IllegalArgumentException("Weights cover " + weights.rows()
                    + " tokens but the vocabulary has " + vocabulary.size());
        }
    }

    @Override
    public ModelId modelId() {
        return modelId;
    }

    @Override
    public ChatTemplate chatTemplate() {
        return chatTemplate;
    }

    @Override
    public int[] encode(String text) {
        ensureOpen();
        return vocabulary.encode(text);
    }

    @Override
    public String decode(int[] tokens, int length) {
        ensureOpen();
        return vocabulary.decode(tokens, length);
    }

    @Override
    public void generate(int[] promptTokens, SamplingParams params, TokenSink sink) {
        ensureOpen();
        if (promptTokens.length == 0) {
            return;
        }
        Sampler sampler = params.newSampler();
        int current = promptTokens[promptTokens.length - 1];
        for (int produced = 0; produced < params.maxNewTokens(); produced++) {
            ensureOpen();
            int[] candidates = weights.successors(current);
            if (candidates.length == 0) {
                return;
            }
            int next = candidates[sampler.sample(weights.logits(current))];
            if (vocabulary.isStop(next) || !sink.accept(next)) {
                return;
            }
            current = next;
        }
    }

    @Override
    public long memoryFootprintBytes() {
        return vocabulary.approximateBytes() + weights.approximateBytes();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Model handle closed: modelId={}", modelId);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    private void ensureOpen() {
        if (closed) {
            throw new InferenceException("Model handle has been released: " + modelId);
        }
    }
}
