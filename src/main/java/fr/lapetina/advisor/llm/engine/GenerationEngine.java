package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs generations against a {@link ModelHandle}, blocking or streaming.
 *
 * The engine is stateless with respect to models: callers pass the handle
 * (blocking) or a {@link StreamSession} that hands it out (streaming), and
 * remain responsible for generation exclusion.
 */
public final class GenerationEngine {

    private static final Logger log = LoggerFactory.getLogger(GenerationEngine.class);

    public static final int DEFAULT_MAX_NEW_TOKENS = 1024;
    public static final Duration DEFAULT_ABANDON_TIMEOUT = Duration.ofSeconds(120);
    public static final int DEFAULT_CHANNEL_CAPACITY = 256;

    private final int defaultMaxNewTokens;
    private final Duration abandonTimeout;
    private final int channelCapacity;

    public GenerationEngine() {
        this(DEFAULT_MAX_NEW_TOKENS, DEFAULT_ABANDON_TIMEOUT, DEFAULT_CHANNEL_CAPACITY);
    }

    public GenerationEngine(int defaultMaxNewTokens, Duration abandonTimeout, int channelCapacity) {
        if (defaultMaxNewTokens <= 0) {
            throw new IllegalArgumentException("defaultMaxNewTokens must be > 0");
        }
        if (channelCapacity <= 0) {
            throw new IllegalArgumentException("channelCapacity must be > 0");
        }
        this.abandonTimeout = Objects.requireNonNull(abandonTimeout, "Abandon timeout is required");
        if (abandonTimeout.isNegative() || abandonTimeout.isZero()) {
            throw new IllegalArgumentException("Abandon timeout must be positive");
        }
        this.defaultMaxNewTokens = defaultMaxNewTokens;
        this.channelCapacity = channelCapacity;
    }

    /**
     * Generates the full response on the calling thread.
     * Engine faults are logged and reported through {@link Completion#error()}.
     */
    public Completion complete(ModelHandle handle, GenerationRequest request) {
        TokenBuffer tokens = new TokenBuffer();
        try {
            int[] prompt = promptTokens(handle, request);
            handle.generate(prompt, samplingParams(request), token -> {
                tokens.add(token);
                return true;
            });
        } catch (OutOfMemoryError e) {
            log.warn("Generation ran out of memory: requestId={}, model={}", request.requestId(), handle.modelId());
            return Completion.failure(ErrorType.OUT_OF_MEMORY);
        } catch (RuntimeException e) {
            log.warn("Generation failed: requestId={}, model={}, error={}",
                    request.requestId(), handle.modelId(), e.getMessage(), e);
            return Completion.failure(ErrorType.ENGINE_ERROR);
        }

        try {
            String text = handle.decode(tokens.array(), tokens.size()).strip();
            log.debug("Generation completed: requestId={}, model={}, tokens={}",
                    request.requestId(), handle.modelId(), tokens.size());
            return Completion.success(text, tokens.size());
        } catch (RuntimeException e) {
            log.warn("Decoding failed: requestId={}, model={}, error={}",
                    request.requestId(), handle.modelId(), e.getMessage(), e);
            return Completion.failure(ErrorType.DECODE_ERROR);
        }
    }

    /**
     * Creates a lazily-started stream of cumulative snapshots. Nothing
     * happens until the first {@link TokenStream#hasNext()}.
     */
    public TokenStream stream(GenerationRequest request, StreamSession session) {
        return new TokenStream(this, request, session, abandonTimeout, channelCapacity);
    }

    int[] promptTokens(ModelHandle handle, GenerationRequest request) {
        String prompt = handle.chatTemplate().render(request.messages(), true);
        return handle.encode(prompt);
    }

    SamplingParams samplingParams(GenerationRequest request) {
        int maxNewTokens = request.maxNewTokensOverride().orElse(defaultMaxNewTokens);
        long seed = request.seedOverride().orElseGet(() -> ThreadLocalRandom.current().nextLong());
        return new SamplingParams(request.temperature(), maxNewTokens, seed);
    }
}
