package fr.lapetina.advisor.llm.engine.bigram;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.engine.ChatTemplate;
import fr.lapetina.advisor.llm.engine.ModelHandle;
import fr.lapetina.advisor.llm.engine.ModelLoadException;
import fr.lapetina.advisor.llm.engine.ModelLoader;
import fr.lapetina.advisor.llm.engine.ProgressListener;
import fr.lapetina.advisor.llm.infrastructure.store.WeightStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Loads bigram models from the {@link WeightStore}: {@code tokenizer.json}
 * first, then {@code weights.json}.
 */
public class BigramModelLoader implements ModelLoader {

    private static final Logger log = LoggerFactory.getLogger(BigramModelLoader.class);

    public static final String TOKENIZER_FILE = "tokenizer.json";
    public static final String WEIGHTS_FILE = "weights.json";

    private final WeightStore weightStore;
    private final ChatTemplate chatTemplate;
    private final ObjectMapper objectMapper;

    public BigramModelLoader(WeightStore weightStore) {
        this(weightStore, ChatTemplate.CHATML);
    }

    public BigramModelLoader(WeightStore weightStore, ChatTemplate chatTemplate) {
        this.weightStore = Objects.requireNonNull(weightStore, "Weight store is required");
        this.chatTemplate = Objects.requireNonNull(chatTemplate, "Chat template is required");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public ModelHandle load(ModelId modelId, ProgressListener progress) throws ModelLoadException {
        Instant startTime = Instant.now();

        progress.onProgress("Downloading tokenizer");
        Path tokenizerPath = resolve(modelId, TOKENIZER_FILE, progress);
        Vocabulary vocabulary;
        try {
            vocabulary = objectMapper.readValue(tokenizerPath.toFile(), TokenizerFile.class).toVocabulary();
        } catch (IOException | IllegalArgumentException e) {
            throw new ModelLoadException(modelId, "Invalid tokenizer: " + e.getMessage(), e);
        }

        progress.onProgress("Loading weights");
        Path weightsPath = resolve(modelId, WEIGHTS_FILE, progress);
        BigramWeights weights;
        try {
            weights = objectMapper.readValue(weightsPath.toFile(), WeightsFile.class).toWeights(vocabulary);
        } catch (IOException | IllegalArgumentException e) {
            throw new ModelLoadException(modelId, "Invalid weights: " + e.getMessage(), e);
        }

        BigramModelHandle handle = new BigramModelHandle(modelId, vocabulary, weights, chatTemplate);
        log.info("Model weights loaded: modelId={}, vocabSize={}, transitions={}, footprintBytes={}, latencyMs={}",
                modelId, vocabulary.size(), weights.transitionCount(), handle.memoryFootprintBytes(),
                Duration.between(startTime, Instant.now()).toMillis());
        return handle;
    }

    private Path resolve(ModelId modelId, String artifact, ProgressListener progress) throws ModelLoadException {
        try {
            return weightStore.resolve(modelId, artifact, progress);
        } catch (IOException e) {
            throw new ModelLoadException(modelId, "Cannot obtain " + artifact + ": " + e.getMessage(), e);
        }
    }
}
