package fr.lapetina.advisor.llm.infrastructure.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.advisor.llm.domain.model.ModelId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable memory of the last successfully loaded model, a JSON file of the
 * form {@code {"model_id": "Qwen/Qwen3-8B"}}.
 *
 * Reads are tolerant: a missing, unreadable or corrupt file reads as empty.
 * Writes are best-effort: failures are logged and never propagate.
 */
public class PersistenceRecord {

    private static final Logger log = LoggerFactory.getLogger(PersistenceRecord.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public PersistenceRecord(Path file) {
        this.file = Objects.requireNonNull(file, "Persistence file is required");
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Optional<ModelId> read() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            Stored stored = objectMapper.readValue(file.toFile(), Stored.class);
            if (stored == null || stored.modelId() == null || stored.modelId().isBlank()) {
                log.warn("Persistence record has no model id: file={}", file);
                return Optional.empty();
            }
            return Optional.of(ModelId.of(stored.modelId()));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable persistence record: file={}, error={}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replaces the record with {@code modelId}. Concurrent writers are serialized.
     */
    public synchronized void write(ModelId modelId) {
        Path temp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            Files.write(temp, serialize(modelId));
            moveIntoPlace(temp, file);
            log.debug("Persistence record written: file={}, modelId={}", file, modelId);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write persistence record: file={}, modelId={}, error={}",
                    file, modelId, e.getMessage());
            deleteQuietly(temp);
        }
    }

    /**
     * Replaces {@code target} with the fully written {@code temp} file.
     */
    protected void moveIntoPlace(Path temp, Path target) throws IOException {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Path getFile() {
        return file;
    }

    private byte[] serialize(ModelId modelId) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(new Stored(modelId.value()));
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Failed to delete temporary file: file={}, error={}", temp, e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Stored(@JsonProperty("model_id") String modelId) {
    }
}
