package fr.lapetina.advisor.llm.infrastructure.store;

import fr.lapetina.advisor.llm.domain.model.ModelId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PersistenceRecordTest {

    @TempDir
    Path dir;

    private Path file;
    private PersistenceRecord record;

    @BeforeEach
    void setUp() {
        file = dir.resolve("data").resolve("llm_config.json");
        record = new PersistenceRecord(file);
    }

    @Test
    @DisplayName("should read empty when the file is absent")
    void shouldReadEmptyWhenAbsent() {
        assertThat(record.read()).isEmpty();
    }

    @Test
    @DisplayName("should write the model id and create parent directories")
    void shouldWriteModelId() throws Exception {
        record.write(ModelId.of("Qwen/Qwen3-8B"));

        assertThat(Files.readString(file)).contains("\"model_id\"").contains("Qwen/Qwen3-8B");
        assertThat(record.read()).contains(ModelId.of("Qwen/Qwen3-8B"));
    }

    @Test
    @DisplayName("should replace the previous record")
    void shouldReplacePreviousRecord() {
        record.write(ModelId.of("Qwen/Qwen3-4B"));
        record.write(ModelId.of("Qwen/Qwen3-14B"));

        assertThat(new PersistenceRecord(file).read()).contains(ModelId.of("Qwen/Qwen3-14B"));
        assertThat(dir.resolve("data").toFile().list()).containsExactly("llm_config.json");
    }

    @Test
    @DisplayName("should read empty when the file is corrupt")
    void shouldReadEmptyWhenCorrupt() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"model_id\": ");

        assertThat(record.read()).isEmpty();
    }

    @Test
    @DisplayName("should read empty when the model id is missing or blank")
    void shouldReadEmptyWhenBlank() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"model_id\": \"  \"}");
        assertThat(record.read()).isEmpty();

        Files.writeString(file, "{\"other\": 1}");
        assertThat(record.read()).isEmpty();
    }

    @Test
    @DisplayName("should swallow write failures")
    void shouldSwallowWriteFailures() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        PersistenceRecord unwritable = new PersistenceRecord(blocker.resolve("llm_config.json"));

        assertThatCode(() -> unwritable.write(ModelId.of("Qwen/Qwen3-4B"))).doesNotThrowAnyException();
        assertThat(unwritable.read()).isEmpty();
    }

    @Test
    @DisplayName("should swallow unchecked failures and clean up the temporary file")
    void shouldSwallowUncheckedWriteFailures() throws Exception {
        record.write(ModelId.of("Qwen/Qwen3-4B"));
        PersistenceRecord noAtomicMove = new PersistenceRecord(record.getFile()) {
            @Override
            protected void moveIntoPlace(Path temp, Path target) {
                throw new UnsupportedOperationException("Atomic move not supported");
            }
        };

        assertThatCode(() -> noAtomicMove.write(ModelId.of("Qwen/Qwen3-8B"))).doesNotThrowAnyException();

        assertThat(noAtomicMove.read()).contains(ModelId.of("Qwen/Qwen3-4B"));
        try (Stream<Path> files = Files.list(record.getFile().getParent())) {
            assertThat(files).containsExactly(record.getFile());
        }
    }

    @Test
    @DisplayName("should serialize concurrent writers")
    void shouldSerializeConcurrentWriters() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 20; i++) {
            ModelId id = ModelId.of("org/model-" + (i % 4));
            executor.submit(() -> record.write(id));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(record.read()).isPresent();
        assertThat(record.read().get().value()).startsWith("org/model-");
    }
}
