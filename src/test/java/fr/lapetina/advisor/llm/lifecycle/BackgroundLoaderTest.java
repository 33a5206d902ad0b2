package fr.lapetina.advisor.llm.lifecycle;

import fr.lapetina.advisor.llm.domain.model.LifecycleState;
import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.engine.GenerationEngine;
import fr.lapetina.advisor.llm.engine.ProgressListener;
import fr.lapetina.advisor.llm.infrastructure.store.PersistenceRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BackgroundLoaderTest {

    private static final ModelId MODEL = ModelId.of("Qwen/Qwen3-4B");

    @TempDir
    Path dataDir;

    private StubModelLoader loader;
    private PersistenceRecord persistence;
    private ModelLifecycleManager manager;
    private BackgroundLoader backgroundLoader;

    @BeforeEach
    void setUp() {
        loader = new StubModelLoader();
        persistence = new PersistenceRecord(dataDir.resolve("llm_config.json"));
        manager = new ModelLifecycleManager(loader, new GenerationEngine(), persistence, null, null);
        backgroundLoader = new BackgroundLoader(manager);
    }

    @AfterEach
    void tearDown() {
        loader.release();
        backgroundLoader.close();
    }

    @Test
    @DisplayName("should load off the calling thread")
    void shouldLoadInBackground() throws Exception {
        Optional<CompletableFuture<Boolean>> submitted = backgroundLoader.submit(MODEL, ProgressListener.NONE);

        assertThat(submitted).isPresent();
        assertThat(submitted.get().get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.state()).isEqualTo(LifecycleState.ready(MODEL));
        assertThat(backgroundLoader.isBusy()).isFalse();
    }

    @Test
    @DisplayName("should refuse a submission while a load is running")
    void shouldRefuseWhileBusy() throws Exception {
        loader.hold();
        Optional<CompletableFuture<Boolean>> first = backgroundLoader.submit(MODEL, ProgressListener.NONE);
        assertThat(loader.awaitEntered()).isTrue();

        Optional<CompletableFuture<Boolean>> second =
                backgroundLoader.submit(ModelId.of("Qwen/Qwen3-8B"), ProgressListener.NONE);

        assertThat(second).isEmpty();
        assertThat(backgroundLoader.isBusy()).isTrue();

        loader.release();
        assertThat(first.orElseThrow().get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(loader.requested()).containsExactly(MODEL);
    }

    @Test
    @DisplayName("should resume the persisted model")
    void shouldResumePersistedModel() throws Exception {
        persistence.write(MODEL);

        Optional<CompletableFuture<Boolean>> resumed = backgroundLoader.resumeLastModel(ModelId.of("Qwen/Qwen3-8B"));

        assertThat(resumed).isPresent();
        resumed.get().get(5, TimeUnit.SECONDS);
        assertThat(manager.state()).isEqualTo(LifecycleState.ready(MODEL));
    }

    @Test
    @DisplayName("should do nothing when no model was persisted")
    void shouldSkipResumeWithoutRecord() {
        assertThat(backgroundLoader.resumeLastModel(null)).isEmpty();
        assertThat(loader.requested()).isEmpty();
    }

    @Test
    @DisplayName("should load the fallback model when nothing was persisted")
    void shouldResumeFallbackWithoutRecord() throws Exception {
        Optional<CompletableFuture<Boolean>> resumed = backgroundLoader.resumeLastModel(MODEL);

        assertThat(resumed).isPresent();
        assertThat(resumed.get().get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(loader.requested()).containsExactly(MODEL);
        assertThat(manager.state()).isEqualTo(LifecycleState.ready(MODEL));
    }
}
