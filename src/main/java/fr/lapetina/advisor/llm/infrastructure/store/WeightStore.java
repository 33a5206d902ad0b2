package fr.lapetina.advisor.llm.infrastructure.store;

import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.engine.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Local cache of model artifacts, one directory per model:
 * {@code <cacheDir>/models--<org>--<name>/<artifact>}.
 *
 * Missing artifacts are fetched on demand when a {@link ArtifactFetcher} is
 * configured; without one the store is offline.
 */
public class WeightStore {

    private static final Logger log = LoggerFactory.getLogger(WeightStore.class);

    private final Path cacheDir;
    private final ArtifactFetcher fetcher;

    public WeightStore(Path cacheDir, ArtifactFetcher fetcher) {
        this.cacheDir = Objects.requireNonNull(cacheDir, "Cache directory is required");
        this.fetcher = fetcher;
    }

    public static WeightStore offline(Path cacheDir) {
        return new WeightStore(cacheDir, null);
    }

    public Path modelDirectory(ModelId modelId) {
        return cacheDir.resolve(modelId.cacheDirectoryName());
    }

    public boolean isCached(ModelId modelId, String artifact) {
        return Files.isRegularFile(modelDirectory(modelId).resolve(artifact));
    }

    /**
     * Returns the local path of an artifact, downloading it first if needed.
     *
     * @throws ArtifactNotFoundException if it is not cached and the store is offline
     * @throws IOException               if the download fails
     */
    public Path resolve(ModelId modelId, String artifact, ProgressListener progress) throws IOException {
        Path path = modelDirectory(modelId).resolve(artifact);
        if (Files.isRegularFile(path)) {
            log.debug("Artifact cache hit: modelId={}, artifact={}", modelId, artifact);
            return path;
        }
        if (fetcher == null) {
            throw new ArtifactNotFoundException(modelId, artifact);
        }
        progress.onProgress("Fetching " + artifact + " for " + modelId);
        fetcher.fetch(modelId, artifact, path);
        return path;
    }

    /**
     * Total bytes cached for a model, 0 when nothing is cached.
     */
    public long sizeOnDisk(ModelId modelId) {
        Path dir = modelDirectory(modelId);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .mapToLong(WeightStore::sizeOf)
                    .sum();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to measure cache size: modelId={}, error={}", modelId, e.getMessage());
            return 0;
        }
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public Optional<ArtifactFetcher> getFetcher() {
        return Optional.ofNullable(fetcher);
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
