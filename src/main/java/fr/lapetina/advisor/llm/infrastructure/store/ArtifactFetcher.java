package fr.lapetina.advisor.llm.infrastructure.store;

import fr.lapetina.advisor.llm.domain.model.ModelId;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Retrieves a model artifact from a remote source into the local cache.
 */
@FunctionalInterface
public interface ArtifactFetcher {

    /**
     * Downloads {@code artifact} of {@code modelId} to {@code target}.
     * Implementations must not leave a partial file at {@code target}.
     */
    void fetch(ModelId modelId, String artifact, Path target) throws IOException;
}
