package fr.lapetina.advisor.llm.infrastructure.store;

import fr.lapetina.advisor.llm.domain.model.ModelId;

import java.io.IOException;

/**
 * A model artifact is not in the local cache and cannot be downloaded.
 */
public class ArtifactNotFoundException extends IOException {

    public ArtifactNotFoundException(ModelId modelId, String artifact) {
        super("Artifact not found: modelId=" + modelId + ", artifact=" + artifact);
    }
}
