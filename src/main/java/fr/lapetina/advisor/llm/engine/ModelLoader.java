package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ModelId;

/**
 * Acquires a {@link ModelHandle} for a model identifier.
 *
 * Loaders may download artifacts and allocate large amounts of memory; they
 * are only ever called from the lifecycle manager's load sequence, one at a
 * time.
 */
@FunctionalInterface
public interface ModelLoader {

    /**
     * Loads tokenizer and weights for the given model.
     *
     * @param modelId  model to load
     * @param progress advisory milestone observer, never {@code null}
     * @return a fresh handle owned by the caller
     * @throws ModelLoadException if artifacts are missing, corrupt, or cannot be fetched
     */
    ModelHandle load(ModelId modelId, ProgressListener progress) throws ModelLoadException;
}
