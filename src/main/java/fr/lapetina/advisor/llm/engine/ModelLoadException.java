package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ModelId;

/**
 * Raised by a {@link ModelLoader} when a model cannot be brought into memory.
 */
public class ModelLoadException extends Exception {

    private final ModelId modelId;

    public ModelLoadException(ModelId modelId, String message) {
        super(message);
        this.modelId = modelId;
    }

    public ModelLoadException(ModelId modelId, String message, Throwable cause) {
        super(message, cause);
        this.modelId = modelId;
    }

    public ModelId getModelId() {
        return modelId;
    }
}
