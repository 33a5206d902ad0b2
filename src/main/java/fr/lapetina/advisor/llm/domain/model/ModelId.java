package fr.lapetina.advisor.llm.domain.model;

import java.util.Objects;

/**
 * Opaque identifier of a loadable model, e.g. {@code Qwen/Qwen3-8B}.
 * Immutable value type.
 */
public record ModelId(String value) {

    public ModelId {
        Objects.requireNonNull(value, "Model id is required");
        value = value.strip();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Model id must not be blank");
        }
    }

    public static ModelId of(String value) {
        return new ModelId(value);
    }

    /**
     * Directory name of this model inside the weight cache, following the
     * Hugging Face hub layout ({@code models--org--name}).
     */
    public String cacheDirectoryName() {
        return "models--" + value.replace("/", "--");
    }

    @Override
    public String toString() {
        return value;
    }
}
