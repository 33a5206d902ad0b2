package fr.lapetina.advisor.llm.domain.model;

import java.util.Objects;

/**
 * State of the model lifecycle. Exactly one phase holds at any instant.
 *
 * <pre>
 * UNLOADED --load--> LOADING --ok--> READY --load--> LOADING
 * LOADING --error--> FAILED --load--> LOADING
 * READY --unload--> UNLOADED
 * </pre>
 *
 * Immutable; new states are produced by the factory methods only.
 */
public record LifecycleState(Phase phase, ModelId model, String error) {

    public enum Phase {
        /** No model installed */
        UNLOADED,

        /** A load is in progress for {@link #model()} */
        LOADING,

        /** {@link #model()} is installed and accepts generations */
        READY,

        /** The last load of {@link #model()} failed with {@link #error()} */
        FAILED
    }

    private static final LifecycleState UNLOADED_STATE = new LifecycleState(Phase.UNLOADED, null, null);

    public LifecycleState {
        Objects.requireNonNull(phase, "Phase is required");
        if (phase != Phase.UNLOADED) {
            Objects.requireNonNull(model, "Model is required in phase " + phase);
        }
        if (phase == Phase.FAILED && error == null) {
            error = "unknown error";
        }
    }

    public static LifecycleState unloaded() {
        return UNLOADED_STATE;
    }

    public static LifecycleState loading(ModelId model) {
        return new LifecycleState(Phase.LOADING, model, null);
    }

    public static LifecycleState ready(ModelId model) {
        return new LifecycleState(Phase.READY, model, null);
    }

    public static LifecycleState failed(ModelId model, String error) {
        return new LifecycleState(Phase.FAILED, model, error);
    }

    public boolean isReady() {
        return phase == Phase.READY;
    }

    @Override
    public String toString() {
        return switch (phase) {
            case UNLOADED -> "Unloaded";
            case LOADING -> "Loading(" + model + ")";
            case READY -> "Ready(" + model + ")";
            case FAILED -> "Failed(" + model + ", " + error + ")";
        };
    }
}
