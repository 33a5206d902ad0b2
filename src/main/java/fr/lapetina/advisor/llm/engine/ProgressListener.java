package fr.lapetina.advisor.llm.engine;

/**
 * Observer of human-readable load milestones
 * ("Unloading previous model", "Downloading tokenizer", "Loading weights").
 *
 * Progress reporting is advisory: listeners may be omitted entirely and
 * exceptions they throw are logged and ignored by the caller.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = milestone -> { };

    void onProgress(String milestone);

    /**
     * Returns a listener notifying this one, then {@code next}.
     */
    default ProgressListener andThen(ProgressListener next) {
        return milestone -> {
            onProgress(milestone);
            next.onProgress(milestone);
        };
    }
}
