package fr.lapetina.advisor.llm.domain.event;

import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.domain.model.ModelId;

import java.time.Duration;

/**
 * Sink for lifecycle events.
 *
 * Implementations must never block the caller nor throw: publishing happens
 * from inside load and generation paths, some of them holding the
 * generation permit.
 */
@FunctionalInterface
public interface LifecycleEventPublisher {

    /**
     * Publisher that discards every event.
     */
    LifecycleEventPublisher NOOP = (type, model, requestId, detail, errorType, duration) -> { };

    void publish(
            LifecycleEventType type,
            String model,
            String requestId,
            String detail,
            ErrorType errorType,
            Duration duration
    );

    default void loadStarted(ModelId model) {
        publish(LifecycleEventType.LOAD_STARTED, model.value(), null, null, null, null);
    }

    default void loadProgress(ModelId model, String milestone) {
        publish(LifecycleEventType.LOAD_PROGRESS, model.value(), null, milestone, null, null);
    }

    default void loadCompleted(ModelId model, Duration duration) {
        publish(LifecycleEventType.LOAD_COMPLETED, model.value(), null, null, null, duration);
    }

    default void loadFailed(ModelId model, ErrorType errorType, String message, Duration duration) {
        publish(LifecycleEventType.LOAD_FAILED, model.value(), null, message, errorType, duration);
    }

    default void unloaded(ModelId model) {
        publish(LifecycleEventType.UNLOADED, model != null ? model.value() : null, null, null, null, null);
    }

    default void generationCompleted(ModelId model, String requestId, String mode, Duration duration) {
        publish(LifecycleEventType.GENERATION_COMPLETED, model.value(), requestId, mode, null, duration);
    }

    default void generationFailed(ModelId model, String requestId, String mode, ErrorType errorType) {
        publish(LifecycleEventType.GENERATION_FAILED, model.value(), requestId, mode, errorType, null);
    }

    default void streamAbandoned(ModelId model, String requestId, Duration duration) {
        publish(LifecycleEventType.STREAM_ABANDONED, model.value(), requestId, "streaming",
                ErrorType.STREAM_ABANDONED, duration);
    }
}
