package fr.lapetina.advisor.llm.domain.event;

/**
 * Kinds of events published by the model lifecycle manager.
 */
public enum LifecycleEventType {
    /** A load sequence started */
    LOAD_STARTED,

    /** A load reported a milestone */
    LOAD_PROGRESS,

    /** A load installed its handle */
    LOAD_COMPLETED,

    /** A load ended in the FAILED state */
    LOAD_FAILED,

    /** The handle was dropped by an explicit unload */
    UNLOADED,

    /** A generation (blocking or streaming) produced its final text */
    GENERATION_COMPLETED,

    /** A generation failed and returned an empty result */
    GENERATION_FAILED,

    /** A streaming consumer stopped waiting before the producer finished */
    STREAM_ABANDONED;

    public boolean isLoadEvent() {
        return this == LOAD_STARTED || this == LOAD_PROGRESS
                || this == LOAD_COMPLETED || this == LOAD_FAILED;
    }
}
