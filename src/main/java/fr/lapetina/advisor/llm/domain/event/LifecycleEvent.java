package fr.lapetina.advisor.llm.domain.event;

import fr.lapetina.advisor.llm.domain.model.ErrorType;

import java.time.Duration;
import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * It should never be accessed outside the event bus handlers; handlers that
 * need to keep an event copy it with {@link #toRecord()}.
 */
public final class LifecycleEvent {

    private LifecycleEventType type;
    private String model;
    private String requestId;
    private String detail;
    private ErrorType errorType;
    private Duration duration;
    private Instant occurredAt;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.type = null;
        this.model = null;
        this.requestId = null;
        this.detail = null;
        this.errorType = null;
        this.duration = null;
        this.occurredAt = null;
    }

    public void initialize(
            LifecycleEventType type,
            String model,
            String requestId,
            String detail,
            ErrorType errorType,
            Duration duration
    ) {
        clear();
        this.type = type;
        this.model = model;
        this.requestId = requestId;
        this.detail = detail;
        this.errorType = errorType;
        this.duration = duration;
        this.occurredAt = Instant.now();
    }

    public LifecycleEventType getType() {
        return type;
    }

    public String getModel() {
        return model;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getDetail() {
        return detail;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public Duration getDuration() {
        return duration;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    /**
     * Immutable copy of the current slot content.
     */
    public Record toRecord() {
        return new Record(type, model, requestId, detail, errorType,
                duration != null ? duration.toMillis() : null, occurredAt);
    }

    @Override
    public String toString() {
        return "LifecycleEvent{" +
                "type=" + type +
                ", model='" + model + '\'' +
                ", requestId='" + requestId + '\'' +
                ", errorType=" + errorType +
                '}';
    }

    /**
     * Detached, immutable view of an event.
     */
    public record Record(
            LifecycleEventType type,
            String model,
            String requestId,
            String detail,
            ErrorType errorType,
            Long durationMs,
            Instant occurredAt
    ) {
    }
}
