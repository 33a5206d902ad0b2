package fr.lapetina.advisor.llm.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.advisor.llm.domain.event.LifecycleEvent;
import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Turns lifecycle events into Micrometer counters and timers.
 *
 * Records:
 * - Loads by model and outcome, with duration
 * - Generations by model, mode and outcome, with latency
 * - Errors by type
 */
public final class MetricsHandler implements EventHandler<LifecycleEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(LifecycleEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) {
            return;
        }
        if (event.getRequestId() != null) {
            MDC.put("requestId", event.getRequestId());
        }
        try {
            recordMetrics(event);
        } finally {
            MDC.remove("requestId");
        }
    }

    private void recordMetrics(LifecycleEvent event) {
        String model = event.getModel() != null ? event.getModel() : "none";
        String mode = event.getDetail() != null ? event.getDetail() : "unknown";

        switch (event.getType()) {
            case LOAD_COMPLETED -> {
                metricsRegistry.incrementLoadCount(model, "completed");
                if (event.getDuration() != null) {
                    metricsRegistry.recordLoadDuration(model, event.getDuration());
                }
            }
            case LOAD_FAILED -> {
                metricsRegistry.incrementLoadCount(model, "failed");
                if (event.getDuration() != null) {
                    metricsRegistry.recordLoadDuration(model, event.getDuration());
                }
                recordError(model, event);
            }
            case GENERATION_COMPLETED -> {
                metricsRegistry.incrementGenerationCount(model, mode, "completed");
                if (event.getDuration() != null) {
                    metricsRegistry.recordGenerationLatency(model, mode, event.getDuration());
                }
            }
            case GENERATION_FAILED -> {
                metricsRegistry.incrementGenerationCount(model, mode, "failed");
                recordError(model, event);
            }
            case STREAM_ABANDONED -> {
                metricsRegistry.incrementGenerationCount(model, mode, "abandoned");
                recordError(model, event);
            }
            default -> {
                // progress, start and unload events carry no metric
            }
        }
    }

    private void recordError(String model, LifecycleEvent event) {
        ErrorType errorType = event.getErrorType() != null ? event.getErrorType() : ErrorType.INTERNAL_ERROR;
        metricsRegistry.incrementErrorCount(model, errorType);
        log.debug("Error recorded: model={}, type={}, errorType={}", model, event.getType(), errorType);
    }
}
