package fr.lapetina.advisor.llm.infrastructure.metrics;

import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.domain.model.StatusSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Load counters and durations per model
 * - Generation counters and latency per model and mode
 * - Error counters by type
 * - Lifecycle gauges (availability, loading, device memory)
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> loadCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> loadTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> generationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> generationTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    private final AtomicLong ringBufferRemaining = new AtomicLong(0);
    private final Counter droppedEvents;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_event_ringbuffer_remaining", ringBufferRemaining, AtomicLong::get)
                .description("Remaining capacity in the lifecycle event ring buffer")
                .register(registry);

        this.droppedEvents = Counter.builder(prefix + "_events_dropped_total")
                .description("Lifecycle events dropped because the ring buffer was full")
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}", prefix);
    }

    public MetricsRegistry() {
        this("advisor_llm");
    }

    /**
     * Registers gauges reading the lifecycle status on every scrape.
     */
    public void registerLifecycleGauges(Supplier<StatusSnapshot> status) {
        Gauge.builder(prefix + "_model_available", status, s -> s.get().available() ? 1 : 0)
                .description("1 when a model is ready for generation")
                .register(registry);
        Gauge.builder(prefix + "_model_loading", status, s -> s.get().loading() ? 1 : 0)
                .description("1 while a model load is in progress")
                .register(registry);
        Gauge.builder(prefix + "_device_memory_used_bytes", status, s -> s.get().deviceMemoryUsedBytes())
                .description("Memory in use on the compute device")
                .register(registry);
        Gauge.builder(prefix + "_device_memory_total_bytes", status, s -> s.get().deviceMemoryTotalBytes())
                .description("Capacity of the compute device")
                .register(registry);
    }

    /**
     * Counts a finished load; {@code outcome} is {@code completed} or {@code failed}.
     */
    public void incrementLoadCount(String model, String outcome) {
        String key = model + ":" + outcome;
        loadCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_loads_total")
                        .description("Total number of model loads")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordLoadDuration(String model, Duration duration) {
        loadTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_load_duration")
                        .description("Model load duration")
                        .tag("model", model)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Counts a finished generation; {@code mode} is {@code blocking} or {@code streaming}.
     */
    public void incrementGenerationCount(String model, String mode, String outcome) {
        String key = model + ":" + mode + ":" + outcome;
        generationCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_generations_total")
                        .description("Total number of generations")
                        .tag("model", model)
                        .tag("mode", mode)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordGenerationLatency(String model, String mode, Duration latency) {
        String key = model + ":" + mode;
        generationTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_generation_latency")
                        .description("Generation latency")
                        .tag("model", model)
                        .tag("mode", mode)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(String model, ErrorType errorType) {
        String key = model + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("model", model)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void incrementDroppedEvents() {
        droppedEvents.increment();
    }

    public void setRingBufferRemaining(long value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
