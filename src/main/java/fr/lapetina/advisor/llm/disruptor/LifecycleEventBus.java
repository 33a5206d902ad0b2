package fr.lapetina.advisor.llm.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.advisor.llm.disruptor.handlers.JournalHandler;
import fr.lapetina.advisor.llm.disruptor.handlers.MetricsHandler;
import fr.lapetina.advisor.llm.domain.event.LifecycleEvent;
import fr.lapetina.advisor.llm.domain.event.LifecycleEventFactory;
import fr.lapetina.advisor.llm.domain.event.LifecycleEventPublisher;
import fr.lapetina.advisor.llm.domain.event.LifecycleEventType;
import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.infrastructure.config.AdvisorConfig;
import fr.lapetina.advisor.llm.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-blocking fan-out of lifecycle events to metrics and the event journal.
 *
 * Events are published from load, unload and generation paths, some of them
 * holding the generation permit, so publishing must never wait: a slot is
 * claimed with {@code tryNext()} and the event is dropped with a warning when
 * the ring buffer is full.
 *
 * PRODUCER TYPE: MULTI, since the background loader, HTTP threads and stream
 * consumers all publish. Handlers run in parallel on their own threads.
 */
public final class LifecycleEventBus implements LifecycleEventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEventBus.class);

    private final Disruptor<LifecycleEvent> disruptor;
    private final RingBuffer<LifecycleEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final JournalHandler journalHandler;
    private final MetricsRegistry metricsRegistry;

    private LifecycleEventBus(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.journalHandler = new JournalHandler(builder.journalSize);

        this.disruptor = new Disruptor<>(
                new LifecycleEventFactory(),
                builder.ringBufferSize,
                new EventThreadFactory("lifecycle-events"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        List<EventHandler<LifecycleEvent>> handlers = new ArrayList<>();
        handlers.add(journalHandler);
        if (metricsRegistry != null) {
            handlers.add(new MetricsHandler(metricsRegistry));
        }
        handlers.addAll(builder.extraHandlers);
        disruptor.handleEventsWith(toArray(handlers));
        disruptor.setDefaultExceptionHandler(new EventExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("LifecycleEventBus created: ringBufferSize={}, waitStrategy={}, journalSize={}",
                builder.ringBufferSize, builder.waitStrategy, builder.journalSize);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("LifecycleEventBus started");
        }
    }

    @Override
    public void publish(
            LifecycleEventType type,
            String model,
            String requestId,
            String detail,
            ErrorType errorType,
            Duration duration
    ) {
        if (!running.get()) {
            log.debug("Event bus not running, dropping event: type={}, model={}", type, model);
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Event ring buffer full, dropping event: type={}, model={}, requestId={}",
                    type, model, requestId);
            if (metricsRegistry != null) {
                metricsRegistry.incrementDroppedEvents();
            }
            return;
        }

        try {
            LifecycleEvent event = ringBuffer.get(sequence);
            event.initialize(type, model, requestId, detail, errorType, duration);
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining(ringBuffer.remainingCapacity());
        }
    }

    /**
     * Waits until every published event has been handled.
     *
     * @return {@code false} if events were still pending at the timeout
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (ringBuffer.remainingCapacity() < ringBuffer.getBufferSize()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public List<LifecycleEvent.Record> recentEvents(int limit) {
        return journalHandler.recent(limit);
    }

    public JournalHandler getJournal() {
        return journalHandler;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down LifecycleEventBus...");
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
                log.info("LifecycleEventBus shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("LifecycleEventBus shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static EventHandler<LifecycleEvent>[] toArray(List<EventHandler<LifecycleEvent>> handlers) {
        return handlers.toArray(new EventHandler[0]);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Daemon threads: a stuck handler must not keep the process alive.
     */
    private static class EventThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        EventThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Logs handler failures; the event is skipped and processing continues.
     */
    private static class EventExceptionHandler implements ExceptionHandler<LifecycleEvent> {

        private static final Logger log = LoggerFactory.getLogger(EventExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, LifecycleEvent event) {
            log.error("Exception in lifecycle event handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during event bus start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during event bus shutdown", ex);
        }
    }

    /**
     * Builder for LifecycleEventBus.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int journalSize = 200;
        private MetricsRegistry metricsRegistry;
        private final List<EventHandler<LifecycleEvent>> extraHandlers = new ArrayList<>();

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder journalSize(int journalSize) {
            this.journalSize = journalSize;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        /**
         * Adds a handler running alongside the journal and metrics handlers.
         */
        public Builder handler(EventHandler<LifecycleEvent> handler) {
            this.extraHandlers.add(handler);
            return this;
        }

        public Builder fromConfig(AdvisorConfig config) {
            ringBufferSize(config.getEvents().getRingBufferSize());
            this.waitStrategy = config.getEvents().getWaitStrategy();
            this.journalSize = config.getEvents().getJournalSize();
            return this;
        }

        public LifecycleEventBus build() {
            return new LifecycleEventBus(this);
        }
    }
}
