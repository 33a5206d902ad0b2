package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Cumulative text snapshots of one streaming generation.
 *
 * <h2>Threading</h2>
 * <p>The stream is consumed by a single thread. The first {@link #hasNext()}
 * acquires the handle through the {@link StreamSession} and starts a daemon
 * producer thread that runs the engine and pushes snapshots into a bounded
 * channel. The consumer yields snapshots until the producer signals the end,
 * or until the producer stays silent for longer than the abandonment
 * timeout. The timeout is an inactivity bound: it restarts with every
 * snapshot received, so a long but steady generation is never cut off.</p>
 *
 * <h2>Abandonment</h2>
 * <p>On timeout or {@link #close()} the consumer stops, reports the session
 * finished (which releases the generation permit) and flags the producer,
 * which stops at its next token without being interrupted. The producer
 * reports {@link StreamSession#handleReleased()} when it exits.</p>
 *
 * <h2>Snapshots</h2>
 * <p>Every element is the whole text decoded so far, whitespace-trimmed, and
 * differs from the previous element. At temperature 0 the last element equals
 * the blocking result for the same request.</p>
 */
public final class TokenStream implements Iterator<String>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TokenStream.class);
    private static final AtomicLong PRODUCER_IDS = new AtomicLong();
    private static final long OFFER_POLL_MILLIS = 50;

    private final GenerationEngine engine;
    private final GenerationRequest request;
    private final StreamSession session;
    private final Duration abandonTimeout;
    private final BlockingQueue<Chunk> channel;
    private final AtomicBoolean abandoned = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();

    private volatile StreamOutcome outcome;
    private boolean started;
    private long acquiredAtNanos;
    private long deadlineNanos;
    private String pending;
    private String lastYielded = "";

    TokenStream(
            GenerationEngine engine,
            GenerationRequest request,
            StreamSession session,
            Duration abandonTimeout,
            int channelCapacity
    ) {
        this.engine = engine;
        this.request = request;
        this.session = session;
        this.abandonTimeout = abandonTimeout;
        this.channel = new ArrayBlockingQueue<>(channelCapacity);
    }

    /**
     * A stream with no elements, returned when no model is ready.
     */
    public static TokenStream empty() {
        TokenStream stream = new TokenStream(null, null, null, Duration.ZERO, 1);
        stream.started = true;
        stream.finished.set(true);
        stream.outcome = StreamOutcome.UNAVAILABLE;
        return stream;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished.get()) {
            return false;
        }
        if (!started && !start()) {
            return false;
        }

        long remaining = deadlineNanos - System.nanoTime();
        Chunk chunk;
        try {
            chunk = remaining > 0 ? channel.poll(remaining, TimeUnit.NANOSECONDS) : channel.poll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandoned.set(true);
            finish(StreamOutcome.CLOSED, null);
            return false;
        }
        if (chunk == null) {
            abandon();
            return false;
        }
        deadlineNanos = System.nanoTime() + abandonTimeout.toNanos();
        if (chunk.kind() == ChunkKind.END) {
            finish(StreamOutcome.COMPLETED, null);
            return false;
        }
        if (chunk.kind() == ChunkKind.FAILED) {
            finish(StreamOutcome.FAILED, chunk.error());
            return false;
        }
        pending = chunk.text();
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String snapshot = pending;
        pending = null;
        lastYielded = snapshot;
        return snapshot;
    }

    /**
     * Drains the stream, passing each snapshot to the consumer.
     *
     * @return the last snapshot, or an empty string if none was produced
     */
    public String drainTo(Consumer<String> consumer) {
        try {
            while (hasNext()) {
                consumer.accept(next());
            }
            return lastYielded;
        } finally {
            close();
        }
    }

    /**
     * Stops the stream early. Idempotent; a no-op once the stream has ended.
     */
    @Override
    public void close() {
        pending = null;
        if (!started) {
            started = true;
            finished.set(true);
            outcome = StreamOutcome.CLOSED;
            return;
        }
        if (!finished.get()) {
            abandoned.set(true);
            finish(StreamOutcome.CLOSED, null);
        }
    }

    public boolean isFinished() {
        return finished.get();
    }

    public String lastSnapshot() {
        return lastYielded;
    }

    /**
     * How the stream ended, empty while it is still running.
     */
    public Optional<StreamOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    private boolean start() {
        started = true;
        ModelHandle handle = session.acquire();
        if (handle == null) {
            finished.set(true);
            outcome = StreamOutcome.UNAVAILABLE;
            session.finished(StreamOutcome.UNAVAILABLE, "", Duration.ZERO, null);
            return false;
        }
        acquiredAtNanos = System.nanoTime();
        deadlineNanos = acquiredAtNanos + abandonTimeout.toNanos();

        Thread producer = new Thread(new Producer(handle), "token-stream-" + PRODUCER_IDS.incrementAndGet());
        producer.setDaemon(true);
        try {
            producer.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            log.warn("Failed to start stream producer: requestId={}, error={}", request.requestId(), e.toString());
            session.handleReleased();
            finish(StreamOutcome.FAILED, ErrorType.INTERNAL_ERROR);
            return false;
        }
        return true;
    }

    private void abandon() {
        log.warn("Stream abandoned, producer silent: requestId={}, timeoutMs={}", request.requestId(), abandonTimeout.toMillis());
        abandoned.set(true);
        finish(StreamOutcome.ABANDONED, null);
    }

    private void finish(StreamOutcome outcome, ErrorType error) {
        if (finished.compareAndSet(false, true)) {
            this.outcome = outcome;
            Duration elapsed = Duration.ofNanos(System.nanoTime() - acquiredAtNanos);
            session.finished(outcome, lastYielded, elapsed, error);
        }
    }

    private enum ChunkKind {
        TEXT, END, FAILED
    }

    private record Chunk(ChunkKind kind, String text, ErrorType error) {
        static final Chunk END = new Chunk(ChunkKind.END, null, null);

        static Chunk text(String text) {
            return new Chunk(ChunkKind.TEXT, text, null);
        }

        static Chunk failed(ErrorType error) {
            return new Chunk(ChunkKind.FAILED, null, error);
        }
    }

    /**
     * Runs the engine and feeds the channel. Only touches the handle while
     * the session lease is held.
     */
    private final class Producer implements Runnable {

        private final ModelHandle handle;
        private final TokenBuffer tokens = new TokenBuffer();
        private String lastSent = "";

        Producer(ModelHandle handle) {
            this.handle = handle;
        }

        @Override
        public void run() {
            try {
                int[] prompt = engine.promptTokens(handle, request);
                handle.generate(prompt, engine.samplingParams(request), this::onToken);
                send(Chunk.END);
            } catch (OutOfMemoryError e) {
                log.warn("Streaming generation ran out of memory: requestId={}", request.requestId());
                send(Chunk.failed(ErrorType.OUT_OF_MEMORY));
            } catch (RuntimeException e) {
                log.warn("Streaming generation failed: requestId={}, error={}", request.requestId(), e.getMessage(), e);
                send(Chunk.failed(ErrorType.ENGINE_ERROR));
            } finally {
                session.handleReleased();
            }
        }

        private boolean onToken(int token) {
            if (abandoned.get()) {
                return false;
            }
            tokens.add(token);
            String snapshot = handle.decode(tokens.array(), tokens.size()).strip();
            if (snapshot.equals(lastSent)) {
                return true;
            }
            lastSent = snapshot;
            return send(Chunk.text(snapshot));
        }

        /**
         * Blocks while the channel is full, giving up once the stream is abandoned.
         */
        private boolean send(Chunk chunk) {
            try {
                while (!abandoned.get()) {
                    if (channel.offer(chunk, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                        return true;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return false;
        }
    }
}
