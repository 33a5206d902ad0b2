package fr.lapetina.advisor.llm.lifecycle;

import fr.lapetina.advisor.llm.domain.event.LifecycleEventPublisher;
import fr.lapetina.advisor.llm.domain.model.ErrorType;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;
import fr.lapetina.advisor.llm.domain.model.LifecycleState;
import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.domain.model.StatusSnapshot;
import fr.lapetina.advisor.llm.engine.Completion;
import fr.lapetina.advisor.llm.engine.GenerationEngine;
import fr.lapetina.advisor.llm.engine.ModelHandle;
import fr.lapetina.advisor.llm.engine.ModelLoadException;
import fr.lapetina.advisor.llm.engine.ModelLoader;
import fr.lapetina.advisor.llm.engine.ProgressListener;
import fr.lapetina.advisor.llm.engine.StreamOutcome;
import fr.lapetina.advisor.llm.engine.StreamSession;
import fr.lapetina.advisor.llm.engine.TokenStream;
import fr.lapetina.advisor.llm.infrastructure.device.DeviceMemoryProbe;
import fr.lapetina.advisor.llm.infrastructure.store.PersistenceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Owns the single loaded model and arbitrates every caller that wants to
 * load, swap, unload, query or generate with it.
 *
 * <h2>Locks</h2>
 * <ul>
 *   <li>{@code stateLock} guards the state, the load-in-progress flag, the
 *       installed lease and the last progress message. It is only held for
 *       field copies, so a status snapshot is never torn.</li>
 *   <li>The generation permit (a fair single-permit semaphore) excludes
 *       generations from each other and from load and unload. A load enters
 *       {@code LOADING} before it waits for the permit, so callers arriving
 *       behind an in-flight generation fail fast instead of queueing behind
 *       the swap.</li>
 *   <li>{@code loading} admits at most one load; a second caller returns
 *       {@code false} without waiting.</li>
 * </ul>
 *
 * <p>A generation only runs against the lease it saw when it was admitted.
 * A caller that was queued on the permit when the model changed gets an
 * empty result.</p>
 *
 * <h2>Failures</h2>
 * <p>Load failures, including {@link OutOfMemoryError}, end in
 * {@code FAILED} with no handle installed. Generation failures return an
 * empty result and leave the state untouched.</p>
 */
public final class ModelLifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelLifecycleManager.class);

    static final String MILESTONE_UNLOADING = "Unloading previous model";

    private final ModelLoader loader;
    private final GenerationEngine engine;
    private final PersistenceRecord persistence;
    private final DeviceMemoryProbe memoryProbe;
    private final LifecycleEventPublisher events;

    private final Object stateLock = new Object();
    private final Semaphore generationPermit = new Semaphore(1, true);
    private final AtomicBoolean loading = new AtomicBoolean(false);

    private LifecycleState state = LifecycleState.unloaded();
    private boolean loadInProgress;
    private HandleLease lease;
    private String lastProgress = "";

    public ModelLifecycleManager(
            ModelLoader loader,
            GenerationEngine engine,
            PersistenceRecord persistence,
            DeviceMemoryProbe memoryProbe,
            LifecycleEventPublisher events
    ) {
        this.loader = Objects.requireNonNull(loader, "Loader is required");
        this.engine = Objects.requireNonNull(engine, "Generation engine is required");
        this.persistence = Objects.requireNonNull(persistence, "Persistence record is required");
        this.memoryProbe = memoryProbe != null ? memoryProbe : DeviceMemoryProbe.none();
        this.events = events != null ? events : LifecycleEventPublisher.NOOP;
    }

    /**
     * Current status. Never waits for a load or a generation.
     */
    public StatusSnapshot status() {
        LifecycleState currentState;
        boolean currentlyLoading;
        String progress;
        synchronized (stateLock) {
            currentState = state;
            currentlyLoading = loadInProgress;
            progress = lastProgress;
        }
        long used = 0;
        long total = 0;
        try {
            used = memoryProbe.usedBytes();
            total = memoryProbe.totalBytes();
        } catch (RuntimeException e) {
            log.debug("Device memory probe failed: device={}, error={}", memoryProbe.device(), e.getMessage());
        }
        return new StatusSnapshot(currentState, currentlyLoading, progress, memoryProbe.device(), used, total);
    }

    public LifecycleState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isReady() {
        return state().isReady();
    }

    public boolean isLoading() {
        synchronized (stateLock) {
            return loadInProgress;
        }
    }

    public boolean load(ModelId modelId) {
        return load(modelId, ProgressListener.NONE);
    }

    /**
     * Loads {@code modelId}, replacing the current model. Blocks the caller
     * until the load ends; run it on a background thread to keep callers
     * responsive.
     *
     * @param listener optional milestone observer; its exceptions are ignored
     * @return {@code false} if another load is already in progress, {@code true} once this load has ended
     *         (check {@link #status()} for success or failure)
     */
    public boolean load(ModelId modelId, ProgressListener listener) {
        Objects.requireNonNull(modelId, "Model id is required");
        ProgressListener observer = listener != null ? listener : ProgressListener.NONE;

        if (!loading.compareAndSet(false, true)) {
            log.info("Load rejected, another load is in progress: modelId={}", modelId);
            return false;
        }

        Instant startTime = Instant.now();
        boolean installed = false;
        try {
            synchronized (stateLock) {
                state = LifecycleState.loading(modelId);
                loadInProgress = true;
                lastProgress = "";
            }
            log.info("Loading model: modelId={}", modelId);
            events.loadStarted(modelId);

            generationPermit.acquireUninterruptibly();
            try {
                ProgressListener progress = milestone -> reportProgress(modelId, milestone, observer);
                retireCurrent(progress);

                ModelHandle handle = loader.load(modelId, progress);
                synchronized (stateLock) {
                    lease = new HandleLease(handle);
                    state = LifecycleState.ready(modelId);
                    loadInProgress = false;
                }
                installed = true;
            } catch (ModelLoadException | RuntimeException | OutOfMemoryError e) {
                markFailed(modelId, e, startTime);
            } catch (Error e) {
                markFailed(modelId, e, startTime);
                throw e;
            } finally {
                generationPermit.release();
            }

            if (installed) {
                Duration duration = Duration.between(startTime, Instant.now());
                log.info("Model ready: modelId={}, latencyMs={}", modelId, duration.toMillis());
                events.loadCompleted(modelId, duration);
                persistence.write(modelId);
            }
            return true;
        } finally {
            loading.set(false);
        }
    }

    /**
     * Releases the current model, waiting for a running generation or load
     * to finish first. Clears a failed state. The persistence record is kept.
     * When a load is already waiting for the permit the handle is dropped but
     * the state stays {@code LOADING}: that load runs next.
     */
    public void unload() {
        generationPermit.acquireUninterruptibly();
        try {
            HandleLease previous;
            ModelId previousModel;
            synchronized (stateLock) {
                previous = lease;
                if (previous != null) {
                    previousModel = previous.handle().modelId();
                } else {
                    previousModel = loadInProgress ? null : state.model();
                }
                lease = null;
                if (!loadInProgress) {
                    state = LifecycleState.unloaded();
                    lastProgress = "";
                }
            }
            if (previous != null) {
                previous.retire();
            }
            log.info("Model unloaded: modelId={}", previousModel);
            events.unloaded(previousModel);
        } finally {
            generationPermit.release();
        }
    }

    /**
     * Model recorded by the last successful load, if any. Pure read.
     */
    public Optional<ModelId> lastPersistedModel() {
        return persistence.read();
    }

    /**
     * Generates a full response. Returns an empty string at once when no
     * model is ready, and an empty string when the engine fails.
     */
    public String generate(GenerationRequest request) {
        Objects.requireNonNull(request, "Request is required");
        HandleLease admitted = readyLease();
        if (admitted == null) {
            log.debug("Generation skipped, no model ready: requestId={}", request.requestId());
            return "";
        }

        try {
            generationPermit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Generation interrupted while waiting: requestId={}", request.requestId());
            return "";
        }
        HandleLease held = null;
        try {
            held = leaseIfCurrent(admitted);
            if (held == null) {
                log.debug("Generation skipped, model changed while waiting: requestId={}", request.requestId());
                return "";
            }
            ModelId model = held.handle().modelId();
            Instant startTime = Instant.now();
            Completion completion = engine.complete(held.handle(), request);
            if (completion.failed()) {
                events.generationFailed(model, request.requestId(), "blocking", completion.error());
            } else {
                events.generationCompleted(model, request.requestId(), "blocking",
                        Duration.between(startTime, Instant.now()));
            }
            return completion.text();
        } finally {
            if (held != null) {
                held.release();
            }
            generationPermit.release();
        }
    }

    /**
     * Streams cumulative snapshots of a response. The returned stream is
     * empty when no model is ready; otherwise it waits for the generation
     * permit on its first {@link TokenStream#hasNext()} and holds it until it
     * ends, is closed, or is abandoned.
     */
    public TokenStream streamGenerate(GenerationRequest request) {
        Objects.requireNonNull(request, "Request is required");
        HandleLease admitted = readyLease();
        if (admitted == null) {
            log.debug("Streaming skipped, no model ready: requestId={}", request.requestId());
            return TokenStream.empty();
        }
        return engine.stream(request, new ManagedStreamSession(request.requestId(), admitted));
    }

    /**
     * Streams on the calling thread, handing each snapshot to {@code consumer}.
     *
     * @return the final text, empty if nothing was produced
     */
    public String streamGenerate(GenerationRequest request, Consumer<String> consumer) {
        return streamGenerate(request).drainTo(consumer);
    }

    @Override
    public void close() {
        unload();
    }

    private HandleLease readyLease() {
        synchronized (stateLock) {
            return state.isReady() ? lease : null;
        }
    }

    /**
     * Acquires the installed lease only if it is still the one the caller was
     * admitted with.
     */
    private HandleLease leaseIfCurrent(HandleLease admitted) {
        synchronized (stateLock) {
            if (!state.isReady() || lease == null || lease != admitted) {
                return null;
            }
            return lease.acquire() ? lease : null;
        }
    }

    private void retireCurrent(ProgressListener progress) {
        HandleLease previous;
        synchronized (stateLock) {
            previous = lease;
            lease = null;
        }
        if (previous != null) {
            progress.onProgress(MILESTONE_UNLOADING);
            previous.retire();
        }
    }

    private void reportProgress(ModelId modelId, String milestone, ProgressListener observer) {
        synchronized (stateLock) {
            lastProgress = milestone;
        }
        log.info("Load progress: modelId={}, milestone={}", modelId, milestone);
        events.loadProgress(modelId, milestone);
        try {
            observer.onProgress(milestone);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: modelId={}, milestone={}, error={}", modelId, milestone, e.getMessage());
        }
    }

    private void markFailed(ModelId modelId, Throwable error, Instant startTime) {
        ErrorType errorType = ErrorType.classifyLoadFailure(error);
        String message = error instanceof OutOfMemoryError
                ? "Out of memory while loading " + modelId
                : Objects.requireNonNullElse(error.getMessage(), error.getClass().getSimpleName());
        HandleLease previous;
        synchronized (stateLock) {
            previous = lease;
            lease = null;
            state = LifecycleState.failed(modelId, message);
            loadInProgress = false;
        }
        if (previous != null) {
            previous.retire();
        }
        Duration duration = Duration.between(startTime, Instant.now());
        log.error("Model load failed: modelId={}, errorType={}, latencyMs={}, error={}",
                modelId, errorType, duration.toMillis(), message, error);
        events.loadFailed(modelId, errorType, message, duration);
    }

    /**
     * Ties one token stream to the generation permit and the installed lease.
     */
    private final class ManagedStreamSession implements StreamSession {

        private final String requestId;
        private final HandleLease admitted;
        private final AtomicBoolean permitHeld = new AtomicBoolean(false);
        private final AtomicBoolean leaseHeld = new AtomicBoolean(false);
        private volatile HandleLease held;

        ManagedStreamSession(String requestId, HandleLease admitted) {
            this.requestId = requestId;
            this.admitted = admitted;
        }

        @Override
        public ModelHandle acquire() {
            try {
                generationPermit.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Streaming interrupted while waiting: requestId={}", requestId);
                return null;
            }
            permitHeld.set(true);
            HandleLease acquired = leaseIfCurrent(admitted);
            if (acquired == null) {
                releasePermit();
                log.debug("Streaming skipped, model changed while waiting: requestId={}", requestId);
                return null;
            }
            held = acquired;
            leaseHeld.set(true);
            return acquired.handle();
        }

        @Override
        public void handleReleased() {
            if (leaseHeld.compareAndSet(true, false)) {
                held.release();
            }
        }

        @Override
        public void finished(StreamOutcome outcome, String finalText, Duration elapsed, ErrorType error) {
            releasePermit();
            HandleLease current = held;
            if (current == null) {
                return;
            }
            ModelId model = current.handle().modelId();
            switch (outcome) {
                case COMPLETED -> events.generationCompleted(model, requestId, "streaming", elapsed);
                case FAILED -> events.generationFailed(model, requestId, "streaming", error);
                case ABANDONED -> events.streamAbandoned(model, requestId, elapsed);
                case CLOSED -> log.debug("Stream closed by consumer: requestId={}, chars={}",
                        requestId, finalText.length());
                case UNAVAILABLE -> log.debug("Stream ended without a model: requestId={}", requestId);
            }
        }

        private void releasePermit() {
            if (permitHeld.compareAndSet(true, false)) {
                generationPermit.release();
            }
        }
    }
}
