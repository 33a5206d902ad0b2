package fr.lapetina.advisor.llm.lifecycle;

import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.engine.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs model loads off the caller's thread, one at a time.
 *
 * Used by the HTTP layer, which answers immediately and lets clients poll
 * the status, and at startup to resume the last persisted model.
 */
public final class BackgroundLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundLoader.class);

    private final ModelLifecycleManager manager;
    private final ExecutorService executor;
    private final AtomicBoolean pending = new AtomicBoolean(false);

    public BackgroundLoader(ModelLifecycleManager manager) {
        this.manager = Objects.requireNonNull(manager, "Lifecycle manager is required");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "model-loader");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts loading {@code modelId} unless a load is already queued or running.
     *
     * @return the future of {@link ModelLifecycleManager#load}, or empty if busy
     */
    public Optional<CompletableFuture<Boolean>> submit(ModelId modelId, ProgressListener listener) {
        Objects.requireNonNull(modelId, "Model id is required");
        if (manager.isLoading() || !pending.compareAndSet(false, true)) {
            log.info("Background load rejected, loader busy: modelId={}", modelId);
            return Optional.empty();
        }
        try {
            CompletableFuture<Boolean> future = CompletableFuture.supplyAsync(() -> {
                try {
                    return manager.load(modelId, listener);
                } finally {
                    pending.set(false);
                }
            }, executor);
            log.info("Background load submitted: modelId={}", modelId);
            return Optional.of(future);
        } catch (RejectedExecutionException e) {
            pending.set(false);
            log.warn("Background load rejected, loader shut down: modelId={}", modelId);
            return Optional.empty();
        }
    }

    /**
     * Loads the model recorded by the last successful load, or
     * {@code fallback} when nothing was recorded.
     *
     * @param fallback model to load on a first start, may be {@code null}
     * @return the submitted load, or empty if there is nothing to resume or the loader is busy
     */
    public Optional<CompletableFuture<Boolean>> resumeLastModel(ModelId fallback) {
        Optional<ModelId> last = manager.lastPersistedModel();
        if (last.isPresent()) {
            log.info("Resuming persisted model: modelId={}", last.get());
            return submit(last.get(), ProgressListener.NONE);
        }
        if (fallback == null) {
            log.info("No model to resume");
            return Optional.empty();
        }
        log.info("No persisted model, loading default: modelId={}", fallback);
        return submit(fallback, ProgressListener.NONE);
    }

    public boolean isBusy() {
        return pending.get() || manager.isLoading();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Model loader did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
