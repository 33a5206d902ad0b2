package fr.lapetina.advisor.llm.lifecycle;

import fr.lapetina.advisor.llm.engine.ModelHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Reference-counted ownership of an installed {@link ModelHandle}.
 *
 * The handle is closed exactly once, when it has been retired by the
 * lifecycle manager and no generation holds it any more. A retired lease
 * refuses new holders.
 */
final class HandleLease {

    private static final Logger log = LoggerFactory.getLogger(HandleLease.class);

    private final ModelHandle handle;
    private int holders;
    private boolean retired;
    private boolean closed;

    HandleLease(ModelHandle handle) {
        this.handle = Objects.requireNonNull(handle, "Handle is required");
    }

    ModelHandle handle() {
        return handle;
    }

    /**
     * @return {@code false} if the lease is retired
     */
    synchronized boolean acquire() {
        if (retired) {
            return false;
        }
        holders++;
        return true;
    }

    void release() {
        boolean closeNow;
        synchronized (this) {
            if (holders == 0) {
                throw new IllegalStateException("Lease released more often than acquired");
            }
            holders--;
            closeNow = shouldClose();
        }
        if (closeNow) {
            closeHandle();
        }
    }

    /**
     * Marks the handle for disposal; closes it now if nobody holds it.
     */
    void retire() {
        boolean closeNow;
        synchronized (this) {
            retired = true;
            closeNow = shouldClose();
        }
        if (closeNow) {
            closeHandle();
        }
    }

    synchronized int holders() {
        return holders;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    private boolean shouldClose() {
        if (retired && holders == 0 && !closed) {
            closed = true;
            return true;
        }
        return false;
    }

    private void closeHandle() {
        try {
            handle.close();
            log.info("Model handle released: modelId={}", handle.modelId());
        } catch (RuntimeException e) {
            log.warn("Failed to release model handle: modelId={}, error={}", handle.modelId(), e.getMessage(), e);
        }
    }
}
