package fr.lapetina.advisor.llm.domain.model;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;

/**
 * Error taxonomy for load and generation failures.
 * Used for log classification and metrics tags; failures themselves are
 * reported as lifecycle state or empty results.
 */
public enum ErrorType {
    /** Artifact could not be downloaded into the weight store */
    DOWNLOAD_ERROR,

    /** Artifact is missing, unreadable or corrupt */
    ARTIFACT_ERROR,

    /** Not enough memory to hold the weights */
    OUT_OF_MEMORY,

    /** Inference engine fault during generation */
    ENGINE_ERROR,

    /** Produced tokens could not be decoded */
    DECODE_ERROR,

    /** Streaming consumer gave up waiting for the producer */
    STREAM_ABANDONED,

    /** Internal system error */
    INTERNAL_ERROR;

    /**
     * Classifies a load failure by walking its cause chain.
     */
    public static ErrorType classifyLoadFailure(Throwable ex) {
        boolean io = false;
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof OutOfMemoryError) {
                return OUT_OF_MEMORY;
            }
            if (t instanceof HttpTimeoutException
                    || t instanceof ConnectException
                    || t instanceof UnknownHostException) {
                return DOWNLOAD_ERROR;
            }
            if (t instanceof IOException || t instanceof UncheckedIOException) {
                io = true;
            }
        }
        return io ? ARTIFACT_ERROR : INTERNAL_ERROR;
    }
}
