package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.domain.model.ErrorType;

import java.time.Duration;

/**
 * Binds a {@link TokenStream} to whoever owns the model handle.
 *
 * The three callbacks are each invoked at most once, in this order:
 * {@link #acquire()} on the consumer thread at the first pull,
 * {@link #handleReleased()} on the producer thread when it stops touching
 * the handle, {@link #finished} on the consumer thread when iteration ends.
 * {@code handleReleased} and {@code finished} may race when a stream is
 * abandoned.
 */
public interface StreamSession {

    /**
     * Obtains exclusive use of the current handle, blocking while another
     * generation or a load holds it.
     *
     * @return the handle, or {@code null} when no model is ready
     */
    ModelHandle acquire();

    /**
     * The producer no longer uses the handle returned by {@link #acquire()}.
     */
    void handleReleased();

    /**
     * Iteration is over.
     *
     * @param outcome   how the stream ended
     * @param finalText last snapshot yielded, empty if none
     * @param elapsed   time since the handle was acquired
     * @param error     failure classification for {@link StreamOutcome#FAILED}, otherwise {@code null}
     */
    void finished(StreamOutcome outcome, String finalText, Duration elapsed, ErrorType error);
}
