package fr.lapetina.advisor.llm.engine;

/**
 * How a {@link TokenStream} ended.
 */
public enum StreamOutcome {
    /** The producer reached end of sequence or the token budget */
    COMPLETED,

    /** The engine raised an error; snapshots yielded so far stand */
    FAILED,

    /** The consumer stopped waiting after the abandonment timeout */
    ABANDONED,

    /** The consumer closed the stream before it completed */
    CLOSED,

    /** No model was ready when the stream started */
    UNAVAILABLE
}
