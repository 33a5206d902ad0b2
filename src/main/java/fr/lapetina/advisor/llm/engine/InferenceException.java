package fr.lapetina.advisor.llm.engine;

/**
 * Fault raised by an inference engine while generating.
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
