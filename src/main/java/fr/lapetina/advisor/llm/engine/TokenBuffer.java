package fr.lapetina.advisor.llm.engine;

import java.util.Arrays;

/**
 * Growable array of token ids. Not thread-safe.
 */
final class TokenBuffer {

    private int[] tokens = new int[64];
    private int size;

    void add(int token) {
        if (size == tokens.length) {
            tokens = Arrays.copyOf(tokens, size * 2);
        }
        tokens[size++] = token;
    }

    int size() {
        return size;
    }

    /**
     * Backing array; only the first {@link #size()} entries are meaningful.
     */
    int[] array() {
        return tokens;
    }
}
