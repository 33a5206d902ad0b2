package fr.lapetina.advisor.llm.engine.bigram;

/**
 * Sparse next-token logits: for each token id, the candidate successors and
 * their unnormalized scores. Immutable after construction, so concurrent
 * reads need no synchronization.
 */
public final class BigramWeights {

    private static final int[] NO_SUCCESSORS = new int[0];
    private static final float[] NO_LOGITS = new float[0];

    private final int[][] successors;
    private final float[][] logits;

    BigramWeights(int[][] successors, float[][] logits) {
        if (successors.length != logits.length) {
            throw new IllegalArgumentException("Successor and logit tables differ in size");
        }
        for (int i = 0; i < successors.length; i++) {
            if (successors[i] == null) {
                successors[i] = NO_SUCCESSORS;
                logits[i] = NO_LOGITS;
            } else if (successors[i].length != logits[i].length) {
                throw new IllegalArgumentException("Row " + i + " has mismatched successor and logit counts");
            }
        }
        this.successors = successors;
        this.logits = logits;
    }

    public int[] successors(int tokenId) {
        return successors[tokenId];
    }

    public float[] logits(int tokenId) {
        return logits[tokenId];
    }

    public int rows() {
        return successors.length;
    }

    public long transitionCount() {
        long count = 0;
        for (int[] row : successors) {
            count += row.length;
        }
        return count;
    }

    long approximateBytes() {
        return transitionCount() * (Integer.BYTES + Float.BYTES) + 32L * successors.length;
    }
}
