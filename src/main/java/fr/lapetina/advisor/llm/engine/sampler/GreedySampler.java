package fr.lapetina.advisor.llm.engine.sampler;

/**
 * Argmax sampler. Ties resolve to the lowest index so decoding is deterministic.
 */
public final class GreedySampler implements Sampler {

    public static final GreedySampler INSTANCE = new GreedySampler();

    private GreedySampler() {
    }

    @Override
    public int sample(float[] logits) {
        if (logits.length == 0) {
            throw new IllegalArgumentException("No candidates to sample from");
        }
        int best = 0;
        for (int i = 1; i < logits.length; i++) {
            if (logits[i] > logits[best]) {
                best = i;
            }
        }
        return best;
    }
}
