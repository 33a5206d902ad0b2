package fr.lapetina.advisor.llm.engine.sampler;

import java.util.Random;

/**
 * Picks the next token among candidate logits.
 *
 * Samplers carry their own random state and are not thread-safe; one
 * instance is created per generation.
 */
@FunctionalInterface
public interface Sampler {

    /**
     * @param logits unnormalized scores, at least one element
     * @return index of the chosen element in {@code logits}
     */
    int sample(float[] logits);

    /**
     * Greedy decoding for a temperature of 0, categorical sampling otherwise.
     */
    static Sampler create(double temperature, long seed) {
        if (temperature == 0.0) {
            return GreedySampler.INSTANCE;
        }
        return new CategoricalSampler(new Random(seed), temperature);
    }
}
