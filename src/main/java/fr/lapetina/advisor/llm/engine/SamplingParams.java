package fr.lapetina.advisor.llm.engine;

import fr.lapetina.advisor.llm.engine.sampler.Sampler;

/**
 * Decoding parameters for one generation.
 *
 * @param temperature  0 for greedy decoding, > 0 for categorical sampling
 * @param maxNewTokens upper bound on produced tokens
 * @param seed         random seed used when sampling
 */
public record SamplingParams(double temperature, int maxNewTokens, long seed) {

    public SamplingParams {
        if (temperature < 0) {
            throw new IllegalArgumentException("Temperature must be >= 0: " + temperature);
        }
        if (maxNewTokens <= 0) {
            throw new IllegalArgumentException("maxNewTokens must be > 0: " + maxNewTokens);
        }
    }

    public Sampler newSampler() {
        return Sampler.create(temperature, seed);
    }
}
