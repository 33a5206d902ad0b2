package fr.lapetina.advisor.llm.engine.sampler;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Draws from the temperature-scaled softmax distribution over the logits.
 */
public final class CategoricalSampler implements Sampler {

    private final RandomGenerator random;
    private final double temperature;

    public CategoricalSampler(RandomGenerator random, double temperature) {
        if (temperature <= 0 || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("Temperature must be > 0: " + temperature);
        }
        this.random = Objects.requireNonNull(random, "Random generator is required");
        this.temperature = temperature;
    }

    @Override
    public int sample(float[] logits) {
        if (logits.length == 0) {
            throw new IllegalArgumentException("No candidates to sample from");
        }
        // subtract the max for numerical stability
        double max = Double.NEGATIVE_INFINITY;
        for (float logit : logits) {
            max = Math.max(max, logit);
        }
        double[] weights = new double[logits.length];
        double total = 0;
        for (int i = 0; i < logits.length; i++) {
            weights[i] = Math.exp((logits[i] - max) / temperature);
            total += weights[i];
        }

        double draw = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (draw < cumulative) {
                return i;
            }
        }
        return weights.length - 1;
    }

    public double getTemperature() {
        return temperature;
    }
}
