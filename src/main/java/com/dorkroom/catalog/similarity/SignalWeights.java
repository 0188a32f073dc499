package com.dorkroom.catalog.similarity;

/**
 * Weights of the five signals in a composite fuzzy score.
 */
public record SignalWeights(
        double orderInsensitiveWeight,
        double substringWeight,
        double rawWeight,
        double setWeight,
        double secondarySubstringWeight
) {
    public SignalWeights {
        if (orderInsensitiveWeight < 0 || substringWeight < 0 || rawWeight < 0
                || setWeight < 0 || secondarySubstringWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = orderInsensitiveWeight + substringWeight + rawWeight + setWeight + secondarySubstringWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: 0.30 / 0.25 / 0.20 / 0.15 / 0.10, favouring the primary text.
     */
    public static SignalWeights defaultWeights() {
        return new SignalWeights(0.30, 0.25, 0.20, 0.15, 0.10);
    }
}
