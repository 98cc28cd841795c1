package io.codeforesight.artifacts;

import java.util.Map;

/**
 * Named numeric features of one snippet.
 */
public record FeatureVector(Map<String, Double> values) {

    public FeatureVector {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    /**
     * Returns the value of a feature, 0 when absent.
     */
    public double get(String name) {
        return values.getOrDefault(name, 0.0);
    }
}
