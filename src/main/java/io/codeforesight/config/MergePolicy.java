package io.codeforesight.config;

import java.util.Locale;

/**
 * How a rule finding and a classifier finding on the same location and category are combined.
 */
public enum MergePolicy {
    /**
     * Keep the higher of the two confidences.
     */
    MAX("max"),
    /**
     * Weighted average: {@code weight * rule + (1 - weight) * classifier}.
     */
    WEIGHTED_AVERAGE("weighted-average");

    private final String id;

    MergePolicy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Combines the two confidences.
     *
     * @param ruleConfidence       confidence of the rule finding
     * @param classifierConfidence confidence of the classifier finding
     * @param ruleWeight           weight of the rule confidence, used by WEIGHTED_AVERAGE only
     */
    public double merge(double ruleConfidence, double classifierConfidence, double ruleWeight) {
        return switch (this) {
            case MAX -> Math.max(ruleConfidence, classifierConfidence);
            case WEIGHTED_AVERAGE -> ruleWeight * ruleConfidence + (1.0 - ruleWeight) * classifierConfidence;
        };
    }

    public static MergePolicy parse(String value) throws ConfigException {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (v) {
            case "max", "max-confidence" -> MAX;
            case "weighted-average", "weighted", "average" -> WEIGHTED_AVERAGE;
            default -> throw new ConfigException("Unknown merge policy: " + value);
        };
    }
}
