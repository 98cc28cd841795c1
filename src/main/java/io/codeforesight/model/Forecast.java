package io.codeforesight.model;

import java.util.List;

/**
 * Stage 3 output: forecast risk score and trend.
 *
 * @param score              Forecast risk in [0,1]
 * @param trend              Direction over the horizon
 * @param confidence         Confidence of the estimate in [0,1]
 * @param horizon            Steps projected ahead
 * @param singlePoint        True when no history was supplied
 * @param currentLoad        Risk load of the current run
 * @param projectedLoad      Projected risk load at the horizon
 * @param historyLength      Number of historical points used
 * @param timeline           Timeline bucket ("3-6 months"), null when the model has none
 * @param timelineConfidence Confidence of the timeline bucket
 * @param factors            Human-readable factors that shaped the forecast
 * @param likelyWeaknesses   Trending weaknesses not already observed in the input
 * @param modelVersion       Version of the temporal model used
 * @param explanation        Risk level, rationale and prevention advice; null unless explain mode is on
 */
public record Forecast(
        double score,
        Trend trend,
        double confidence,
        int horizon,
        boolean singlePoint,
        double currentLoad,
        double projectedLoad,
        int historyLength,
        String timeline,
        double timelineConfidence,
        List<String> factors,
        List<LikelyWeakness> likelyWeaknesses,
        String modelVersion,
        String explanation
) {
    /**
     * A weakness class trending in recent vulnerability data.
     */
    public record LikelyWeakness(
            String cweId,
            String name,
            Category category,
            int count,
            String reference
    ) {}

    public Forecast {
        InvariantViolationException.requireUnitInterval(score, "forecast score");
        InvariantViolationException.requireUnitInterval(confidence, "forecast confidence");
        InvariantViolationException.requireUnitInterval(timelineConfidence, "timeline confidence");
        if (trend == null) {
            throw new IllegalArgumentException("trend cannot be null");
        }
        factors = factors == null ? List.of() : List.copyOf(factors);
        likelyWeaknesses = likelyWeaknesses == null ? List.of() : List.copyOf(likelyWeaknesses);
    }

    public Forecast withExplanation(String explanation) {
        return new Forecast(score, trend, confidence, horizon, singlePoint, currentLoad, projectedLoad,
                historyLength, timeline, timelineConfidence, factors, likelyWeaknesses, modelVersion, explanation);
    }
}
