package io.codeforesight.stages;

import io.codeforesight.artifacts.TemporalModel;
import io.codeforesight.artifacts.TemporalModel.TimelineEstimate;
import io.codeforesight.artifacts.TemporalModel.TrendingWeakness;
import io.codeforesight.config.GateConfig.Stage3Settings;
import io.codeforesight.model.Category;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Forecast;
import io.codeforesight.model.Severity;
import io.codeforesight.model.Stage;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.TrajectoryPoint;
import io.codeforesight.model.Trend;
import io.codeforesight.model.Verdict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stage 3: forecasts the risk trend of the code base.
 * <p>
 * The current risk load is the severity-weighted confidence sum of the Stage 1 and Stage 2
 * findings. Appended to the caller's history it is projected {@code horizon} steps ahead by
 * the temporal model. Without history the forecast is a single-point estimate with low
 * confidence and a stable trend. Report-only unless a block threshold is configured.
 */
public class Stage3Forecaster {

    private static final int MAX_LIKELY_WEAKNESSES = 5;
    private static final double FULL_HISTORY_CONFIDENCE = 0.8;

    private final TemporalModel model;
    private final Stage3Settings settings;

    public Stage3Forecaster(TemporalModel model, Stage3Settings settings) {
        this.model = model;
        this.settings = settings;
    }

    public StageReport run(List<Finding> observed, List<TrajectoryPoint> history) {
        return run(observed, history, null);
    }

    /**
     * Runs the forecast and, when an explainer is given, attaches its explanation. The
     * explanation never changes the score or the verdict.
     */
    public StageReport run(List<Finding> observed, List<TrajectoryPoint> history, ForecastExplainer explainer) {
        Forecast forecast = forecast(observed, history);
        if (explainer != null) {
            forecast = forecast.withExplanation(explainer.explain(forecast));
        }
        Double threshold = settings.blockThreshold();
        if (threshold != null && forecast.score() >= threshold) {
            String reason = String.format(Locale.ROOT, "Forecast risk %.2f (%s) reaches block threshold %.2f",
                    forecast.score(), forecast.trend().id(), threshold);
            return new StageReport(Stage.STAGE3, Verdict.BLOCK, List.of(), reason, false, forecast);
        }
        String reason = settings.reportOnly() ? "Report-only forecast" : null;
        return new StageReport(Stage.STAGE3, Verdict.PASS, List.of(), reason, false, forecast);
    }

    public Forecast forecast(List<Finding> observed, List<TrajectoryPoint> history) {
        double current = riskLoad(observed);
        List<TrajectoryPoint> points = chronological(history);
        List<String> factors = new ArrayList<>();
        factors.add(String.format(Locale.ROOT, "Current risk load %.2f from %d finding(s)", current, observed.size()));
        topCategory(observed).ifPresent(factors::add);

        boolean singlePoint = points.isEmpty();
        double projected;
        double confidence;
        Trend trend;
        double change;
        if (singlePoint) {
            projected = current;
            confidence = settings.singlePointConfidence();
            trend = Trend.STABLE;
            change = 0.0;
            factors.add("No history supplied; single-point estimate");
        } else {
            List<Double> series = new ArrayList<>();
            points.forEach(p -> series.add(p.riskLoad()));
            series.add(current);
            projected = model.project(series, settings.horizon());
            change = (projected - current) / Math.max(current, 1.0);
            trend = change > settings.trendTolerance() ? Trend.INCREASING
                    : change < -settings.trendTolerance() ? Trend.DECREASING
                    : Trend.STABLE;
            double coverage = Math.min(1.0, (double) points.size() / model.window());
            double base = settings.singlePointConfidence();
            confidence = base + (Math.max(base, FULL_HISTORY_CONFIDENCE) - base) * coverage;
            factors.add(String.format(Locale.ROOT, "History of %d point(s), window %d", points.size(), model.window()));
            factors.add(String.format(Locale.ROOT, "Projected load %.2f in %d step(s) (%+.0f%%)",
                    projected, settings.horizon(), change * 100));
        }

        double score = model.normalize(projected);
        TimelineEstimate timeline = model.timeline(score, change).orElse(null);

        return new Forecast(
                score,
                trend,
                confidence,
                settings.horizon(),
                singlePoint,
                current,
                projected,
                points.size(),
                timeline != null ? timeline.label() : null,
                timeline != null ? timeline.confidence() : 0.0,
                factors,
                likelyWeaknesses(observed),
                model.modelVersion(),
                null);
    }

    /**
     * Severity-weighted confidence sum.
     */
    static double riskLoad(List<Finding> findings) {
        return findings.stream()
                .mapToDouble(f -> f.confidence() * severityWeight(f.severity()))
                .sum();
    }

    static double severityWeight(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 4.0;
            case HIGH -> 3.0;
            case MEDIUM -> 2.0;
            case LOW -> 1.0;
            case INFO -> 0.5;
        };
    }

    /**
     * Timestamped histories are sorted by time; otherwise the given order is kept.
     */
    private static List<TrajectoryPoint> chronological(List<TrajectoryPoint> history) {
        if (history == null) {
            return List.of();
        }
        if (history.stream().allMatch(p -> p.timestamp() != null)) {
            return history.stream().sorted(Comparator.comparing(TrajectoryPoint::timestamp)).toList();
        }
        return List.copyOf(history);
    }

    private static Optional<String> topCategory(List<Finding> observed) {
        Map<Category, Long> counts = observed.stream()
                .collect(Collectors.groupingBy(Finding::category, Collectors.counting()));
        return counts.entrySet().stream()
                .max(Map.Entry.<Category, Long>comparingByValue().thenComparing(e -> e.getKey().id(), Comparator.reverseOrder()))
                .map(e -> "Dominant category: " + e.getKey().id() + " (" + e.getValue() + " finding(s))");
    }

    private List<Forecast.LikelyWeakness> likelyWeaknesses(List<Finding> observed) {
        Set<String> seen = observed.stream()
                .map(Finding::cweId)
                .filter(c -> c != null)
                .map(c -> c.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<Forecast.LikelyWeakness> result = new ArrayList<>();
        for (TrendingWeakness w : model.trendingWeaknesses()) {
            if (seen.contains(w.cweId().toUpperCase(Locale.ROOT))) {
                continue;
            }
            result.add(new Forecast.LikelyWeakness(w.cweId(), w.name(), Category.fromCwe(w.cweId()), w.count(),
                    reference(w.cweId())));
            if (result.size() == MAX_LIKELY_WEAKNESSES) {
                break;
            }
        }
        return result;
    }

    static String reference(String cweId) {
        String number = cweId.replaceAll("[^0-9]", "");
        return "https://cwe.mitre.org/data/definitions/" + number + ".html";
    }
}
