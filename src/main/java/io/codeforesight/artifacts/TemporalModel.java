package io.codeforesight.artifacts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Trained Stage 3 artifact: a ridge-fitted linear autoregression over a fixed window of
 * risk loads, min/max bounds for normalisation, an optional timeline classifier and the
 * weakness classes trending in recent vulnerability data.
 */
public final class TemporalModel {

    public static final int FORMAT_VERSION = 1;

    /**
     * A weakness class and how often it appeared in the training window.
     */
    public record TrendingWeakness(String cweId, String name, int count) {}

    /**
     * Timeline bucket and its probability.
     */
    public record TimelineEstimate(String label, double confidence) {}

    /**
     * Logistic timeline classifier over the features "score" and "change".
     */
    record TimelineClassifier(String soonLabel, String laterLabel, double bias, Map<String, Double> weights) {

        TimelineEstimate estimate(double score, double change) {
            double z = bias
                    + weights.getOrDefault("score", 0.0) * score
                    + weights.getOrDefault("change", 0.0) * change;
            double soon = 1.0 / (1.0 + Math.exp(-z));
            return soon >= 0.5
                    ? new TimelineEstimate(soonLabel, soon)
                    : new TimelineEstimate(laterLabel, 1.0 - soon);
        }
    }

    private final String modelVersion;
    private final double[] coefficients;
    private final double intercept;
    private final double minLoad;
    private final double maxLoad;
    private final TimelineClassifier timeline;
    private final List<TrendingWeakness> trending;

    TemporalModel(String modelVersion, double[] coefficients, double intercept, double minLoad, double maxLoad,
                  TimelineClassifier timeline, List<TrendingWeakness> trending) {
        this.modelVersion = modelVersion;
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.minLoad = minLoad;
        this.maxLoad = maxLoad;
        this.timeline = timeline;
        this.trending = trending.stream()
                .sorted(Comparator.comparingInt(TrendingWeakness::count).reversed()
                        .thenComparing(TrendingWeakness::cweId))
                .toList();
    }

    public static TemporalModel load(String location) throws ModelLoadException {
        try (InputStream is = ArtifactSource.open(location)) {
            return load(is, location);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read temporal model " + location, e);
        }
    }

    public static TemporalModel load(InputStream is, String origin) throws ModelLoadException {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(is);
        } catch (JsonProcessingException e) {
            throw new ModelLoadException("Malformed temporal model " + origin + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read temporal model " + origin, e);
        }
        if (root == null || !root.isObject()) {
            throw new ModelLoadException("Temporal model " + origin + " is not a JSON object");
        }
        int format = root.path("formatVersion").asInt(-1);
        if (format != FORMAT_VERSION) {
            throw new ModelLoadException("Temporal model " + origin + " has formatVersion " + format
                    + ", expected " + FORMAT_VERSION);
        }

        JsonNode coef = root.path("coefficients");
        int window = root.path("window").asInt(coef.size());
        if (window < 1 || coef.size() != window) {
            throw new ModelLoadException("Temporal model " + origin + " declares window " + window
                    + " but has " + coef.size() + " coefficients");
        }
        double[] coefficients = new double[window];
        for (int i = 0; i < window; i++) {
            coefficients[i] = coef.get(i).asDouble();
        }
        double minLoad = root.path("minLoad").asDouble(0.0);
        double maxLoad = root.path("maxLoad").asDouble(Double.NaN);
        if (Double.isNaN(maxLoad) || maxLoad <= minLoad) {
            throw new ModelLoadException("Temporal model " + origin + " needs maxLoad > minLoad");
        }

        TimelineClassifier timeline = null;
        JsonNode t = root.path("timeline");
        if (t.isObject()) {
            JsonNode labels = t.path("labels");
            if (labels.size() != 2) {
                throw new ModelLoadException("Temporal model " + origin + " timeline needs exactly two labels");
            }
            Map<String, Double> weights = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = t.path("weights").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> w = it.next();
                weights.put(w.getKey(), w.getValue().asDouble());
            }
            timeline = new TimelineClassifier(labels.get(0).asText(), labels.get(1).asText(),
                    t.path("bias").asDouble(0.0), Map.copyOf(weights));
        }

        List<TrendingWeakness> trending = new ArrayList<>();
        for (JsonNode w : root.path("trendingWeaknesses")) {
            String cwe = w.path("cweId").asText(null);
            if (cwe == null || cwe.isBlank()) {
                throw new ModelLoadException("Temporal model " + origin + " has a trending weakness without cweId");
            }
            trending.add(new TrendingWeakness(cwe, w.path("name").asText(cwe), w.path("count").asInt(0)));
        }

        return new TemporalModel(root.path("modelVersion").asText("unversioned"), coefficients,
                root.path("intercept").asDouble(0.0), minLoad, maxLoad, timeline, trending);
    }

    public int window() {
        return coefficients.length;
    }

    /**
     * Projects the series {@code horizon} steps ahead. Series shorter than the window are
     * padded on the left with their first value; projections never go below zero.
     *
     * @param series risk loads in chronological order, current run last; must not be empty
     */
    public double project(List<Double> series, int horizon) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("series cannot be empty");
        }
        int window = window();
        List<Double> values = new ArrayList<>();
        for (int i = series.size(); i < window; i++) {
            values.add(series.get(0));
        }
        values.addAll(series);

        double next = values.get(values.size() - 1);
        for (int step = 0; step < horizon; step++) {
            int base = values.size() - window;
            next = intercept;
            for (int i = 0; i < window; i++) {
                next += coefficients[i] * values.get(base + i);
            }
            next = Math.max(0.0, next);
            values.add(next);
        }
        return next;
    }

    /**
     * Maps a risk load to [0,1] with the model's min/max bounds.
     */
    public double normalize(double load) {
        double score = (load - minLoad) / (maxLoad - minLoad);
        return Math.max(0.0, Math.min(1.0, score));
    }

    public Optional<TimelineEstimate> timeline(double score, double change) {
        return timeline == null ? Optional.empty() : Optional.of(timeline.estimate(score, change));
    }

    /**
     * Trending weaknesses, most frequent first.
     */
    public List<TrendingWeakness> trendingWeaknesses() {
        return trending;
    }

    public String modelVersion() {
        return modelVersion;
    }
}
