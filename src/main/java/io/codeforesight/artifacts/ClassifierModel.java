package io.codeforesight.artifacts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.codeforesight.model.Category;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trained Stage 1 classifier: one-vs-rest logistic scoring per category over
 * {@link FeatureExtractor} features. Immutable and shared across runs.
 */
public final class ClassifierModel {

    public static final int FORMAT_VERSION = 1;

    /**
     * Logistic weights of one category.
     */
    public record CategoryWeights(double bias, Map<String, Double> weights) {
        public CategoryWeights {
            weights = Map.copyOf(weights);
        }

        double probability(FeatureVector features) {
            double z = bias;
            for (Map.Entry<String, Double> w : weights.entrySet()) {
                z += w.getValue() * features.get(w.getKey());
            }
            return 1.0 / (1.0 + Math.exp(-z));
        }
    }

    private final String modelVersion;
    private final Map<Category, CategoryWeights> classes;

    public ClassifierModel(String modelVersion, Map<Category, CategoryWeights> classes) {
        this.modelVersion = modelVersion;
        this.classes = Collections.unmodifiableMap(new EnumMap<>(classes));
    }

    public static ClassifierModel load(String location) throws ModelLoadException {
        try (InputStream is = ArtifactSource.open(location)) {
            return load(is, location);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read classifier model " + location, e);
        }
    }

    /**
     * Parses a classifier artifact.
     *
     * @throws ModelLoadException on a format mismatch, an unknown category or an unknown feature
     */
    public static ClassifierModel load(InputStream is, String origin) throws ModelLoadException {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(is);
        } catch (JsonProcessingException e) {
            throw new ModelLoadException("Malformed classifier model " + origin + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read classifier model " + origin, e);
        }
        if (root == null || !root.isObject()) {
            throw new ModelLoadException("Classifier model " + origin + " is not a JSON object");
        }
        int format = root.path("formatVersion").asInt(-1);
        if (format != FORMAT_VERSION) {
            throw new ModelLoadException("Classifier model " + origin + " has formatVersion " + format
                    + ", expected " + FORMAT_VERSION);
        }

        List<String> features = new ArrayList<>();
        root.path("features").forEach(n -> features.add(n.asText()));
        for (String feature : features) {
            if (!FeatureExtractor.FEATURE_NAMES.contains(feature)) {
                throw new ModelLoadException("Classifier model " + origin + " uses unknown feature '" + feature + "'");
            }
        }

        Map<Category, CategoryWeights> classes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("classes").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            Category category = Category.fromLabel(entry.getKey());
            if (category == Category.OTHER) {
                throw new ModelLoadException("Classifier model " + origin + " has unknown class '"
                        + entry.getKey() + "'");
            }
            Map<String, Double> weights = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> ws = entry.getValue().path("weights").fields();
            while (ws.hasNext()) {
                Map.Entry<String, JsonNode> w = ws.next();
                if (!features.contains(w.getKey())) {
                    throw new ModelLoadException("Classifier class " + entry.getKey()
                            + " weights undeclared feature '" + w.getKey() + "'");
                }
                weights.put(w.getKey(), w.getValue().asDouble());
            }
            classes.put(category, new CategoryWeights(entry.getValue().path("bias").asDouble(0.0), weights));
        }
        if (classes.isEmpty()) {
            throw new ModelLoadException("Classifier model " + origin + " declares no classes");
        }
        return new ClassifierModel(root.path("modelVersion").asText("unversioned"), classes);
    }

    /**
     * Probability per category, in category order.
     */
    public Map<Category, Double> score(FeatureVector features) {
        Map<Category, Double> result = new EnumMap<>(Category.class);
        classes.forEach((category, weights) -> result.put(category, weights.probability(features)));
        return result;
    }

    public String modelVersion() {
        return modelVersion;
    }

    public Map<Category, CategoryWeights> classes() {
        return classes;
    }
}
