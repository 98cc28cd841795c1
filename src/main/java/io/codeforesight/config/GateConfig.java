package io.codeforesight.config;

import io.codeforesight.model.Category;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Gate thresholds, reasoning backend settings and artifact locations.
 * Loaded from YAML: the bundled default merged with an optional user file.
 */
public class GateConfig {

    private static final String DEFAULT_CONFIG = "/code-foresight.yaml";

    private final Map<String, Object> raw;
    private final Stage1Settings stage1;
    private final Stage2Settings stage2;
    private final Stage3Settings stage3;
    private final ReasoningSettings reasoning;
    private final int fallbackWindowLines;
    private final ArtifactLocations artifacts;

    /**
     * Stage 1 gate settings.
     *
     * @param keepThreshold            minimum classifier probability for a finding to be retained (τ1_keep)
     * @param blockThreshold           confidence at which a high-severity finding blocks (τ1_block)
     * @param blockCategories          categories that can block the gate
     * @param mergePolicy              rule/classifier merge policy
     * @param mergeWeight              rule weight for the weighted-average policy
     * @param workers                  size of the per-snippet worker pool
     * @param maxHitsPerSnippet        cap on hits per rule per snippet
     * @param degradedConfidenceFactor multiplier for classifier confidences on degraded input
     * @param maxExplain               number of findings explained in explain mode
     */
    public record Stage1Settings(
            double keepThreshold,
            double blockThreshold,
            Set<Category> blockCategories,
            MergePolicy mergePolicy,
            double mergeWeight,
            int workers,
            int maxHitsPerSnippet,
            double degradedConfidenceFactor,
            int maxExplain
    ) {
        public Stage1Settings {
            blockCategories = blockCategories.isEmpty() ? Set.of() : Set.copyOf(blockCategories);
        }
    }

    /**
     * Stage 2 gate settings.
     *
     * @param blockThreshold      confidence at which a business-logic finding blocks (τ2_block)
     * @param runWhenStage1Blocks run Stage 2 even when Stage 1 blocked
     * @param granularity         per-snippet or whole-file reasoning requests
     */
    public record Stage2Settings(
            double blockThreshold,
            boolean runWhenStage1Blocks,
            Granularity granularity
    ) {}

    /**
     * Stage 3 forecast settings.
     *
     * @param horizon               steps projected ahead
     * @param trendTolerance        relative change under which the trend is stable
     * @param singlePointConfidence confidence reported when no history is available
     * @param blockThreshold        score at which Stage 3 blocks; null for report-only
     */
    public record Stage3Settings(
            int horizon,
            double trendTolerance,
            double singlePointConfidence,
            Double blockThreshold
    ) {
        public boolean reportOnly() {
            return blockThreshold == null;
        }
    }

    /**
     * Reasoning backend settings.
     */
    public record ReasoningSettings(
            String endpoint,
            String model,
            String fallbackModel,
            String apiKeyEnv,
            double temperature,
            int maxTokens,
            int attemptTimeoutSeconds,
            int maxAttempts,
            long initialBackoffMillis,
            long maxBackoffMillis,
            int totalBudgetSeconds
    ) {}

    /**
     * Locations of the rule index and model artifacts. "classpath:" prefixes load bundled resources.
     */
    public record ArtifactLocations(String rules, String classifier, String temporal) {}

    /**
     * Per-snippet or whole-file reasoning requests.
     */
    public enum Granularity {
        SNIPPET,
        FILE
    }

    private GateConfig(Map<String, Object> config) throws ConfigException {
        this.raw = config;
        this.stage1 = parseStage1(section(config, "stage1"));
        this.stage2 = parseStage2(section(config, "stage2"));
        this.stage3 = parseStage3(section(config, "stage3"));
        this.reasoning = parseReasoning(section(config, "reasoning"));
        this.fallbackWindowLines = positiveInt(section(config, "normalizer"), "normalizer.fallbackWindowLines",
                "fallbackWindowLines", 40);
        Map<String, Object> artifactSection = section(config, "artifacts");
        this.artifacts = new ArtifactLocations(
                string(artifactSection, "rules", "classpath:/rules.yaml"),
                string(artifactSection, "classifier", "classpath:/models/stage1-classifier.json"),
                string(artifactSection, "temporal", "classpath:/models/stage3-temporal.json"));
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static GateConfig loadDefault() throws ConfigException {
        try (InputStream is = GateConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new ConfigException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new ConfigException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static GateConfig loadFromFile(Path path) throws IOException, ConfigException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public static GateConfig load(InputStream is) throws ConfigException {
        try {
            Yaml yaml = new Yaml();
            Object loaded = yaml.load(is);
            if (loaded == null) {
                return new GateConfig(Map.of());
            }
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new ConfigException("Configuration root must be a mapping");
            }
            return new GateConfig(stringKeys(map));
        } catch (YAMLException e) {
            throw new ConfigException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Merges this configuration with another, with the other taking precedence.
     */
    public GateConfig merge(GateConfig other) throws ConfigException {
        return new GateConfig(deepMerge(this.raw, other.raw));
    }

    /**
     * Returns a copy with one key overridden, e.g. {@code withOverride("stage1", "maxExplain", 5)}.
     */
    public GateConfig withOverride(String section, String key, Object value) throws ConfigException {
        Map<String, Object> override = new HashMap<>();
        override.put(section, Map.of(key, value));
        return new GateConfig(deepMerge(this.raw, override));
    }

    public Stage1Settings stage1() {
        return stage1;
    }

    public Stage2Settings stage2() {
        return stage2;
    }

    public Stage3Settings stage3() {
        return stage3;
    }

    public ReasoningSettings reasoning() {
        return reasoning;
    }

    public int fallbackWindowLines() {
        return fallbackWindowLines;
    }

    public ArtifactLocations artifacts() {
        return artifacts;
    }

    // ---- Parsing ----

    private static Stage1Settings parseStage1(Map<String, Object> s) throws ConfigException {
        Set<Category> blockCategories = EnumSet.noneOf(Category.class);
        for (String label : stringList(s, "blockCategories")) {
            Category category = Category.fromLabel(label);
            if (category == Category.OTHER && !"other".equalsIgnoreCase(label.trim())) {
                throw new ConfigException("stage1.blockCategories: unknown category '" + label + "'");
            }
            blockCategories.add(category);
        }
        if (blockCategories.isEmpty()) {
            blockCategories = EnumSet.of(Category.BUFFER_OVERFLOW, Category.INJECTION,
                    Category.COMMAND_INJECTION, Category.CODE_EXECUTION, Category.DESERIALIZATION);
        }
        int defaultWorkers = Math.max(1, Math.min(8, Runtime.getRuntime().availableProcessors()));
        return new Stage1Settings(
                unit(s, "stage1.keepThreshold", "keepThreshold", 0.6),
                unit(s, "stage1.blockThreshold", "blockThreshold", 0.8),
                blockCategories,
                MergePolicy.parse(string(s, "mergePolicy", "max")),
                unit(s, "stage1.mergeWeight", "mergeWeight", 0.5),
                positiveInt(s, "stage1.workers", "workers", defaultWorkers),
                positiveInt(s, "stage1.maxHitsPerSnippet", "maxHitsPerSnippet", 3),
                unit(s, "stage1.degradedConfidenceFactor", "degradedConfidenceFactor", 0.9),
                positiveInt(s, "stage1.maxExplain", "maxExplain", 3));
    }

    private static Stage2Settings parseStage2(Map<String, Object> s) throws ConfigException {
        String granularity = string(s, "granularity", "snippet");
        Granularity g = switch (granularity.trim().toLowerCase(Locale.ROOT)) {
            case "snippet" -> Granularity.SNIPPET;
            case "file" -> Granularity.FILE;
            default -> throw new ConfigException("stage2.granularity must be 'snippet' or 'file', got " + granularity);
        };
        return new Stage2Settings(
                unit(s, "stage2.blockThreshold", "blockThreshold", 0.7),
                bool(s, "runWhenStage1Blocks", false),
                g);
    }

    private static Stage3Settings parseStage3(Map<String, Object> s) throws ConfigException {
        Double block = s.get("blockThreshold") == null ? null : unit(s, "stage3.blockThreshold", "blockThreshold", 0.5);
        return new Stage3Settings(
                positiveInt(s, "stage3.horizon", "horizon", 3),
                unit(s, "stage3.trendTolerance", "trendTolerance", 0.1),
                unit(s, "stage3.singlePointConfidence", "singlePointConfidence", 0.2),
                block);
    }

    private static ReasoningSettings parseReasoning(Map<String, Object> s) throws ConfigException {
        double temperature = number(s, "reasoning.temperature", "temperature", 0.2);
        if (temperature < 0 || temperature > 2) {
            throw new ConfigException("reasoning.temperature must be in [0,2], got " + temperature);
        }
        long initialBackoff = positiveInt(s, "reasoning.initialBackoffMillis", "initialBackoffMillis", 500);
        long maxBackoff = positiveInt(s, "reasoning.maxBackoffMillis", "maxBackoffMillis", 8000);
        if (maxBackoff < initialBackoff) {
            throw new ConfigException("reasoning.maxBackoffMillis must be >= initialBackoffMillis");
        }
        return new ReasoningSettings(
                string(s, "endpoint", "https://api.groq.com/openai/v1/chat/completions"),
                string(s, "model", "openai/gpt-oss-120b"),
                string(s, "fallbackModel", "llama-3.1-8b-instant"),
                string(s, "apiKeyEnv", "GROQ_API_KEY"),
                temperature,
                positiveInt(s, "reasoning.maxTokens", "maxTokens", 500),
                positiveInt(s, "reasoning.attemptTimeoutSeconds", "attemptTimeoutSeconds", 60),
                positiveInt(s, "reasoning.maxAttempts", "maxAttempts", 3),
                initialBackoff,
                maxBackoff,
                positiveInt(s, "reasoning.totalBudgetSeconds", "totalBudgetSeconds", 180));
    }

    // ---- Value helpers ----

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> config, String key) throws ConfigException {
        Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return stringKeys(map);
        }
        throw new ConfigException("'" + key + "' must be a mapping");
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static String string(Map<String, Object> s, String key, String defaultValue) {
        Object value = s.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    private static boolean bool(Map<String, Object> s, String key, boolean defaultValue) {
        Object value = s.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value == null ? defaultValue : Boolean.parseBoolean(String.valueOf(value));
    }

    private static double number(Map<String, Object> s, String path, String key, double defaultValue)
            throws ConfigException {
        Object value = s.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new ConfigException(path + " must be a number, got '" + value + "'");
        }
    }

    private static double unit(Map<String, Object> s, String path, String key, double defaultValue)
            throws ConfigException {
        double value = number(s, path, key, defaultValue);
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigException(path + " must be in [0,1], got " + value);
        }
        return value;
    }

    private static int positiveInt(Map<String, Object> s, String path, String key, int defaultValue)
            throws ConfigException {
        double value = number(s, path, key, defaultValue);
        if (value < 1 || value != Math.rint(value)) {
            throw new ConfigException(path + " must be a positive integer, got " + value);
        }
        return (int) value;
    }

    private static List<String> stringList(Map<String, Object> s, String key) {
        Object value = s.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
        }
        return result;
    }

    private static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> merged = new HashMap<>(base);
        override.forEach((key, value) -> {
            Object existing = merged.get(key);
            if (existing instanceof Map<?, ?> a && value instanceof Map<?, ?> b) {
                merged.put(key, deepMerge(stringKeys(a), stringKeys(b)));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }
}
