package io.codeforesight.rules;

import io.codeforesight.artifacts.ArtifactSource;
import io.codeforesight.artifacts.ModelLoadException;
import io.codeforesight.model.Category;
import io.codeforesight.model.Severity;
import io.codeforesight.model.Stage;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Curated, versioned set of detection rules. Loaded once at startup from YAML and
 * shared read-only across runs.
 */
public final class RuleIndex {

    /**
     * Rule file format this build understands.
     */
    public static final int FORMAT_VERSION = 1;

    private final String version;
    private final List<DetectionRule> rules;

    public RuleIndex(String version, List<DetectionRule> rules) {
        this.version = version;
        this.rules = List.copyOf(rules);
    }

    public static RuleIndex load(String location) throws ModelLoadException {
        try (InputStream is = ArtifactSource.open(location)) {
            return load(is, location);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read rule index " + location, e);
        }
    }

    /**
     * Parses a rule index.
     *
     * @throws ModelLoadException on a format version mismatch, a duplicate id or an invalid pattern
     */
    public static RuleIndex load(InputStream is, String origin) throws ModelLoadException {
        Map<String, Object> doc;
        try {
            Object loaded = new Yaml().load(is);
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new ModelLoadException("Rule index " + origin + " is empty or not a mapping");
            }
            doc = stringKeys(map);
        } catch (YAMLException e) {
            throw new ModelLoadException("Malformed rule index " + origin + ": " + e.getMessage(), e);
        }

        Object format = doc.get("formatVersion");
        if (!(format instanceof Number n) || n.intValue() != FORMAT_VERSION) {
            throw new ModelLoadException("Rule index " + origin + " has formatVersion " + format
                    + ", expected " + FORMAT_VERSION);
        }
        String version = String.valueOf(doc.getOrDefault("version", "unversioned"));

        List<DetectionRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        Object list = doc.get("rules");
        if (list instanceof List<?> items) {
            for (Object item : items) {
                if (!(item instanceof Map<?, ?> entry)) {
                    throw new ModelLoadException("Rule index " + origin + " contains a non-mapping rule");
                }
                DetectionRule rule = parseRule(stringKeys(entry), origin);
                if (!ids.add(rule.id())) {
                    throw new ModelLoadException("Duplicate rule id " + rule.id() + " in " + origin);
                }
                rules.add(rule);
            }
        }
        return new RuleIndex(version, rules);
    }

    private static DetectionRule parseRule(Map<String, Object> r, String origin) throws ModelLoadException {
        String id = string(r, "id");
        if (id == null) {
            throw new ModelLoadException("Rule without id in " + origin);
        }
        String category = string(r, "category");
        Category resolved = Category.fromLabel(category);
        if (resolved == Category.OTHER && !"other".equalsIgnoreCase(String.valueOf(category))) {
            throw new ModelLoadException("Rule " + id + " has unknown category '" + category + "'");
        }
        boolean ignoreCase = Boolean.TRUE.equals(r.get("ignoreCase"));
        int flags = ignoreCase ? Pattern.CASE_INSENSITIVE : 0;
        try {
            String suppress = string(r, "suppressIf");
            Object confidence = r.get("confidence");
            return new DetectionRule(
                    id,
                    string(r, "name") != null ? string(r, "name") : id,
                    resolved,
                    string(r, "cwe"),
                    Severity.parse(string(r, "severity")),
                    "stage2".equals(string(r, "stage")) ? Stage.STAGE2 : Stage.STAGE1,
                    Pattern.compile(requirePattern(r, id), flags),
                    suppress != null ? Pattern.compile(suppress, flags) : null,
                    confidence instanceof Number c ? c.doubleValue() : 0.7,
                    string(r, "remediation"));
        } catch (PatternSyntaxException e) {
            throw new ModelLoadException("Rule " + id + " has an invalid pattern: " + e.getDescription(), e);
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException("Rule " + id + " is invalid: " + e.getMessage(), e);
        }
    }

    private static String requirePattern(Map<String, Object> r, String id) throws ModelLoadException {
        String pattern = string(r, "pattern");
        if (pattern == null || pattern.isEmpty()) {
            throw new ModelLoadException("Rule " + id + " has no pattern");
        }
        return pattern;
    }

    private static String string(Map<String, Object> r, String key) {
        Object value = r.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    public String version() {
        return version;
    }

    public List<DetectionRule> rules() {
        return rules;
    }

    public List<DetectionRule> rulesFor(Stage stage) {
        return rules.stream().filter(r -> r.stage() == stage).toList();
    }

    public int size() {
        return rules.size();
    }
}
