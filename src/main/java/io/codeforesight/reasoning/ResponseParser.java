package io.codeforesight.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts structured findings from a model completion. Models wrap JSON in prose or code
 * fences and leave trailing commas, so the first balanced-looking object is cut out and
 * cleaned before parsing.
 */
public final class ResponseParser {

    private static final Pattern FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a completion into findings.
     *
     * @throws ReasoningServiceException of kind MALFORMED if no JSON object can be read
     */
    public List<ReasoningFinding> parse(String content) throws ReasoningServiceException {
        if (content == null || content.isBlank()) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.MALFORMED, "Empty completion");
        }
        String json = extractObject(content);
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.MALFORMED,
                    "Completion is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode items = root.path("findings");
        if (items.isMissingNode() || items.isNull()) {
            return List.of();
        }
        if (!items.isArray()) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.MALFORMED,
                    "'findings' is not an array");
        }
        List<ReasoningFinding> findings = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isObject()) {
                findings.add(toFinding(item));
            }
        }
        return findings;
    }

    static String extractObject(String content) throws ReasoningServiceException {
        String text = FENCE.matcher(content).replaceAll("").trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.MALFORMED,
                    "No JSON object in completion");
        }
        return TRAILING_COMMA.matcher(text.substring(start, end + 1)).replaceAll("$1");
    }

    private static ReasoningFinding toFinding(JsonNode item) {
        return new ReasoningFinding(
                text(item, "issue"),
                text(item, "severity"),
                line(item.path("line")),
                text(item, "snippet"),
                text(item, "fix"),
                text(item, "rationale"),
                confidence(item.path("confidence")),
                text(item, "cwe"));
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static Integer line(JsonNode node) {
        if (node.isInt() || node.isLong()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            String digits = node.asText().replaceAll("[^0-9].*$", "");
            if (!digits.isEmpty() && digits.length() < 10) {
                return Integer.parseInt(digits);
            }
        }
        return null;
    }

    private static Double confidence(JsonNode node) {
        if (!node.isNumber()) {
            return null;
        }
        // 0 is the schema placeholder, not an answer
        double value = node.asDouble();
        return value > 0.0 && value <= 1.0 ? value : null;
    }
}
