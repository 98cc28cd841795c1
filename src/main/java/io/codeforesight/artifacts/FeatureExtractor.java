package io.codeforesight.artifacts;

import io.codeforesight.model.Snippet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the classifier feature vector of a snippet: a histogram over tracked call sites,
 * bounds-check presence, fixed-size buffers, interpolation markers and snippet length.
 * Counts are clipped so one noisy snippet cannot dominate the score.
 */
public final class FeatureExtractor {

    private static final int COUNT_CLIP = 3;
    private static final int SMALL_BUFFER_BYTES = 16;

    private static final Map<String, Pattern> CALLS = new LinkedHashMap<>();

    static {
        for (String name : List.of("strcpy", "strcat", "sprintf", "vsprintf", "gets", "memcpy", "memmove",
                "strncpy", "snprintf", "system", "popen", "malloc", "free")) {
            CALLS.put("calls." + name, Pattern.compile("\\b" + name + "\\s*\\("));
        }
        CALLS.put("calls.exec", Pattern.compile("\\bexec(?:l|lp|le|v|vp|ve)?\\s*\\("));
        CALLS.put("calls.eval", Pattern.compile("(?<![\\w.])eval\\s*\\("));
    }

    private static final List<Pattern> BOUNDS_CHECKS = List.of(
            Pattern.compile("\\bsizeof\\s*\\("),
            Pattern.compile("\\bsnprintf\\s*\\("),
            Pattern.compile("\\bstrncpy\\s*\\("),
            Pattern.compile("\\bstrlcpy\\s*\\("));

    private static final Pattern STRLEN_SIZED_COPY =
            Pattern.compile("\\b(memcpy|memmove)\\s*\\([^;]*\\bstrlen\\s*\\(");
    private static final Pattern FIXED_BUFFER =
            Pattern.compile("\\bchar\\s+\\w+\\s*\\[\\s*(\\d+)\\s*\\]");
    private static final Pattern SQL_KEYWORD = Pattern.compile(
            "\\b(SELECT\\b[^;\\n]*?\\bFROM|INSERT\\s+INTO|UPDATE\\b[^;\\n]*?\\bSET|DELETE\\s+FROM)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FORMAT_INTERPOLATION = Pattern.compile("%s");
    private static final Pattern CONCAT_INTERPOLATION =
            Pattern.compile("\"\\s*\\+\\s*[A-Za-z_]|[A-Za-z_)]\\s*\\+\\s*\"");
    private static final Pattern MARKUP_TAG = Pattern.compile("\"[^\"\\n]*<[A-Za-z][^<>\"]*>");
    private static final Pattern INNER_HTML = Pattern.compile("\\binnerHTML\\b");

    /**
     * All feature names this extractor produces, in a stable order.
     */
    public static final List<String> FEATURE_NAMES;

    static {
        List<String> names = new ArrayList<>(CALLS.keySet());
        names.addAll(List.of("bounds_check", "strlen_sized_copy", "fixed_buffers", "small_buffer",
                "min_buffer_ratio", "sql_keyword", "format_interpolation", "concat_interpolation",
                "markup_tag", "inner_html", "length"));
        FEATURE_NAMES = Collections.unmodifiableList(names);
    }

    public FeatureVector extract(Snippet snippet) {
        String text = snippet.text();
        Map<String, Double> values = new LinkedHashMap<>();

        CALLS.forEach((name, pattern) -> values.put(name, clipped(count(pattern, text))));

        boolean bounded = BOUNDS_CHECKS.stream().anyMatch(p -> p.matcher(text).find());
        values.put("bounds_check", bounded ? 1.0 : 0.0);
        values.put("strlen_sized_copy", STRLEN_SIZED_COPY.matcher(text).find() ? 1.0 : 0.0);

        int buffers = 0;
        int smallest = Integer.MAX_VALUE;
        Matcher m = FIXED_BUFFER.matcher(text);
        while (m.find()) {
            buffers++;
            smallest = Math.min(smallest, parseSize(m.group(1)));
        }
        values.put("fixed_buffers", clipped(buffers));
        values.put("small_buffer", buffers > 0 && smallest <= SMALL_BUFFER_BYTES ? 1.0 : 0.0);
        values.put("min_buffer_ratio", buffers > 0 ? Math.min(1.0, smallest / 256.0) : 0.0);

        values.put("sql_keyword", SQL_KEYWORD.matcher(text).find() ? 1.0 : 0.0);
        values.put("format_interpolation", clipped(count(FORMAT_INTERPOLATION, text)));
        values.put("concat_interpolation", clipped(count(CONCAT_INTERPOLATION, text)));
        values.put("markup_tag", MARKUP_TAG.matcher(text).find() ? 1.0 : 0.0);
        values.put("inner_html", INNER_HTML.matcher(text).find() ? 1.0 : 0.0);

        int lines = snippet.endLine() - snippet.startLine() + 1;
        values.put("length", Math.min(1.0, lines / 100.0));
        return new FeatureVector(values);
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    private static double clipped(int count) {
        return Math.min(count, COUNT_CLIP);
    }

    private static int parseSize(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
