package io.codeforesight.reasoning;

import java.util.Locale;
import java.util.Optional;

/**
 * One structured result returned by the reasoning backend, before it is turned into a finding.
 *
 * @param issue      Short name of the issue (for explanations, the id of the explained finding)
 * @param severity   "low", "medium" or "high"
 * @param line       Absolute line the backend points at, if any
 * @param snippet    Offending code line as quoted by the backend
 * @param fix        Suggested fix
 * @param rationale  Why the code is risky
 * @param confidence Numeric confidence in [0,1], if the backend gave one
 * @param cwe        CWE id, if the backend gave one
 */
public record ReasoningFinding(
        String issue,
        String severity,
        Integer line,
        String snippet,
        String fix,
        String rationale,
        Double confidence,
        String cwe
) {
    public Optional<Integer> lineNumber() {
        return Optional.ofNullable(line);
    }

    public Optional<Double> confidenceValue() {
        return Optional.ofNullable(confidence);
    }

    /**
     * All free text of this result, lower-cased, for keyword filtering.
     */
    public String searchableText() {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{issue, rationale, fix}) {
            if (part != null) {
                sb.append(part.toLowerCase(Locale.ROOT)).append(' ');
            }
        }
        return sb.toString();
    }
}
