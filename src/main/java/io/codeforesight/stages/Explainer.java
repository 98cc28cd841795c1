package io.codeforesight.stages;

import io.codeforesight.model.Category;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.reasoning.PromptTemplate;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ReasoningFinding;
import io.codeforesight.reasoning.ReasoningRequest;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches natural-language rationale to the most severe Stage 1 findings. Falls back to
 * per-CWE templates when the reasoning backend fails. Never changes a confidence or a verdict.
 */
public class Explainer {

    private static final Map<String, String> CWE_TEMPLATES = Map.of(
            "CWE-120", "Potential buffer overflow. Avoid unbounded copy functions and add bounds checks.",
            "CWE-805", "Copy length comes from the source, not the destination. Bound it by the buffer size.",
            "CWE-78", "Command injection risk. Use safe process APIs and validate inputs.",
            "CWE-89", "SQL injection risk. Use parameterized queries and input validation.",
            "CWE-79", "XSS risk. Encode output and avoid raw HTML injection.",
            "CWE-22", "Path traversal risk. Normalize paths and enforce allowlists.",
            "CWE-502", "Unsafe deserialization. Avoid deserializing untrusted data.",
            "CWE-95", "Dynamic code evaluation. Never evaluate strings derived from input.",
            "CWE-798", "Hard-coded credential. Move secrets to the environment or a secret store.");

    private static final String GENERIC_TEMPLATE =
            "Potential security weakness. Review input handling and apply the recommended remediation.";

    private final ReasoningClient client;
    private final int maxExplain;

    public Explainer(ReasoningClient client, int maxExplain) {
        this.client = client;
        this.maxExplain = maxExplain;
    }

    /**
     * Returns the findings with rationale attached to at most {@code maxExplain} of them,
     * chosen by severity then confidence. Order and everything else are preserved.
     */
    public List<Finding> explain(List<Finding> findings, Map<String, SourceUnit> units) {
        Set<String> selected = new HashSet<>();
        findings.stream()
                .filter(f -> f.rationale() == null)
                .sorted(Comparator.comparing((Finding f) -> f.severity().rank())
                        .thenComparing(Finding::confidence, Comparator.reverseOrder())
                        .thenComparing(Finding.REPORT_ORDER))
                .limit(maxExplain)
                .forEach(f -> selected.add(f.id()));

        Map<String, String> rationales = new HashMap<>();
        boolean warned = false;
        for (Finding finding : findings) {
            if (!selected.contains(finding.id())) {
                continue;
            }
            String text;
            try {
                text = ask(finding, units.get(finding.file()));
            } catch (ReasoningServiceException e) {
                if (!warned) {
                    System.err.println("Warning: explanations unavailable (" + e.kind().id() + ": "
                            + e.getMessage() + "); using template explanations");
                    warned = true;
                }
                text = null;
            }
            rationales.put(finding.id(), text != null ? text : template(finding));
        }

        List<Finding> result = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            String rationale = rationales.get(finding.id());
            result.add(rationale != null ? finding.withRationale(rationale) : finding);
        }
        return result;
    }

    private String ask(Finding finding, SourceUnit unit) throws ReasoningServiceException {
        Snippet snippet = enclosing(finding, unit);
        ReasoningRequest request = new ReasoningRequest(snippet, "", PromptTemplate.EXPLAIN, List.of(finding));
        List<ReasoningFinding> answers = client.analyze(request).findings();
        ReasoningFinding match = answers.stream()
                .filter(a -> finding.id().equals(a.issue()))
                .findFirst()
                .orElse(answers.isEmpty() ? null : answers.get(0));
        if (match == null || match.rationale() == null) {
            return null;
        }
        return match.fix() == null ? match.rationale() : match.rationale() + " Fix: " + match.fix();
    }

    private static Snippet enclosing(Finding finding, SourceUnit unit) {
        if (unit != null) {
            for (Snippet s : unit.snippets()) {
                if (s.containsLine(finding.lineStart())) {
                    return s;
                }
            }
        }
        String text = finding.evidence() != null ? finding.evidence() : "";
        return new Snippet(finding.file(), 0, text.length(), finding.lineStart(), finding.lineStart(), text,
                finding.functionName());
    }

    /**
     * Template explanation for a finding, by CWE then by category.
     */
    static String template(Finding finding) {
        if (finding.cweId() != null && CWE_TEMPLATES.containsKey(finding.cweId())) {
            return CWE_TEMPLATES.get(finding.cweId());
        }
        Category category = finding.category();
        String primary = category.primaryCwe();
        if (primary != null && CWE_TEMPLATES.containsKey(primary)) {
            return CWE_TEMPLATES.get(primary);
        }
        return GENERIC_TEMPLATE;
    }
}
