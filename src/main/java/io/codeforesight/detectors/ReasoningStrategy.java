package io.codeforesight.detectors;

import io.codeforesight.model.Category;
import io.codeforesight.model.DetectionSource;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Severity;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.reasoning.PromptTemplate;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ReasoningFinding;
import io.codeforesight.reasoning.ReasoningRequest;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Sends a snippet with line numbers and the signatures of its sibling functions to the
 * reasoning backend and turns each structured result into a finding.
 * <p>
 * Returned line numbers are clamped into the snippet. Without a numeric confidence the
 * confidence is derived from severity.
 */
public class ReasoningStrategy implements DetectionStrategy {

    /**
     * Terms marking classic signature issues, which belong to Stage 1.
     */
    static final List<String> SIGNATURE_TERMS = List.of(
            "sql", "xss", "injection", "overflow", "buffer", "memory", "uninitialized",
            "leak", "use-after", "uaf", "format string", "csrf", "ssrf");

    private final ReasoningClient client;
    private final PromptTemplate template;
    private final Stage stage;

    public ReasoningStrategy(ReasoningClient client, PromptTemplate template, Stage stage) {
        this.client = client;
        this.template = template;
        this.stage = stage;
    }

    /**
     * Stage 2: business-logic and unknown flaws.
     */
    public static ReasoningStrategy businessLogic(ReasoningClient client) {
        return new ReasoningStrategy(client, PromptTemplate.BUSINESS_LOGIC, Stage.STAGE2);
    }

    /**
     * Stage 1 in llm-only mode: known vulnerabilities.
     */
    public static ReasoningStrategy knownVulnerabilities(ReasoningClient client) {
        return new ReasoningStrategy(client, PromptTemplate.KNOWN_VULNERABILITY, Stage.STAGE1);
    }

    @Override
    public String id() {
        return "reasoning-" + template.id();
    }

    @Override
    public String description() {
        return "Asks the reasoning backend (" + client.name() + ") for " + template.id() + " issues";
    }

    @Override
    public List<Finding> analyze(SourceUnit unit, Snippet snippet) throws ReasoningServiceException {
        ReasoningRequest request = new ReasoningRequest(snippet, context(unit, snippet), template);
        List<Finding> findings = new ArrayList<>();
        for (ReasoningFinding result : client.analyze(request).findings()) {
            if (stage == Stage.STAGE2 && isSignatureIssue(result)) {
                continue;
            }
            findings.add(toFinding(unit, snippet, result));
        }
        return findings;
    }

    static boolean isSignatureIssue(ReasoningFinding result) {
        String text = result.searchableText();
        return SIGNATURE_TERMS.stream().anyMatch(text::contains);
    }

    /**
     * Signatures of the other functions in the unit, one per line.
     */
    static String context(SourceUnit unit, Snippet snippet) {
        return unit.snippets().stream()
                .filter(s -> s.functionName() != null && s.startOffset() != snippet.startOffset())
                .map(s -> s.text().lines().findFirst().orElse(s.functionName()).strip())
                .collect(Collectors.joining("\n"));
    }

    private Finding toFinding(SourceUnit unit, Snippet snippet, ReasoningFinding result) {
        Severity severity = Severity.parse(result.severity());
        int lineStart;
        int lineEnd;
        if (result.line() == null || result.line() <= 0) {
            lineStart = snippet.startLine();
            lineEnd = snippet.endLine();
        } else {
            lineStart = Math.max(snippet.startLine(), Math.min(snippet.endLine(), result.line()));
            lineEnd = lineStart;
        }
        Category category = stage == Stage.STAGE2 ? Category.BUSINESS_LOGIC : categorize(result);
        String cwe = result.cwe() != null ? result.cwe().toUpperCase(Locale.ROOT) : category.primaryCwe();

        return Finding.builder()
                .stage(stage)
                .category(category)
                .cweId(cwe)
                .file(unit.id())
                .lines(lineStart, lineEnd)
                .confidence(result.confidenceValue().orElse(confidenceFor(severity)))
                .severity(severity)
                .rationale(rationale(result))
                .detector(DetectionSource.REASONING)
                .remediation(result.fix())
                .functionName(snippet.functionName())
                .evidence(result.snippet() != null ? RuleStrategy.evidence(result.snippet()) : lineText(snippet, lineStart))
                .build();
    }

    /**
     * Confidence assumed when the backend gives none.
     */
    static double confidenceFor(Severity severity) {
        return switch (severity) {
            case CRITICAL, HIGH -> 0.8;
            case MEDIUM -> 0.6;
            case LOW, INFO -> 0.4;
        };
    }

    private static Category categorize(ReasoningFinding result) {
        Category byCwe = Category.fromCwe(result.cwe());
        if (byCwe != Category.OTHER) {
            return byCwe;
        }
        String text = result.searchableText();
        if (text.contains("sql") || text.contains("query")) {
            return Category.INJECTION;
        }
        if (text.contains("command") || text.contains("shell")) {
            return Category.COMMAND_INJECTION;
        }
        if (text.contains("overflow") || text.contains("buffer") || text.contains("bounds")) {
            return Category.BUFFER_OVERFLOW;
        }
        if (text.contains("xss") || text.contains("html") || text.contains("script")) {
            return Category.XSS;
        }
        if (text.contains("deserializ")) {
            return Category.DESERIALIZATION;
        }
        if (text.contains("eval")) {
            return Category.CODE_EXECUTION;
        }
        if (text.contains("path") || text.contains("traversal")) {
            return Category.PATH_TRAVERSAL;
        }
        if (text.contains("password") || text.contains("credential") || text.contains("secret")) {
            return Category.CREDENTIALS;
        }
        return Category.fromLabel(result.issue());
    }

    private static String rationale(ReasoningFinding result) {
        if (result.issue() == null) {
            return result.rationale();
        }
        return result.rationale() == null ? result.issue() : result.issue() + ": " + result.rationale();
    }

    private static String lineText(Snippet snippet, int line) {
        String[] lines = snippet.text().split("\n", -1);
        int index = line - snippet.startLine();
        return index >= 0 && index < lines.length ? RuleStrategy.evidence(lines[index]) : "";
    }
}
