package io.codeforesight.detectors;

import io.codeforesight.model.DetectionSource;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.rules.DetectionRule;
import io.codeforesight.rules.RuleIndex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Evaluates the rule index against a snippet. Deterministic: one finding per matching line,
 * at most {@code maxHitsPerSnippet} per rule.
 */
public class RuleStrategy implements DetectionStrategy {

    private static final int MAX_EVIDENCE = 200;

    private final List<DetectionRule> rules;
    private final int maxHitsPerSnippet;

    public RuleStrategy(RuleIndex index, int maxHitsPerSnippet) {
        this.rules = index.rulesFor(Stage.STAGE1);
        this.maxHitsPerSnippet = maxHitsPerSnippet;
    }

    @Override
    public String id() {
        return "rules";
    }

    @Override
    public String description() {
        return "Matches curated known-vulnerability patterns";
    }

    @Override
    public List<Finding> analyze(SourceUnit unit, Snippet snippet) {
        List<Finding> findings = new ArrayList<>();
        String text = snippet.text();
        String[] lines = text.split("\n", -1);

        for (DetectionRule rule : rules) {
            Set<Integer> hitLines = new HashSet<>();
            Matcher m = rule.pattern().matcher(text);
            while (m.find() && hitLines.size() < maxHitsPerSnippet) {
                int relative = lineOffset(text, m.start());
                String line = lines[relative];
                if (rule.suppresses(line) || !hitLines.add(relative)) {
                    continue;
                }
                findings.add(Finding.builder()
                        .stage(Stage.STAGE1)
                        .category(rule.category())
                        .cweId(rule.cweId())
                        .file(unit.id())
                        .line(snippet.startLine() + relative)
                        .confidence(rule.confidence())
                        .severity(rule.severity())
                        .detector(DetectionSource.RULE)
                        .ruleId(rule.id())
                        .remediation(rule.remediation())
                        .functionName(snippet.functionName())
                        .evidence(evidence(line))
                        .build());
            }
        }
        return findings;
    }

    private static int lineOffset(String text, int index) {
        int count = 0;
        for (int i = 0; i < index; i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    static String evidence(String line) {
        String trimmed = line.strip();
        return trimmed.length() > MAX_EVIDENCE ? trimmed.substring(0, MAX_EVIDENCE) + "..." : trimmed;
    }
}
