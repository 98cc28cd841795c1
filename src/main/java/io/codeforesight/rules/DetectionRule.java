package io.codeforesight.rules;

import io.codeforesight.model.Category;
import io.codeforesight.model.Severity;
import io.codeforesight.model.Stage;

import java.util.regex.Pattern;

/**
 * One curated detection rule.
 *
 * @param id          Stable rule id ("S1-UNBOUNDED-COPY")
 * @param name        Human-readable name
 * @param category    Category of findings this rule emits
 * @param cweId       CWE id of the weakness
 * @param severity    Severity of findings this rule emits
 * @param stage       Owning stage
 * @param pattern     Matcher evaluated against snippet text
 * @param suppressIf  Optional pattern; a match is dropped when its line also matches this
 * @param confidence  Baseline confidence in [0,1] of findings from this rule
 * @param remediation Recommended fix
 */
public record DetectionRule(
        String id,
        String name,
        Category category,
        String cweId,
        Severity severity,
        Stage stage,
        Pattern pattern,
        Pattern suppressIf,
        double confidence,
        String remediation
) {
    public DetectionRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id cannot be null or blank");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("rule " + id + " has no pattern");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("rule " + id + " confidence must be in [0,1]");
        }
        if (category == null) {
            category = Category.OTHER;
        }
        if (severity == null) {
            severity = category.defaultSeverity();
        }
        if (stage == null) {
            stage = Stage.STAGE1;
        }
    }

    /**
     * True if a match on the given line should be dropped.
     */
    public boolean suppresses(String line) {
        return suppressIf != null && suppressIf.matcher(line).find();
    }
}
