package io.codeforesight.model;

import java.util.Comparator;
import java.util.Optional;

/**
 * A single detected flaw.
 *
 * @param id           Run-unique id ("S1-0003"); null until the stage assigns ids
 * @param stage        Stage that emitted the finding
 * @param category     Vulnerability or flaw class
 * @param cweId        CWE id, if known
 * @param file         Source file (unit id)
 * @param lineStart    1-based first line
 * @param lineEnd      1-based last line, inclusive
 * @param confidence   Confidence in [0,1]
 * @param severity     Severity of the flaw
 * @param rationale    Natural-language rationale (reasoning results, explain mode)
 * @param detector     Strategy that produced the finding
 * @param ruleId       Id of the matching rule or model label
 * @param remediation  Recommended fix
 * @param functionName Enclosing function, if resolvable
 * @param evidence     Source line or excerpt that triggered the finding
 */
public record Finding(
        String id,
        Stage stage,
        Category category,
        String cweId,
        String file,
        int lineStart,
        int lineEnd,
        double confidence,
        Severity severity,
        String rationale,
        DetectionSource detector,
        String ruleId,
        String remediation,
        String functionName,
        String evidence
) {
    /**
     * Deterministic report order: location first, then category, then tie-breakers.
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::file)
            .thenComparingInt(Finding::lineStart)
            .thenComparingInt(Finding::lineEnd)
            .thenComparing(f -> f.category().id())
            .thenComparing(f -> f.ruleId() == null ? "" : f.ruleId())
            .thenComparing(f -> f.detector().id())
            .thenComparing(Finding::confidence, Comparator.reverseOrder())
            .thenComparing(f -> f.evidence() == null ? "" : f.evidence())
            .thenComparing(f -> f.rationale() == null ? "" : f.rationale());

    public Finding {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
        if (lineStart < 0 || lineEnd < lineStart) {
            throw new IllegalArgumentException("invalid line range " + lineStart + "-" + lineEnd);
        }
        InvariantViolationException.requireUnitInterval(confidence, "finding confidence");
        if (severity == null) {
            severity = category.defaultSeverity();
        }
        if (detector == null) {
            throw new IllegalArgumentException("detector cannot be null");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy carrying the given id.
     */
    public Finding withId(String newId) {
        return toBuilder().id(newId).build();
    }

    /**
     * Returns a copy carrying the given rationale.
     */
    public Finding withRationale(String newRationale) {
        return toBuilder().rationale(newRationale).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .stage(stage)
                .category(category)
                .cweId(cweId)
                .file(file)
                .lines(lineStart, lineEnd)
                .confidence(confidence)
                .severity(severity)
                .rationale(rationale)
                .detector(detector)
                .ruleId(ruleId)
                .remediation(remediation)
                .functionName(functionName)
                .evidence(evidence);
    }

    public Optional<String> rationaleText() {
        return Optional.ofNullable(rationale);
    }

    /**
     * Returns a display-friendly location string.
     */
    public String location() {
        if (lineStart == lineEnd) {
            return file + ":" + lineStart;
        }
        return file + ":" + lineStart + "-" + lineEnd;
    }

    /**
     * True when both findings cover the same category and one line range contains the other.
     */
    public boolean overlaps(Finding other) {
        return file.equals(other.file)
                && category == other.category
                && lineStart <= other.lineEnd
                && other.lineStart <= lineEnd;
    }

    public static class Builder {
        private String id;
        private Stage stage;
        private Category category;
        private String cweId;
        private String file;
        private int lineStart;
        private int lineEnd;
        private double confidence;
        private Severity severity;
        private String rationale;
        private DetectionSource detector;
        private String ruleId;
        private String remediation;
        private String functionName;
        private String evidence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder category(Category category) {
            this.category = category;
            return this;
        }

        public Builder cweId(String cweId) {
            this.cweId = cweId;
            return this;
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder lines(int lineStart, int lineEnd) {
            this.lineStart = lineStart;
            this.lineEnd = lineEnd;
            return this;
        }

        public Builder line(int line) {
            return lines(line, line);
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder detector(DetectionSource detector) {
            this.detector = detector;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder remediation(String remediation) {
            this.remediation = remediation;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder evidence(String evidence) {
            this.evidence = evidence;
            return this;
        }

        public Finding build() {
            return new Finding(
                    id,
                    stage,
                    category,
                    cweId,
                    file,
                    lineStart,
                    lineEnd,
                    confidence,
                    severity,
                    rationale,
                    detector,
                    ruleId,
                    remediation,
                    functionName,
                    evidence
            );
        }
    }
}
