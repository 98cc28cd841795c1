package io.codeforesight.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of one gate.
 *
 * @param stage    Stage this report belongs to
 * @param verdict  Gate verdict
 * @param findings Findings in report order
 * @param reason   Why the stage was skipped, indeterminate or blocked; null on a plain pass
 * @param degraded True if any analyzed unit fell back to a lexical scan
 * @param forecast Stage 3 forecast, null for other stages or when skipped
 */
public record StageReport(
        Stage stage,
        Verdict verdict,
        List<Finding> findings,
        String reason,
        boolean degraded,
        Forecast forecast
) {
    public StageReport {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        if (findings == null) {
            findings = List.of();
        } else {
            List<Finding> sorted = new ArrayList<>(findings);
            sorted.sort(Finding.REPORT_ORDER);
            findings = List.copyOf(sorted);
        }
        for (Finding f : findings) {
            if (f.stage() != stage) {
                throw new InvariantViolationException(
                        "finding " + f.id() + " of " + f.stage() + " placed in " + stage + " report");
            }
        }
    }

    /**
     * Report for a stage that did not run.
     */
    public static StageReport skipped(Stage stage, String reason) {
        return new StageReport(stage, Verdict.SKIPPED, List.of(), reason, false, null);
    }

    public boolean isSkipped() {
        return verdict == Verdict.SKIPPED;
    }

    public Optional<Forecast> forecastResult() {
        return Optional.ofNullable(forecast);
    }

    public Map<Category, Long> findingCountsByCategory() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::category, Collectors.counting()));
    }

    public Map<Severity, List<Finding>> findingsBySeverity() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::severity));
    }

    public int totalFindings() {
        return findings.size();
    }
}
