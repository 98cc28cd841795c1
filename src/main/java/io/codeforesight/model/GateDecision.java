package io.codeforesight.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Terminal output of a run: the three stage reports plus the aggregated verdict.
 *
 * @param runId            Id of the run that produced the decision
 * @param inputs           Ids of the analyzed source units
 * @param modes            Mode options the run was configured with, in sorted order
 * @param stage1           Stage 1 report
 * @param stage2           Stage 2 report
 * @param stage3           Stage 3 report
 * @param overallVerdict   Aggregated verdict
 * @param exitStatus       Exit status for CI callers
 * @param artifactVersions Versions of the rule index and model artifacts used, in load order
 * @param startTime        When the run started
 * @param duration         How long the run took
 */
public record GateDecision(
        String runId,
        List<String> inputs,
        Set<String> modes,
        StageReport stage1,
        StageReport stage2,
        StageReport stage3,
        Verdict overallVerdict,
        ExitStatus exitStatus,
        Map<String, String> artifactVersions,
        Instant startTime,
        Duration duration
) {
    public GateDecision {
        if (stage1 == null || stage2 == null || stage3 == null) {
            throw new IllegalArgumentException("all three stage reports are required");
        }
        if (stage1.stage() != Stage.STAGE1 || stage2.stage() != Stage.STAGE2 || stage3.stage() != Stage.STAGE3) {
            throw new InvariantViolationException("stage reports out of order");
        }
        if (overallVerdict == null || exitStatus == null) {
            throw new IllegalArgumentException("overallVerdict and exitStatus are required");
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        // modes iterate sorted, versions in insertion order
        modes = modes == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(new TreeSet<>(modes));
        artifactVersions = artifactVersions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(artifactVersions));
    }

    public List<StageReport> stageReports() {
        return List.of(stage1, stage2, stage3);
    }

    public StageReport report(Stage stage) {
        return switch (stage) {
            case STAGE1 -> stage1;
            case STAGE2 -> stage2;
            case STAGE3 -> stage3;
        };
    }

    public int totalFindings() {
        return stage1.totalFindings() + stage2.totalFindings() + stage3.totalFindings();
    }

    public long durationMs() {
        return duration != null ? duration.toMillis() : 0;
    }
}
