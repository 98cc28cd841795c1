package io.codeforesight.stages;

import io.codeforesight.config.GateConfig.Granularity;
import io.codeforesight.config.GateConfig.Stage2Settings;
import io.codeforesight.detectors.ReasoningStrategy;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.Verdict;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Stage 2: business-logic and unknown flaws found by semantic reasoning.
 * <p>
 * A failed backend call never yields a pass: the stage becomes indeterminate, keeping the
 * findings of the calls that succeeded.
 */
public class Stage2Detector {

    private final Stage2Settings settings;

    public Stage2Detector(Stage2Settings settings) {
        this.settings = settings;
    }

    public StageReport run(List<SourceUnit> units, RunContext ctx, ReasoningClient reasoning) {
        ReasoningStrategy strategy = ReasoningStrategy.businessLogic(reasoning);
        boolean degraded = units.stream().anyMatch(SourceUnit::degraded);

        List<Finding> findings = new ArrayList<>();
        int total = units.stream().mapToInt(u -> targets(u).size()).sum();
        int succeeded = 0;
        ReasoningServiceException first = null;
        outer:
        for (SourceUnit unit : units) {
            for (Snippet target : targets(unit)) {
                try {
                    findings.addAll(strategy.analyze(unit, target));
                    succeeded++;
                } catch (ReasoningServiceException e) {
                    if (first == null) {
                        first = e;
                    }
                    if (!e.kind().isRetryable()) {
                        break outer;
                    }
                }
            }
        }

        findings = ctx.assignIds(Stage.STAGE2, findings);
        List<Finding> blocking = findings.stream()
                .filter(f -> f.confidence() >= settings.blockThreshold())
                .toList();
        String failure = first == null ? null
                : Stage1Detector.failureReason(total - succeeded, total, first);

        if (!blocking.isEmpty()) {
            String reason = blocking.size() + " business-logic finding(s) at confidence >= "
                    + String.format(Locale.ROOT, "%.2f", settings.blockThreshold()) + ": "
                    + blocking.stream().map(f -> f.id() + " at " + f.location()).collect(Collectors.joining(", "))
                    + (failure != null ? "; " + failure : "");
            return new StageReport(Stage.STAGE2, Verdict.BLOCK, findings, reason, degraded, null);
        }
        if (failure != null) {
            return new StageReport(Stage.STAGE2, Verdict.INDETERMINATE, findings, failure, degraded, null);
        }
        return new StageReport(Stage.STAGE2, Verdict.PASS, findings, null, degraded, null);
    }

    /**
     * Per-snippet requests, or one whole-file request for degraded units and file granularity.
     */
    List<Snippet> targets(SourceUnit unit) {
        if (unit.isEmpty()) {
            return List.of();
        }
        if (unit.degraded() || settings.granularity() == Granularity.FILE) {
            String text = unit.text();
            return List.of(new Snippet(unit.id(), 0, text.length(), 1, Math.max(1, unit.lineCount()), text, null));
        }
        return unit.snippets();
    }
}
