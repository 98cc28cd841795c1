package io.codeforesight.gate;

import io.codeforesight.artifacts.AnalysisArtifacts;
import io.codeforesight.config.GateConfig;
import io.codeforesight.config.ModeConfiguration;
import io.codeforesight.model.ExitStatus;
import io.codeforesight.model.Finding;
import io.codeforesight.model.GateDecision;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.TrajectoryPoint;
import io.codeforesight.model.Verdict;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ResilientReasoningClient;
import io.codeforesight.reasoning.Sleeper;
import io.codeforesight.reasoning.TimeBudget;
import io.codeforesight.stages.ForecastExplainer;
import io.codeforesight.stages.RunContext;
import io.codeforesight.stages.Stage1Detector;
import io.codeforesight.stages.Stage2Detector;
import io.codeforesight.stages.Stage3Forecaster;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sequences the three gates for one run and aggregates their reports.
 * <p>
 * {@code READY -> STAGE1_RUNNING -> STAGE2_RUNNING -> STAGE3_RUNNING -> DONE}. A blocking
 * stage ends the run: later stages are skipped with a reason naming it (Stage 2 may be
 * configured to run anyway). Stages the mode does not select are skipped. An indeterminate
 * stage lets the run continue. Each reasoning-backed stage gets its own time budget.
 * <p>
 * Artifacts and configuration are shared read-only; all per-run state lives in a
 * {@link RunContext}, so one orchestrator can serve concurrent runs.
 */
public class GateOrchestrator {

    private final GateConfig config;
    private final AnalysisArtifacts artifacts;
    private final ReasoningClient primary;
    private final ReasoningClient fallback;
    private final Sleeper sleeper;

    /**
     * @param primary  reasoning backend
     * @param fallback backend tried when the primary keeps failing; may be null
     * @param sleeper  waits between reasoning retries
     */
    public GateOrchestrator(GateConfig config, AnalysisArtifacts artifacts,
                            ReasoningClient primary, ReasoningClient fallback, Sleeper sleeper) {
        this.config = config;
        this.artifacts = artifacts;
        this.primary = primary;
        this.fallback = fallback;
        this.sleeper = sleeper;
    }

    public GateDecision run(List<SourceUnit> units, ModeConfiguration mode, List<TrajectoryPoint> history) {
        return run(units, mode, history, new RunContext(), GateListener.NONE);
    }

    public GateDecision run(List<SourceUnit> units, ModeConfiguration mode, List<TrajectoryPoint> history,
                            RunContext ctx, GateListener listener) {
        listener.onTransition(GateState.READY);
        Stage1Detector stage1Detector = new Stage1Detector(artifacts, config.stage1());

        StageReport stage1;
        if (!mode.runs(Stage.STAGE1)) {
            stage1 = StageReport.skipped(Stage.STAGE1, notSelected(mode));
        } else {
            listener.onTransition(GateState.STAGE1_RUNNING);
            try (ResilientReasoningClient reasoning = reasoningClient()) {
                stage1 = stage1Detector.run(units, mode, ctx, reasoning);
            }
            listener.onStageComplete(stage1);
        }
        Stage blockedBy = stage1.verdict() == Verdict.BLOCK ? Stage.STAGE1 : null;

        StageReport stage2;
        if (!mode.runs(Stage.STAGE2)) {
            stage2 = StageReport.skipped(Stage.STAGE2, notSelected(mode));
        } else if (blockedBy != null && !config.stage2().runWhenStage1Blocks()) {
            stage2 = StageReport.skipped(Stage.STAGE2, notReached(blockedBy));
        } else {
            listener.onTransition(GateState.STAGE2_RUNNING);
            try (ResilientReasoningClient reasoning = reasoningClient()) {
                stage2 = new Stage2Detector(config.stage2()).run(units, ctx, reasoning);
            }
            listener.onStageComplete(stage2);
            if (blockedBy == null && stage2.verdict() == Verdict.BLOCK) {
                blockedBy = Stage.STAGE2;
            }
        }

        StageReport stage3;
        if (!mode.runs(Stage.STAGE3)) {
            stage3 = StageReport.skipped(Stage.STAGE3, notSelected(mode));
        } else if (blockedBy != null) {
            stage3 = StageReport.skipped(Stage.STAGE3, notReached(blockedBy));
        } else {
            listener.onTransition(GateState.STAGE3_RUNNING);
            List<Finding> observed = new ArrayList<>();
            if (stage1.isSkipped()) {
                // Stage 3 alone still needs the current risk load
                observed.addAll(stage1Detector.detect(units));
            } else {
                observed.addAll(stage1.findings());
            }
            observed.addAll(stage2.findings());
            Stage3Forecaster forecaster = new Stage3Forecaster(artifacts.temporal(), config.stage3());
            if (mode.explain()) {
                try (ResilientReasoningClient reasoning = reasoningClient()) {
                    stage3 = forecaster.run(observed, history, new ForecastExplainer(reasoning, units));
                }
            } else {
                stage3 = forecaster.run(observed, history);
            }
            listener.onStageComplete(stage3);
        }
        listener.onTransition(GateState.DONE);

        Verdict overall = overallVerdict(List.of(stage1, stage2, stage3));
        return new GateDecision(
                ctx.runId(),
                units.stream().map(SourceUnit::id).toList(),
                mode.optionIds(),
                stage1,
                stage2,
                stage3,
                overall,
                exitStatus(List.of(stage1, stage2, stage3)),
                artifacts.versions(),
                ctx.startTime(),
                Duration.between(ctx.startTime(), Instant.now()));
    }

    /**
     * Block if any stage blocked, else indeterminate if any stage was, else pass.
     */
    static Verdict overallVerdict(List<StageReport> reports) {
        if (reports.stream().anyMatch(r -> r.verdict() == Verdict.BLOCK)) {
            return Verdict.BLOCK;
        }
        if (reports.stream().anyMatch(r -> r.verdict() == Verdict.INDETERMINATE)) {
            return Verdict.INDETERMINATE;
        }
        return Verdict.PASS;
    }

    /**
     * Exit status of the first blocking stage, else indeterminate, else pass.
     */
    static ExitStatus exitStatus(List<StageReport> reports) {
        for (StageReport report : reports) {
            if (report.verdict() == Verdict.BLOCK) {
                return report.stage().blockedStatus();
            }
        }
        if (reports.stream().anyMatch(r -> r.verdict() == Verdict.INDETERMINATE)) {
            return ExitStatus.INDETERMINATE;
        }
        return ExitStatus.PASS;
    }

    private ResilientReasoningClient reasoningClient() {
        GateConfig.ReasoningSettings settings = config.reasoning();
        return new ResilientReasoningClient(primary, fallback, settings, sleeper,
                TimeBudget.of(Duration.ofSeconds(settings.totalBudgetSeconds())));
    }

    private static String notSelected(ModeConfiguration mode) {
        return "Not selected by mode " + mode;
    }

    private static String notReached(Stage blockedBy) {
        return "Not reached: " + blockedBy.id() + " blocked";
    }
}
