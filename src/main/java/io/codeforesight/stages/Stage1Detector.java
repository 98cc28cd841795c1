package io.codeforesight.stages;

import io.codeforesight.artifacts.AnalysisArtifacts;
import io.codeforesight.config.GateConfig.Stage1Settings;
import io.codeforesight.config.ModeConfiguration;
import io.codeforesight.detectors.StrategyRegistry;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.Verdict;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Stage 1: known vulnerabilities.
 * <p>
 * Rules and classifier run per snippet on a fixed worker pool and are merged per snippet.
 * The gate blocks when a finding in a blocking category reaches the block threshold.
 * In llm-only mode the snippets go to the reasoning backend instead; a backend failure
 * makes the stage indeterminate.
 */
public class Stage1Detector {

    private final AnalysisArtifacts artifacts;
    private final Stage1Settings settings;
    private final FindingMerger merger;

    public Stage1Detector(AnalysisArtifacts artifacts, Stage1Settings settings) {
        this.artifacts = artifacts;
        this.settings = settings;
        this.merger = new FindingMerger(settings.mergePolicy(), settings.mergeWeight());
    }

    /**
     * Runs the stage.
     *
     * @param reasoning backend for llm-only and explain modes
     */
    public StageReport run(List<SourceUnit> units, ModeConfiguration mode, RunContext ctx, ReasoningClient reasoning) {
        boolean degraded = units.stream().anyMatch(SourceUnit::degraded);
        List<Finding> findings;
        String failure = null;

        if (mode.llmOnly()) {
            LlmResult result = runLlm(units, reasoning);
            findings = result.findings();
            failure = result.failure();
        } else {
            findings = detect(units);
        }

        findings = ctx.assignIds(Stage.STAGE1, findings);
        if (mode.explain() && !findings.isEmpty()) {
            Map<String, SourceUnit> byId = new LinkedHashMap<>();
            units.forEach(u -> byId.put(u.id(), u));
            findings = new Explainer(reasoning, settings.maxExplain()).explain(findings, byId);
        }

        List<Finding> blocking = blocking(findings);
        if (!blocking.isEmpty()) {
            return new StageReport(Stage.STAGE1, Verdict.BLOCK, findings, blockReason(blocking), degraded, null);
        }
        if (failure != null) {
            return new StageReport(Stage.STAGE1, Verdict.INDETERMINATE, findings, failure, degraded, null);
        }
        return new StageReport(Stage.STAGE1, Verdict.PASS, findings, null, degraded, null);
    }

    /**
     * Rule and classifier findings for all snippets, without ids and without gating.
     */
    public List<Finding> detect(List<SourceUnit> units) {
        StrategyRegistry registry = StrategyRegistry.createDefault(artifacts, settings);
        List<Callable<List<Finding>>> tasks = new ArrayList<>();
        for (SourceUnit unit : units) {
            for (Snippet snippet : unit.snippets()) {
                tasks.add(() -> {
                    List<List<Finding>> results = registry.runAll(unit, snippet);
                    return merger.merge(results.get(0), results.get(1));
                });
            }
        }
        if (tasks.isEmpty()) {
            return List.of();
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(settings.workers(), tasks.size()));
        try {
            List<Finding> all = new ArrayList<>();
            for (Future<List<Finding>> future : pool.invokeAll(tasks)) {
                all.addAll(future.get());
            }
            return all;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Stage 1 interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Stage 1 detection failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private record LlmResult(List<Finding> findings, String failure) {}

    private LlmResult runLlm(List<SourceUnit> units, ReasoningClient reasoning) {
        StrategyRegistry registry = StrategyRegistry.llmOnly(reasoning);
        List<Finding> findings = new ArrayList<>();
        int total = units.stream().mapToInt(u -> u.snippets().size()).sum();
        int succeeded = 0;
        ReasoningServiceException first = null;
        outer:
        for (SourceUnit unit : units) {
            for (Snippet snippet : unit.snippets()) {
                try {
                    registry.runAll(unit, snippet).forEach(findings::addAll);
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
        return new LlmResult(findings, first == null ? null : failureReason(total - succeeded, total, first));
    }

    static String failureReason(int failed, int total, ReasoningServiceException first) {
        return "Reasoning backend failed for " + failed + " of " + total + " request(s): "
                + first.kind().id() + ": " + first.getMessage();
    }

    private List<Finding> blocking(List<Finding> findings) {
        return findings.stream()
                .filter(f -> settings.blockCategories().contains(f.category()))
                .filter(f -> f.confidence() >= settings.blockThreshold())
                .toList();
    }

    private String blockReason(List<Finding> blocking) {
        return blocking.size() + " finding(s) in blocking categories at confidence >= "
                + String.format(Locale.ROOT, "%.2f", settings.blockThreshold()) + ": "
                + blocking.stream().map(f -> f.id() + " " + f.category().id() + " at " + f.location())
                .collect(Collectors.joining(", "));
    }
}
