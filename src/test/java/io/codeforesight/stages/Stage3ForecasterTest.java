package io.codeforesight.stages;

import io.codeforesight.artifacts.TemporalModel;
import io.codeforesight.config.GateConfig;
import io.codeforesight.model.Category;
import io.codeforesight.model.DetectionSource;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Forecast;
import io.codeforesight.model.Severity;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.model.Stage;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.TrajectoryPoint;
import io.codeforesight.model.Trend;
import io.codeforesight.model.Verdict;
import io.codeforesight.reasoning.PromptTemplate;
import io.codeforesight.reasoning.ReasoningRequest;
import io.codeforesight.reasoning.ReasoningServiceException;
import io.codeforesight.support.FakeReasoningClient;
import io.codeforesight.support.Sources;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static io.codeforesight.support.FakeReasoningClient.finding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class Stage3ForecasterTest {

    private static final GateConfig.Stage3Settings REPORT_ONLY = new GateConfig.Stage3Settings(3, 0.1, 0.2, null);

    private static TemporalModel model;

    @BeforeAll
    static void load() throws Exception {
        model = TemporalModel.load("classpath:/models/stage3-temporal.json");
    }

    @Test
    void forecast_withoutHistoryIsSinglePointStableEstimate() {
        List<Finding> observed = findings(4, Severity.HIGH, Category.BUFFER_OVERFLOW, "CWE-120");

        Forecast forecast = new Stage3Forecaster(model, REPORT_ONLY).forecast(observed, List.of());

        assertThat(forecast.singlePoint()).isTrue();
        assertThat(forecast.trend()).isEqualTo(Trend.STABLE);
        assertThat(forecast.confidence()).isEqualTo(0.2);
        assertThat(forecast.currentLoad()).isCloseTo(12.0, within(1e-9));
        assertThat(forecast.projectedLoad()).isCloseTo(12.0, within(1e-9));
        assertThat(forecast.score()).isCloseTo(0.3, within(1e-9));
        assertThat(forecast.historyLength()).isZero();
        assertThat(forecast.modelVersion()).isEqualTo("stage3-ridge-ar6-2024.06");
        assertThat(forecast.factors()).anyMatch(f -> f.contains("single-point"));
        assertThat(forecast.factors()).anyMatch(f -> f.contains("Dominant category: buffer-overflow"));
    }

    @Test
    void forecast_risingHistoryTrendsUpward() {
        List<TrajectoryPoint> history = series(2, 4, 6, 8, 10);
        List<Finding> observed = findings(4, Severity.HIGH, Category.INJECTION, "CWE-89");

        Forecast forecast = new Stage3Forecaster(model, REPORT_ONLY).forecast(observed, history);

        assertThat(forecast.singlePoint()).isFalse();
        assertThat(forecast.trend()).isEqualTo(Trend.INCREASING);
        assertThat(forecast.projectedLoad()).isGreaterThan(12.0);
        assertThat(forecast.historyLength()).isEqualTo(5);
        assertThat(forecast.confidence()).isCloseTo(0.2 + 0.6 * 5 / 6.0, within(1e-9));
    }

    @Test
    void forecast_fallingHistoryTrendsDownward() {
        List<TrajectoryPoint> history = series(20, 20, 20, 20, 20);
        List<Finding> observed = findings(1, Severity.MEDIUM, Category.XSS, "CWE-79");

        Forecast forecast = new Stage3Forecaster(model, REPORT_ONLY).forecast(observed, history);

        assertThat(forecast.trend()).isEqualTo(Trend.DECREASING);
        assertThat(forecast.projectedLoad()).isLessThan(forecast.currentLoad());
    }

    @Test
    void forecast_flatHistoryIsStable() {
        List<TrajectoryPoint> history = series(12, 12, 12, 12, 12, 12, 12);
        List<Finding> observed = findings(4, Severity.HIGH, Category.INJECTION, "CWE-89");

        Forecast forecast = new Stage3Forecaster(model, REPORT_ONLY).forecast(observed, history);

        assertThat(forecast.trend()).isEqualTo(Trend.STABLE);
        assertThat(forecast.confidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void forecast_sortsTimestampedHistory() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        List<TrajectoryPoint> shuffled = List.of(
                new TrajectoryPoint(t0.plusSeconds(400), 10),
                new TrajectoryPoint(t0, 2),
                new TrajectoryPoint(t0.plusSeconds(300), 8),
                new TrajectoryPoint(t0.plusSeconds(100), 4),
                new TrajectoryPoint(t0.plusSeconds(200), 6));
        List<Finding> observed = findings(4, Severity.HIGH, Category.INJECTION, "CWE-89");
        Stage3Forecaster forecaster = new Stage3Forecaster(model, REPORT_ONLY);

        Forecast sorted = forecaster.forecast(observed, shuffled);
        Forecast ordered = forecaster.forecast(observed, series(2, 4, 6, 8, 10));

        assertThat(sorted.projectedLoad()).isCloseTo(ordered.projectedLoad(), within(1e-9));
    }

    @Test
    void forecast_likelyWeaknessesSkipObservedCwes() {
        List<Finding> observed = new ArrayList<>(findings(1, Severity.MEDIUM, Category.XSS, "CWE-79"));
        observed.addAll(findings(1, Severity.HIGH, Category.INJECTION, "CWE-89"));

        Forecast forecast = new Stage3Forecaster(model, REPORT_ONLY).forecast(observed, List.of());

        assertThat(forecast.likelyWeaknesses())
                .extracting(Forecast.LikelyWeakness::cweId)
                .containsExactly("CWE-787", "CWE-352", "CWE-22", "CWE-416", "CWE-78");
        assertThat(forecast.likelyWeaknesses().get(0).reference())
                .isEqualTo("https://cwe.mitre.org/data/definitions/787.html");
        assertThat(forecast.likelyWeaknesses().get(0).category()).isEqualTo(Category.BUFFER_OVERFLOW);
    }

    @Test
    void forecast_attachesTimelineBucket() {
        Forecast low = new Stage3Forecaster(model, REPORT_ONLY).forecast(List.of(), List.of());

        assertThat(low.score()).isZero();
        assertThat(low.timeline()).isEqualTo("6-12 months");
        assertThat(low.timelineConfidence()).isCloseTo(1 - 1 / (1 + Math.exp(1.0)), within(1e-9));
    }

    @Test
    void run_isReportOnlyPassByDefault() {
        StageReport report = new Stage3Forecaster(model, REPORT_ONLY)
                .run(findings(10, Severity.CRITICAL, Category.INJECTION, "CWE-89"), List.of());

        assertThat(report.stage()).isEqualTo(Stage.STAGE3);
        assertThat(report.verdict()).isEqualTo(Verdict.PASS);
        assertThat(report.reason()).isEqualTo("Report-only forecast");
        assertThat(report.findings()).isEmpty();
        assertThat(report.forecast()).isNotNull();
    }

    @Test
    void run_blocksWhenScoreReachesConfiguredThreshold() {
        GateConfig.Stage3Settings blocking = new GateConfig.Stage3Settings(3, 0.1, 0.2, 0.5);

        StageReport high = new Stage3Forecaster(model, blocking)
                .run(findings(10, Severity.CRITICAL, Category.INJECTION, "CWE-89"), List.of());
        StageReport low = new Stage3Forecaster(model, blocking)
                .run(findings(1, Severity.LOW, Category.XSS, "CWE-79"), List.of());

        assertThat(high.verdict()).isEqualTo(Verdict.BLOCK);
        assertThat(high.reason()).contains("block threshold 0.50");
        assertThat(low.verdict()).isEqualTo(Verdict.PASS);
        assertThat(low.reason()).isNull();
    }

    @Test
    void run_explainerAttachesBackendRiskExplanation() {
        FakeReasoningClient client = FakeReasoningClient.answering(
                finding("future-risk", "HIGH", null, "Input copies grow with every release.", "Replace strcpy with strlcpy."));
        SourceUnit unit = Sources.fixtureUnit("demo_vuln.c");

        StageReport report = new Stage3Forecaster(model, REPORT_ONLY)
                .run(findings(4, Severity.HIGH, Category.BUFFER_OVERFLOW, "CWE-120"), List.of(),
                        new ForecastExplainer(client, List.of(unit)));

        assertThat(report.verdict()).isEqualTo(Verdict.PASS);
        assertThat(report.forecast().explanation()).isEqualTo(
                "Risk level: high. Input copies grow with every release. Prevention: Replace strcpy with strlcpy.");
        ReasoningRequest request = client.requests().get(0);
        assertThat(request.template()).isEqualTo(PromptTemplate.FUTURE_RISK);
        assertThat(request.snippet().startLine()).isEqualTo(1);
        assertThat(request.snippet().endLine()).isLessThanOrEqualTo(ForecastExplainer.MAX_LINES);
        assertThat(request.context()).contains("risk 0.30", "trend stable");
    }

    @Test
    void run_explainerFallsBackToTemplateWhenBackendFails() {
        FakeReasoningClient client = FakeReasoningClient.failing(ReasoningServiceException.Kind.UNAVAILABLE);
        Stage3Forecaster forecaster = new Stage3Forecaster(model, REPORT_ONLY);
        List<Finding> observed = findings(4, Severity.HIGH, Category.BUFFER_OVERFLOW, "CWE-120");

        StageReport explained = forecaster.run(observed, List.of(),
                new ForecastExplainer(client, List.of(Sources.fixtureUnit("demo_vuln.c"))));
        StageReport plain = forecaster.run(observed, List.of());

        assertThat(client.calls()).isEqualTo(1);
        assertThat(explained.forecast().explanation())
                .startsWith("Risk level: low. Forecast risk 0.30 with a stable trend")
                .contains("Cross-site Scripting (CWE-79)");
        assertThat(explained.forecast().score()).isEqualTo(plain.forecast().score());
        assertThat(explained.verdict()).isEqualTo(plain.verdict());
        assertThat(plain.forecast().explanation()).isNull();
    }

    @Test
    void run_explainerWithoutInputUsesTemplate() {
        FakeReasoningClient client = FakeReasoningClient.silent();

        StageReport report = new Stage3Forecaster(model, REPORT_ONLY)
                .run(List.of(), List.of(), new ForecastExplainer(client, List.of()));

        assertThat(client.calls()).isZero();
        assertThat(report.forecast().explanation()).startsWith("Risk level: low.");
    }

    @Test
    void riskLoad_weightsConfidenceBySeverity() {
        List<Finding> observed = new ArrayList<>();
        observed.addAll(findings(1, Severity.CRITICAL, Category.INJECTION, "CWE-89"));
        observed.addAll(findings(1, Severity.INFO, Category.INFO_DISCLOSURE, "CWE-200"));

        assertThat(Stage3Forecaster.riskLoad(observed)).isCloseTo(4.5, within(1e-9));
    }

    private static List<TrajectoryPoint> series(double... loads) {
        List<TrajectoryPoint> points = new ArrayList<>();
        for (double load : loads) {
            points.add(new TrajectoryPoint(null, load));
        }
        return points;
    }

    private static List<Finding> findings(int count, Severity severity, Category category, String cwe) {
        List<Finding> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            result.add(Finding.builder()
                    .stage(Stage.STAGE1)
                    .category(category)
                    .cweId(cwe)
                    .file("a.c")
                    .line(i + 1)
                    .confidence(1.0)
                    .severity(severity)
                    .detector(DetectionSource.RULE)
                    .build());
        }
        return result;
    }
}
