package io.codeforesight.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.codeforesight.model.Finding;
import io.codeforesight.model.Forecast;
import io.codeforesight.model.GateDecision;
import io.codeforesight.model.Stage;
import io.codeforesight.model.StageReport;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Formats the gate decision as JSON for CI consumers. Keys are snake_case.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(GateDecision decision, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(decision));
    }

    JsonReport toJsonReport(GateDecision decision) {
        return new JsonReport(
                decision.runId(),
                decision.inputs(),
                decision.modes(),
                decision.artifactVersions(),
                decision.startTime(),
                decision.durationMs(),
                toJsonStage(decision.stage1()),
                toJsonStage(decision.stage2()),
                toJsonStage(decision.stage3()),
                decision.overallVerdict().id(),
                decision.exitStatus().code(),
                decision.totalFindings()
        );
    }

    private JsonReport.StageResult toJsonStage(StageReport report) {
        return new JsonReport.StageResult(
                report.verdict().id(),
                report.reason(),
                report.degraded() ? Boolean.TRUE : null,
                report.stage() == Stage.STAGE3 ? null : report.findings().stream().map(this::toJsonFinding).toList(),
                report.forecastResult().map(this::toJsonForecast).orElse(null)
        );
    }

    private JsonReport.Finding toJsonFinding(Finding f) {
        return new JsonReport.Finding(
                f.id(),
                f.stage().id(),
                f.category().id(),
                f.cweId(),
                f.file(),
                f.lineStart(),
                f.lineEnd(),
                f.confidence(),
                f.severity().label().toLowerCase(Locale.ROOT),
                f.rationale(),
                f.detector().id(),
                f.ruleId(),
                f.remediation(),
                f.functionName(),
                f.evidence()
        );
    }

    private JsonReport.Forecast toJsonForecast(Forecast f) {
        return new JsonReport.Forecast(
                f.score(),
                f.trend().id(),
                f.confidence(),
                f.horizon(),
                f.singlePoint(),
                f.currentLoad(),
                f.projectedLoad(),
                f.historyLength(),
                f.timeline(),
                f.timeline() != null ? f.timelineConfidence() : null,
                f.factors(),
                f.likelyWeaknesses().stream()
                        .map(w -> new JsonReport.Weakness(w.cweId(), w.name(), w.category().id(), w.count(), w.reference()))
                        .toList(),
                f.modelVersion(),
                f.explanation()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            String runId,
            List<String> inputs,
            Set<String> modes,
            Map<String, String> artifactVersions,
            Instant startTime,
            long durationMs,
            StageResult stage1,
            StageResult stage2,
            StageResult stage3,
            String overallVerdict,
            int exitStatus,
            int totalFindings
    ) {
        public record StageResult(
                String verdict,
                String reason,
                Boolean degraded,
                List<Finding> findings,
                Forecast forecast
        ) {}

        public record Finding(
                String id,
                String stage,
                String category,
                String cwe,
                String file,
                int lineStart,
                int lineEnd,
                double confidence,
                String severity,
                String rationale,
                String detector,
                String ruleId,
                String remediation,
                String function,
                String evidence
        ) {}

        public record Forecast(
                double score,
                String trend,
                double confidence,
                int horizon,
                boolean singlePoint,
                double currentLoad,
                double projectedLoad,
                int historyLength,
                String timeline,
                Double timelineConfidence,
                List<String> factors,
                List<Weakness> likelyWeaknesses,
                String modelVersion,
                String explanation
        ) {}

        public record Weakness(
                String cwe,
                String name,
                String category,
                int count,
                String reference
        ) {}
    }
}
