package io.codeforesight.report;

import io.codeforesight.model.Finding;
import io.codeforesight.model.Forecast;
import io.codeforesight.model.GateDecision;
import io.codeforesight.model.Severity;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.Verdict;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Locale;

/**
 * Formats the gate decision for console output with ANSI colors.
 * <p>
 * Layout:
 * - Header with inputs, modes and artifact versions
 * - One verdict line per stage
 * - Findings per stage, with rationale and remediation
 * - Forecast block when Stage 3 ran
 * - Footer with the overall verdict and exit status
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final int WIDTH = 70;

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(GateDecision decision, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, decision);
        printSummary(out, decision);
        for (StageReport report : decision.stageReports()) {
            if (!report.findings().isEmpty()) {
                printFindings(out, report);
            }
        }
        decision.stage3().forecastResult().ifPresent(f -> printForecast(out, f));
        printFooter(out, decision);
        out.flush();
    }

    private void printHeader(PrintWriter out, GateDecision decision) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center("CODE-FORESIGHT GATE REPORT", WIDTH));
        out.println(line('=', WIDTH));
        out.println();

        out.println("Inputs: " + String.join(", ", decision.inputs()));
        out.println("Modes: " + String.join(", ", decision.modes()));
        if (!decision.artifactVersions().isEmpty()) {
            StringBuilder versions = new StringBuilder("Artifacts: ");
            decision.artifactVersions().forEach((k, v) -> versions.append(k).append('=').append(v).append(' '));
            out.println(versions.toString().trim());
        }
        out.println(String.format(Locale.ROOT, "Run: %s (%.1fs)", decision.runId(), decision.durationMs() / 1000.0));
        out.println();
    }

    private void printSummary(PrintWriter out, GateDecision decision) {
        out.println(bold("GATES"));
        out.println(line('-', WIDTH));
        for (StageReport report : decision.stageReports()) {
            String name = String.format("%-8s %-22s", report.stage().id(), report.stage().displayName());
            StringBuilder row = new StringBuilder("  ").append(name).append(' ')
                    .append(verdictLabel(report.verdict()));
            if (!report.isSkipped()) {
                row.append(color(CYAN, "  " + report.totalFindings() + " finding(s)"));
            }
            if (report.degraded()) {
                row.append(color(YELLOW, "  [degraded]"));
            }
            out.println(row);
            if (report.reason() != null && report.verdict() != Verdict.PASS) {
                out.println("           " + report.reason());
            }
        }
        out.println();
    }

    private void printFindings(PrintWriter out, StageReport report) {
        out.println(bold(report.stage().displayName().toUpperCase(Locale.ROOT))
                + color(CYAN, " (" + report.totalFindings() + ")"));
        out.println(line('-', WIDTH));
        for (Finding f : report.findings()) {
            out.println(severityIndicator(f.severity()) + " " + bold(f.id()) + " " + f.category().id()
                    + (f.cweId() != null ? " " + f.cweId() : "")
                    + String.format(Locale.ROOT, " (%.2f, %s)", f.confidence(), f.detector().id()));
            out.println("    Location: " + f.location()
                    + (f.functionName() != null ? " in " + f.functionName() + "()" : ""));
            if (f.evidence() != null && !f.evidence().isEmpty()) {
                out.println("    Code: " + f.evidence());
            }
            if (f.rationale() != null) {
                out.println("    Why: " + f.rationale());
            }
            if (f.remediation() != null) {
                out.println("    " + color(GREEN, "Fix: " + f.remediation()));
            }
        }
        out.println();
    }

    private void printForecast(PrintWriter out, Forecast f) {
        out.println(bold("RISK FORECAST") + color(CYAN, " (" + f.modelVersion() + ")"));
        out.println(line('-', WIDTH));
        String trendColor = switch (f.trend()) {
            case INCREASING -> RED;
            case STABLE -> YELLOW;
            case DECREASING -> GREEN;
        };
        out.println(String.format(Locale.ROOT, "  Score: %.2f  Trend: %s  Confidence: %.2f%s",
                f.score(), color(trendColor, f.trend().id()), f.confidence(),
                f.singlePoint() ? " (single point)" : ""));
        if (f.timeline() != null) {
            out.println(String.format(Locale.ROOT, "  Timeline: %s (%.2f)", f.timeline(), f.timelineConfidence()));
        }
        for (String factor : f.factors()) {
            out.println("  - " + factor);
        }
        if (!f.likelyWeaknesses().isEmpty()) {
            out.println("  Likely next weaknesses:");
            for (Forecast.LikelyWeakness w : f.likelyWeaknesses()) {
                out.println("    " + w.cweId() + " " + w.name() + "  " + color(CYAN, w.reference()));
            }
        }
        if (f.explanation() != null) {
            out.println("  Outlook: " + f.explanation());
        }
        out.println();
    }

    private void printFooter(PrintWriter out, GateDecision decision) {
        out.println(line('=', WIDTH));
        String summary = "OVERALL: " + decision.overallVerdict().id().toUpperCase(Locale.ROOT)
                + " (exit " + decision.exitStatus().code() + ": " + decision.exitStatus().description() + ")";
        String c = switch (decision.overallVerdict()) {
            case BLOCK -> RED;
            case INDETERMINATE -> YELLOW;
            default -> GREEN;
        };
        out.println(color(c, bold(summary)));
        out.println(line('=', WIDTH));
    }

    private String verdictLabel(Verdict verdict) {
        return switch (verdict) {
            case PASS -> color(GREEN, "PASS");
            case BLOCK -> color(RED, "BLOCK");
            case INDETERMINATE -> color(YELLOW, "INDETERMINATE");
            case SKIPPED -> "skipped";
        };
    }

    private String severityIndicator(Severity severity) {
        return switch (severity) {
            case CRITICAL -> color(RED, "[CRIT]");
            case HIGH -> color(RED, "[HIGH]");
            case MEDIUM -> color(YELLOW, "[MED] ");
            case LOW -> "[LOW] ";
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
