package io.codeforesight.report;

import io.codeforesight.model.Finding;
import io.codeforesight.model.Forecast;
import io.codeforesight.model.GateDecision;
import io.codeforesight.model.StageReport;
import io.codeforesight.model.Verdict;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formats the gate decision as a standalone HTML page.
 */
public class HtmlReporter implements Reporter {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    @Override
    public String format() {
        return "html";
    }

    @Override
    public void write(GateDecision decision, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        out.println("<!DOCTYPE html>");
        out.println("<html lang=\"en\">");
        out.println("<head>");
        out.println("  <meta charset=\"UTF-8\">");
        out.println("  <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">");
        out.println("  <title>Code-Foresight Gate Report</title>");
        writeStyles(out);
        out.println("</head>");
        out.println("<body>");

        writeHeader(out, decision);
        writeStages(out, decision);
        for (StageReport report : decision.stageReports()) {
            if (!report.findings().isEmpty()) {
                writeFindingSection(out, report);
            }
        }
        decision.stage3().forecastResult().ifPresent(f -> writeForecast(out, f));
        writeFooter(out, decision);

        out.println("</body>");
        out.println("</html>");
        out.flush();
    }

    private void writeStyles(PrintWriter out) {
        out.println("  <style>");
        out.println("    :root {");
        out.println("      --block: #dc3545;");
        out.println("      --indeterminate: #ffc107;");
        out.println("      --pass: #28a745;");
        out.println("      --skipped: #6c757d;");
        out.println("      --critical: #dc3545;");
        out.println("      --high: #fd7e14;");
        out.println("      --medium: #ffc107;");
        out.println("      --low: #28a745;");
        out.println("      --info: #17a2b8;");
        out.println("    }");
        out.println("    * { box-sizing: border-box; margin: 0; padding: 0; }");
        out.println("    body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; ");
        out.println("           line-height: 1.6; color: #333; background: #f5f5f5; }");
        out.println("    .container { max-width: 1200px; margin: 0 auto; padding: 20px; }");
        out.println("    header { background: #2c3e50; color: white; padding: 40px 20px; text-align: center; }");
        out.println("    header h1 { font-size: 2.2em; margin-bottom: 10px; }");
        out.println("    .meta { display: grid; grid-template-columns: repeat(auto-fit, minmax(200px, 1fr)); ");
        out.println("            gap: 10px; margin: 20px 0; background: white; padding: 20px; border-radius: 8px; }");
        out.println("    .meta-item label { color: #666; font-size: 0.85em; }");
        out.println("    table { width: 100%; border-collapse: collapse; background: white; margin: 20px 0; }");
        out.println("    th, td { text-align: left; padding: 8px 12px; border-bottom: 1px solid #ddd; }");
        out.println("    .verdict { font-weight: bold; text-transform: uppercase; }");
        out.println("    .verdict.block { color: var(--block); }");
        out.println("    .verdict.indeterminate { color: var(--indeterminate); }");
        out.println("    .verdict.pass { color: var(--pass); }");
        out.println("    .verdict.skipped { color: var(--skipped); }");
        out.println("    .findings-section { margin: 30px 0; }");
        out.println("    .findings-section h2 { margin-bottom: 15px; padding-bottom: 10px; border-bottom: 2px solid #ddd; }");
        out.println("    .finding { background: white; border-radius: 8px; padding: 20px; margin-bottom: 15px; ");
        out.println("               box-shadow: 0 2px 4px rgba(0,0,0,0.1); }");
        out.println("    .finding.critical { border-left: 4px solid var(--critical); }");
        out.println("    .finding.high { border-left: 4px solid var(--high); }");
        out.println("    .finding.medium { border-left: 4px solid var(--medium); }");
        out.println("    .finding.low { border-left: 4px solid var(--low); }");
        out.println("    .finding.info { border-left: 4px solid var(--info); }");
        out.println("    .finding .location { color: #666; font-size: 0.9em; margin: 5px 0; }");
        out.println("    .finding .code { font-family: monospace; background: #f0f0f0; padding: 8px; ");
        out.println("                     border-radius: 4px; margin: 10px 0; white-space: pre-wrap; }");
        out.println("    .finding .recommendation { background: #e8f5e9; padding: 10px; border-radius: 4px; ");
        out.println("                               margin-top: 10px; border-left: 3px solid var(--low); }");
        out.println("    .forecast { background: white; border-radius: 8px; padding: 20px; margin: 30px 0; }");
        out.println("    footer { text-align: center; padding: 20px; color: #666; font-size: 0.9em; }");
        out.println("  </style>");
    }

    private void writeHeader(PrintWriter out, GateDecision decision) {
        out.println("<header>");
        out.println("  <h1>Code-Foresight Gate Report</h1>");
        out.println("  <p>Known vulnerabilities, business logic and risk forecast</p>");
        out.println("</header>");
        out.println("<div class=\"container\">");

        out.println("<div class=\"meta\">");
        out.println("  <div class=\"meta-item\"><label>Inputs</label><div>"
                + escape(String.join(", ", decision.inputs())) + "</div></div>");
        out.println("  <div class=\"meta-item\"><label>Modes</label><div>"
                + escape(String.join(", ", decision.modes())) + "</div></div>");
        out.println("  <div class=\"meta-item\"><label>Run</label><div>" + escape(decision.runId()) + "</div></div>");
        if (decision.startTime() != null) {
            out.println("  <div class=\"meta-item\"><label>Started</label><div>"
                    + DATE_FORMAT.format(decision.startTime()) + "</div></div>");
        }
        decision.artifactVersions().forEach((name, version) ->
                out.println("  <div class=\"meta-item\"><label>" + escape(name) + "</label><div>"
                        + escape(version) + "</div></div>"));
        out.println("</div>");
    }

    private void writeStages(PrintWriter out, GateDecision decision) {
        out.println("<table class=\"stages\">");
        out.println("  <tr><th>Stage</th><th>Verdict</th><th>Findings</th><th>Reason</th></tr>");
        for (StageReport report : decision.stageReports()) {
            String verdict = report.verdict().id();
            out.println("  <tr id=\"" + report.stage().id() + "\">"
                    + "<td>" + escape(report.stage().displayName()) + "</td>"
                    + "<td class=\"verdict " + verdict + "\">" + verdict
                    + (report.degraded() ? " (degraded)" : "") + "</td>"
                    + "<td>" + (report.isSkipped() ? "" : String.valueOf(report.totalFindings())) + "</td>"
                    + "<td>" + escape(report.reason()) + "</td></tr>");
        }
        out.println("</table>");
    }

    private void writeFindingSection(PrintWriter out, StageReport report) {
        out.println("<div class=\"findings-section\">");
        out.println("  <h2>" + escape(report.stage().displayName()) + " Findings (" + report.totalFindings() + ")</h2>");

        for (Finding f : report.findings()) {
            String severityClass = f.severity().label().toLowerCase(Locale.ROOT);

            out.println("  <div class=\"finding " + severityClass + "\" id=\"" + escape(f.id()) + "\">");
            out.println("    <h3>" + escape(f.id()) + " " + escape(f.category().id())
                    + (f.cweId() != null ? " " + escape(f.cweId()) : "") + "</h3>");
            out.println("    <div class=\"location\">" + escape(f.location())
                    + (f.functionName() != null ? " in " + escape(f.functionName()) + "()" : "")
                    + String.format(Locale.ROOT, " | %s | confidence %.2f | %s",
                    f.severity().label(), f.confidence(), f.detector().id()) + "</div>");
            if (f.evidence() != null && !f.evidence().isEmpty()) {
                out.println("    <div class=\"code\">" + escape(f.evidence()) + "</div>");
            }
            if (f.rationale() != null) {
                out.println("    <div class=\"description\">" + escape(f.rationale()) + "</div>");
            }
            if (f.remediation() != null) {
                out.println("    <div class=\"recommendation\"><strong>Fix:</strong> " + escape(f.remediation()) + "</div>");
            }
            out.println("  </div>");
        }

        out.println("</div>");
    }

    private void writeForecast(PrintWriter out, Forecast f) {
        out.println("<div class=\"forecast\">");
        out.println("  <h2>Risk Forecast</h2>");
        out.println(String.format(Locale.ROOT, "  <p>Score %.2f, trend %s, confidence %.2f%s</p>",
                f.score(), f.trend().id(), f.confidence(), f.singlePoint() ? " (single point)" : ""));
        if (f.timeline() != null) {
            out.println(String.format(Locale.ROOT, "  <p>Timeline: %s (%.2f)</p>",
                    escape(f.timeline()), f.timelineConfidence()));
        }
        if (!f.factors().isEmpty()) {
            out.println("  <ul>");
            for (String factor : f.factors()) {
                out.println("    <li>" + escape(factor) + "</li>");
            }
            out.println("  </ul>");
        }
        if (!f.likelyWeaknesses().isEmpty()) {
            out.println("  <h3>Likely next weaknesses</h3>");
            out.println("  <ul>");
            for (Forecast.LikelyWeakness w : f.likelyWeaknesses()) {
                out.println("    <li><a href=\"" + escape(w.reference()) + "\">" + escape(w.cweId()) + "</a> "
                        + escape(w.name()) + "</li>");
            }
            out.println("  </ul>");
        }
        if (f.explanation() != null) {
            out.println("  <p class=\"outlook\">" + escape(f.explanation()) + "</p>");
        }
        out.println("  <p><small>Model " + escape(f.modelVersion()) + "</small></p>");
        out.println("</div>");
    }

    private void writeFooter(PrintWriter out, GateDecision decision) {
        Verdict overall = decision.overallVerdict();
        out.println("<p class=\"verdict " + overall.id() + "\" id=\"overall\">Overall: " + overall.id()
                + " (exit " + decision.exitStatus().code() + ": " + escape(decision.exitStatus().description()) + ")</p>");
        out.println("</div>"); // container
        out.println("<footer>");
        out.println("  <p>Generated by Code-Foresight</p>");
        out.println("</footer>");
    }

    private String escape(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
