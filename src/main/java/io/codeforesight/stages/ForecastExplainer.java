package io.codeforesight.stages;

import io.codeforesight.model.Forecast;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import io.codeforesight.reasoning.PromptTemplate;
import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ReasoningFinding;
import io.codeforesight.reasoning.ReasoningRequest;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Explains a Stage 3 forecast: risk level, rationale and one prevention step. Asks the
 * reasoning backend about the head of the first input and falls back to a template built
 * from the forecast itself.
 */
public class ForecastExplainer {

    static final int MAX_LINES = 120;

    private final ReasoningClient client;
    private final List<SourceUnit> units;

    public ForecastExplainer(ReasoningClient client, List<SourceUnit> units) {
        this.client = client;
        this.units = units == null ? List.of() : List.copyOf(units);
    }

    public String explain(Forecast forecast) {
        Snippet head = head();
        if (head == null) {
            return template(forecast);
        }
        try {
            String answer = ask(head, forecast);
            if (answer != null) {
                return answer;
            }
        } catch (ReasoningServiceException e) {
            System.err.println("Warning: forecast explanation unavailable (" + e.kind().id() + ": "
                    + e.getMessage() + "); using template explanation");
        }
        return template(forecast);
    }

    private String ask(Snippet head, Forecast forecast) throws ReasoningServiceException {
        ReasoningRequest request = new ReasoningRequest(head, context(forecast), PromptTemplate.FUTURE_RISK);
        List<ReasoningFinding> answers = client.analyze(request).findings();
        if (answers.isEmpty() || answers.get(0).rationale() == null) {
            return null;
        }
        ReasoningFinding answer = answers.get(0);
        String level = answer.severity() != null ? answer.severity().toLowerCase(Locale.ROOT) : level(forecast.score());
        StringBuilder sb = new StringBuilder("Risk level: ").append(level).append(". ").append(answer.rationale());
        if (answer.fix() != null) {
            sb.append(" Prevention: ").append(answer.fix());
        }
        return sb.toString();
    }

    /**
     * First {@value #MAX_LINES} lines of the first non-empty input; null when there is none.
     */
    private Snippet head() {
        for (SourceUnit unit : units) {
            if (unit.text().isBlank()) {
                continue;
            }
            List<String> lines = unit.text().lines().limit(MAX_LINES).toList();
            String text = String.join("\n", lines);
            return new Snippet(unit.id(), 0, text.length(), 1, Math.max(1, lines.size()), text, null);
        }
        return null;
    }

    static String context(Forecast forecast) {
        String weaknesses = forecast.likelyWeaknesses().stream()
                .map(w -> w.cweId() + " " + w.name())
                .collect(Collectors.joining(", "));
        return String.format(Locale.ROOT, "risk %.2f, trend %s, confidence %.2f%s",
                forecast.score(), forecast.trend().id(), forecast.confidence(),
                weaknesses.isEmpty() ? "" : "; likely weaknesses: " + weaknesses);
    }

    /**
     * Explanation derived from the forecast alone.
     */
    static String template(Forecast forecast) {
        String focus = forecast.likelyWeaknesses().isEmpty()
                ? "the weakness classes already found"
                : forecast.likelyWeaknesses().get(0).name() + " (" + forecast.likelyWeaknesses().get(0).cweId() + ")";
        return String.format(Locale.ROOT,
                "Risk level: %s. Forecast risk %.2f with a %s trend over %d step(s). Prevention: add review "
                        + "checks and tests targeting %s.",
                level(forecast.score()), forecast.score(), forecast.trend().id(), forecast.horizon(), focus);
    }

    static String level(double score) {
        if (score >= 0.66) {
            return "high";
        }
        return score >= 0.33 ? "medium" : "low";
    }
}
