package io.codeforesight.reasoning;

import io.codeforesight.model.Finding;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Task-specific prompts. Texts live under {@code /prompts} on the classpath and use
 * {@code {{code}}}, {@code {{context}}} and {@code {{findings}}} placeholders.
 */
public enum PromptTemplate {
    /**
     * Stage 2: authorization gaps, broken state invariants, unsafe operation ordering.
     */
    BUSINESS_LOGIC("business-logic", "/prompts/business-logic.txt"),
    /**
     * Stage 1 in llm-only mode: signature vulnerabilities.
     */
    KNOWN_VULNERABILITY("known-vulnerability", "/prompts/known-vulnerability.txt"),
    /**
     * Stage 1 explain mode: why each finding is risky and how to fix it.
     */
    EXPLAIN("explain", "/prompts/explain.txt"),
    /**
     * Stage 3 explain mode: risk level, rationale and one prevention step for the forecast.
     */
    FUTURE_RISK("future-risk", "/prompts/future-risk.txt");

    private final String id;
    private final String resource;
    private volatile String text;

    PromptTemplate(String id, String resource) {
        this.id = id;
        this.resource = resource;
    }

    public String id() {
        return id;
    }

    /**
     * Raw template text.
     */
    public String text() {
        String loaded = text;
        if (loaded == null) {
            try (InputStream is = PromptTemplate.class.getResourceAsStream(resource)) {
                if (is == null) {
                    throw new IllegalStateException("Prompt template not found: " + resource);
                }
                loaded = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read prompt template " + resource, e);
            }
            text = loaded;
        }
        return loaded;
    }

    String render(ReasoningRequest request) {
        String findings = request.subjects().stream()
                .map(PromptTemplate::describe)
                .collect(Collectors.joining("\n"));
        return text()
                .replace("{{context}}", request.context().isBlank() ? "(none)" : request.context())
                .replace("{{findings}}", findings.isEmpty() ? "(none)" : findings)
                .replace("{{code}}", request.snippet().numberedText());
    }

    private static String describe(Finding f) {
        return "- " + f.id() + " | " + f.category().id()
                + (f.cweId() != null ? " | " + f.cweId() : "")
                + " | line " + f.lineStart()
                + (f.evidence() != null ? " | " + f.evidence() : "");
    }
}
