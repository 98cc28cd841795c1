package io.codeforesight.reasoning;

import java.util.List;

/**
 * Structured answer of the reasoning backend.
 *
 * @param findings Results in the order the backend returned them
 * @param model    Model that answered, if known
 */
public record ReasoningResponse(List<ReasoningFinding> findings, String model) {

    public ReasoningResponse {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static ReasoningResponse empty(String model) {
        return new ReasoningResponse(List.of(), model);
    }
}
