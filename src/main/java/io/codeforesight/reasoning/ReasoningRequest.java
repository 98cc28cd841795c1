package io.codeforesight.reasoning;

import io.codeforesight.model.Finding;
import io.codeforesight.model.Snippet;

import java.util.List;

/**
 * One call to the reasoning backend.
 *
 * @param snippet  Code under analysis
 * @param context  Surrounding context: signatures of the other functions in the file, or the forecast summary
 * @param template Prompt describing the task
 * @param subjects Findings to explain, used by {@link PromptTemplate#EXPLAIN} only
 */
public record ReasoningRequest(
        Snippet snippet,
        String context,
        PromptTemplate template,
        List<Finding> subjects
) {
    public ReasoningRequest {
        if (snippet == null) {
            throw new IllegalArgumentException("snippet cannot be null");
        }
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        context = context == null ? "" : context;
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }

    public ReasoningRequest(Snippet snippet, String context, PromptTemplate template) {
        this(snippet, context, template, List.of());
    }

    /**
     * The prompt text sent to the backend.
     */
    public String prompt() {
        return template.render(this);
    }
}
