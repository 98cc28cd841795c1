package io.codeforesight.model;

import java.util.List;

/**
 * One analyzed input: raw text plus the snippets extracted from it.
 *
 * @param id       Path or identifier of the input
 * @param language Language tag used for parsing
 * @param text     Raw source text
 * @param snippets Snippets in source order
 * @param degraded True when parsing fell back to a lexical scan
 */
public record SourceUnit(
        String id,
        Language language,
        String text,
        List<Snippet> snippets,
        boolean degraded
) {
    public SourceUnit {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (language == null) {
            language = Language.OTHER;
        }
        if (text == null) {
            text = "";
        }
        snippets = snippets == null ? List.of() : List.copyOf(snippets);
    }

    public boolean isEmpty() {
        return snippets.isEmpty();
    }

    public int lineCount() {
        if (text.isEmpty()) {
            return 0;
        }
        return (int) text.lines().count();
    }

    /**
     * Names of all functions resolved in this unit, in source order.
     */
    public List<String> functionNames() {
        return snippets.stream()
                .map(Snippet::functionName)
                .filter(n -> n != null)
                .toList();
    }
}
