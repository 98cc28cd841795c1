package io.codeforesight.normalize;

import io.codeforesight.model.Language;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw source text into a {@link SourceUnit} of function-level snippets.
 * <p>
 * Language-aware parsing is attempted first. Code between functions (globals, script bodies)
 * becomes top-level snippets without an enclosing function. When parsing fails, or no parser
 * exists for the language, the text is cut into fixed line windows and the unit is marked
 * degraded instead of failing the run.
 */
public class Normalizer {

    private final int fallbackWindowLines;

    public Normalizer() {
        this(40);
    }

    public Normalizer(int fallbackWindowLines) {
        if (fallbackWindowLines < 1) {
            throw new IllegalArgumentException("fallbackWindowLines must be positive");
        }
        this.fallbackWindowLines = fallbackWindowLines;
    }

    /**
     * Normalizes anonymous input.
     */
    public SourceUnit normalize(String text, Language language) {
        return normalize("<input>", text, language);
    }

    /**
     * Normalizes one input.
     *
     * @param id       path or identifier reported in findings
     * @param text     raw source text
     * @param language language tag; {@link Language#OTHER} forces the lexical scan
     */
    public SourceUnit normalize(String id, String text, Language language) {
        String source = text == null ? "" : text;
        if (source.isBlank()) {
            return new SourceUnit(id, language, source, List.of(), false);
        }

        Optional<FunctionParser> parser = parserFor(language);
        if (parser.isPresent()) {
            try {
                List<FunctionSpan> spans = parser.get().parse(source);
                return new SourceUnit(id, language, source, toSnippets(id, source, spans), false);
            } catch (SourceParseException e) {
                System.err.println("Warning: " + id + ": " + e.getMessage() + "; falling back to lexical scan");
            }
        }
        return new SourceUnit(id, language, source, lexicalScan(id, source), true);
    }

    private Optional<FunctionParser> parserFor(Language language) {
        return switch (language) {
            case C, CPP -> Optional.of(new BraceFunctionParser(true, false, false, false));
            case CSHARP -> Optional.of(new BraceFunctionParser(true, false, false, true));
            case JAVA -> Optional.of(new BraceFunctionParser(false, false, false, true));
            case JAVASCRIPT -> Optional.of(new BraceFunctionParser(false, true, false, false));
            case GO -> Optional.of(new BraceFunctionParser(false, true, true, false));
            case PYTHON -> Optional.of(new IndentFunctionParser());
            case OTHER -> Optional.empty();
        };
    }

    private List<Snippet> toSnippets(String id, String text, List<FunctionSpan> spans) {
        LineIndex lines = new LineIndex(text);
        List<Snippet> snippets = new ArrayList<>();
        int cursor = 0;
        for (FunctionSpan span : spans) {
            if (span.startOffset() > cursor) {
                snippets.addAll(topLevel(id, text, lines, cursor, span.startOffset()));
            }
            int start = Math.max(span.startOffset(), cursor);
            snippets.add(snippet(id, text, lines, start, span.endOffset(), span.name()));
            cursor = span.endOffset();
        }
        if (cursor < text.length()) {
            snippets.addAll(topLevel(id, text, lines, cursor, text.length()));
        }
        snippets.sort(Comparator.comparingInt(Snippet::startOffset));
        return snippets;
    }

    /**
     * Splits the code between functions into windows, dropping whitespace-only stretches.
     */
    private List<Snippet> topLevel(String id, String text, LineIndex lines, int from, int to) {
        List<Snippet> result = new ArrayList<>();
        int firstLine = lines.lineOf(from);
        int lastLine = lines.lineOf(Math.max(from, to - 1));
        for (int start = firstLine; start <= lastLine; start += fallbackWindowLines) {
            int end = Math.min(lastLine, start + fallbackWindowLines - 1);
            int startOffset = Math.max(from, lines.lineStart(start));
            int endOffset = Math.min(to, lines.lineEnd(end));
            if (endOffset <= startOffset) {
                continue;
            }
            Snippet window = trimmed(id, text, lines, startOffset, endOffset);
            if (window != null) {
                result.add(window);
            }
        }
        return result;
    }

    private List<Snippet> lexicalScan(String id, String text) {
        return topLevel(id, text, new LineIndex(text), 0, text.length());
    }

    private Snippet trimmed(String id, String text, LineIndex lines, int from, int to) {
        int start = from;
        while (start < to && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        int end = to;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start >= end) {
            return null;
        }
        return snippet(id, text, lines, start, end, null);
    }

    private Snippet snippet(String id, String text, LineIndex lines, int start, int end, String function) {
        int startLine = lines.lineOf(start);
        int endLine = lines.lineOf(Math.max(start, end - 1));
        return new Snippet(id, start, end, startLine, endLine, text.substring(start, end), function);
    }
}
