package io.codeforesight.model;

import java.util.Optional;

/**
 * A function-level or line-range extract of a source unit, the unit of detection.
 *
 * @param sourceId     Identifier (path) of the owning source unit
 * @param startOffset  Byte offset of the first character, inclusive
 * @param endOffset    Byte offset after the last character, exclusive
 * @param startLine    1-based first line
 * @param endLine      1-based last line, inclusive
 * @param text         Extracted text
 * @param functionName Enclosing function name, null for top-level or lexical windows
 */
public record Snippet(
        String sourceId,
        int startOffset,
        int endOffset,
        int startLine,
        int endLine,
        String text,
        String functionName
) {
    public Snippet {
        if (sourceId == null) {
            throw new IllegalArgumentException("sourceId cannot be null");
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid line range " + startLine + "-" + endLine);
        }
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid offset range " + startOffset + "-" + endOffset);
        }
        if (text == null) {
            text = "";
        }
    }

    public Optional<String> function() {
        return Optional.ofNullable(functionName);
    }

    /**
     * Returns true if the given 1-based line falls inside this snippet.
     */
    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * Returns the snippet text with each line prefixed by its absolute line number.
     */
    public String numberedText() {
        StringBuilder sb = new StringBuilder();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            sb.append(String.format("%5d | %s", startLine + i, lines[i]));
            if (i < lines.length - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Returns "name" or "lines a-b" for display.
     */
    public String label() {
        if (functionName != null) {
            return functionName + " (lines " + startLine + "-" + endLine + ")";
        }
        return "lines " + startLine + "-" + endLine;
    }
}
