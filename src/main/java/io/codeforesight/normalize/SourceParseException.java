package io.codeforesight.normalize;

/**
 * Raised by a {@link FunctionParser} when the source cannot be parsed structurally.
 * The normalizer recovers from it by falling back to a lexical scan.
 */
public class SourceParseException extends Exception {

    private final int line;

    public SourceParseException(String message, int line) {
        super(message + (line > 0 ? " at line " + line : ""));
        this.line = line;
    }

    /**
     * 1-based line where parsing failed, or 0 if unknown.
     */
    public int line() {
        return line;
    }
}
