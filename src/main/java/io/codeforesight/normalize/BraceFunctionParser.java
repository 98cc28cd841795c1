package io.codeforesight.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts function definitions from brace-delimited languages (C, C++, Java, JavaScript, Go, C#).
 * <p>
 * Comments, string and character literals (and, for C-family languages, preprocessor lines)
 * are masked first so that braces inside them do not count. A brace opens a function when it
 * follows a parameter list whose name is not a control keyword. Only outermost functions are
 * reported; nested lambdas and local classes stay part of their enclosing function.
 */
class BraceFunctionParser implements FunctionParser {

    private static final Set<String> CONTROL_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "sizeof", "synchronized",
            "foreach", "using", "lock", "fixed", "with", "else", "do", "try", "function",
            "defined", "alignof", "typeof", "decltype");

    private static final Set<String> NON_FUNCTION_PREFIXES = Set.of("new", "record", "class", "struct", "enum");

    private static final Set<String> TRAILING_QUALIFIERS = Set.of(
            "const", "noexcept", "override", "final", "volatile", "mutable", "&", "&&", "async");

    private static final Pattern GO_FUNC = Pattern.compile("^\\s*func\\s*(?:\\([^)]*\\)\\s*)?([A-Za-z_]\\w*)");

    private final boolean preprocessor;
    private final boolean backtickStrings;
    private final boolean goSyntax;
    private final boolean textBlocks;

    /**
     * @param preprocessor    mask '#' directive lines (C, C++, C#)
     * @param backtickStrings treat backticks as multi-line string delimiters (JavaScript, Go)
     * @param goSyntax        recognise Go "func" headers
     * @param textBlocks      treat {@code """} as a multi-line literal delimiter (Java, C#)
     */
    BraceFunctionParser(boolean preprocessor, boolean backtickStrings, boolean goSyntax, boolean textBlocks) {
        this.preprocessor = preprocessor;
        this.backtickStrings = backtickStrings;
        this.goSyntax = goSyntax;
        this.textBlocks = textBlocks;
    }

    @Override
    public List<FunctionSpan> parse(String text) throws SourceParseException {
        char[] masked = mask(text);
        LineIndex lines = new LineIndex(text);
        List<FunctionSpan> spans = new ArrayList<>();

        int depth = 0;
        int functionDepth = -1;
        String functionName = null;
        int functionStart = 0;

        for (int i = 0; i < masked.length; i++) {
            char c = masked[i];
            if (c == '{') {
                if (functionDepth < 0) {
                    Header header = detectHeader(masked, i, lines);
                    if (header != null) {
                        functionDepth = depth;
                        functionName = header.name();
                        functionStart = header.startOffset();
                    }
                }
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    throw new SourceParseException("Unbalanced closing brace", lines.lineOf(i));
                }
                if (functionDepth >= 0 && depth == functionDepth) {
                    spans.add(new FunctionSpan(functionName, functionStart, i + 1));
                    functionDepth = -1;
                    functionName = null;
                }
            }
        }
        if (depth != 0) {
            throw new SourceParseException("Unclosed brace (depth " + depth + ")", lines.lineCount());
        }
        return spans;
    }

    private record Header(String name, int startOffset) {}

    private Header detectHeader(char[] masked, int braceIndex, LineIndex lines) {
        if (goSyntax) {
            int line = lines.lineOf(braceIndex);
            String lineText = new String(masked, lines.lineStart(line), braceIndex - lines.lineStart(line));
            Matcher m = GO_FUNC.matcher(lineText);
            if (m.find()) {
                return new Header(m.group(1), lines.lineStart(line));
            }
            return null;
        }

        // Walk back over trailing qualifiers (const, throws X, noexcept) to the closing paren
        int j = braceIndex - 1;
        int limit = Math.max(0, braceIndex - 300);
        while (j >= limit && isQualifierChar(masked[j])) {
            j--;
        }
        if (j < limit || masked[j] != ')') {
            return null;
        }
        String trailing = new String(masked, j + 1, braceIndex - j - 1).trim();
        if (!acceptableTrailing(trailing)) {
            return null;
        }

        int open = matchOpenParen(masked, j);
        if (open < 0) {
            return null;
        }
        int end = open - 1;
        while (end >= 0 && Character.isWhitespace(masked[end])) {
            end--;
        }
        int start = end;
        while (start >= 0 && isNameChar(masked[start])) {
            start--;
        }
        start++;
        if (start > end) {
            return null;
        }
        String name = new String(masked, start, end - start + 1);
        String simple = name.contains("::") ? name.substring(name.lastIndexOf("::") + 2) : name;
        if (simple.isEmpty() || Character.isDigit(simple.charAt(0)) || CONTROL_KEYWORDS.contains(simple)) {
            return null;
        }
        String previous = previousWord(masked, start - 1);
        if (NON_FUNCTION_PREFIXES.contains(previous)) {
            return null;
        }
        return new Header(name, lines.lineStart(lines.lineOf(start)));
    }

    private static boolean acceptableTrailing(String trailing) {
        if (trailing.isEmpty()) {
            return true;
        }
        String[] tokens = trailing.split("[\\s,]+");
        if ("throws".equals(tokens[0])) {
            return tokens.length > 1;
        }
        for (String token : tokens) {
            if (!TRAILING_QUALIFIERS.contains(token)) {
                return false;
            }
        }
        return true;
    }

    private static int matchOpenParen(char[] masked, int close) {
        int depth = 0;
        for (int k = close; k >= 0; k--) {
            if (masked[k] == ')') {
                depth++;
            } else if (masked[k] == '(') {
                depth--;
                if (depth == 0) {
                    return k;
                }
            } else if (masked[k] == '{' || masked[k] == '}' || masked[k] == ';') {
                return -1;
            }
        }
        return -1;
    }

    private static String previousWord(char[] masked, int from) {
        int end = from;
        while (end >= 0 && Character.isWhitespace(masked[end])) {
            end--;
        }
        int start = end;
        while (start >= 0 && Character.isJavaIdentifierPart(masked[start])) {
            start--;
        }
        return end > start ? new String(masked, start + 1, end - start) : "";
    }

    private static boolean isQualifierChar(char c) {
        return Character.isJavaIdentifierPart(c) || Character.isWhitespace(c)
                || c == ',' || c == '.' || c == '&' || c == '<' || c == '>' || c == '[' || c == ']';
    }

    private static boolean isNameChar(char c) {
        return Character.isJavaIdentifierPart(c) || c == ':' || c == '~';
    }

    /**
     * Replaces comments, literal contents and preprocessor lines with spaces, keeping offsets and newlines.
     */
    char[] mask(String text) throws SourceParseException {
        char[] out = text.toCharArray();
        int n = out.length;
        int line = 1;
        boolean atLineStart = true;
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : '\0';

            if (c == '\n') {
                line++;
                atLineStart = true;
                i++;
                continue;
            }
            if (preprocessor && atLineStart && c == '#') {
                // Directive runs to end of line, honouring backslash continuations
                while (i < n && text.charAt(i) != '\n') {
                    if (text.charAt(i) == '\\' && i + 1 < n && text.charAt(i + 1) == '\n') {
                        out[i] = ' ';
                        i += 2;
                        line++;
                        continue;
                    }
                    out[i] = ' ';
                    i++;
                }
                continue;
            }
            if (!Character.isWhitespace(c)) {
                atLineStart = false;
            }
            if (c == '/' && next == '/') {
                while (i < n && text.charAt(i) != '\n') {
                    out[i++] = ' ';
                }
                continue;
            }
            if (c == '/' && next == '*') {
                int startLine = line;
                out[i] = ' ';
                out[i + 1] = ' ';
                i += 2;
                boolean closed = false;
                while (i < n) {
                    if (text.charAt(i) == '*' && i + 1 < n && text.charAt(i + 1) == '/') {
                        out[i] = ' ';
                        out[i + 1] = ' ';
                        i += 2;
                        closed = true;
                        break;
                    }
                    if (text.charAt(i) == '\n') {
                        line++;
                    } else {
                        out[i] = ' ';
                    }
                    i++;
                }
                if (!closed) {
                    throw new SourceParseException("Unterminated block comment", startLine);
                }
                continue;
            }
            if (textBlocks && c == '"' && text.startsWith("\"\"\"", i)) {
                int startLine = line;
                i += 3;
                boolean closed = false;
                while (i < n) {
                    char d = text.charAt(i);
                    if (d == '\\' && i + 1 < n) {
                        out[i] = ' ';
                        if (text.charAt(i + 1) == '\n') {
                            line++;
                        } else {
                            out[i + 1] = ' ';
                        }
                        i += 2;
                        continue;
                    }
                    if (d == '"' && text.startsWith("\"\"\"", i)) {
                        i += 3;
                        closed = true;
                        break;
                    }
                    if (d == '\n') {
                        line++;
                    } else {
                        out[i] = ' ';
                    }
                    i++;
                }
                if (!closed) {
                    throw new SourceParseException("Unterminated text block", startLine);
                }
                continue;
            }
            if (c == '"' || c == '\'' || (backtickStrings && c == '`')) {
                boolean multiLine = c == '`';
                int startLine = line;
                i++;
                boolean closed = false;
                while (i < n) {
                    char d = text.charAt(i);
                    if (d == '\\' && !multiLine && i + 1 < n) {
                        out[i] = ' ';
                        if (text.charAt(i + 1) != '\n') {
                            out[i + 1] = ' ';
                        } else {
                            line++;
                        }
                        i += 2;
                        continue;
                    }
                    if (d == c) {
                        i++;
                        closed = true;
                        break;
                    }
                    if (d == '\n') {
                        if (!multiLine) {
                            break;
                        }
                        line++;
                    } else {
                        out[i] = ' ';
                    }
                    i++;
                }
                if (!closed) {
                    throw new SourceParseException("Unterminated literal", startLine);
                }
                continue;
            }
            i++;
        }
        return out;
    }
}
