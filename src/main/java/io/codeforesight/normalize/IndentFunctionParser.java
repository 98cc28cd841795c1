package io.codeforesight.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code def} blocks from indentation-delimited Python source.
 * A block ends at the first non-blank line indented no deeper than its {@code def}.
 */
class IndentFunctionParser implements FunctionParser {

    private static final Pattern DEF = Pattern.compile("^([ \\t]*)(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");

    @Override
    public List<FunctionSpan> parse(String text) throws SourceParseException {
        String[] lines = text.split("\n", -1);
        checkTripleQuotes(lines);
        LineIndex index = new LineIndex(text);
        List<FunctionSpan> spans = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            Matcher m = DEF.matcher(lines[i]);
            if (!m.find()) {
                i++;
                continue;
            }
            int indent = width(m.group(1));
            int last = i;
            int j = i + 1;
            while (j < lines.length) {
                String line = lines[j];
                if (line.isBlank()) {
                    j++;
                    continue;
                }
                if (width(leadingWhitespace(line)) <= indent && !isContinuation(lines, last)) {
                    break;
                }
                last = j;
                j++;
            }
            int lineNumber = i + 1;
            spans.add(new FunctionSpan(m.group(2), index.lineStart(lineNumber), index.lineEnd(last + 1)));
            i = last + 1;
        }
        return spans;
    }

    private static boolean isContinuation(String[] lines, int lineIndex) {
        String trimmed = lines[lineIndex].stripTrailing();
        return trimmed.endsWith("\\") || trimmed.endsWith(",") || trimmed.endsWith("(");
    }

    private static void checkTripleQuotes(String[] lines) throws SourceParseException {
        String open = null;
        int openLine = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int pos = 0;
            while (pos < line.length()) {
                if (open == null) {
                    int dq = line.indexOf("\"\"\"", pos);
                    int sq = line.indexOf("'''", pos);
                    int hit = dq < 0 ? sq : (sq < 0 ? dq : Math.min(dq, sq));
                    if (hit < 0) {
                        break;
                    }
                    open = line.substring(hit, hit + 3);
                    openLine = i + 1;
                    pos = hit + 3;
                } else {
                    int close = line.indexOf(open, pos);
                    if (close < 0) {
                        break;
                    }
                    open = null;
                    pos = close + 3;
                }
            }
        }
        if (open != null) {
            throw new SourceParseException("Unterminated triple-quoted string", openLine);
        }
    }

    private static String leadingWhitespace(String line) {
        int k = 0;
        while (k < line.length() && (line.charAt(k) == ' ' || line.charAt(k) == '\t')) {
            k++;
        }
        return line.substring(0, k);
    }

    private static int width(String whitespace) {
        int w = 0;
        for (char c : whitespace.toCharArray()) {
            w += c == '\t' ? 8 - (w % 8) : 1;
        }
        return w;
    }
}
