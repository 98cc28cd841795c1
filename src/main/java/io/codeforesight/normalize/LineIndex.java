package io.codeforesight.normalize;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets to 1-based line numbers and back.
 */
final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    LineIndex(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.length = text.length();
    }

    /**
     * Line containing the given offset. Offsets at the end of text map to the last line.
     */
    int lineOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Offset just past the end of the given line, excluding its newline.
     */
    int lineEnd(int line) {
        if (line < lineStarts.length) {
            return lineStarts[line] - 1;
        }
        return length;
    }

    int lineCount() {
        return lineStarts.length;
    }
}
