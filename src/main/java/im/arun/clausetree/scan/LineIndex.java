package im.arun.clausetree.scan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Precomputed line starts for one text, so position lookups are binary
 * searches instead of backwards scans for newlines.
 */
public class LineIndex {
    private static final int TAB_WIDTH = 4;
    private static final double FULL_INDENT_COLUMNS = 20.0;

    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text == null ? "" : text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < this.text.length(); i++) {
            if (this.text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public String getText() {
        return text;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Zero-based index of the line containing {@code position}.
     */
    public int lineOf(int position) {
        int idx = Arrays.binarySearch(lineStarts, position);
        if (idx >= 0) {
            return idx;
        }
        return Math.max(0, -idx - 2);
    }

    public int lineStart(int lineIndex) {
        return lineStarts[lineIndex];
    }

    /**
     * End offset (exclusive, newline not included) of the given line.
     */
    public int lineEnd(int lineIndex) {
        int end = text.indexOf('\n', lineStarts[lineIndex]);
        return end < 0 ? text.length() : end;
    }

    public int column(int position) {
        return position - lineStarts[lineOf(position)];
    }

    /**
     * True when only whitespace precedes {@code position} on its line.
     */
    public boolean isLineStart(int position) {
        if (position == 0) {
            return true;
        }
        int start = lineStarts[lineOf(position)];
        return text.substring(start, position).isBlank();
    }

    /**
     * Leading indentation of the enumerator's line as a score in [0, 1]:
     * spaces count one column, tabs four, 20 or more columns saturate at 1.0.
     */
    public double indentation(int position) {
        int start = lineStarts[lineOf(position)];
        int columns = 0;
        for (int i = start; i < position; i++) {
            char ch = text.charAt(i);
            if (ch == ' ') {
                columns += 1;
            } else if (ch == '\t') {
                columns += TAB_WIDTH;
            } else {
                break;
            }
        }
        return Math.min(columns / FULL_INDENT_COLUMNS, 1.0);
    }
}
