package org.learningjava.uniagent.domain.service.lint;

import org.learningjava.uniagent.domain.service.text.TextLines;

import java.util.List;

/**
 * Line-start offsets of a text, for turning a character offset into a 1-based line.
 */
final class LineIndex {

    private final List<String> lines;
    private final int[] starts;

    LineIndex(String text) {
        this.lines = TextLines.splitKeepEnds(text);
        this.starts = new int[lines.size()];
        int pos = 0;
        for (int i = 0; i < lines.size(); i++) {
            starts[i] = pos;
            pos += lines.get(i).length();
        }
    }

    /** 0-based index of the last line starting at or before {@code offset}. */
    int lineOf(int offset) {
        int lo = 0, hi = starts.length - 1;
        int line = 0;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (starts[mid] <= offset) {
                line = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return line;
    }

    String trimmedLine(int line) {
        return line < lines.size() ? lines.get(line).strip() : "";
    }

    int size() {
        return lines.size();
    }
}
