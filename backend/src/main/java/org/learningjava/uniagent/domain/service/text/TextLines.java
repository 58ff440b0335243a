package org.learningjava.uniagent.domain.service.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class TextLines {

    // ``` or ```html at line start, and a closing ``` at line end
    private static final Pattern CODE_FENCE = Pattern.compile(
            "^\\s*```[a-zA-Z]*\\s*|\\s*```\\s*$", Pattern.MULTILINE);

    private TextLines() {}

    /** Splits on \n, \r\n and \r, keeping each terminator on its line. */
    public static List<String> splitKeepEnds(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        int start = 0;
        int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                out.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < n && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                out.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
        }
        if (start < n) out.add(text.substring(start));
        return out;
    }

    /** Same split, terminators dropped. */
    public static List<String> split(String text) {
        List<String> keep = splitKeepEnds(text);
        List<String> out = new ArrayList<>(keep.size());
        for (String line : keep) {
            out.add(stripTerminator(line));
        }
        return out;
    }

    public static String stripTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) end--;
        return line.substring(0, end);
    }

    public static boolean hasTerminator(String line) {
        return !line.isEmpty() && (line.endsWith("\n") || line.endsWith("\r"));
    }

    public static String stripCodeFences(String text) {
        if (text == null) return "";
        return CODE_FENCE.matcher(text).replaceAll("");
    }

    /** "ln1, first line" style numbering used in the patch-mode file view. */
    public static String withLinePrefixes(String text, String prefix) {
        List<String> lines = split(text);
        StringBuilder sb = new StringBuilder(text.length() + lines.size() * 8);
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(prefix).append(i + 1).append(", ").append(lines.get(i));
        }
        return sb.toString();
    }
}
