package org.pragmatica.monostyle.shared;

import java.util.ArrayList;
import java.util.Arrays;

/// Maps text offsets to 1-based line and column numbers.
///
/// A line ends after `\n`, after `\r\n`, or after a lone `\r`.
public final class LineMap {
    private final String text;
    private final int[] lineStarts;

    private LineMap(String text, int[] lineStarts) {
        this.text = text;
        this.lineStarts = lineStarts;
    }

    public static LineMap lineMap(String text) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        return new LineMap(text, starts.stream()
                                       .mapToInt(Integer::intValue)
                                       .toArray());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /// 1-based line containing the offset.
    public int line(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0
               ? idx + 1
               : -idx - 1;
    }

    /// 1-based column of the offset within its line.
    public int column(int offset) {
        return offset - lineStart(line(offset)) + 1;
    }

    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /// Offset just past the last content character of the line, excluding the line break.
    public int lineContentEnd(int line) {
        int end = line < lineStarts.length
                  ? lineStarts[line]
                  : text.length();
        while (end > lineStarts[line - 1] && isBreak(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    public String lineText(int line) {
        return text.substring(lineStart(line), lineContentEnd(line));
    }

    /// Leading whitespace of the line.
    public String indentation(int line) {
        var content = lineText(line);
        int i = 0;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) {
            i++;
        }
        return content.substring(0, i);
    }

    /// Display width of the line with tabs expanded to the given tab stop.
    public int displayWidth(int line, int tabWidth) {
        var content = lineText(line);
        int width = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\t') {
                width += tabWidth - (width % tabWidth);
            } else {
                width++;
            }
        }
        return width;
    }

    private static boolean isBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
