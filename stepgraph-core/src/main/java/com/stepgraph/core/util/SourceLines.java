package com.stepgraph.core.util;

/**
 * Line lookups in source text, used for diagnostics.
 */
public final class SourceLines {

    private SourceLines() {
        // Utility class
    }

    /**
     * Returns the text of a 1-based line, without its terminator.
     *
     * @param source full source text
     * @param lineNumber 1-based line number
     * @return line text, or an empty string if the line does not exist
     */
    public static String lineAt(String source, int lineNumber) {
        if (source == null || lineNumber < 1) {
            return "";
        }
        int start = 0;
        for (int current = 1; current < lineNumber; current++) {
            int newline = source.indexOf('\n', start);
            if (newline < 0) {
                return "";
            }
            start = newline + 1;
        }
        int end = source.indexOf('\n', start);
        String line = end < 0 ? source.substring(start) : source.substring(start, end);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Wraps text into lines of at most {@code width} characters.
     *
     * <p>Breaks after commas or spaces where possible, otherwise hard-wraps.
     *
     * @param text text to wrap
     * @param width maximum line width, values below 1 disable wrapping
     * @return wrapped text joined with {@code \n}
     */
    public static String wrap(String text, int width) {
        if (text == null || width < 1 || text.length() <= width) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + text.length() / width);
        int start = 0;
        while (text.length() - start > width) {
            int limit = start + width;
            int breakAt = -1;
            for (int i = limit - 1; i > start; i--) {
                char c = text.charAt(i);
                if (c == ',' || c == ' ') {
                    breakAt = i + 1;
                    break;
                }
            }
            if (breakAt <= start) {
                breakAt = limit;
            }
            out.append(text, start, breakAt).append('\n');
            start = breakAt;
            while (start < text.length() && text.charAt(start) == ' ') {
                start++;
            }
        }
        out.append(text.substring(start));
        return out.toString();
    }
}
