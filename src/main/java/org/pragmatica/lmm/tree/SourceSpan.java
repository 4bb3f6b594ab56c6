package org.pragmatica.lmm.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive). May cover several lines.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public boolean isMultiLine() {
        return end.line() > start.line();
    }

    /**
     * Cut the text covered by this span out of the source it was produced from.
     */
    public String extract(String source) {
        return source.substring(offsetOf(source, start), offsetOf(source, end));
    }

    private static int offsetOf(String source, SourceLocation location) {
        int offset = 0;
        for (int line = 0; line < location.line(); line++) {
            int newline = source.indexOf('\n', offset);
            if (newline < 0) {
                return source.length();
            }
            offset = newline + 1;
        }
        return Math.min(source.length(), offset + location.col16());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
