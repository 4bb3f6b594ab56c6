package org.pragmatica.lmm.tree;

/**
 * A position in source text: zero-based line plus the zero-based column within that line,
 * expressed at once in UTF-8 bytes ({@code col8}), UTF-16 code units ({@code col16})
 * and Unicode scalar values ({@code col32}).
 */
public record SourceLocation(int line, int col8, int col16, int col32) {

    public static final SourceLocation START = new SourceLocation(0, 0, 0, 0);

    public static SourceLocation at(int line, int col8, int col16, int col32) {
        return new SourceLocation(line, col8, col16, col32);
    }

    /**
     * Start of the given line (all columns zero).
     */
    public static SourceLocation lineStart(int line) {
        return new SourceLocation(line, 0, 0, 0);
    }

    /**
     * Location reached after consuming one code point from this one.
     * A newline moves to the start of the next line.
     */
    public SourceLocation advance(int codePoint) {
        if (codePoint == '\n') {
            return lineStart(line + 1);
        }
        return new SourceLocation(line,
                                  col8 + utf8Length(codePoint),
                                  col16 + Character.charCount(codePoint),
                                  col32 + 1);
    }

    public boolean isLineStart() {
        return col8 == 0;
    }

    static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    @Override
    public String toString() {
        return line + ":" + col32;
    }
}
