package org.pragmatica.lmm.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceSpanTest {

    @Test
    void extract_usesUtf16ColumnsOfTheRightLine() {
        var source = "ab\ncé😀d";
        var span = SourceSpan.of(SourceLocation.at(1, 1, 1, 1), SourceLocation.at(1, 7, 4, 3));

        assertEquals("é😀", span.extract(source));
    }

    @Test
    void extract_acrossLines() {
        var source = "@part A\n  B {\nbody";
        var span = SourceSpan.of(SourceLocation.START, SourceLocation.at(1, 5, 5, 5));

        assertEquals("@part A\n  B {", span.extract(source));
    }

    @Test
    void at_isEmptySingleLineSpan() {
        var span = SourceSpan.at(SourceLocation.lineStart(2));

        assertTrue(span.isEmpty());
        assertFalse(span.isMultiLine());
    }

    @Test
    void isMultiLine_whenEndIsOnLaterLine() {
        var span = SourceSpan.of(SourceLocation.START, SourceLocation.at(1, 0, 0, 0));

        assertTrue(span.isMultiLine());
        assertFalse(span.isEmpty());
    }
}
