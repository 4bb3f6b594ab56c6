package org.pragmatica.lmm.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.lmm.error.Diagnostic;
import org.pragmatica.lmm.tree.SourceLocation;
import org.pragmatica.lmm.tree.SourceSpan;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the scan cursor: column bookkeeping, line movement and in-line search.
 */
class ParsingContextTest {

    // === Position Management ===

    @Test
    void position_startsAtZero() {
        var ctx = ParsingContext.create("test", ParserConfig.DEFAULT);

        assertEquals(0, ctx.pos());
        assertEquals(SourceLocation.START, ctx.location());
        assertTrue(ctx.isLineStart());
        assertFalse(ctx.isAtEnd());
    }

    @Test
    void advance_keepsThreeColumnsInStep() {
        var ctx = ParsingContext.create("aé😀\nb", ParserConfig.DEFAULT);

        ctx.advance();
        assertEquals(SourceLocation.at(0, 1, 1, 1), ctx.location());
        ctx.advance();
        assertEquals(SourceLocation.at(0, 3, 2, 2), ctx.location());
        ctx.advance();
        assertEquals(SourceLocation.at(0, 7, 4, 3), ctx.location());
        assertEquals(4, ctx.pos());

        ctx.advance();
        assertEquals(SourceLocation.lineStart(1), ctx.location());
        assertEquals(5, ctx.pos());
        assertEquals(5, ctx.lineStart());
        assertTrue(ctx.isLineStart());
    }

    @Test
    void advanceTo_neverMovesBackwards() {
        var ctx = ParsingContext.create("abcdef", ParserConfig.DEFAULT);

        ctx.advanceTo(4);
        ctx.advanceTo(2);

        assertEquals(4, ctx.pos());
        assertEquals(SourceLocation.at(0, 4, 4, 4), ctx.location());
    }

    @Test
    void advanceLine_movesToNextLineStart() {
        var ctx = ParsingContext.create("ab\ncd", ParserConfig.DEFAULT);

        ctx.advance();
        ctx.advanceLine();

        assertEquals(SourceLocation.lineStart(1), ctx.location());
        assertEquals("cd", ctx.currentLine());
        assertTrue(ctx.isLineStart());
    }

    @Test
    void advanceLine_onLastLine_stopsAtEnd() {
        var ctx = ParsingContext.create("ab", ParserConfig.DEFAULT);

        ctx.advanceLine();

        assertTrue(ctx.isAtEnd());
        assertEquals(SourceLocation.at(0, 2, 2, 2), ctx.location());
    }

    @Test
    void advanceLineIfAtEol_onlyConsumesNewlineAtLineEnd() {
        var ctx = ParsingContext.create("a{\nb", ParserConfig.DEFAULT);

        ctx.advance();
        ctx.advanceLineIfAtEol();
        assertEquals(1, ctx.pos());

        ctx.advance();
        ctx.advanceLineIfAtEol();
        assertEquals(3, ctx.pos());
        assertTrue(ctx.isLineStart());
    }

    @Test
    void lastConsumedLine_atLineStart_isPreviousLine() {
        var withNewline = ParsingContext.create("a\n", ParserConfig.DEFAULT);
        withNewline.advanceLine();

        var withoutNewline = ParsingContext.create("a\nb", ParserConfig.DEFAULT);
        withoutNewline.advanceLine();
        withoutNewline.advanceLine();

        assertEquals(0, withNewline.lastConsumedLine());
        assertEquals(1, withoutNewline.lastConsumedLine());
    }

    // === Line Search ===

    @Test
    void findInLine_onlySearchesCurrentLineFromCursor() {
        var ctx = ParsingContext.create("x } y\n}", ParserConfig.DEFAULT);

        assertEquals(2, ctx.findInLine("}"));

        ctx.advanceTo(3);
        assertEquals(-1, ctx.findInLine("}"));
    }

    @Test
    void findInLine_matchesLongerDelimiter() {
        var ctx = ParsingContext.create("a } b }+ c", ParserConfig.DEFAULT);

        assertEquals(6, ctx.findInLine("}+"));
    }

    @Test
    void locate_walksCodePoints() {
        assertEquals(SourceLocation.at(0, 6, 3, 2), ParsingContext.locate(0, "é😀x", 3));
        assertEquals(SourceLocation.lineStart(5), ParsingContext.locate(5, "abc", 0));
    }

    // === Diagnostics ===

    @Test
    void diagnostics_keepInsertionOrder() {
        var ctx = ParsingContext.create("", ParserConfig.DEFAULT);
        var span = SourceSpan.at(SourceLocation.START);

        ctx.addError("first", span);
        ctx.addDiagnostic(Diagnostic.warning("second", span));

        assertEquals(2, ctx.diagnostics().size());
        assertEquals("first", ctx.diagnostics().get(0).message());
        assertEquals("second", ctx.diagnostics().get(1).message());
    }
}
