package org.pragmatica.lmm.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.lmm.error.Diagnostic;
import org.pragmatica.lmm.error.LmmParseException;
import org.pragmatica.lmm.tree.Document;
import org.pragmatica.lmm.tree.SourceLocation;
import org.pragmatica.lmm.tree.SourceSpan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParseResultTest {

    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);
    private static final Diagnostic ERROR = Diagnostic.error("missing closing delimiter", SPAN);
    private static final Diagnostic WARNING = Diagnostic.warning("missing space between block name and '{'", SPAN);

    @Test
    void clean_hasNoDiagnostics() {
        var result = new ParseResult(Document.EMPTY, List.of(), "");

        assertTrue(result.isClean());
        assertFalse(result.hasErrors());
        assertEquals("", result.formatDiagnostics());
        assertSame(Document.EMPTY, result.requireNoErrors());
    }

    @Test
    void warningsOnly_areNotErrors() {
        var result = new ParseResult(Document.EMPTY, List.of(WARNING), "@a{}");

        assertFalse(result.isClean());
        assertFalse(result.hasErrors());
        assertEquals(0, result.errorCount());
        assertEquals(1, result.warningCount());
        assertSame(Document.EMPTY, result.requireNoErrors());
    }

    @Test
    void requireNoErrors_throwsWithErrorsOnly() {
        var result = new ParseResult(Document.EMPTY, List.of(WARNING, ERROR), "@a{");

        var exception = assertThrows(LmmParseException.class, result::requireNoErrors);
        assertEquals(List.of(ERROR), exception.diagnostics());
        assertTrue(exception.getMessage().startsWith("1 error(s) in LMM source:"));
        assertTrue(exception.getMessage().contains("error: missing closing delimiter"));
    }

    @Test
    void formatDiagnostics_usesFilenameForEveryEntry() {
        var result = new ParseResult(Document.EMPTY, List.of(ERROR, WARNING), "@a{");

        var formatted = result.formatDiagnostics("doc.lmm");
        assertEquals(2, formatted.split("--> doc.lmm:1:1", -1).length - 1);
        assertTrue(formatted.indexOf("error:") < formatted.indexOf("warning:"));
    }

    @Test
    void diagnostics_areCopied() {
        var diagnostics = new java.util.ArrayList<Diagnostic>();
        diagnostics.add(ERROR);
        var result = new ParseResult(Document.EMPTY, diagnostics, "");
        diagnostics.clear();

        assertEquals(1, result.diagnostics().size());
    }
}
