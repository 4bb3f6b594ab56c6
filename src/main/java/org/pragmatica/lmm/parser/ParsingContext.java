package org.pragmatica.lmm.parser;

import org.pragmatica.lmm.error.Diagnostic;
import org.pragmatica.lmm.tree.SourceLocation;
import org.pragmatica.lmm.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable scan state for a single parse: a forward-only cursor over the input and the
 * diagnostics recorded so far.
 *
 * <p>The cursor is an index into the input plus the derived {@link SourceLocation}. Every movement
 * goes through {@link #advance()}, so the byte, UTF-16 and character columns stay in step.
 */
public final class ParsingContext {
    private static final Logger log = LoggerFactory.getLogger(ParsingContext.class);

    private final String input;
    private final ParserConfig config;
    private final List<Diagnostic> diagnostics;

    private int pos;
    private int lineStart;
    private SourceLocation location;

    private ParsingContext(String input, ParserConfig config) {
        this.input = input;
        this.config = config;
        this.diagnostics = new ArrayList<>();
        this.pos = 0;
        this.lineStart = 0;
        this.location = SourceLocation.START;
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return location;
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public boolean isLineStart() {
        return pos == lineStart;
    }

    /**
     * Index of the first character of the current physical line.
     */
    public int lineStart() {
        return lineStart;
    }

    /**
     * Index of the newline ending the current line, or the input length on the last line.
     */
    public int lineEnd() {
        int newline = input.indexOf('\n', lineStart);
        return newline < 0 ? input.length() : newline;
    }

    /**
     * The whole current physical line, without its newline.
     */
    public String currentLine() {
        return input.substring(lineStart, lineEnd());
    }

    /**
     * Offset of the cursor within the current line, in UTF-16 units.
     */
    public int lineOffset() {
        return pos - lineStart;
    }

    /**
     * Line of the last consumed character. At a line start that is the previous line.
     */
    public int lastConsumedLine() {
        if (location.isLineStart() && location.line() > 0) {
            return location.line() - 1;
        }
        return location.line();
    }

    // === Character Access ===

    public int peek() {
        return input.codePointAt(pos);
    }

    /**
     * Consume one code point. The single primitive all other movement is built on.
     */
    public int advance() {
        int cp = input.codePointAt(pos);
        pos += Character.charCount(cp);
        location = location.advance(cp);
        if (cp == '\n') {
            lineStart = pos;
        }
        return cp;
    }

    /**
     * Consume code points until the cursor reaches {@code target}. Never moves backwards.
     */
    public void advanceTo(int target) {
        int limit = Math.min(target, input.length());
        while (pos < limit) {
            advance();
        }
    }

    /**
     * Consume the rest of the current line and its newline, if any.
     */
    public void advanceLine() {
        advanceTo(lineEnd());
        if (!isAtEnd() && peek() == '\n') {
            advance();
        }
    }

    /**
     * Consume the newline if nothing but it remains on the current line.
     */
    public void advanceLineIfAtEol() {
        if (pos >= lineEnd() && !isAtEnd() && peek() == '\n') {
            advance();
        }
    }

    /**
     * Find {@code needle} between the cursor and the end of the current line.
     *
     * @return absolute index of the match, or -1
     */
    public int findInLine(String needle) {
        int end = lineEnd();
        for (int i = pos; i + needle.length() <= end; i++) {
            if (input.startsWith(needle, i)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Location of a UTF-16 offset within a line's text, derived by walking its code points.
     */
    public static SourceLocation locate(int lineIndex, String lineText, int offset) {
        var loc = SourceLocation.lineStart(lineIndex);
        int i = 0;
        while (i < offset) {
            int cp = lineText.codePointAt(i);
            loc = loc.advance(cp);
            i += Character.charCount(cp);
        }
        return loc;
    }

    public static SourceSpan spanOf(int lineIndex, String lineText, int start, int end) {
        return SourceSpan.of(locate(lineIndex, lineText, start), locate(lineIndex, lineText, end));
    }

    // === Diagnostic Collection ===

    public void addDiagnostic(Diagnostic diagnostic) {
        log.debug("{} at {}: {}", diagnostic.severity().display(), diagnostic.span(), diagnostic.message());
        diagnostics.add(diagnostic);
    }

    public void addError(String message, SourceSpan span) {
        addDiagnostic(Diagnostic.error(message, span));
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    // === Accessors ===

    public String input() {
        return input;
    }

    public ParserConfig config() {
        return config;
    }

    // === Span Creation ===

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location);
    }
}
