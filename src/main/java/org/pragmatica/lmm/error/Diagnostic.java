package org.pragmatica.lmm.error;

import org.pragmatica.lmm.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory message produced while parsing. Diagnostics never abort a parse.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * error: missing closing delimiter
 *   --> notes.lmm:3:1
 *    |
 *  3 | @list {
 *    | ^
 *    |
 * </pre>
 *
 * @param severity error or warning
 * @param message  primary message
 * @param span     source span the message refers to
 * @param notes    additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String message,
    SourceSpan span,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Diagnostic severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic as a compiler-style report. Lines and columns are shown one-based,
     * columns counted in characters.
     *
     * @param source   the source text
     * @param filename optional filename for display
     * @return formatted diagnostic
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display()).append(": ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line() + 1).append(":").append(loc.col32() + 1).append("\n");

        int firstLine = span.start().line();
        int lastLine = Math.min(span.end().line(), lines.length - 1);
        int gutterWidth = String.valueOf(lastLine + 1).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = firstLine; lineNum <= lastLine; lineNum++) {
            var lineContent = lines[lineNum];
            sb.append(String.format("%" + gutterWidth + "d", lineNum + 1))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(underline(lineNum, lineContent))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    private String underline(int lineNum, String lineContent) {
        int lineLength = lineContent.codePointCount(0, lineContent.length());
        int startCol = span.start().line() == lineNum ? span.start().col32() : 0;
        int endCol = span.end().line() == lineNum ? span.end().col32() : lineLength;
        return " ".repeat(startCol) + "^".repeat(Math.max(1, endCol - startCol));
    }

    /**
     * Single-line format for quick display.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s",
            "input", loc.line() + 1, loc.col32() + 1, severity.display(), message);
    }
}
