package org.pragmatica.lmm.parser;

import org.pragmatica.lmm.error.Diagnostic;
import org.pragmatica.lmm.error.LmmParseException;
import org.pragmatica.lmm.tree.Document;

import java.util.List;

/**
 * Result of one parse - the (possibly partial) document and the diagnostics collected on the way,
 * in source encounter order.
 *
 * @param document    The parsed document, always present
 * @param diagnostics Accumulated diagnostic messages (empty for well-formed input)
 * @param source      The original source text (for formatting diagnostics)
 */
public record ParseResult(
    Document document,
    List<Diagnostic> diagnostics,
    String source
) {
    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Check if parsing produced no diagnostics at all.
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    /**
     * Check if there were any error-severity diagnostics. Warnings do not count.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public int errorCount() {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
            .count();
    }

    public int warningCount() {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
            .count();
    }

    /**
     * Return the document, or throw if any error diagnostic was recorded.
     *
     * @throws LmmParseException when {@link #hasErrors()} is true
     */
    public Document requireNoErrors() {
        if (!hasErrors()) {
            return document;
        }
        var errors = diagnostics.stream()
            .filter(Diagnostic::isError)
            .toList();
        throw new LmmParseException(errors.size() + " error(s) in LMM source:\n" + formatDiagnostics(), errors);
    }

    /**
     * Format all diagnostics.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Format all diagnostics with default filename "input".
     */
    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }
}
