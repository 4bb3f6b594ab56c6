package org.pragmatica.lmm.error;

import java.io.Serial;
import java.util.List;

/**
 * Thrown by strict callers when a parse produced error diagnostics.
 */
public final class LmmParseException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final List<Diagnostic> diagnostics;

    public LmmParseException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
