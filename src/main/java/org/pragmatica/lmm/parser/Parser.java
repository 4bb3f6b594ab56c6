package org.pragmatica.lmm.parser;

/**
 * Parser interface - turns LMM source text into a document tree plus diagnostics.
 * Implementations hold no per-parse state and may be shared between threads.
 */
public interface Parser {

    /**
     * Parse input. Never fails: malformed constructs are reported as diagnostics
     * and the best-effort document is returned.
     */
    ParseResult parse(String input);

    /**
     * The configuration this parser applies.
     */
    ParserConfig config();
}
