package org.pragmatica.lmm;

import org.pragmatica.lmm.parser.LmmEngine;
import org.pragmatica.lmm.parser.ParseResult;
import org.pragmatica.lmm.parser.Parser;
import org.pragmatica.lmm.parser.ParserConfig;
import org.pragmatica.lmm.render.HtmlRenderer;
import org.pragmatica.lmm.render.MarkdownRenderer;
import org.pragmatica.lmm.tree.Document;

/**
 * Entry point for parsing and rendering LMM documents.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = LmmParser.parse("""
 *     #title: Demo
 *     @part Intro {
 *       Hello
 *     }
 *     """);
 *
 * var html = LmmParser.renderHtml(result.document());
 * }</pre>
 */
public final class LmmParser {
    private static final Parser DEFAULT_PARSER = LmmEngine.create(ParserConfig.DEFAULT);

    private LmmParser() {}

    /**
     * Parse with default indentation weights (space = 1, tab = 2).
     */
    public static ParseResult parse(String input) {
        return DEFAULT_PARSER.parse(input);
    }

    /**
     * Parse with custom configuration.
     */
    public static ParseResult parse(String input, ParserConfig config) {
        return LmmEngine.create(config).parse(input);
    }

    public static String renderMarkdown(Document document) {
        return MarkdownRenderer.render(document);
    }

    public static String renderHtml(Document document) {
        return HtmlRenderer.render(document);
    }

    /**
     * Create a builder for a reusable parser with custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int spaceWidth = ParserConfig.DEFAULT.spaceWidth();
        private int tabWidth = ParserConfig.DEFAULT.tabWidth();

        private Builder() {}

        public Builder spaceWidth(int width) {
            this.spaceWidth = width;
            return this;
        }

        public Builder tabWidth(int width) {
            this.tabWidth = width;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a width is negative
         */
        public Parser build() {
            return LmmEngine.create(new ParserConfig(spaceWidth, tabWidth));
        }
    }
}
