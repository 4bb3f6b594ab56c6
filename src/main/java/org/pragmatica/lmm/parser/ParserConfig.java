package org.pragmatica.lmm.parser;

/**
 * Parser configuration options.
 *
 * @param spaceWidth indent weight of one leading space
 * @param tabWidth   indent weight of one leading tab
 */
public record ParserConfig(
    int spaceWidth,
    int tabWidth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(1, 2);

    public ParserConfig {
        if (spaceWidth < 0) {
            throw new IllegalArgumentException("spaceWidth must not be negative: " + spaceWidth);
        }
        if (tabWidth < 0) {
            throw new IllegalArgumentException("tabWidth must not be negative: " + tabWidth);
        }
    }

    public ParserConfig withSpaceWidth(int spaceWidth) {
        return new ParserConfig(spaceWidth, tabWidth);
    }

    public ParserConfig withTabWidth(int tabWidth) {
        return new ParserConfig(spaceWidth, tabWidth);
    }
}
