package org.pragmatica.lmm.tree;

/**
 * A single line of text content.
 *
 * @param indent    weighted indentation of the line's leading whitespace
 * @param value     unescaped, stripped content
 * @param span      source span of {@code value} before unescaping
 * @param isComment whether the line came from a {@code !} comment
 */
public record TextLine(int indent, String value, SourceSpan span, boolean isComment) {}
