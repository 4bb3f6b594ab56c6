package org.pragmatica.lmm.tree;

/**
 * Key/value pair from an attribute line ({@code #key: value}) or a block parameter list.
 * Both strings are trimmed.
 */
public record Attribute(String key, String value, SourceSpan span) {

    public static Attribute of(String key, String value, SourceSpan span) {
        return new Attribute(key, value, span);
    }
}
