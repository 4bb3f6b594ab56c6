package org.pragmatica.lmm.render;

import org.pragmatica.lmm.tree.Attribute;

import java.util.List;

/**
 * HTML escaping and attribute helpers.
 */
final class HtmlText {
    private HtmlText() {}

    /**
     * Append {@code value} with {@code & < > " '} replaced by entities.
     */
    static void escapeInto(StringBuilder out, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
    }

    static String escape(String value) {
        var out = new StringBuilder(value.length());
        escapeInto(out, value);
        return out.toString();
    }

    /**
     * Lowercase ASCII letters, digits, {@code -} and {@code _} are kept; whitespace and {@code :}
     * become {@code -}; anything else is dropped.
     */
    static String sanitizeIdent(String value) {
        var out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isAsciiAlphanumeric(c) || c == '-' || c == '_') {
                out.append(Character.toLowerCase(c));
            } else if (isAsciiWhitespace(c) || c == ':') {
                out.append('-');
            }
        }
        return out.toString();
    }

    /**
     * Append {@code data-*} attributes for {@code attrs} and {@code data-param-*} attributes for
     * {@code params}. Keys that sanitize to nothing are skipped.
     */
    static void dataAttributes(StringBuilder out, List<Attribute> attrs, List<Attribute> params) {
        appendData(out, "data-", attrs);
        appendData(out, "data-param-", params);
    }

    private static void appendData(StringBuilder out, String prefix, List<Attribute> attributes) {
        for (var attribute : attributes) {
            var key = sanitizeIdent(attribute.key());
            if (key.isEmpty()) {
                continue;
            }
            out.append(' ').append(prefix).append(key).append("=\"");
            escapeInto(out, attribute.value());
            out.append('"');
        }
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }
}
