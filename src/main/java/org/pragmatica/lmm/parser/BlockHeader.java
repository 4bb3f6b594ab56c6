package org.pragmatica.lmm.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed block header text: {@code @name arg1 arg2 [k=v, flag] ++}, everything before the opening brace.
 *
 * @param name         block name
 * @param args         bare tokens after the name
 * @param params       bracketed parameters in source order
 * @param plusCount    number of trailing {@code +}, which extends the closing delimiter
 * @param missingSpace whether the opening brace followed the name directly
 */
record BlockHeader(
    String name,
    List<String> args,
    List<Param> params,
    int plusCount,
    boolean missingSpace
) {
    record Param(String key, String value) {}

    /**
     * Delimiter closing the body: <code>}</code> followed by {@code plusCount} plus signs.
     */
    String closingDelimiter() {
        return "}" + "+".repeat(plusCount);
    }

    /**
     * Parse header text. Empty when it does not start with {@code @} followed by at least one
     * name character.
     */
    static Optional<BlockHeader> parse(String header) {
        if (header.isEmpty() || header.charAt(0) != '@') {
            return Optional.empty();
        }
        int cursor = 1;
        while (cursor < header.length() && isNameChar(header.charAt(cursor))) {
            cursor++;
        }
        if (cursor == 1) {
            return Optional.empty();
        }
        var name = header.substring(1, cursor);
        boolean missingSpace = cursor == header.length();

        cursor = skipSpaces(header, cursor);
        var args = new ArrayList<String>();
        while (cursor < header.length()) {
            char c = header.charAt(cursor);
            if (c == '[' || c == '+') {
                break;
            }
            int start = cursor;
            while (cursor < header.length() && !isArgBoundary(header.charAt(cursor))) {
                cursor++;
            }
            args.add(header.substring(start, cursor));
            cursor = skipSpaces(header, cursor);
        }

        var params = new ArrayList<Param>();
        if (cursor < header.length() && header.charAt(cursor) == '[') {
            cursor = parseParams(header, cursor + 1, params);
            cursor = skipSpaces(header, cursor);
        }

        int plusCount = 0;
        while (cursor < header.length() && header.charAt(cursor) == '+') {
            plusCount++;
            cursor++;
        }

        return Optional.of(new BlockHeader(name, List.copyOf(args), List.copyOf(params), plusCount, missingSpace));
    }

    /**
     * Collect comma separated tokens up to the first {@code ]}. Nesting is not supported.
     *
     * @return index just past the {@code ]}, or the header length when it is missing, in which
     *         case the unterminated last token still counts
     */
    private static int parseParams(String header, int start, List<Param> params) {
        var token = new StringBuilder();
        int cursor = start;
        while (cursor < header.length()) {
            char c = header.charAt(cursor);
            if (c == ']' || c == ',') {
                addParam(token.toString(), params);
                token.setLength(0);
                cursor++;
                if (c == ']') {
                    return cursor;
                }
                continue;
            }
            token.append(c);
            cursor++;
        }
        addParam(token.toString(), params);
        return cursor;
    }

    private static void addParam(String token, List<Param> params) {
        var trimmed = token.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        int eq = trimmed.indexOf('=');
        if (eq < 0) {
            params.add(new Param(trimmed, ""));
            return;
        }
        params.add(new Param(trimmed.substring(0, eq).strip(), trimmed.substring(eq + 1).strip()));
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private static boolean isArgBoundary(char c) {
        return isSpace(c) || c == '[' || c == '+';
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static int skipSpaces(String header, int index) {
        while (index < header.length() && isSpace(header.charAt(index))) {
            index++;
        }
        return index;
    }
}
