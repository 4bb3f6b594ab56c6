package org.pragmatica.lmm.parser;

import org.pragmatica.lmm.tree.Node;
import org.pragmatica.lmm.tree.SourceSpan;
import org.pragmatica.lmm.tree.TextLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Line-level text rules shared by plain lines, comment lines and verbatim sections:
 * weighted indentation, the {@code !!} prefix, stripping and unescaping.
 */
final class TextSegments {
    private TextSegments() {}

    /**
     * A text line collected during the scan, before unescaping.
     */
    record PendingLine(int indent, String raw, SourceSpan span, boolean isComment) {

        TextLine toTextLine() {
            return new TextLine(indent, unescape(raw), span, isComment);
        }
    }

    static boolean isCommentLine(String line) {
        var trimmed = line.stripLeading();
        return trimmed.startsWith("!") && !trimmed.startsWith("!!");
    }

    static boolean isDollarLine(String line) {
        return line.strip().equals("$");
    }

    /**
     * Parse {@code line[start, end)} as text. Indentation and the {@code !!} prefix only apply
     * when the segment starts at column 0.
     *
     * @return the line, or empty when nothing but whitespace remains
     */
    static Optional<PendingLine> segment(String line, int lineIndex, int start, int end, ParserConfig config) {
        if (start >= end) {
            return Optional.empty();
        }
        var segment = line.substring(start, end);
        int indent = 0;
        int skip = 0;

        if (start == 0) {
            skip = leadingIndentLength(segment);
            indent = weightedIndent(segment.substring(0, skip), config);
        }

        var rest = segment.substring(skip);
        var value = rest.strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        int valueStart = start + skip + (rest.length() - rest.stripLeading().length());
        var span = ParsingContext.spanOf(lineIndex, line, valueStart, valueStart + value.length());

        if (start == 0 && value.startsWith("!!")) {
            value = value.substring(1);
        }
        return Optional.of(new PendingLine(indent, value, span, false));
    }

    /**
     * Parse a {@code !} comment line. Comment lines are kept even when their text is empty.
     */
    static Optional<PendingLine> comment(String line, int lineIndex, ParserConfig config) {
        if (!isCommentLine(line)) {
            return Optional.empty();
        }
        int skip = leadingIndentLength(line);
        int indent = weightedIndent(line.substring(0, skip), config);
        int bang = line.indexOf('!', skip);
        var rest = line.substring(bang + 1);
        var value = rest.strip();
        int valueStart = bang + 1 + (rest.length() - rest.stripLeading().length());
        var span = ParsingContext.spanOf(lineIndex, line, valueStart, valueStart + value.length());
        return Optional.of(new PendingLine(indent, value, span, true));
    }

    /**
     * Parse a whole physical line as either a comment or text, as done inside verbatim sections.
     */
    static Optional<PendingLine> line(String line, int lineIndex, ParserConfig config) {
        if (isCommentLine(line)) {
            return comment(line, lineIndex, config);
        }
        return segment(line, lineIndex, 0, line.length(), config);
    }

    static Node.Text toText(List<PendingLine> pending) {
        var lines = new ArrayList<TextLine>(pending.size());
        for (var line : pending) {
            lines.add(line.toTextLine());
        }
        return new Node.Text(lines);
    }

    /**
     * Collapse the escape pairs {@code @@}, {@code ##} and <code>{{</code> to their first character, left to right.
     */
    static String unescape(String value) {
        var sb = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (i + 1 < value.length() && value.charAt(i + 1) == c && isEscapable(c)) {
                sb.append(c);
                i += 2;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    static int weightedIndent(String whitespace, ParserConfig config) {
        int indent = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            indent += whitespace.charAt(i) == '\t' ? config.tabWidth() : config.spaceWidth();
        }
        return indent;
    }

    private static int leadingIndentLength(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static boolean isEscapable(char c) {
        return c == '@' || c == '#' || c == '{';
    }
}
