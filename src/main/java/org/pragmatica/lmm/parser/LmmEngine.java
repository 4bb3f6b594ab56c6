package org.pragmatica.lmm.parser;

import org.pragmatica.lmm.error.Diagnostic;
import org.pragmatica.lmm.parser.TextSegments.PendingLine;
import org.pragmatica.lmm.tree.Attribute;
import org.pragmatica.lmm.tree.Document;
import org.pragmatica.lmm.tree.Node;
import org.pragmatica.lmm.tree.SourceLocation;
import org.pragmatica.lmm.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LMM parsing engine - a single forward pass over the input with one recursion level per
 * nested block.
 */
public final class LmmEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(LmmEngine.class);

    static final String ATTRIBUTE_MISSING_COLON = "attribute missing ':'";
    static final String ATTRIBUTE_KEY_EMPTY = "attribute key is empty";
    static final String HEADER_MISSING_BRACE = "block header missing opening delimiter";
    static final String MISSING_BLOCK_NAME = "missing block name";
    static final String MISSING_SPACE = "missing space between block name and '{'";
    static final String UNTERMINATED_VERBATIM = "unterminated $ block";
    static final String MISSING_CLOSING = "missing closing delimiter";
    static final String TRAILING_CONTENT = "unexpected trailing content";

    private final ParserConfig config;

    private LmmEngine(ParserConfig config) {
        this.config = config;
    }

    public static LmmEngine create(ParserConfig config) {
        return new LmmEngine(Objects.requireNonNull(config, "config"));
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResult parse(String input) {
        Objects.requireNonNull(input, "input");
        var ctx = ParsingContext.create(input, config);

        var attrs = parseLeadingAttributes(ctx);
        var nodes = parseNodes(ctx, Optional.empty());
        skipTrailingLines(ctx);

        if (!ctx.isAtEnd()) {
            var start = ctx.location();
            ctx.advanceTo(input.length());
            ctx.addError(TRAILING_CONTENT, ctx.spanFrom(start));
        }

        var diagnostics = ctx.diagnostics();
        log.debug("Parsed {} chars into {} attribute(s), {} top-level node(s), {} diagnostic(s)",
                  input.length(), attrs.size(), nodes.size(), diagnostics.size());
        return new ParseResult(new Document(attrs, nodes), diagnostics, input);
    }

    // === Attributes ===

    /**
     * Consume consecutive {@code #key: value} lines at a line start. Stops at the first line that is
     * blank, a comment, or not a valid attribute.
     */
    private List<Attribute> parseLeadingAttributes(ParsingContext ctx) {
        var attrs = new ArrayList<Attribute>();
        while (!ctx.isAtEnd() && ctx.isLineStart()) {
            var line = ctx.currentLine();
            if (TextSegments.isCommentLine(line) || line.isBlank()) {
                break;
            }
            var attr = parseAttributeLine(ctx, line);
            if (attr.isEmpty()) {
                break;
            }
            attrs.add(attr.get());
            ctx.advanceLine();
        }
        return attrs;
    }

    private Optional<Attribute> parseAttributeLine(ParsingContext ctx, String line) {
        var trimmed = line.stripLeading();
        if (!trimmed.startsWith("#") || trimmed.startsWith("##")) {
            return Optional.empty();
        }
        int lineIndex = ctx.location().line();
        var span = ParsingContext.spanOf(lineIndex, line, 0, line.length());
        var body = trimmed.substring(1);
        int colon = body.indexOf(':');
        if (colon < 0) {
            ctx.addError(ATTRIBUTE_MISSING_COLON, span);
            return Optional.empty();
        }
        var key = body.substring(0, colon).strip();
        if (key.isEmpty()) {
            ctx.addError(ATTRIBUTE_KEY_EMPTY, span);
            return Optional.empty();
        }
        return Optional.of(Attribute.of(key, body.substring(colon + 1).strip(), span));
    }

    // === Node Loop ===

    /**
     * Parse nodes until {@code closing} is found, or until end of input when no delimiter is expected.
     * Pending text lines are grouped into one {@link Node.Text} until a block, a verbatim section or
     * the end of the sequence flushes them.
     */
    private List<Node> parseNodes(ParsingContext ctx, Optional<String> closing) {
        var nodes = new ArrayList<Node>();
        var pending = new ArrayList<PendingLine>();
        boolean closed = closing.isEmpty();

        while (!ctx.isAtEnd()) {
            if (closing.isPresent()) {
                var delimiter = closing.get();
                int closeAt = ctx.findInLine(delimiter);
                if (closeAt >= 0) {
                    if (closeAt > ctx.pos()) {
                        TextSegments.segment(ctx.currentLine(),
                                             ctx.location().line(),
                                             ctx.lineOffset(),
                                             closeAt - ctx.lineStart(),
                                             ctx.config())
                                    .ifPresent(pending::add);
                    }
                    flush(nodes, pending);
                    ctx.advanceTo(closeAt + delimiter.length());
                    closed = true;
                    break;
                }
            }

            if (ctx.isLineStart()) {
                var line = ctx.currentLine();
                if (TextSegments.isCommentLine(line)) {
                    TextSegments.comment(line, ctx.location().line(), ctx.config())
                                .ifPresent(pending::add);
                    ctx.advanceLine();
                    continue;
                }
                if (line.isBlank()) {
                    ctx.advanceLine();
                    continue;
                }
                if (TextSegments.isDollarLine(line)) {
                    flush(nodes, pending);
                    ctx.advanceLine();
                    parseVerbatim(ctx).ifPresent(nodes::add);
                    continue;
                }
                if (isHeaderLine(line)) {
                    // a rejected header leaves the cursor past it; the loop goes on from there
                    parseBlock(ctx, line, nodes, pending).ifPresent(nodes::add);
                    continue;
                }
            }

            TextSegments.segment(ctx.currentLine(),
                                 ctx.location().line(),
                                 ctx.lineOffset(),
                                 ctx.lineEnd() - ctx.lineStart(),
                                 ctx.config())
                        .ifPresent(pending::add);
            ctx.advanceLine();
        }

        flush(nodes, pending);
        if (!closed) {
            ctx.addError(MISSING_CLOSING, SourceSpan.at(SourceLocation.lineStart(ctx.lastConsumedLine())));
        }
        return nodes;
    }

    /**
     * A line opening a block header. {@code @@} is an escaped {@code @} and stays text.
     */
    private static boolean isHeaderLine(String line) {
        var trimmed = line.stripLeading();
        return trimmed.startsWith("@") && !trimmed.startsWith("@@");
    }

    private static void flush(List<Node> nodes, List<PendingLine> pending) {
        if (pending.isEmpty()) {
            return;
        }
        nodes.add(TextSegments.toText(pending));
        pending.clear();
    }

    // === Verbatim Sections ===

    /**
     * Collect lines up to the next bare {@code $} line. No block recognition happens inside.
     */
    private Optional<Node> parseVerbatim(ParsingContext ctx) {
        var lines = new ArrayList<PendingLine>();
        boolean terminated = false;
        while (!ctx.isAtEnd()) {
            var line = ctx.currentLine();
            if (TextSegments.isDollarLine(line)) {
                ctx.advanceLine();
                terminated = true;
                break;
            }
            TextSegments.line(line, ctx.location().line(), ctx.config())
                        .ifPresent(lines::add);
            ctx.advanceLine();
        }
        if (!terminated) {
            ctx.addError(UNTERMINATED_VERBATIM, SourceSpan.at(SourceLocation.lineStart(ctx.lastConsumedLine())));
        }
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(TextSegments.toText(lines));
    }

    // === Blocks ===

    /**
     * Parse a block starting on the current line. Pending text is flushed only once the header is
     * accepted.
     *
     * @return the block, or empty when the header was rejected
     */
    private Optional<Node> parseBlock(ParsingContext ctx, String line, List<Node> nodes, List<PendingLine> pending) {
        int atColumn = line.length() - line.stripLeading().length();
        var start = ParsingContext.locate(ctx.location().line(), line, atColumn);
        var scanned = scanHeader(ctx.input(), ctx.lineStart() + atColumn, start);

        if (scanned.isEmpty()) {
            ctx.addError(HEADER_MISSING_BRACE, ParsingContext.spanOf(ctx.location().line(), line, 0, line.length()));
            ctx.advanceLine();
            return Optional.empty();
        }

        var raw = scanned.get();
        ctx.advanceTo(raw.endPos());
        ctx.advanceLineIfAtEol();

        var header = BlockHeader.parse(raw.text());
        if (header.isEmpty()) {
            ctx.addError(MISSING_BLOCK_NAME, raw.span());
            return Optional.empty();
        }
        var parsed = header.get();
        if (parsed.missingSpace()) {
            ctx.addDiagnostic(Diagnostic.warning(MISSING_SPACE, raw.span())
                                        .withHelp("write '@" + parsed.name() + " {'"));
        }

        flush(nodes, pending);
        var attrs = parseLeadingAttributes(ctx);
        var children = parseNodes(ctx, Optional.of(parsed.closingDelimiter()));
        var params = parsed.params()
                           .stream()
                           .map(param -> Attribute.of(param.key(), param.value(), raw.span()))
                           .toList();
        return Optional.of(new Node.Block(parsed.name(), parsed.args(), params, attrs, children, raw.span()));
    }

    /**
     * Header text from {@code @} up to the first unescaped opening brace, newlines folded to spaces.
     *
     * @param text   header text without the brace
     * @param span   from {@code @} through the brace
     * @param endPos input index just past the brace
     */
    record ScannedHeader(String text, SourceSpan span, int endPos) {}

    /**
     * Look ahead from {@code from} for the opening brace without moving the cursor. A doubled
     * brace is an escaped literal brace.
     */
    static Optional<ScannedHeader> scanHeader(String input, int from, SourceLocation start) {
        var text = new StringBuilder();
        var loc = start;
        int i = from;
        while (i < input.length()) {
            int cp = input.codePointAt(i);
            if (cp == '{') {
                if (i + 1 < input.length() && input.charAt(i + 1) == '{') {
                    text.append('{');
                    loc = loc.advance(cp).advance(cp);
                    i += 2;
                    continue;
                }
                return Optional.of(new ScannedHeader(text.toString(), SourceSpan.of(start, loc.advance(cp)), i + 1));
            }
            text.appendCodePoint(cp == '\n' ? ' ' : cp);
            loc = loc.advance(cp);
            i += Character.charCount(cp);
        }
        return Optional.empty();
    }

    private static void skipTrailingLines(ParsingContext ctx) {
        while (!ctx.isAtEnd()) {
            var line = ctx.currentLine();
            if (!TextSegments.isCommentLine(line) && !line.isBlank()) {
                break;
            }
            ctx.advanceLine();
        }
    }
}
