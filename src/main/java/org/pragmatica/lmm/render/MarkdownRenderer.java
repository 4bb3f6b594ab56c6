package org.pragmatica.lmm.render;

import org.pragmatica.lmm.tree.Document;
import org.pragmatica.lmm.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders a document as Markdown. {@code part} blocks become headings, {@code list} blocks
 * become lists, {@code code} blocks become fenced code; other blocks are transparent.
 */
public final class MarkdownRenderer {
    private static final Logger log = LoggerFactory.getLogger(MarkdownRenderer.class);
    private static final int MAX_HEADING_LEVEL = 6;

    private MarkdownRenderer() {}

    public static String render(Document document) {
        var out = new StringBuilder();
        renderNodes(document.nodes(), out, 0);
        // only the very end is trimmed
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') {
            end--;
        }
        out.setLength(end);
        log.trace("Rendered {} top-level node(s) into {} chars of Markdown", document.nodes().size(), out.length());
        return out.toString();
    }

    private static void renderNodes(List<Node> nodes, StringBuilder out, int partLevel) {
        for (var node : nodes) {
            if (node instanceof Node.Block block) {
                renderBlock(block, out, partLevel);
            } else if (node instanceof Node.Text text) {
                renderText(text, out);
            }
        }
    }

    private static void renderBlock(Node.Block block, StringBuilder out, int partLevel) {
        switch (block.name()) {
            case "part" -> {
                int level = Math.min(partLevel + 1, MAX_HEADING_LEVEL);
                out.append("#".repeat(level)).append(' ').append(block.title()).append("\n\n");
                renderNodes(block.nodes(), out, partLevel + 1);
            }
            case "list" -> renderList(block, out, ListStyle.of(block));
            case "code" -> renderCode(block, out);
            default -> renderNodes(block.nodes(), out, partLevel);
        }
    }

    private static void renderText(Node.Text text, StringBuilder out) {
        for (var line : text.visibleLines()) {
            out.append(" ".repeat(line.indent())).append(line.value()).append('\n');
        }
        out.append('\n');
    }

    private static void renderList(Node.Block block, StringBuilder out, ListStyle style) {
        boolean hadItems = false;
        for (var node : block.nodes()) {
            if (node instanceof Node.Text text) {
                for (var line : text.visibleLines()) {
                    hadItems = true;
                    if (style == ListStyle.BULLET) {
                        out.append("- ");
                    }
                    out.append(line.value()).append('\n');
                }
            } else if (node instanceof Node.Block child) {
                renderBlock(child, out, 0);
            }
        }
        if (hadItems) {
            out.append('\n');
        }
    }

    private static void renderCode(Node.Block block, StringBuilder out) {
        out.append("```").append(block.param("lang").orElse("")).append('\n');
        for (var node : block.nodes()) {
            if (node instanceof Node.Text text) {
                for (var line : text.visibleLines()) {
                    out.append(line.value()).append('\n');
                }
            }
        }
        out.append("```\n\n");
    }
}
