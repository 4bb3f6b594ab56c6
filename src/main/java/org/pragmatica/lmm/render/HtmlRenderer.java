package org.pragmatica.lmm.render;

import org.pragmatica.lmm.tree.Document;
import org.pragmatica.lmm.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders a document as an HTML fragment wrapped in {@code <div class="lmm-document">}.
 * Attributes and params are carried over as {@code data-*} and {@code data-param-*} attributes.
 */
public final class HtmlRenderer {
    private static final Logger log = LoggerFactory.getLogger(HtmlRenderer.class);
    private static final int MAX_HEADING_LEVEL = 6;

    private HtmlRenderer() {}

    public static String render(Document document) {
        var out = new StringBuilder();
        out.append("<div class=\"lmm-document\"");
        HtmlText.dataAttributes(out, document.attrs(), List.of());
        out.append(">\n");
        renderNodes(document.nodes(), out, 0);
        out.append("</div>\n");
        log.trace("Rendered {} top-level node(s) into {} chars of HTML", document.nodes().size(), out.length());
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
            case "part" -> renderPart(block, out, partLevel);
            case "list" -> renderList(block, out, ListStyle.of(block));
            case "code" -> renderCode(block, out);
            default -> {
                out.append("<div class=\"lmm-block lmm-block-")
                   .append(HtmlText.sanitizeIdent(block.name()))
                   .append('"');
                HtmlText.dataAttributes(out, block.attrs(), block.params());
                out.append(">\n");
                renderNodes(block.nodes(), out, partLevel);
                out.append("</div>\n");
            }
        }
    }

    private static void renderPart(Node.Block block, StringBuilder out, int partLevel) {
        int level = Math.min(partLevel + 1, MAX_HEADING_LEVEL);
        out.append("<section class=\"lmm-part\"");
        HtmlText.dataAttributes(out, block.attrs(), block.params());
        out.append(">\n");
        out.append("<h").append(level).append('>');
        HtmlText.escapeInto(out, block.title());
        out.append("</h").append(level).append(">\n");
        renderNodes(block.nodes(), out, partLevel + 1);
        out.append("</section>\n");
    }

    private static void renderText(Node.Text text, StringBuilder out) {
        for (var line : text.visibleLines()) {
            out.append("<p>");
            HtmlText.escapeInto(out, line.value());
            out.append("</p>\n");
        }
    }

    private static void renderList(Node.Block block, StringBuilder out, ListStyle style) {
        var open = style == ListStyle.BULLET ? "<ul class=\"lmm-list\"" : "<div class=\"lmm-lines\"";
        var itemOpen = style == ListStyle.BULLET ? "<li>" : "<div class=\"lmm-line\">";
        var itemClose = style == ListStyle.BULLET ? "</li>\n" : "</div>\n";

        out.append(open);
        HtmlText.dataAttributes(out, block.attrs(), block.params());
        out.append(">\n");
        for (var node : block.nodes()) {
            if (node instanceof Node.Text text) {
                for (var line : text.visibleLines()) {
                    out.append(itemOpen);
                    HtmlText.escapeInto(out, line.value());
                    out.append(itemClose);
                }
            } else if (node instanceof Node.Block child) {
                renderBlock(child, out, 0);
            }
        }
        out.append(style == ListStyle.BULLET ? "</ul>\n" : "</div>\n");
    }

    private static void renderCode(Node.Block block, StringBuilder out) {
        var lang = block.param("lang").orElse("");
        out.append("<pre class=\"lmm-code\"");
        HtmlText.dataAttributes(out, block.attrs(), block.params());
        out.append("><code");
        if (!lang.isEmpty()) {
            out.append(" class=\"language-");
            HtmlText.escapeInto(out, lang);
            out.append('"');
        }
        out.append('>');
        for (var node : block.nodes()) {
            if (node instanceof Node.Text text) {
                for (var line : text.visibleLines()) {
                    HtmlText.escapeInto(out, line.value());
                    out.append('\n');
                }
            }
        }
        out.append("</code></pre>\n");
    }
}
