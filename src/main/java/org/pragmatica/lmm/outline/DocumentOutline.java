package org.pragmatica.lmm.outline;

import org.pragmatica.lmm.tree.Document;
import org.pragmatica.lmm.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the section outline of a document from its {@code part} blocks.
 */
public final class DocumentOutline {
    private static final String PART = "part";

    private DocumentOutline() {}

    /**
     * One symbol per {@code part} block. Parts nested inside other blocks are hoisted to the
     * nearest enclosing part, or to the top level.
     */
    public static List<OutlineSymbol> collect(Document document) {
        return collect(document.nodes());
    }

    private static List<OutlineSymbol> collect(List<Node> nodes) {
        var symbols = new ArrayList<OutlineSymbol>();
        for (var node : nodes) {
            if (!(node instanceof Node.Block block)) {
                continue;
            }
            var children = collect(block.nodes());
            if (PART.equals(block.name())) {
                symbols.add(new OutlineSymbol(block.title(), block.span(), block.span(), children));
            } else {
                symbols.addAll(children);
            }
        }
        return symbols;
    }
}
