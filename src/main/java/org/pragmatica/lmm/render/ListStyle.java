package org.pragmatica.lmm.render;

import org.pragmatica.lmm.tree.Node;

/**
 * Presentation of a {@code list} block's text lines.
 */
public enum ListStyle {
    /**
     * One bullet item per line. The default.
     */
    BULLET,
    /**
     * Plain lines without markers.
     */
    LINE;

    /**
     * Style selected by a {@code bullet} or {@code line} marker among the block's params or args.
     * An explicit {@code bullet} wins over {@code line}.
     */
    public static ListStyle of(Node.Block block) {
        if (block.hasMarker("bullet")) {
            return BULLET;
        }
        if (block.hasMarker("line")) {
            return LINE;
        }
        return BULLET;
    }
}
