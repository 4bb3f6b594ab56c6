package org.pragmatica.lmm.outline;

import org.pragmatica.lmm.tree.SourceSpan;

import java.util.List;

/**
 * A document outline entry for a {@code part} block.
 *
 * @param name           part title
 * @param range          full range of the symbol
 * @param selectionRange range to select when the symbol is picked
 * @param children       nested parts
 */
public record OutlineSymbol(String name, SourceSpan range, SourceSpan selectionRange, List<OutlineSymbol> children) {

    public OutlineSymbol {
        children = List.copyOf(children);
    }
}
