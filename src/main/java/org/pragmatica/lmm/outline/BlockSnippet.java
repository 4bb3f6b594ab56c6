package org.pragmatica.lmm.outline;

import java.util.List;

/**
 * Completion snippet for a block name. {@code $1}, {@code $2} mark tab stops in {@code body}.
 *
 * @param label  block name shown in the completion list
 * @param detail short description
 * @param body   text inserted after the {@code @}
 */
public record BlockSnippet(String label, String detail, String body) {
    private static final List<BlockSnippet> DEFAULTS = List.of(
        new BlockSnippet("part", "section", "part { $1 }"),
        new BlockSnippet("list", "list block", "list bullet {\n  $1\n}"),
        new BlockSnippet("code", "code block", "code[lang=$1] {\n  $2\n}"),
        new BlockSnippet("b", "bold", "b {$1}")
    );

    /**
     * Snippets offered for the block names the renderers know about, plus {@code b}.
     */
    public static List<BlockSnippet> defaults() {
        return DEFAULTS;
    }
}
