package org.pragmatica.lmm.render;

import org.junit.jupiter.api.Test;
import org.pragmatica.lmm.LmmParser;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownRendererTest {

    // === Parts ===

    @Test
    void part_nestingIncreasesHeadingLevel() {
        assertThat(render("@part A {\n@part B {\nx\n}\n}")).isEqualTo("# A\n\n## B\n\nx");
    }

    @Test
    void part_headingLevelIsCappedAtSix() {
        var input = new StringBuilder();
        for (int i = 1; i <= 7; i++) {
            input.append("@part P").append(i).append(" {\n");
        }
        input.append("}\n".repeat(7));

        assertThat(render(input.toString())).endsWith("###### P6\n\n###### P7");
    }

    @Test
    void part_withoutArgs_usesBlockName() {
        assertThat(render("@part {\n}")).isEqualTo("# part");
    }

    // === Lists ===

    @Test
    void list_bulletIsDefault() {
        assertThat(render("@list {\na\nb\n}\nafter")).isEqualTo("- a\n- b\n\nafter");
    }

    @Test
    void list_lineStyle_omitsMarkers() {
        assertThat(render("@list line {\na\nb\n}")).isEqualTo("a\nb");
    }

    @Test
    void list_childBlocksRestartHeadingDepth() {
        assertThat(render("@part A {\n@list {\n@part B {\n}\n}\n}")).isEqualTo("# A\n\n# B");
    }

    // === Code and Other Blocks ===

    @Test
    void code_withoutLang_usesBareFence() {
        assertThat(render("@code {\n  x = 1\n}")).isEqualTo("```\nx = 1\n```");
    }

    @Test
    void unknownBlock_isTransparent() {
        assertThat(render("@note {\nhi\n}")).isEqualTo("hi");
    }

    // === Text ===

    @Test
    void text_commentsAreHidden() {
        assertThat(render("a\n! secret\nb")).isEqualTo("a\nb");
    }

    @Test
    void text_indentIsReproducedAsSpaces() {
        assertThat(render("  a\n\tb")).isEqualTo("  a\n  b");
    }

    @Test
    void emptyDocument_rendersEmptyString() {
        assertThat(render("")).isEmpty();
    }

    private static String render(String input) {
        return MarkdownRenderer.render(LmmParser.parse(input).document());
    }
}
