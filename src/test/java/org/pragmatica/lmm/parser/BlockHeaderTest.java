package org.pragmatica.lmm.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.lmm.parser.BlockHeader.Param;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockHeaderTest {

    @Test
    void parse_nameAndArgs() {
        var header = BlockHeader.parse("@part Hello World ").orElseThrow();

        assertEquals("part", header.name());
        assertEquals(List.of("Hello", "World"), header.args());
        assertTrue(header.params().isEmpty());
        assertEquals(0, header.plusCount());
        assertFalse(header.missingSpace());
    }

    @Test
    void parse_braceRightAfterName_flagsMissingSpace() {
        var header = BlockHeader.parse("@part").orElseThrow();

        assertTrue(header.missingSpace());
        assertTrue(header.args().isEmpty());
    }

    @Test
    void parse_nameAllowsDashUnderscoreAndDigits() {
        assertEquals("my-block_2", BlockHeader.parse("@my-block_2 ").orElseThrow().name());
    }

    @Test
    void parse_bracketedParams() {
        var header = BlockHeader.parse("@code[lang = rust, x=a=b, flag ,] ").orElseThrow();

        assertEquals(List.of(new Param("lang", "rust"), new Param("x", "a=b"), new Param("flag", "")),
                     header.params());
        assertFalse(header.missingSpace());
    }

    @Test
    void parse_duplicateParamsAreKept() {
        var header = BlockHeader.parse("@x[a=1, a=2] ").orElseThrow();

        assertEquals(List.of(new Param("a", "1"), new Param("a", "2")), header.params());
    }

    @Test
    void parse_argsStopAtBracketAndPlus() {
        var header = BlockHeader.parse("@x one two[k=v] ++ ").orElseThrow();

        assertEquals(List.of("one", "two"), header.args());
        assertEquals(List.of(new Param("k", "v")), header.params());
        assertEquals(2, header.plusCount());
        assertEquals("}++", header.closingDelimiter());
    }

    @Test
    void parse_plusDirectlyAfterName() {
        var header = BlockHeader.parse("@code+ ").orElseThrow();

        assertEquals("code", header.name());
        assertEquals(1, header.plusCount());
        assertEquals("}+", header.closingDelimiter());
        assertFalse(header.missingSpace());
    }

    @Test
    void parse_unclosedBracket_takesRestAsParams() {
        var header = BlockHeader.parse("@x[a=1, b ").orElseThrow();

        assertEquals(List.of(new Param("a", "1"), new Param("b", "")), header.params());
    }

    @Test
    void parse_withoutName_isEmpty() {
        assertTrue(BlockHeader.parse("@ ").isEmpty());
        assertTrue(BlockHeader.parse("@!x ").isEmpty());
        assertTrue(BlockHeader.parse("").isEmpty());
        assertTrue(BlockHeader.parse("part ").isEmpty());
    }

    @Test
    void closingDelimiter_withoutPlus_isSingleBrace() {
        assertEquals("}", BlockHeader.parse("@a ").orElseThrow().closingDelimiter());
    }
}
