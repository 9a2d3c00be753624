package com.scrabble.core.gaddag;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class GaddagBuilderTest {

    private static int walk(Gaddag gaddag, String path) {
        int node = gaddag.root();
        for (int i = 0; i < path.length() && node != Gaddag.NO_NODE; i++) {
            node = gaddag.next(node, Gaddag.symbolOf(path.charAt(i)));
        }
        return node;
    }

    @Test
    void containsExactlyTheWords() {
        Gaddag gaddag = GaddagBuilder.build(List.of("CAT", "CATS", "AT", "CARE"));

        for (String word : List.of("CAT", "CATS", "AT", "CARE")) {
            assertTrue(gaddag.contains(word), word);
        }
        for (String word : List.of("", "C", "CA", "ATS", "TA", "CAR", "SCAT", "CATSS")) {
            assertFalse(gaddag.contains(word), word);
        }
    }

    @Test
    void everySplitOfAWordIsTerminal() {
        Gaddag gaddag = GaddagBuilder.build(List.of("CARE"));

        for (String path : List.of("ERAC", "RAC+E", "AC+RE", "C+ARE")) {
            assertTrue(gaddag.isTerminal(walk(gaddag, path)), path);
        }
        assertFalse(gaddag.isTerminal(walk(gaddag, "RAC+")));
        assertEquals(Gaddag.NO_NODE, walk(gaddag, "ERAC+"));
        assertEquals(Gaddag.NO_NODE, walk(gaddag, "+CARE"));
    }

    @Test
    void letterMaskListsOutgoingLetters() {
        Gaddag gaddag = GaddagBuilder.build(List.of("AT", "CAT"));

        int expected = (1 << ('A' - 'A')) | (1 << ('C' - 'A')) | (1 << ('T' - 'A'));
        assertEquals(expected, gaddag.letterMask(gaddag.root()));
        assertEquals(0, gaddag.letterMask(Gaddag.NO_NODE));
        assertEquals(Gaddag.NO_NODE, gaddag.next(gaddag.root(), Gaddag.SYMBOL_COUNT));
        assertEquals(Gaddag.NO_NODE, gaddag.nextLetter(gaddag.root(), 'Z'));
    }

    @Test
    void emptyWordListHasOnlyRoot() {
        Gaddag gaddag = GaddagBuilder.build(List.of());

        assertEquals(1, gaddag.nodeCount());
        assertEquals(0, gaddag.arcCount());
        assertFalse(gaddag.contains("A"));
    }

    @Test
    void ignoresDuplicatesAndEmptyWords() {
        Gaddag plain = GaddagBuilder.build(List.of("AT", "TA"));
        Gaddag noisy = GaddagBuilder.build(Arrays.asList("TA", "", "AT", "AT"));

        assertArrayEquals(GaddagCodec.serialize(plain), GaddagCodec.serialize(noisy));
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        Gaddag first = GaddagBuilder.build(List.of("CAT", "CATS", "AT", "SCAT"));
        Gaddag second = GaddagBuilder.build(List.of("SCAT", "AT", "CATS", "CAT"));

        assertArrayEquals(GaddagCodec.serialize(first), GaddagCodec.serialize(second));
    }

    @Test
    void sharesCommonSuffixes() {
        Gaddag one = GaddagBuilder.build(List.of("CARE"));
        Gaddag two = GaddagBuilder.build(List.of("CARE", "BARE"));

        assertTrue(two.nodeCount() < 2 * one.nodeCount() - 1,
                "Minimisation should merge the states shared by CARE and BARE");
        assertTrue(two.contains("BARE"));
    }

    @Test
    void rejectsCharactersOutsideAlphabet() {
        assertThrows(ConstructionException.class, () -> GaddagBuilder.build(List.of("cat")));
        assertThrows(ConstructionException.class, () -> GaddagBuilder.build(List.of("C4T")));
        assertThrows(ConstructionException.class, () -> GaddagBuilder.build(Arrays.asList("AT", null)));
    }

    @Test
    void symbolMapping() {
        assertEquals(0, Gaddag.symbolOf('A'));
        assertEquals(Gaddag.SEPARATOR, Gaddag.symbolOf(Gaddag.SEPARATOR_CHAR));
        assertEquals(-1, Gaddag.symbolOf('a'));
        assertEquals('Z', Gaddag.charOf(25));
        assertThrows(IllegalArgumentException.class, () -> Gaddag.charOf(27));
    }
}
