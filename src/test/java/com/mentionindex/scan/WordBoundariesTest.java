package com.mentionindex.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class WordBoundariesTest {

    @Test
    void testMatchesAtRequiresWholeWord() {
        assertTrue(WordBoundaries.matchesAt("John attended", 0, "john"));
        assertFalse(WordBoundaries.matchesAt("Johnson attended", 0, "john"));
        assertFalse(WordBoundaries.matchesAt("MrJohn", 2, "john"));
        assertTrue(WordBoundaries.matchesAt("(John)", 1, "john"));
        assertFalse(WordBoundaries.matchesAt("Jo", 0, "john"));
    }

    @Test
    void testDigitsAndNonLatinLettersAreWordChars() {
        assertFalse(WordBoundaries.matchesAt("John2", 0, "john"));
        assertFalse(WordBoundaries.matchesAt("张John", 1, "john"));
        assertTrue(WordBoundaries.matchesAt("见 张三。", 2, "张三"));
        assertFalse(WordBoundaries.matchesAt("见张三。", 1, "张三"));
        assertTrue(WordBoundaries.matchesAt("john_smith", 0, "john"));
    }

    @Test
    void testFindAllReportsEveryOccurrence() {
        assertEquals(List.of(0, 15), WordBoundaries.findAll("John Smith met John Smith again", "john smith"));
        assertEquals(List.of(0, 3), WordBoundaries.findAll("aa aa", "aa"));
        assertEquals(List.of(), WordBoundaries.findAll("aaa", "aa"));
        assertEquals(List.of(), WordBoundaries.findAll("a", "john"));
        assertEquals(List.of(), WordBoundaries.findAll("text", ""));
    }

    @Test
    void testWordStartAndEnd() {
        assertTrue(WordBoundaries.isWordStart("- John", 2));
        assertFalse(WordBoundaries.isWordStart("- John", 3));
        assertFalse(WordBoundaries.isWordStart("- John", 0));
        assertEquals(6, WordBoundaries.wordEnd("- John Smith", 2));
    }
}
