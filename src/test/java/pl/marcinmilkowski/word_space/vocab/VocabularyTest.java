package pl.marcinmilkowski.word_space.vocab;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Vocabulary.
 */
class VocabularyTest {

    private final Vocabulary vocabulary = Vocabulary.ofSorted(List.of("a", "b", "c"));

    @Test
    @DisplayName("Indices follow token order")
    void testIndexOf() {
        assertEquals(0, vocabulary.indexOf("a"));
        assertEquals(2, vocabulary.indexOf("c"));
        assertEquals("b", vocabulary.tokenAt(1));
        assertTrue(vocabulary.contains("b"));
        assertFalse(vocabulary.contains("d"));
    }

    @Test
    @DisplayName("Unknown token raises UnknownTokenException")
    void testUnknownToken() {
        UnknownTokenException ex = assertThrows(UnknownTokenException.class, () -> vocabulary.indexOf("zzz"));
        assertEquals("zzz", ex.getToken());
        assertTrue(ex.getMessage().contains("zzz"));
    }

    @Test
    @DisplayName("Index map iterates in index order")
    void testIndexMap() {
        Map<String, Integer> map = vocabulary.toIndexMap();
        assertEquals(List.of("a", "b", "c"), List.copyOf(map.keySet()));
        assertEquals(List.of(0, 1, 2), List.copyOf(map.values()));
        assertThrows(UnsupportedOperationException.class, () -> map.put("d", 3));
    }

    @Test
    @DisplayName("Unsorted or duplicate tokens are rejected")
    void testOfSortedValidation() {
        assertThrows(IllegalArgumentException.class, () -> Vocabulary.ofSorted(List.of("b", "a")));
        assertThrows(IllegalArgumentException.class, () -> Vocabulary.ofSorted(List.of("a", "a")));
        assertEquals(0, Vocabulary.ofSorted(List.of()).size());
    }

    @Test
    @DisplayName("Sorted check compares code points")
    void testOfSortedUsesCodePoints() {
        assertEquals(2, Vocabulary.ofSorted(List.of("\uFF21", "\uD83D\uDE00")).size());
        assertThrows(IllegalArgumentException.class, () -> Vocabulary.ofSorted(List.of("\uD83D\uDE00", "\uFF21")));
        assertTrue(Vocabulary.CODE_POINT_ORDER.compare("ab", "abc") < 0);
        assertEquals(0, Vocabulary.CODE_POINT_ORDER.compare("x", "x"));
    }
}
