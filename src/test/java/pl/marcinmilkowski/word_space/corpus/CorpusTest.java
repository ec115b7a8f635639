package pl.marcinmilkowski.word_space.corpus;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusTest {

    @Test
    @DisplayName("Corpus should copy its documents")
    void testDefensiveCopy() {
        List<String> doc = new ArrayList<>(Arrays.asList("a", "b"));
        List<List<String>> docs = new ArrayList<>();
        docs.add(doc);

        Corpus corpus = Corpus.of(docs);
        doc.add("c");
        docs.add(List.of("d"));

        assertEquals(1, corpus.size());
        assertEquals(List.of("a", "b"), corpus.document(0));
        assertThrows(UnsupportedOperationException.class, () -> corpus.documents().add(List.of()));
        assertThrows(UnsupportedOperationException.class, () -> corpus.document(0).add("x"));
    }

    @Test
    @DisplayName("Empty documents and empty corpora are valid")
    void testEmpty() {
        assertTrue(Corpus.empty().isEmpty());
        assertEquals(0, Corpus.empty().tokenCount());

        Corpus withEmptyDoc = Corpus.of(List.of(List.of(), List.of("x", "y")));
        assertEquals(2, withEmptyDoc.size());
        assertEquals(2, withEmptyDoc.tokenCount());
    }

    @Test
    @DisplayName("Null tokens are rejected")
    void testNullToken() {
        List<String> doc = Arrays.asList("a", null);
        assertThrows(NullPointerException.class, () -> Corpus.of(List.of(doc)));
    }
}
