package pl.marcinmilkowski.word_space.corpus;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.word_space.TestCorpora;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Fixture file with markers matches the in-memory toy corpus")
    void testReadToyCorpus() throws IOException {
        CorpusReader reader = new CorpusReader();
        reader.setBoundaryMarkers("START", "END");

        Corpus corpus = reader.read(TestCorpora.TOY_CORPUS_FILE);

        assertEquals(TestCorpora.toyCorpus(), corpus);
    }

    @Test
    @DisplayName("Tokens are kept verbatim by default")
    void testCaseSensitiveByDefault() throws IOException {
        CorpusReader reader = new CorpusReader();
        Corpus corpus = reader.fromLines(List.of("The  cat\tsat, The END."));

        assertEquals(List.of("The", "cat", "sat,", "The", "END."), corpus.document(0));
    }

    @Test
    @DisplayName("Lowercasing leaves boundary markers alone")
    void testLowercase() throws IOException {
        CorpusReader reader = new CorpusReader();
        reader.setLowercase(true);
        reader.setBoundaryMarkers("START", "END");

        Corpus corpus = reader.fromLines(List.of("All That Glitters"));

        assertEquals(List.of("START", "all", "that", "glitters", "END"), corpus.document(0));
    }

    @Test
    @DisplayName("Blank lines and comments are skipped")
    void testSkipsBlankAndComments() throws IOException {
        Path file = tempDir.resolve("corpus.txt");
        Files.writeString(file, "# header\n\na b\n   \n# more\nc\n");

        Corpus corpus = new CorpusReader().read(file);

        assertEquals(2, corpus.size());
        assertEquals(List.of("a", "b"), corpus.document(0));
        assertEquals(List.of("c"), corpus.document(1));
    }

    @Test
    @DisplayName("Null lines are treated as blank")
    void testNullLines() throws IOException {
        Corpus corpus = new CorpusReader().fromLines(Arrays.asList(null, "x"));
        assertEquals(1, corpus.size());
    }

    @Test
    @DisplayName("Missing file fails with IOException")
    void testMissingFile() {
        Path missing = tempDir.resolve("nope.txt");
        IOException ex = assertThrows(IOException.class, () -> new CorpusReader().read(missing));
        assertTrue(ex.getMessage().contains("nope.txt"));
    }

    @Test
    @DisplayName("Markers must be set together and not blank")
    void testInvalidMarkers() {
        CorpusReader reader = new CorpusReader();
        assertThrows(IllegalArgumentException.class, () -> reader.setBoundaryMarkers("START", null));
        assertThrows(IllegalArgumentException.class, () -> reader.setBoundaryMarkers(" ", "END"));

        reader.setBoundaryMarkers("S", "E");
        assertTrue(reader.hasBoundaryMarkers());
        reader.setBoundaryMarkers(null, null);
        assertFalse(reader.hasBoundaryMarkers());
    }

    @Test
    @DisplayName("Long tokens are kept whole")
    void testLongToken() throws IOException {
        String longToken = "x".repeat(300);
        Corpus corpus = new CorpusReader().fromLines(List.of("a " + longToken + " b"));
        assertEquals(List.of("a", longToken, "b"), corpus.document(0));

        CorpusReader lowercasing = new CorpusReader();
        lowercasing.setLowercase(true);
        Corpus lowered = lowercasing.fromLines(List.of("A " + "Y".repeat(300)));
        assertEquals(List.of("a", "y".repeat(300)), lowered.document(0));
    }
}
