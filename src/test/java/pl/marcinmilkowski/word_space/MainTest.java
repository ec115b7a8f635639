package pl.marcinmilkowski.word_space;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.word_space.corpus.Corpus;
import pl.marcinmilkowski.word_space.embedding.EmbeddingJson;
import pl.marcinmilkowski.word_space.embedding.EmbeddingMatrix;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks of the command line.
 */
class MainTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Flags override values from the config file")
    void testOptionsOverrideConfig() throws IOException {
        Main.PipelineOptions options = Main.parseOptions(new String[]{
            "embed", "--config", "src/test/resources/test-config.json", "--window", "3", "--corpus", "x.txt"});

        assertEquals(3, options.windowSize);
        assertEquals(3, options.dimensions);
        assertEquals(42L, options.seed);
        assertTrue(options.lowercase);
        assertNotNull(options.markers);
        assertEquals("x.txt", options.corpusFile);
    }

    @Test
    @DisplayName("Markers flag wraps documents read from file")
    void testReadCorpusWithMarkers() throws IOException {
        Main.PipelineOptions options = Main.parseOptions(new String[]{
            "vocab", "--markers", "--corpus", TestCorpora.TOY_CORPUS_FILE.toString()});

        Corpus corpus = Main.readCorpus(options);
        assertEquals(TestCorpora.toyCorpus(), corpus);
    }

    @Test
    @DisplayName("Embed command writes embeddings and plot")
    void testEmbedCommand() throws IOException {
        Path out = tempDir.resolve("emb.json");
        Path plot = tempDir.resolve("plot.svg");

        Main.main(new String[]{
            "embed", "--corpus", TestCorpora.TOY_CORPUS_FILE.toString(), "--markers",
            "--window", "2", "--dims", "2", "--output", out.toString(), "--plot", plot.toString()});

        EmbeddingMatrix embedding = EmbeddingJson.read(out);
        assertEquals(10, embedding.size());
        assertEquals(2, embedding.dimensions());
        assertTrue(Files.readString(plot).contains(">glitters</text>"));
    }

    @Test
    @DisplayName("Flag without a value is reported by name")
    void testMissingFlagValue() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> Main.parseOptions(new String[]{"embed", "--corpus", "x.txt", "--window"}));
        assertEquals("Missing value for --window", ex.getMessage());

        assertThrows(IllegalArgumentException.class, () -> Main.parseOptions(new String[]{"embed", "--config"}));
    }
}
