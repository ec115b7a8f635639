package pl.marcinmilkowski.word_space.corpus;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a plain-text corpus: one document per line, tokens separated by whitespace.
 *
 * Blank lines and lines starting with '#' are skipped. Tokenization goes through
 * a Lucene analyzer, so tokens are kept exactly as written unless lowercasing
 * is switched on.
 *
 * Usage:
 *   CorpusReader reader = new CorpusReader();
 *   reader.setLowercase(true);
 *   reader.setBoundaryMarkers("START", "END");
 *   Corpus corpus = reader.read(path);
 */
public class CorpusReader {

    private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);

    private static final String FIELD = "text";

    // Lucene splits longer whitespace-delimited runs; this is its upper bound
    private static final int MAX_TOKEN_LENGTH = 1024 * 1024;

    private boolean lowercase = false;
    private String startMarker;
    private String endMarker;

    public void setLowercase(boolean lowercase) { this.lowercase = lowercase; }

    /**
     * Wrap every document in the given marker tokens.
     * Pass nulls to switch markers off.
     */
    public void setBoundaryMarkers(String start, String end) {
        if ((start == null) != (end == null)) {
            throw new IllegalArgumentException("Boundary markers must be both set or both null");
        }
        if (start != null && (start.isBlank() || end.isBlank())) {
            throw new IllegalArgumentException("Boundary markers must not be blank");
        }
        this.startMarker = start;
        this.endMarker = end;
    }

    public boolean isLowercase() { return lowercase; }

    public boolean hasBoundaryMarkers() { return startMarker != null; }

    /**
     * Read a corpus file.
     *
     * @param path UTF-8 text file, one document per line
     * @throws IOException if the file is missing or unreadable
     */
    public Corpus read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Corpus file not found: " + path);
        }
        logger.info("Reading corpus: {}", path);

        // Lenient decoding, as for CoNLL-U input
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)
            .replaceWith("?");

        List<List<String>> documents = new ArrayList<>();
        try (Analyzer analyzer = createAnalyzer();
             BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                documents.add(toDocument(analyzer, trimmed));
            }
        }

        Corpus corpus = Corpus.of(documents);
        logger.info("Read {} documents, {} tokens", corpus.size(), corpus.tokenCount());
        return corpus;
    }

    /**
     * Build a corpus from in-memory lines with the same rules as {@link #read(Path)}.
     */
    public Corpus fromLines(List<String> lines) throws IOException {
        List<List<String>> documents = new ArrayList<>();
        try (Analyzer analyzer = createAnalyzer()) {
            for (String line : lines) {
                String trimmed = line == null ? "" : line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                documents.add(toDocument(analyzer, trimmed));
            }
        }
        return Corpus.of(documents);
    }

    private List<String> toDocument(Analyzer analyzer, String line) throws IOException {
        List<String> tokens = new ArrayList<>();
        if (startMarker != null) {
            tokens.add(startMarker);
        }
        try (TokenStream stream = analyzer.tokenStream(FIELD, line)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        }
        if (endMarker != null) {
            tokens.add(endMarker);
        }
        return tokens;
    }

    private Analyzer createAnalyzer() {
        if (!lowercase) {
            return new WhitespaceAnalyzer(MAX_TOKEN_LENGTH);
        }
        return new Analyzer() {
            @Override
            protected TokenStreamComponents createComponents(String fieldName) {
                Tokenizer source = new WhitespaceTokenizer(TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, MAX_TOKEN_LENGTH);
                return new TokenStreamComponents(source, new LowerCaseFilter(source));
            }
        };
    }
}
