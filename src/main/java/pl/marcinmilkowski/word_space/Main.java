package pl.marcinmilkowski.word_space;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_space.config.EmbeddingConfigLoader;
import pl.marcinmilkowski.word_space.cooccurrence.CooccurrenceBuilder;
import pl.marcinmilkowski.word_space.cooccurrence.CooccurrenceMatrix;
import pl.marcinmilkowski.word_space.corpus.Corpus;
import pl.marcinmilkowski.word_space.corpus.CorpusReader;
import pl.marcinmilkowski.word_space.embedding.EmbeddingJson;
import pl.marcinmilkowski.word_space.embedding.EmbeddingMatrix;
import pl.marcinmilkowski.word_space.embedding.Neighbor;
import pl.marcinmilkowski.word_space.reduce.DimensionReducer;
import pl.marcinmilkowski.word_space.viz.EmbeddingScatterPlot;
import pl.marcinmilkowski.word_space.vocab.Vocabulary;
import pl.marcinmilkowski.word_space.vocab.VocabularyBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Main entry point for the Word Space application.
 * Builds vocabularies, co-occurrence matrices and SVD embeddings from plain-text corpora.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Starting Word Space application...");

        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "vocab":
                    handleVocabCommand(args);
                    break;
                case "cooccur":
                    handleCooccurCommand(args);
                    break;
                case "embed":
                    handleEmbedCommand(args);
                    break;
                case "neighbors":
                    handleNeighborsCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    /**
     * Options shared by the corpus-based commands. Starts from the config
     * (file or default) and is overridden by explicit flags.
     */
    static final class PipelineOptions {
        String corpusFile;
        String outputFile;
        String plotFile;
        int windowSize;
        int dimensions;
        long seed;
        int iterations;
        int threads;
        boolean lowercase;
        EmbeddingConfigLoader.BoundaryMarkers markers;

        PipelineOptions(EmbeddingConfigLoader config) {
            windowSize = config.getWindowSize();
            dimensions = config.getDimensions();
            seed = config.getSeed();
            iterations = config.getIterations();
            threads = config.getThreads();
            lowercase = config.isLowercase();
            markers = config.getBoundaryMarkers();
        }
    }

    static PipelineOptions parseOptions(String[] args) throws IOException {
        EmbeddingConfigLoader config = EmbeddingConfigLoader.createDefault();
        for (int i = 1; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config = new EmbeddingConfigLoader(Paths.get(args[i + 1]));
            }
        }
        logger.debug("Effective config: {}", config.toJson());

        PipelineOptions options = new PipelineOptions(config);
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                    requireValue(args, ++i);
                    break;
                case "--corpus":
                case "-c":
                    options.corpusFile = requireValue(args, ++i);
                    break;
                case "--output":
                case "-o":
                    options.outputFile = requireValue(args, ++i);
                    break;
                case "--plot":
                    options.plotFile = requireValue(args, ++i);
                    break;
                case "--window":
                case "-w":
                    options.windowSize = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--dims":
                case "-k":
                    options.dimensions = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--seed":
                    options.seed = Long.parseLong(requireValue(args, ++i));
                    break;
                case "--iterations":
                    options.iterations = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--threads":
                    options.threads = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--lowercase":
                    options.lowercase = true;
                    break;
                case "--markers":
                    options.markers = new EmbeddingConfigLoader.BoundaryMarkers("START", "END");
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }
        return options;
    }

    /**
     * Value of the flag at {@code i - 1}.
     *
     * @throws IllegalArgumentException if the flag is the last argument
     */
    private static String requireValue(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }

    static Corpus readCorpus(PipelineOptions options) throws IOException {
        CorpusReader reader = new CorpusReader();
        reader.setLowercase(options.lowercase);
        if (options.markers != null) {
            reader.setBoundaryMarkers(options.markers.start(), options.markers.end());
        }
        return reader.read(Paths.get(options.corpusFile));
    }

    private static void handleVocabCommand(String[] args) throws IOException {
        PipelineOptions options = parseOptions(args);
        if (options.corpusFile == null) {
            System.err.println("Error: --corpus is required");
            System.err.println("Usage: java -jar word-space.jar vocab --corpus <file>");
            return;
        }

        Corpus corpus = readCorpus(options);
        Vocabulary vocabulary = VocabularyBuilder.build(corpus);

        System.out.println("Words in corpus: " + vocabulary.size());
        for (String token : vocabulary.tokens()) {
            System.out.println("  " + token);
        }
    }

    private static void handleCooccurCommand(String[] args) throws IOException {
        PipelineOptions options = parseOptions(args);
        if (options.corpusFile == null) {
            System.err.println("Error: --corpus is required");
            System.err.println("Usage: java -jar word-space.jar cooccur --corpus <file> [--window <n>]");
            return;
        }

        Corpus corpus = readCorpus(options);
        CooccurrenceBuilder builder = new CooccurrenceBuilder(options.windowSize);
        builder.setThreads(options.threads);
        CooccurrenceMatrix matrix = builder.build(corpus);

        Vocabulary vocabulary = matrix.vocabulary();
        int width = 6;
        for (String token : vocabulary.tokens()) {
            width = Math.max(width, token.length() + 1);
        }
        String cell = "%" + width + "s";

        StringBuilder header = new StringBuilder(String.format(cell, ""));
        for (String token : vocabulary.tokens()) {
            header.append(String.format(cell, token));
        }
        System.out.println("Co-occurrence matrix (window=" + matrix.windowSize() + "):");
        System.out.println(header);
        for (int i = 0; i < matrix.size(); i++) {
            StringBuilder line = new StringBuilder(String.format(cell, vocabulary.tokenAt(i)));
            for (int j = 0; j < matrix.size(); j++) {
                line.append(String.format(cell, (long) matrix.get(i, j)));
            }
            System.out.println(line);
        }
    }

    private static void handleEmbedCommand(String[] args) throws IOException {
        PipelineOptions options = parseOptions(args);
        if (options.corpusFile == null) {
            System.err.println("Error: --corpus is required");
            System.err.println("Usage: java -jar word-space.jar embed --corpus <file> [--dims <k>] [--output <json>]");
            return;
        }

        System.out.println("Corpus: " + options.corpusFile);
        System.out.println("Window: " + options.windowSize);
        System.out.println("Dimensions: " + options.dimensions);
        System.out.println("Seed: " + options.seed);
        System.out.println("Iterations: " + options.iterations);
        System.out.println();

        Corpus corpus = readCorpus(options);
        CooccurrenceBuilder builder = new CooccurrenceBuilder(options.windowSize);
        builder.setThreads(options.threads);
        CooccurrenceMatrix matrix = builder.build(corpus);

        DimensionReducer reducer = new DimensionReducer();
        reducer.setSeed(options.seed);
        reducer.setIterations(options.iterations);
        EmbeddingMatrix embedding = reducer.reduce(matrix, options.dimensions);

        if (options.outputFile != null) {
            EmbeddingJson.write(embedding, Paths.get(options.outputFile));
            System.out.println("Embeddings written to " + options.outputFile);
        } else {
            for (int i = 0; i < embedding.size(); i++) {
                StringBuilder line = new StringBuilder(embedding.vocabulary().tokenAt(i));
                for (double v : embedding.row(i)) {
                    line.append(String.format(" %.6f", v));
                }
                System.out.println(line);
            }
        }

        if (options.plotFile != null) {
            EmbeddingScatterPlot plot = new EmbeddingScatterPlot(embedding.normalizeRows(), 800, 800);
            Path plotPath = Paths.get(options.plotFile);
            Files.writeString(plotPath, plot.toSVG(), StandardCharsets.UTF_8);
            System.out.println("Plot written to " + plotPath);
        }
    }

    private static void handleNeighborsCommand(String[] args) throws IOException {
        String embeddingsFile = null;
        String word = null;
        int limit = 10;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--embeddings":
                case "-e":
                    embeddingsFile = requireValue(args, ++i);
                    break;
                case "--word":
                    word = requireValue(args, ++i);
                    break;
                case "--limit":
                    limit = Integer.parseInt(requireValue(args, ++i));
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (embeddingsFile == null || word == null) {
            System.err.println("Error: --embeddings and --word are required");
            System.err.println("Usage: java -jar word-space.jar neighbors --embeddings <json> --word <w> [--limit <n>]");
            return;
        }

        EmbeddingMatrix embedding = EmbeddingJson.read(Paths.get(embeddingsFile));
        List<Neighbor> neighbors = embedding.nearestNeighbors(word, limit);

        System.out.println("Nearest neighbours of '" + word + "':");
        for (Neighbor n : neighbors) {
            System.out.printf("  %-20s %.4f%n", n.word(), n.similarity());
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar word-space.jar <command> [options]");
        System.out.println();
        System.out.println("Available commands:");
        System.out.println("  vocab      - List the distinct words of a corpus");
        System.out.println("  cooccur    - Print the window co-occurrence matrix");
        System.out.println("  embed      - Build SVD word embeddings");
        System.out.println("  neighbors  - Show nearest neighbours from saved embeddings");
        System.out.println("  help       - Show this help message");
        System.out.println();
        System.out.println("Corpus format: one document per line, tokens separated by whitespace.");
        System.out.println();
        System.out.println("Common options:");
        System.out.println("  --corpus <file>     Corpus file");
        System.out.println("  --config <json>     Configuration file");
        System.out.println("  --window <n>        Context window radius (default 4)");
        System.out.println("  --lowercase         Lowercase tokens");
        System.out.println("  --markers           Wrap documents in START/END tokens");
        System.out.println("  --threads <n>       Counting threads (default 1)");
        System.out.println();
        System.out.println("Embed command:");
        System.out.println("  java -jar word-space.jar embed --corpus <file> [--dims <k>] [--seed <s>]");
        System.out.println("    [--iterations <n>] [--output <json>] [--plot <svg>]");
        System.out.println();
        System.out.println("Neighbors command:");
        System.out.println("  java -jar word-space.jar neighbors --embeddings <json> --word <w> [--limit <n>]");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar word-space.jar vocab --corpus sentences.txt");
        System.out.println("  java -jar word-space.jar cooccur --corpus sentences.txt --window 2 --markers");
        System.out.println("  java -jar word-space.jar embed --corpus sentences.txt --dims 2 --plot words.svg");
        System.out.println("  java -jar word-space.jar neighbors --embeddings emb.json --word gold");
    }
}
