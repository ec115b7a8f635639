package pl.marcinmilkowski.word_space.cooccurrence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_space.corpus.Corpus;
import pl.marcinmilkowski.word_space.vocab.Vocabulary;
import pl.marcinmilkowski.word_space.vocab.VocabularyBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Builds a symmetric window co-occurrence matrix from a corpus.
 *
 * For every position i of every document, each other position j of the same
 * document with |i - j| <= windowSize adds one to (index(doc[i]), index(doc[j])).
 * Windows stop at document edges; nothing is padded.
 *
 * Usage:
 *   CooccurrenceBuilder builder = new CooccurrenceBuilder();
 *   builder.setWindowSize(2);
 *   CooccurrenceMatrix m = builder.build(corpus);
 */
public class CooccurrenceBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CooccurrenceBuilder.class);

    public static final int DEFAULT_WINDOW_SIZE = 4;

    // Largest vocabulary whose dense square still fits one Java array
    private static final int MAX_DENSE_SIZE = 46_340;

    // Configuration
    private int windowSize = DEFAULT_WINDOW_SIZE;
    private int threads = 1;

    public CooccurrenceBuilder() {
    }

    public CooccurrenceBuilder(int windowSize) {
        setWindowSize(windowSize);
    }

    public void setWindowSize(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive, got " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public void setThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive, got " + threads);
        }
        this.threads = threads;
    }

    public int getWindowSize() { return windowSize; }
    public int getThreads() { return threads; }

    /**
     * Build the matrix over a vocabulary derived from the corpus itself.
     */
    public CooccurrenceMatrix build(Corpus corpus) {
        return build(corpus, VocabularyBuilder.build(corpus));
    }

    /**
     * Build the matrix over a caller-supplied vocabulary.
     *
     * @throws pl.marcinmilkowski.word_space.vocab.UnknownTokenException
     *         if the corpus holds a token the vocabulary lacks
     */
    public CooccurrenceMatrix build(Corpus corpus, Vocabulary vocabulary) {
        int n = vocabulary.size();
        if (n > MAX_DENSE_SIZE) {
            throw new IllegalArgumentException("Vocabulary of " + n + " tokens is too large for a dense matrix (max "
                + MAX_DENSE_SIZE + ")");
        }

        // Resolve every token up front so a lookup failure leaves nothing half-built
        int[][] ids = encode(corpus, vocabulary);

        long start = System.currentTimeMillis();
        double[] counts;
        if (threads == 1 || ids.length < 2) {
            counts = new double[n * n];
            accumulate(ids, 0, ids.length, n, counts);
        } else {
            counts = accumulateParallel(ids, n);
        }

        CooccurrenceMatrix matrix = new CooccurrenceMatrix(vocabulary, windowSize, counts);
        logger.info("Co-occurrence matrix {}x{} built from {} documents (window={}, threads={}) in {} ms",
            n, n, ids.length, windowSize, threads, System.currentTimeMillis() - start);
        return matrix;
    }

    private static int[][] encode(Corpus corpus, Vocabulary vocabulary) {
        int[][] ids = new int[corpus.size()][];
        for (int d = 0; d < corpus.size(); d++) {
            List<String> document = corpus.document(d);
            int[] docIds = new int[document.size()];
            for (int i = 0; i < docIds.length; i++) {
                docIds[i] = vocabulary.indexOf(document.get(i));
            }
            ids[d] = docIds;
        }
        return ids;
    }

    private void accumulate(int[][] ids, int fromDoc, int toDoc, int n, double[] counts) {
        for (int d = fromDoc; d < toDoc; d++) {
            int[] doc = ids[d];
            int len = doc.length;
            for (int i = 0; i < len; i++) {
                int row = doc[i] * n;
                int start = Math.max(0, i - windowSize);
                int end = Math.min(len, i + windowSize + 1);
                for (int j = start; j < end; j++) {
                    if (j == i) continue;
                    counts[row + doc[j]] += 1;
                }
            }
        }
    }

    private double[] accumulateParallel(int[][] ids, int n) {
        int workers = Math.min(threads, ids.length);
        int chunk = (ids.length + workers - 1) / workers;

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        List<Future<double[]>> futures = new ArrayList<>();
        try {
            for (int from = 0; from < ids.length; from += chunk) {
                int fromDoc = from;
                int toDoc = Math.min(ids.length, from + chunk);
                futures.add(executor.submit(() -> {
                    double[] local = new double[n * n];
                    accumulate(ids, fromDoc, toDoc, n, local);
                    return local;
                }));
            }

            double[] counts = new double[n * n];
            for (Future<double[]> future : futures) {
                double[] local = future.get();
                for (int c = 0; c < counts.length; c++) {
                    counts[c] += local[c];
                }
            }
            return counts;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while counting co-occurrences", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Co-occurrence worker failed", e.getCause());
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
