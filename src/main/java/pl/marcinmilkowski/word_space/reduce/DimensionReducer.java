package pl.marcinmilkowski.word_space.reduce;

import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_space.cooccurrence.CooccurrenceMatrix;
import pl.marcinmilkowski.word_space.embedding.EmbeddingMatrix;

/**
 * Turns a co-occurrence matrix into a k-dimensional word embedding.
 *
 * Seed and iteration count are passed to the solver explicitly on every call;
 * no global random state is touched.
 */
public class DimensionReducer {

    private static final Logger logger = LoggerFactory.getLogger(DimensionReducer.class);

    public static final long DEFAULT_SEED = 4355L;
    public static final int DEFAULT_ITERATIONS = 10;

    private final RankReducer solver;

    // Configuration
    private long seed = DEFAULT_SEED;
    private int iterations = DEFAULT_ITERATIONS;

    public DimensionReducer() {
        this(new RandomizedSvdReducer());
    }

    public DimensionReducer(RankReducer solver) {
        this.solver = solver;
    }

    public void setSeed(long seed) { this.seed = seed; }

    public void setIterations(int iterations) {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0, got " + iterations);
        }
        this.iterations = iterations;
    }

    public long getSeed() { return seed; }
    public int getIterations() { return iterations; }

    /**
     * Reduce to {@code k} dimensions; row i of the result belongs to vocabulary index i.
     *
     * @throws IllegalArgumentException if k is not in (0, vocabulary size]
     */
    public EmbeddingMatrix reduce(CooccurrenceMatrix matrix, int k) {
        int words = matrix.size();
        if (k <= 0 || k > words) {
            throw new IllegalArgumentException("k must be in (0, " + words + "], got " + k);
        }

        logger.info("Running truncated SVD over {} words (k={}, iterations={}, seed={})...",
            words, k, iterations, seed);
        long start = System.currentTimeMillis();

        DMatrixRMaj reduced = solver.reduce(matrix.toMatrix(), k, seed, iterations);
        if (reduced.getNumRows() != words || reduced.getNumCols() != k) {
            throw new IllegalStateException("Solver returned " + reduced.getNumRows() + "x" + reduced.getNumCols()
                + ", expected " + words + "x" + k);
        }

        logger.info("Done in {} ms.", System.currentTimeMillis() - start);
        return EmbeddingMatrix.of(matrix.vocabulary(), reduced);
    }
}
