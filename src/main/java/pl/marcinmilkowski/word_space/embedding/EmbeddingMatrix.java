package pl.marcinmilkowski.word_space.embedding;

import org.ejml.data.DMatrixRMaj;
import pl.marcinmilkowski.word_space.vocab.Vocabulary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dense word vectors: one row of {@link #dimensions()} values per vocabulary token.
 * Row i belongs to vocabulary index i. Instances are immutable.
 */
public final class EmbeddingMatrix {

    private final Vocabulary vocabulary;
    private final int dimensions;
    private final double[] values;   // row-major, size x dimensions

    private EmbeddingMatrix(Vocabulary vocabulary, int dimensions, double[] values) {
        this.vocabulary = vocabulary;
        this.dimensions = dimensions;
        this.values = values;
    }

    /**
     * @throws IllegalArgumentException if the matrix row count differs from the vocabulary size
     */
    public static EmbeddingMatrix of(Vocabulary vocabulary, DMatrixRMaj matrix) {
        if (matrix.getNumRows() != vocabulary.size()) {
            throw new IllegalArgumentException("Matrix has " + matrix.getNumRows() + " rows for "
                + vocabulary.size() + " tokens");
        }
        int cols = matrix.getNumCols();
        double[] copy = Arrays.copyOf(matrix.getData(), matrix.getNumRows() * cols);
        return new EmbeddingMatrix(vocabulary, cols, copy);
    }

    /**
     * @throws IllegalArgumentException if the rows are ragged or do not match the vocabulary
     */
    public static EmbeddingMatrix of(Vocabulary vocabulary, double[][] rows) {
        if (rows.length != vocabulary.size()) {
            throw new IllegalArgumentException("Got " + rows.length + " rows for " + vocabulary.size() + " tokens");
        }
        int cols = rows.length == 0 ? 0 : rows[0].length;
        double[] values = new double[rows.length * cols];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != cols) {
                throw new IllegalArgumentException("Row " + i + " has " + rows[i].length
                    + " values, expected " + cols);
            }
            System.arraycopy(rows[i], 0, values, i * cols, cols);
        }
        return new EmbeddingMatrix(vocabulary, cols, values);
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    /**
     * Number of words (rows).
     */
    public int size() {
        return vocabulary.size();
    }

    public int dimensions() {
        return dimensions;
    }

    public double get(int row, int col) {
        if (row < 0 || row >= size() || col < 0 || col >= dimensions) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + size() + "x" + dimensions);
        }
        return values[row * dimensions + col];
    }

    public double[] row(int row) {
        if (row < 0 || row >= size()) {
            throw new IndexOutOfBoundsException("Row " + row + " outside " + size());
        }
        return Arrays.copyOfRange(values, row * dimensions, (row + 1) * dimensions);
    }

    /**
     * @throws pl.marcinmilkowski.word_space.vocab.UnknownTokenException if the word is unknown
     */
    public double[] vector(String word) {
        return row(vocabulary.indexOf(word));
    }

    public double[][] toArray() {
        double[][] rows = new double[size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = row(i);
        }
        return rows;
    }

    public DMatrixRMaj toMatrix() {
        return new DMatrixRMaj(size(), dimensions, true, values.clone());
    }

    /**
     * Copy with every row scaled to unit length. Zero rows stay zero.
     */
    public EmbeddingMatrix normalizeRows() {
        double[] normalized = values.clone();
        for (int i = 0; i < size(); i++) {
            double norm = norm(values, i * dimensions, dimensions);
            if (norm == 0) continue;
            for (int c = 0; c < dimensions; c++) {
                normalized[i * dimensions + c] /= norm;
            }
        }
        return new EmbeddingMatrix(vocabulary, dimensions, normalized);
    }

    /**
     * Cosine similarity between two words; 0 if either vector is zero.
     */
    public double similarity(String a, String b) {
        return cosine(vocabulary.indexOf(a), vocabulary.indexOf(b));
    }

    /**
     * Words closest to {@code word} by cosine similarity, best first.
     * The word itself is not returned; equal scores keep vocabulary order.
     *
     * @throws pl.marcinmilkowski.word_space.vocab.UnknownTokenException if the word is unknown
     */
    public List<Neighbor> nearestNeighbors(String word, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        int query = vocabulary.indexOf(word);
        List<Neighbor> neighbors = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            if (i == query) continue;
            neighbors.add(new Neighbor(vocabulary.tokenAt(i), i, cosine(query, i)));
        }
        Collections.sort(neighbors);
        return neighbors.size() > limit ? List.copyOf(neighbors.subList(0, limit)) : List.copyOf(neighbors);
    }

    private double cosine(int a, int b) {
        double dot = 0;
        for (int c = 0; c < dimensions; c++) {
            dot += values[a * dimensions + c] * values[b * dimensions + c];
        }
        double na = norm(values, a * dimensions, dimensions);
        double nb = norm(values, b * dimensions, dimensions);
        if (na == 0 || nb == 0) {
            return 0;
        }
        return dot / (na * nb);
    }

    private static double norm(double[] data, int offset, int length) {
        double sum = 0;
        for (int c = 0; c < length; c++) {
            sum += data[offset + c] * data[offset + c];
        }
        return Math.sqrt(sum);
    }

    @Override
    public String toString() {
        return String.format("EmbeddingMatrix[%d words x %d dims]", size(), dimensions);
    }
}
