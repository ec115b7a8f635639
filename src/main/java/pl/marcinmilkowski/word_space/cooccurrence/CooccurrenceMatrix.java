package pl.marcinmilkowski.word_space.cooccurrence;

import org.ejml.data.DMatrixRMaj;
import pl.marcinmilkowski.word_space.vocab.Vocabulary;

import java.util.Arrays;
import java.util.Map;

/**
 * Square word-by-word window co-occurrence counts.
 *
 * Rows and columns follow the vocabulary index order. Counts are whole numbers
 * stored as doubles for the linear algebra downstream. Instances are immutable.
 */
public final class CooccurrenceMatrix {

    private final Vocabulary vocabulary;
    private final int windowSize;
    private final int size;
    private final double[] counts;   // row-major, size x size

    CooccurrenceMatrix(Vocabulary vocabulary, int windowSize, double[] counts) {
        int n = vocabulary.size();
        if (counts.length != n * n) {
            throw new IllegalArgumentException("Expected " + (n * n) + " cells, got " + counts.length);
        }
        this.vocabulary = vocabulary;
        this.windowSize = windowSize;
        this.size = n;
        this.counts = counts;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    /**
     * Token to row/column index used by this matrix.
     */
    public Map<String, Integer> tokenToIndex() {
        return vocabulary.toIndexMap();
    }

    public int windowSize() {
        return windowSize;
    }

    /**
     * Number of rows (and columns).
     */
    public int size() {
        return size;
    }

    public double get(int row, int col) {
        if (row < 0 || row >= size || col < 0 || col >= size) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + size + "x" + size);
        }
        return counts[row * size + col];
    }

    /**
     * @throws pl.marcinmilkowski.word_space.vocab.UnknownTokenException if either token is unknown
     */
    public double get(String rowToken, String colToken) {
        return get(vocabulary.indexOf(rowToken), vocabulary.indexOf(colToken));
    }

    public double[] row(int row) {
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " outside " + size);
        }
        return Arrays.copyOfRange(counts, row * size, (row + 1) * size);
    }

    public double totalCount() {
        double total = 0;
        for (double c : counts) {
            total += c;
        }
        return total;
    }

    public boolean isSymmetric() {
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (counts[i * size + j] != counts[j * size + i]) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Dense copy for EJML.
     */
    public DMatrixRMaj toMatrix() {
        return new DMatrixRMaj(size, size, true, counts.clone());
    }

    @Override
    public String toString() {
        return String.format("CooccurrenceMatrix[%dx%d window=%d total=%.0f]",
            size, size, windowSize, totalCount());
    }
}
