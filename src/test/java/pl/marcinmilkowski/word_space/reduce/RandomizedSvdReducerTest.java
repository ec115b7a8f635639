package pl.marcinmilkowski.word_space.reduce;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.word_space.TestCorpora;
import pl.marcinmilkowski.word_space.cooccurrence.CooccurrenceBuilder;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RandomizedSvdReducer.
 */
class RandomizedSvdReducerTest {

    private final RankReducer reducer = new RandomizedSvdReducer();

    private static DMatrixRMaj toyMatrix() {
        return new CooccurrenceBuilder(2).build(TestCorpora.toyCorpus()).toMatrix();
    }

    @Test
    @DisplayName("Output has one row per input row and k columns")
    void testShape() {
        DMatrixRMaj m = toyMatrix();
        for (int k = 1; k <= m.getNumRows(); k++) {
            DMatrixRMaj r = reducer.reduce(m, k, 4355L, 10);
            assertEquals(10, r.getNumRows(), "k=" + k);
            assertEquals(k, r.getNumCols(), "k=" + k);
        }
    }

    @Test
    @DisplayName("Same seed gives identical output")
    void testDeterministic() {
        DMatrixRMaj m = toyMatrix();
        DMatrixRMaj a = reducer.reduce(m, 2, 4355L, 10);
        DMatrixRMaj b = new RandomizedSvdReducer().reduce(m, 2, 4355L, 10);
        assertArrayEquals(a.getData(), b.getData(), 0.0);
    }

    @Test
    @DisplayName("Input matrix is left untouched")
    void testInputNotModified() {
        DMatrixRMaj m = toyMatrix();
        double[] before = m.getData().clone();
        reducer.reduce(m, 3, 1L, 10);
        assertArrayEquals(before, m.getData(), 0.0);
    }

    @Test
    @DisplayName("Column norms are the leading singular values, largest first")
    void testMatchesExactSingularValues() {
        DMatrixRMaj m = toyMatrix();
        SingularValueDecomposition_F64<DMatrixRMaj> svd = DecompositionFactory_DDRM.svd(true, true, true);
        assertTrue(svd.decompose(m.copy()));
        double[] exact = svd.getSingularValues().clone();
        Arrays.sort(exact);

        int k = 3;
        DMatrixRMaj r = reducer.reduce(m, k, 4355L, 10);
        for (int c = 0; c < k; c++) {
            double norm = 0;
            for (int i = 0; i < r.getNumRows(); i++) {
                norm += r.get(i, c) * r.get(i, c);
            }
            assertEquals(exact[exact.length - 1 - c], Math.sqrt(norm), 1e-8, "singular value " + c);
        }
    }

    @Test
    @DisplayName("Full-rank reduction preserves the row Gram matrix")
    void testFullRankGram() {
        DMatrixRMaj m = toyMatrix();
        DMatrixRMaj r = reducer.reduce(m, m.getNumRows(), 99L, 10);

        DMatrixRMaj expected = new DMatrixRMaj(10, 10);
        CommonOps_DDRM.multTransB(m, m, expected);
        DMatrixRMaj actual = new DMatrixRMaj(10, 10);
        CommonOps_DDRM.multTransB(r, r, actual);

        for (int i = 0; i < 10; i++) {
            for (int j = 0; j < 10; j++) {
                assertEquals(expected.get(i, j), actual.get(i, j), 1e-8, "(" + i + "," + j + ")");
            }
        }
    }

    @Test
    @DisplayName("Rank-one matrix reduces to its scaled generating vector")
    void testRankOne() {
        double[] u = {1, 2, 3};
        DMatrixRMaj m = new DMatrixRMaj(3, 3);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                m.set(i, j, u[i] * u[j]);
            }
        }

        double scale = Math.sqrt(14);
        for (long seed : new long[]{1L, 2L, 4355L}) {
            DMatrixRMaj r = reducer.reduce(m, 1, seed, 10);
            for (int i = 0; i < 3; i++) {
                assertEquals(u[i] * scale, r.get(i, 0), 1e-9, "seed " + seed + " row " + i);
            }
        }
    }

    @Test
    @DisplayName("Largest entry of every column is positive")
    void testSignConvention() {
        DMatrixRMaj r = reducer.reduce(toyMatrix(), 4, 4355L, 10);
        for (int c = 0; c < r.getNumCols(); c++) {
            double largest = 0;
            for (int i = 0; i < r.getNumRows(); i++) {
                if (Math.abs(r.get(i, c)) > Math.abs(largest)) {
                    largest = r.get(i, c);
                }
            }
            assertTrue(largest > 0, "column " + c);
        }
    }

    @Test
    @DisplayName("All-zero matrix reduces to zero rows")
    void testAllZero() {
        DMatrixRMaj r = reducer.reduce(new DMatrixRMaj(4, 4), 2, 4355L, 10);
        assertEquals(4, r.getNumRows());
        assertEquals(2, r.getNumCols());
        for (double v : r.getData()) {
            assertEquals(0.0, v);
        }
    }

    @Test
    @DisplayName("Rank-deficient input with zero rows still reduces")
    void testRankDeficient() {
        DMatrixRMaj m = new DMatrixRMaj(5, 5);
        m.set(2, 2, 3.0);

        DMatrixRMaj r = reducer.reduce(m, 2, 4355L, 2);
        for (int row = 0; row < 5; row++) {
            assertEquals(row == 2 ? 3.0 : 0.0, r.get(row, 0), 1e-9, "row " + row);
            assertEquals(0.0, r.get(row, 1), 1e-9, "row " + row);
        }
    }

    @Test
    @DisplayName("Zero power iterations is allowed")
    void testZeroIterations() {
        DMatrixRMaj r = reducer.reduce(toyMatrix(), 2, 4355L, 0);
        assertEquals(2, r.getNumCols());
        for (double v : r.getData()) {
            assertFalse(Double.isNaN(v));
        }
    }

    @Test
    @DisplayName("Non-square input keeps its row count")
    void testRectangular() {
        DMatrixRMaj m = new DMatrixRMaj(5, 3);
        for (int i = 0; i < 5; i++) {
            for (int j = 0; j < 3; j++) {
                m.set(i, j, (i + 1) * (j + 2) % 7);
            }
        }
        DMatrixRMaj r = reducer.reduce(m, 3, 4355L, 10);
        assertEquals(5, r.getNumRows());
        assertEquals(3, r.getNumCols());
        assertThrows(IllegalArgumentException.class, () -> reducer.reduce(m, 4, 4355L, 10));
    }

    @Test
    @DisplayName("Invalid k or iteration count is rejected")
    void testInvalidParameters() {
        DMatrixRMaj m = toyMatrix();
        assertThrows(IllegalArgumentException.class, () -> reducer.reduce(m, 0, 1L, 10));
        assertThrows(IllegalArgumentException.class, () -> reducer.reduce(m, -1, 1L, 10));
        assertThrows(IllegalArgumentException.class, () -> reducer.reduce(m, 11, 1L, 10));
        assertThrows(IllegalArgumentException.class, () -> reducer.reduce(m, 2, 1L, -1));
        assertThrows(IllegalArgumentException.class, () -> reducer.reduce(new DMatrixRMaj(0, 0), 1, 1L, 10));
        assertThrows(IllegalArgumentException.class, () -> new RandomizedSvdReducer(-1));
    }
}
