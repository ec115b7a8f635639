package pl.marcinmilkowski.word_space.reduce;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.SingularOps_DDRM;
import org.ejml.dense.row.decomposition.svd.SafeSvd_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.QRDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Truncated SVD through a randomized range finder.
 *
 * A Gaussian test matrix drawn from {@code new Random(seed)} samples the range
 * of the input; {@code iterations} power iterations, each re-orthonormalized by
 * QR, sharpen that sample before an exact SVD of the small projected matrix.
 * Signs are fixed so the largest-magnitude entry of every left singular vector
 * is positive.
 */
public class RandomizedSvdReducer implements RankReducer {

    private static final Logger logger = LoggerFactory.getLogger(RandomizedSvdReducer.class);

    public static final int DEFAULT_OVERSAMPLES = 10;

    private final int oversamples;

    public RandomizedSvdReducer() {
        this(DEFAULT_OVERSAMPLES);
    }

    public RandomizedSvdReducer(int oversamples) {
        if (oversamples < 0) {
            throw new IllegalArgumentException("oversamples must be >= 0, got " + oversamples);
        }
        this.oversamples = oversamples;
    }

    @Override
    public DMatrixRMaj reduce(DMatrixRMaj matrix, int k, long seed, int iterations) {
        int m = matrix.getNumRows();
        int n = matrix.getNumCols();
        int maxRank = Math.min(m, n);
        if (k <= 0 || k > maxRank) {
            throw new IllegalArgumentException("k must be in (0, " + maxRank + "], got " + k);
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0, got " + iterations);
        }

        if (CommonOps_DDRM.elementMaxAbs(matrix) == 0.0) {
            logger.debug("All-zero {}x{} input, returning zero projection", m, n);
            return new DMatrixRMaj(m, k);
        }

        int samples = Math.min(k + oversamples, maxRank);

        DMatrixRMaj omega = new DMatrixRMaj(n, samples);
        Random random = new Random(seed);
        double[] data = omega.getData();
        for (int i = 0; i < n * samples; i++) {
            data[i] = random.nextGaussian();
        }

        DMatrixRMaj y = new DMatrixRMaj(m, samples);
        DMatrixRMaj z = new DMatrixRMaj(n, samples);

        DMatrixRMaj q = omega;
        for (int it = 0; it < iterations; it++) {
            CommonOps_DDRM.mult(matrix, q, y);
            q = orthonormalize(y);
            CommonOps_DDRM.multTransA(matrix, q, z);
            q = orthonormalize(z);
        }
        CommonOps_DDRM.mult(matrix, q, y);
        q = orthonormalize(y);

        // B = Q^T A is samples x n
        DMatrixRMaj b = new DMatrixRMaj(samples, n);
        CommonOps_DDRM.multTransA(q, matrix, b);

        SafeSvd_DDRM svd = new SafeSvd_DDRM(DecompositionFactory_DDRM.svd(true, true, true));
        if (!svd.decompose(b)) {
            throw new IllegalStateException("SVD of the projected " + samples + "x" + n + " matrix did not converge");
        }
        DMatrixRMaj ub = svd.getU(null, false);
        DMatrixRMaj w = svd.getW(null);
        DMatrixRMaj vb = svd.getV(null, false);
        SingularOps_DDRM.descendingOrder(ub, false, w, vb, false);

        DMatrixRMaj u = new DMatrixRMaj(m, ub.getNumCols());
        CommonOps_DDRM.mult(q, ub, u);

        DMatrixRMaj reduced = new DMatrixRMaj(m, k);
        for (int c = 0; c < k; c++) {
            double sign = signOfLargest(u, c);
            double sigma = w.get(c, c);
            for (int r = 0; r < m; r++) {
                reduced.set(r, c, sign * u.get(r, c) * sigma);
            }
        }
        return reduced;
    }

    private static DMatrixRMaj orthonormalize(DMatrixRMaj y) {
        QRDecomposition<DMatrixRMaj> qr = DecompositionFactory_DDRM.qr(y.getNumRows(), y.getNumCols());
        if (!qr.decompose(y)) {
            // EJML reports false for an exactly zero column; that reflector is the identity, Q stays orthonormal
            logger.debug("Rank-deficient {}x{} sample in range finder", y.getNumRows(), y.getNumCols());
        }
        return qr.getQ(null, true);
    }

    private static double signOfLargest(DMatrixRMaj u, int col) {
        double best = 0;
        double sign = 1;
        for (int r = 0; r < u.getNumRows(); r++) {
            double v = u.get(r, col);
            if (Math.abs(v) > best) {
                best = Math.abs(v);
                sign = v < 0 ? -1 : 1;
            }
        }
        return sign;
    }
}
