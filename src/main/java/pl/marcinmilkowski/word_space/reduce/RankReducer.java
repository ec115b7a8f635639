package pl.marcinmilkowski.word_space.reduce;

import org.ejml.data.DMatrixRMaj;

/**
 * Projects a matrix onto its top-k singular directions.
 *
 * Implementations must be deterministic for a given seed and must not permute
 * rows: row i of the result corresponds to row i of the input.
 */
public interface RankReducer {

    /**
     * Reduce {@code matrix} (rows x cols) to rows x k, scaled by the singular values (U_k * S_k).
     *
     * @param matrix     input, not modified
     * @param k          target rank, 0 < k <= min(rows, cols)
     * @param seed       seed for any randomized initialization
     * @param iterations refinement passes of the solver, >= 0
     * @throws IllegalArgumentException if k or iterations is out of range
     */
    DMatrixRMaj reduce(DMatrixRMaj matrix, int k, long seed, int iterations);
}
