package com.github.micycle1.conicsj.math;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.conicsj.ConicConstants;

/**
 * Diagonalizes the quadratic form of a conic.
 */
public class Canonicalizer {

	private static final Logger LOGGER = LoggerFactory.getLogger(Canonicalizer.class);

	private Canonicalizer() {
	}

	/**
	 * Eigen-decomposes the symmetric matrix {@code m}. If the first eigenvalue is
	 * negative all three are negated (the form −M has the same zero set), which
	 * fixes which parametrization branch applies to the conic. Eigenvectors are
	 * normalized to unit length before being stored as the columns of the
	 * rotation.
	 * <p>
	 * A matrix the solver cannot decompose (typically one holding NaN entries
	 * from a degenerate definition) yields a frame of NaNs rather than an error.
	 *
	 * @param m symmetric 3x3 quadratic form; not modified
	 */
	public static CanonicalFrame canonicalize(DMatrixRMaj m) {
		EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(3, true, true);
		if (!eig.decompose(m.copy())) {
			LOGGER.debug("Eigen-decomposition failed for quadratic form {}", m);
			DMatrixRMaj nan = new DMatrixRMaj(3, 3);
			CommonOps_DDRM.fill(nan, Double.NaN);
			return new CanonicalFrame(nan, new double[] { Double.NaN, Double.NaN, Double.NaN });
		}

		double[] lambda = new double[3];
		DMatrixRMaj rotation = new DMatrixRMaj(3, 3);
		for (int i = 0; i < 3; i++) {
			lambda[i] = eig.getEigenvalue(i).getReal();
			DMatrixRMaj v = eig.getEigenVector(i);
			double len = 0;
			for (int j = 0; j < 3; j++) {
				len += v.get(j) * v.get(j);
			}
			len = Math.sqrt(len);
			for (int j = 0; j < 3; j++) {
				rotation.set(j, i, v.get(j) / len);
			}
		}

		if (lambda[0] < 0) {
			lambda[0] = -lambda[0];
			lambda[1] = -lambda[1];
			lambda[2] = -lambda[2];
		}

		if (LOGGER.isDebugEnabled()) {
			for (double l : lambda) {
				if (Math.abs(l) < ConicConstants.ZERO_EIGENVALUE) {
					LOGGER.debug("Quadratic form is degenerate (zero eigenvalue): {}", m);
					break;
				}
			}
		}
		return new CanonicalFrame(rotation, lambda);
	}
}
