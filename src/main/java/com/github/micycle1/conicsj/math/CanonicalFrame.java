package com.github.micycle1.conicsj.math;

import java.util.Arrays;

import org.ejml.data.DMatrixRMaj;

/**
 * Diagonalized view of a quadratic form: M = R Λ Rᵗ, where the columns of R are
 * unit eigenvectors. The eigenvalues are sign-normalized so that λ0 ≥ 0.
 */
public class CanonicalFrame {

	private final DMatrixRMaj rotation;
	private final double[] eigenvalues;
	private final double a, b, c;

	CanonicalFrame(DMatrixRMaj rotation, double[] eigenvalues) {
		this.rotation = rotation;
		this.eigenvalues = eigenvalues;
		this.c = Math.sqrt(Math.abs(eigenvalues[0]));
		this.a = Math.sqrt(Math.abs(eigenvalues[1]));
		this.b = Math.sqrt(Math.abs(eigenvalues[2]));
	}

	/**
	 * Columns are the eigenvectors, in eigenvalue order.
	 */
	public DMatrixRMaj getRotation() {
		return rotation;
	}

	public double getEigenvalue(int i) {
		return eigenvalues[i];
	}

	public double[] getEigenvalues() {
		return eigenvalues.clone();
	}

	/** √|λ1| */
	public double getA() {
		return a;
	}

	/** √|λ2| */
	public double getB() {
		return b;
	}

	/** √|λ0| */
	public double getC() {
		return c;
	}

	@Override
	public String toString() {
		return "CanonicalFrame{λ=" + Arrays.toString(eigenvalues) + ", a=" + a + ", b=" + b + ", c=" + c + '}';
	}
}
