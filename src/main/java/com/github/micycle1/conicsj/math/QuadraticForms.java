package com.github.micycle1.conicsj.math;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.mult.VectorVectorMult_DDRM;

import com.github.micycle1.conicsj.geom.Homogeneous;

/**
 * Builders for the symmetric 3x3 matrix M of a conic over homogeneous (w, x, y)
 * coordinates: a point p lies on the conic iff pᵗ M p = 0.
 */
public class QuadraticForms {

	private QuadraticForms() {
	}

	/**
	 * Axis-aligned ellipse (x−mx)²/a² + (y−my)²/b² − 1, or with
	 * {@code hyperbolic} set, hyperbola (x−mx)²/a² − (y−my)²/b² − 1.
	 */
	public static DMatrixRMaj focalForm(double a, double b, double mx, double my, boolean hyperbolic) {
		final double aa = a * a;
		final double bb = hyperbolic ? -b * b : b * b;
		return new DMatrixRMaj(new double[][] { //
				{ -1 + mx * mx / aa + my * my / bb, -mx / aa, -my / bb }, //
				{ -mx / aa, 1 / aa, 0 }, //
				{ -my / bb, 0, 1 / bb } });
	}

	/**
	 * Parabola (x−vx)² = 4e(y−vy) opening towards +y, with vertex (vx, vy) and
	 * focal distance e. The matrix is the negated polynomial, which has the same
	 * zero set.
	 */
	public static DMatrixRMaj parabolaForm(double e, double vx, double vy) {
		final double e4 = 4 * e;
		return new DMatrixRMaj(new double[][] { //
				{ -vy * e4 - vx * vx, vx, 2 * e }, //
				{ vx, -1, 0 }, //
				{ 2 * e, 0, 0 } });
	}

	/**
	 * Rotation by −beta about (px, py), in homogeneous coordinates. Maps world
	 * coordinates into the frame in which the conic is axis aligned.
	 */
	public static DMatrixRMaj inverseRotationAbout(double px, double py, double beta) {
		final double co = Math.cos(beta);
		final double si = Math.sin(beta);
		return new DMatrixRMaj(new double[][] { //
				{ 1, 0, 0 }, //
				{ px * (1 - co) - py * si, co, si }, //
				{ py * (1 - co) + px * si, -si, co } });
	}

	/**
	 * @return Tᵗ · inner · T
	 */
	public static DMatrixRMaj conjugate(DMatrixRMaj inner, DMatrixRMaj transform) {
		DMatrixRMaj tmp = new DMatrixRMaj(3, 3);
		DMatrixRMaj out = new DMatrixRMaj(3, 3);
		CommonOps_DDRM.mult(inner, transform, tmp);
		CommonOps_DDRM.multTransA(transform, tmp, out);
		return out;
	}

	/**
	 * sym(A) = A + Aᵗ, in place.
	 */
	public static DMatrixRMaj sym(DMatrixRMaj a) {
		for (int i = 0; i < 3; i++) {
			for (int j = i; j < 3; j++) {
				double s = a.get(i, j) + a.get(j, i);
				a.set(i, j, s);
				a.set(j, i, s);
			}
		}
		return a;
	}

	/**
	 * The degenerate conic made of the two lines v and w: sym(v wᵗ).
	 */
	public static DMatrixRMaj degenerateConic(double[] v, double[] w) {
		DMatrixRMaj mat = new DMatrixRMaj(3, 3);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				mat.set(i, j, v[i] * w[j]);
			}
		}
		return sym(mat);
	}

	/**
	 * The member of the pencil spanned by A and B passing through p:
	 * (pᵗBp)·A − (pᵗAp)·B.
	 */
	public static DMatrixRMaj fitConic(DMatrixRMaj a, DMatrixRMaj b, double[] p) {
		final DMatrixRMaj pv = DMatrixRMaj.wrap(3, 1, p);
		final double pBp = VectorVectorMult_DDRM.innerProdA(pv, b, pv);
		final double pAp = VectorVectorMult_DDRM.innerProdA(pv, a, pv);
		DMatrixRMaj out = new DMatrixRMaj(3, 3);
		CommonOps_DDRM.add(pBp, a, -pAp, b, out);
		return out;
	}

	/**
	 * The unique conic through five points in general position. Each point is a
	 * homogeneous (w, x, y) vector.
	 */
	public static DMatrixRMaj throughFivePoints(double[] p0, double[] p1, double[] p2, double[] p3, double[] p4) {
		DMatrixRMaj c1 = degenerateConic(Homogeneous.lineThrough(p0, p1), Homogeneous.lineThrough(p2, p3));
		DMatrixRMaj c2 = degenerateConic(Homogeneous.lineThrough(p0, p2), Homogeneous.lineThrough(p1, p3));
		return fitConic(c1, c2, p4);
	}

	/**
	 * Places the coefficients of a00·x² + a11·y² + a22 + 2·a01·xy + 2·a02·x +
	 * 2·a12·y into (w, x, y) matrix positions.
	 */
	public static DMatrixRMaj fromCoefficients(double a00, double a11, double a22, double a01, double a02, double a12) {
		return new DMatrixRMaj(new double[][] { //
				{ a22, a02, a12 }, //
				{ a02, a00, a01 }, //
				{ a12, a01, a11 } });
	}

	/**
	 * @return pᵗ M p for the homogeneous point p
	 */
	public static double evaluate(DMatrixRMaj m, double[] p) {
		final DMatrixRMaj pv = DMatrixRMaj.wrap(3, 1, p);
		return VectorVectorMult_DDRM.innerProdA(pv, m, pv);
	}

	/**
	 * Center of a central conic from the cofactors of M, as a homogeneous (w, x,
	 * y) vector. The w component vanishes for parabolas.
	 */
	public static double[] center(DMatrixRMaj m) {
		return new double[] { //
				m.get(1, 1) * m.get(2, 2) - m.get(1, 2) * m.get(1, 2), //
				m.get(1, 2) * m.get(0, 2) - m.get(2, 2) * m.get(0, 1), //
				m.get(0, 1) * m.get(1, 2) - m.get(1, 1) * m.get(0, 2) };
	}
}
