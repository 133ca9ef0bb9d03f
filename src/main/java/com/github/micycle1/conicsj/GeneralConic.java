package com.github.micycle1.conicsj;

import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.conicsj.definition.ConicDefinition;
import com.github.micycle1.conicsj.geom.Homogeneous;
import com.github.micycle1.conicsj.math.CanonicalFrame;
import com.github.micycle1.conicsj.math.Canonicalizer;
import com.github.micycle1.conicsj.math.QuadraticForms;

/**
 * A conic through five points, or given directly by the entries of its
 * quadratic form. Its canonical frame comes from diagonalizing the form.
 * <p>
 * With eigenvalues λ0 ≥ 0, λ1, λ2 the points u = (u0, u1, u2) of the canonical
 * frame with λ0u0² + λ1u1² + λ2u2² = 0 are traced by one of three
 * trigonometric forms, picked by the signs of λ1 and λ2. Forms whose three
 * eigenvalues are positive have no real points and evaluate to NaN. Forms with
 * a zero eigenvalue (parabolas, line pairs) are not handled: they divide by
 * zero and give infinite or NaN coordinates.
 */
public class GeneralConic extends Conic {

	private CanonicalFrame frame;

	public GeneralConic(ConicDefinition.FivePoints definition) {
		super(ConicType.CONIC, definition);
	}

	public GeneralConic(ConicDefinition.SixCoefficients definition) {
		super(ConicType.CONIC, definition);
	}

	@Override
	protected void computeFrame() {
		final ConicDefinition definition = getDefinition();
		if (definition.getKind() == ConicDefinition.Kind.FIVE_POINTS) {
			ConicDefinition.FivePoints points = (ConicDefinition.FivePoints) definition;
			double[][] p = new double[5][];
			for (int i = 0; i < 5; i++) {
				p[i] = points.getPoint(i).homogeneous();
			}
			quadraticForm = QuadraticForms.throughFivePoints(p[0], p[1], p[2], p[3], p[4]);
		} else {
			ConicDefinition.SixCoefficients c = (ConicDefinition.SixCoefficients) definition;
			quadraticForm = QuadraticForms.fromCoefficients(c.getCoefficient(0).getAsDouble(), c.getCoefficient(1).getAsDouble(),
					c.getCoefficient(2).getAsDouble(), c.getCoefficient(3).getAsDouble(), c.getCoefficient(4).getAsDouble(),
					c.getCoefficient(5).getAsDouble());
		}

		frame = Canonicalizer.canonicalize(quadraticForm);
		rotationMatrix = frame.getRotation();
	}

	@Override
	protected double[] preRotation(double phi) {
		final double l1 = frame.getEigenvalue(1);
		final double l2 = frame.getEigenvalue(2);
		final double a = frame.getA();
		final double b = frame.getB();
		final double c = frame.getC();

		if (l1 <= 0 && l2 <= 0) {
			return new double[] { 1 / c, Math.cos(phi) / a, Math.sin(phi) / b };
		} else if (l1 <= 0 && l2 > 0) {
			return new double[] { Math.cos(phi) / c, 1 / a, Math.sin(phi) / b };
		} else if (l2 < 0) {
			return new double[] { Math.sin(phi) / c, Math.cos(phi) / a, 1 / b };
		}
		return new double[] { Double.NaN, Double.NaN, Double.NaN };
	}

	/**
	 * Center of the conic, from the quadratic form of the last refresh.
	 */
	@Override
	public Coordinate getMidpoint() {
		checkRefreshed();
		return Homogeneous.toCoordinate(QuadraticForms.center(quadraticForm));
	}

	/**
	 * @return the diagonalized form as of the last refresh
	 */
	public CanonicalFrame getFrame() {
		checkRefreshed();
		return frame;
	}
}
