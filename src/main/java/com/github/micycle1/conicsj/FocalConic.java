package com.github.micycle1.conicsj;

import java.util.function.DoubleSupplier;

import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.conicsj.definition.ConicDefinition;
import com.github.micycle1.conicsj.geom.PointRef;
import com.github.micycle1.conicsj.math.QuadraticForms;

/**
 * Common frame for the two central conics defined by a pair of foci: the
 * canonical frame is centered at the midpoint of the foci and rotated so that
 * its x axis runs along the focal line.
 */
public abstract class FocalConic extends Conic {

	private final PointRef f0, f1;
	private final DoubleSupplier majorAxis;

	// semi-axes as of the last refresh
	protected double a, b;

	protected FocalConic(ConicType type, ConicDefinition.Focal definition, DoubleSupplier majorAxis) {
		super(type, definition);
		this.f0 = definition.getF0();
		this.f1 = definition.getF1();
		this.majorAxis = majorAxis;
	}

	/**
	 * Semi-minor axis from the semi-major axis and the linear eccentricity. NaN
	 * when the definition cannot be realized.
	 */
	protected abstract double semiMinorAxis(double a, double e);

	protected abstract boolean isHyperbolic();

	@Override
	protected void computeFrame() {
		final Coordinate m = getMidpoint();
		final double beta = focalAngle(f0.getCoordinate(), f1.getCoordinate());

		a = majorAxis.getAsDouble() * 0.5;
		final double e = f1.distance(f0) * 0.5;
		b = semiMinorAxis(a, e);

		rotationMatrix = rotationThenTranslation(m.x, m.y, beta);
		quadraticForm = QuadraticForms.conjugate(QuadraticForms.focalForm(a, b, m.x, m.y, isHyperbolic()),
				QuadraticForms.inverseRotationAbout(m.x, m.y, beta));
	}

	/**
	 * Mean of the two foci, read live.
	 */
	@Override
	public Coordinate getMidpoint() {
		Coordinate p0 = f0.getCoordinate();
		Coordinate p1 = f1.getCoordinate();
		return new Coordinate((p0.x + p1.x) * 0.5, (p0.y + p1.y) * 0.5);
	}

	/**
	 * Angle of the focal line. The angle points into the right half-plane
	 * (atan2 plus π when f1 lies left of f0); for a (nearly) vertical focal line
	 * it is ±π/2 following the direction from f0 to f1.
	 */
	static double focalAngle(Coordinate p0, Coordinate p1) {
		final double dx = p1.x - p0.x;
		final double dy = p1.y - p0.y;
		if (Math.abs(dx) > ConicConstants.VERTICAL_FOCI_TOL) {
			return Math.atan2(dy, dx) + (dx < 0 ? Math.PI : 0);
		}
		return (dy > 0 ? 0.5 : -0.5) * Math.PI;
	}

	public PointRef getF0() {
		return f0;
	}

	public PointRef getF1() {
		return f1;
	}

	/**
	 * Current length of the major axis, read live.
	 */
	public double getMajorAxis() {
		return majorAxis.getAsDouble();
	}

	/**
	 * @return semi-major axis as of the last refresh
	 */
	public double getSemiMajorAxis() {
		checkRefreshed();
		return a;
	}

	/**
	 * @return semi-minor axis as of the last refresh
	 */
	public double getSemiMinorAxis() {
		checkRefreshed();
		return b;
	}
}
