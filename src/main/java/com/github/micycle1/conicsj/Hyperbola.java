package com.github.micycle1.conicsj;

import java.util.function.DoubleSupplier;

import com.github.micycle1.conicsj.definition.ConicDefinition;
import com.github.micycle1.conicsj.geom.PointRef;

/**
 * Hyperbola given by its foci and either a point on it or the length of its
 * major (transverse) axis. Parametrized as (a sec φ, b tan φ) in its canonical
 * frame: φ in (−π/2, π/2) traces one branch, the rest of (−π, π) the other.
 * <p>
 * When built from a point C the major axis is d(C, f0) − d(C, f1), which is
 * negative when C is closer to f0.
 */
public class Hyperbola extends FocalConic {

	public Hyperbola(ConicDefinition.Focal definition) {
		super(ConicType.HYPERBOLA, definition, majorAxis(definition));
	}

	private static DoubleSupplier majorAxis(ConicDefinition.Focal definition) {
		if (definition instanceof ConicDefinition.FociAxisLength) {
			return ((ConicDefinition.FociAxisLength) definition).getMajorAxis();
		}
		final PointRef c = ((ConicDefinition.FociPoint) definition).getSurfacePoint();
		final PointRef f0 = definition.getF0();
		final PointRef f1 = definition.getF1();
		return () -> c.distance(f0) - c.distance(f1);
	}

	@Override
	protected double semiMinorAxis(double a, double e) {
		return Math.sqrt(e * e - a * a);
	}

	@Override
	protected boolean isHyperbolic() {
		return true;
	}

	@Override
	protected double[] preRotation(double phi) {
		return new double[] { 1, a / Math.cos(phi), b * Math.tan(phi) };
	}
}
