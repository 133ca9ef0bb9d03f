package com.github.micycle1.conicsj;

import java.util.function.DoubleSupplier;

import com.github.micycle1.conicsj.definition.ConicDefinition;
import com.github.micycle1.conicsj.geom.PointRef;

/**
 * Ellipse given by its foci and either a point on it or the length of its
 * major axis. Parametrized as (a cos φ, b sin φ) in its canonical frame.
 */
public class Ellipse extends FocalConic {

	public Ellipse(ConicDefinition.Focal definition) {
		super(ConicType.ELLIPSE, definition, majorAxis(definition));
	}

	private static DoubleSupplier majorAxis(ConicDefinition.Focal definition) {
		if (definition instanceof ConicDefinition.FociAxisLength) {
			return ((ConicDefinition.FociAxisLength) definition).getMajorAxis();
		}
		final PointRef c = ((ConicDefinition.FociPoint) definition).getSurfacePoint();
		final PointRef f0 = definition.getF0();
		final PointRef f1 = definition.getF1();
		return () -> c.distance(f0) + c.distance(f1);
	}

	@Override
	protected double semiMinorAxis(double a, double e) {
		return Math.sqrt(a * a - e * e);
	}

	@Override
	protected boolean isHyperbolic() {
		return false;
	}

	@Override
	protected double[] preRotation(double phi) {
		return new double[] { 1, a * Math.cos(phi), b * Math.sin(phi) };
	}
}
