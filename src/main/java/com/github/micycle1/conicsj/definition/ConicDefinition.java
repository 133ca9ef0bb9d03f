package com.github.micycle1.conicsj.definition;

import java.util.Objects;
import java.util.function.DoubleSupplier;

import com.github.micycle1.conicsj.geom.LineRef;
import com.github.micycle1.conicsj.geom.PointRef;

/**
 * The geometric input a conic is built from. One of five variants, identified
 * by {@link #getKind()}; each holds live references that are re-read whenever
 * the conic refreshes.
 */
public abstract class ConicDefinition {

	public enum Kind {
		/** Two foci and a point on the curve. */
		FOCI_POINT,
		/** Two foci and the length of the major axis. */
		FOCI_AXIS_LENGTH,
		/** A focus and a directrix line. */
		FOCUS_DIRECTRIX,
		/** Five points on the curve. */
		FIVE_POINTS,
		/** The six entries of the symmetric quadratic form. */
		SIX_COEFFICIENTS
	}

	private final Kind kind;
	private double from = Double.NaN;
	private double to = Double.NaN;

	private ConicDefinition(Kind kind) {
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Overrides the default parameter interval of conics built from this
	 * definition afterwards. A conic takes its interval when it is constructed,
	 * so conics already built from this definition keep theirs.
	 */
	public ConicDefinition withParameterRange(double from, double to) {
		this.from = from;
		this.to = to;
		return this;
	}

	/**
	 * @return the lower parameter bound, or NaN when the conic's default applies
	 */
	public double getFrom() {
		return from;
	}

	/**
	 * @return the upper parameter bound, or NaN when the conic's default applies
	 */
	public double getTo() {
		return to;
	}

	public static FociPoint fociAndPoint(PointRef f0, PointRef f1, PointRef surfacePoint) {
		return new FociPoint(f0, f1, surfacePoint);
	}

	public static FociAxisLength fociAndAxisLength(PointRef f0, PointRef f1, DoubleSupplier majorAxis) {
		return new FociAxisLength(f0, f1, majorAxis);
	}

	public static FociAxisLength fociAndAxisLength(PointRef f0, PointRef f1, double majorAxis) {
		return new FociAxisLength(f0, f1, () -> majorAxis);
	}

	public static FocusDirectrix focusAndDirectrix(PointRef focus, LineRef directrix) {
		return new FocusDirectrix(focus, directrix);
	}

	public static FivePoints fivePoints(PointRef p0, PointRef p1, PointRef p2, PointRef p3, PointRef p4) {
		return new FivePoints(new PointRef[] { p0, p1, p2, p3, p4 });
	}

	/**
	 * @param a00 x² entry
	 * @param a11 y² entry
	 * @param a22 constant entry
	 * @param a01 xy entry (half the xy coefficient)
	 * @param a02 x entry (half the x coefficient)
	 * @param a12 y entry (half the y coefficient)
	 */
	public static SixCoefficients sixCoefficients(DoubleSupplier a00, DoubleSupplier a11, DoubleSupplier a22, DoubleSupplier a01,
			DoubleSupplier a02, DoubleSupplier a12) {
		return new SixCoefficients(new DoubleSupplier[] { a00, a11, a22, a01, a02, a12 });
	}

	public static SixCoefficients sixCoefficients(double a00, double a11, double a22, double a01, double a02, double a12) {
		return sixCoefficients(() -> a00, () -> a11, () -> a22, () -> a01, () -> a02, () -> a12);
	}

	/**
	 * Two foci, shared by the variants that define ellipses and hyperbolas.
	 */
	public abstract static class Focal extends ConicDefinition {

		private final PointRef f0, f1;

		private Focal(Kind kind, PointRef f0, PointRef f1) {
			super(kind);
			this.f0 = Objects.requireNonNull(f0, "focus f0 cannot be null");
			this.f1 = Objects.requireNonNull(f1, "focus f1 cannot be null");
		}

		public PointRef getF0() {
			return f0;
		}

		public PointRef getF1() {
			return f1;
		}
	}

	public static final class FociPoint extends Focal {

		private final PointRef surfacePoint;

		private FociPoint(PointRef f0, PointRef f1, PointRef surfacePoint) {
			super(Kind.FOCI_POINT, f0, f1);
			this.surfacePoint = Objects.requireNonNull(surfacePoint, "surface point cannot be null");
		}

		public PointRef getSurfacePoint() {
			return surfacePoint;
		}
	}

	public static final class FociAxisLength extends Focal {

		private final DoubleSupplier majorAxis;

		private FociAxisLength(PointRef f0, PointRef f1, DoubleSupplier majorAxis) {
			super(Kind.FOCI_AXIS_LENGTH, f0, f1);
			this.majorAxis = Objects.requireNonNull(majorAxis, "major axis cannot be null");
		}

		public DoubleSupplier getMajorAxis() {
			return majorAxis;
		}
	}

	public static final class FocusDirectrix extends ConicDefinition {

		private final PointRef focus;
		private final LineRef directrix;

		private FocusDirectrix(PointRef focus, LineRef directrix) {
			super(Kind.FOCUS_DIRECTRIX);
			this.focus = Objects.requireNonNull(focus, "focus cannot be null");
			this.directrix = Objects.requireNonNull(directrix, "directrix cannot be null");
		}

		public PointRef getFocus() {
			return focus;
		}

		public LineRef getDirectrix() {
			return directrix;
		}
	}

	public static final class FivePoints extends ConicDefinition {

		private final PointRef[] points;

		private FivePoints(PointRef[] points) {
			super(Kind.FIVE_POINTS);
			for (int i = 0; i < points.length; i++) {
				Objects.requireNonNull(points[i], "point p" + i + " cannot be null");
			}
			this.points = points;
		}

		public PointRef getPoint(int i) {
			return points[i];
		}
	}

	public static final class SixCoefficients extends ConicDefinition {

		// a00, a11, a22, a01, a02, a12
		private final DoubleSupplier[] coefficients;

		private SixCoefficients(DoubleSupplier[] coefficients) {
			super(Kind.SIX_COEFFICIENTS);
			for (int i = 0; i < coefficients.length; i++) {
				Objects.requireNonNull(coefficients[i], "coefficient " + i + " cannot be null");
			}
			this.coefficients = coefficients;
		}

		/**
		 * @param i index in the order a00, a11, a22, a01, a02, a12
		 */
		public DoubleSupplier getCoefficient(int i) {
			return coefficients[i];
		}
	}
}
