package com.github.micycle1.conicsj.definition;

import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

import org.apache.commons.lang3.ClassUtils;
import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;

import com.github.micycle1.conicsj.geom.LineRef;
import com.github.micycle1.conicsj.geom.PointRef;

/**
 * Resolves loosely typed constructor arguments ("parents") into the references
 * a {@link ConicDefinition} holds. Every resolver returns {@code null} when the
 * argument has a shape it does not accept, leaving the error to the caller,
 * which knows the element being built.
 * <p>
 * Accepted shapes:
 * <ul>
 * <li>point: {@link PointRef}; {@link Coordinate} (live); {@code double[]} or
 * {@code Number[]} with at least two entries (fixed); a {@link Supplier} whose
 * value is a {@link Coordinate} (called on every read)</li>
 * <li>number: {@link Number} (constant); {@link DoubleSupplier}; a
 * {@link Supplier} whose value is a {@link Number}</li>
 * <li>line: {@link LineRef}; {@link LineSegment} (live)</li>
 * </ul>
 * A {@link Supplier} parent is called once while resolving, to check the type
 * of its value, and again on every read afterwards.
 */
public class ConicParents {

	private static final String FOCAL_SHAPES = "\nPossible parent types: [point,point,point], [point,point,number|function]";
	private static final String PARABOLA_SHAPES = "\nPossible parent types: [point,line]";
	private static final String CONIC_SHAPES = "\nPossible parent types: [point,point,point,point,point], [a00,a11,a22,a01,a02,a12]";

	private ConicParents() {
	}

	public static PointRef toPoint(Object parent) {
		if (parent instanceof PointRef) {
			return (PointRef) parent;
		}
		if (parent instanceof Coordinate) {
			return PointRef.live((Coordinate) parent);
		}
		if (parent instanceof double[] && ((double[]) parent).length > 1) {
			double[] xy = (double[]) parent;
			return PointRef.fixed(xy[0], xy[1]);
		}
		if (parent instanceof Number[] && ((Number[]) parent).length > 1) {
			Number[] xy = (Number[]) parent;
			if (xy[0] != null && xy[1] != null) {
				return PointRef.fixed(xy[0].doubleValue(), xy[1].doubleValue());
			}
			return null;
		}
		if (parent instanceof Supplier && ((Supplier<?>) parent).get() instanceof Coordinate) {
			final Supplier<?> supplier = (Supplier<?>) parent;
			return () -> (Coordinate) supplier.get();
		}
		return null;
	}

	public static DoubleSupplier toScalar(Object parent) {
		if (parent instanceof Number) {
			final double value = ((Number) parent).doubleValue();
			return () -> value;
		}
		if (parent instanceof DoubleSupplier) {
			return (DoubleSupplier) parent;
		}
		if (parent instanceof Supplier && ((Supplier<?>) parent).get() instanceof Number) {
			final Supplier<?> supplier = (Supplier<?>) parent;
			return () -> ((Number) supplier.get()).doubleValue();
		}
		return null;
	}

	public static LineRef toLine(Object parent) {
		if (parent instanceof LineRef) {
			return (LineRef) parent;
		}
		if (parent instanceof LineSegment) {
			return LineRef.live((LineSegment) parent);
		}
		return null;
	}

	/**
	 * Definition of an ellipse or hyperbola from {@code [f0, f1, point|number, from?, to?]}.
	 *
	 * @param elementName "Ellipse" or "Hyperbola", used in error messages
	 * @throws IllegalArgumentException if a parent has an unsupported shape
	 */
	public static ConicDefinition focal(String elementName, Object... parents) {
		Validate.isTrue(parents.length >= 3 && parents.length <= 5, "Can't create %s with %d parents.%s", elementName, parents.length,
				FOCAL_SHAPES);
		PointRef f0 = toPoint(parents[0]);
		PointRef f1 = toPoint(parents[1]);
		if (f0 == null || f1 == null) {
			throw new IllegalArgumentException("Can't create " + elementName + " with parent types " + describeTypes(parents, 2) + "." + FOCAL_SHAPES);
		}

		ConicDefinition definition;
		DoubleSupplier majorAxis = toScalar(parents[2]);
		if (majorAxis != null) {
			definition = ConicDefinition.fociAndAxisLength(f0, f1, majorAxis);
		} else {
			PointRef c = toPoint(parents[2]);
			if (c == null) {
				throw new IllegalArgumentException(
						"Can't create " + elementName + " with parent types " + describeTypes(parents, 3) + "." + FOCAL_SHAPES);
			}
			definition = ConicDefinition.fociAndPoint(f0, f1, c);
		}
		return withRange(definition, elementName, parents, 3, FOCAL_SHAPES);
	}

	/**
	 * Definition of a parabola from {@code [focus, directrix, from?, to?]}.
	 *
	 * @throws IllegalArgumentException if a parent has an unsupported shape
	 */
	public static ConicDefinition parabola(Object... parents) {
		Validate.isTrue(parents.length >= 2 && parents.length <= 4, "Can't create Parabola with %d parents.%s", parents.length,
				PARABOLA_SHAPES);
		PointRef focus = toPoint(parents[0]);
		LineRef directrix = toLine(parents[1]);
		if (focus == null || directrix == null) {
			throw new IllegalArgumentException("Can't create Parabola with parent types " + describeTypes(parents, 2) + "." + PARABOLA_SHAPES);
		}
		return withRange(ConicDefinition.focusAndDirectrix(focus, directrix), "Parabola", parents, 2, PARABOLA_SHAPES);
	}

	/**
	 * Definition of a general conic from five points or six coefficients
	 * {@code [a00, a11, a22, a01, a02, a12]}.
	 *
	 * @throws IllegalArgumentException if a parent has an unsupported shape, or
	 *                                  there are neither five nor six parents
	 */
	public static ConicDefinition conic(Object... parents) {
		if (parents.length == 5) {
			PointRef[] p = new PointRef[5];
			for (int i = 0; i < 5; i++) {
				p[i] = toPoint(parents[i]);
				if (p[i] == null) {
					throw new IllegalArgumentException("Can't create Conic section with parent types '"
							+ ClassUtils.getShortClassName(parents[i], "null") + "'." + CONIC_SHAPES);
				}
			}
			return ConicDefinition.fivePoints(p[0], p[1], p[2], p[3], p[4]);
		}
		if (parents.length == 6) {
			DoubleSupplier[] a = new DoubleSupplier[6];
			for (int i = 0; i < 6; i++) {
				a[i] = toScalar(parents[i]);
				if (a[i] == null) {
					throw new IllegalArgumentException("Can't create Conic section with parent types '"
							+ ClassUtils.getShortClassName(parents[i], "null") + "'." + CONIC_SHAPES);
				}
			}
			return ConicDefinition.sixCoefficients(a[0], a[1], a[2], a[3], a[4], a[5]);
		}
		throw new IllegalArgumentException("Can't create generic Conic with " + parents.length + " parameters." + CONIC_SHAPES);
	}

	private static ConicDefinition withRange(ConicDefinition definition, String elementName, Object[] parents, int first, String shapes) {
		if (parents.length <= first) {
			return definition;
		}
		double from = Double.NaN;
		double to = Double.NaN;
		for (int i = first; i < parents.length; i++) {
			if (!(parents[i] instanceof Number)) {
				throw new IllegalArgumentException("Can't create " + elementName + " with parameter bound of type '"
						+ ClassUtils.getShortClassName(parents[i], "null") + "'." + shapes);
			}
			if (i == first) {
				from = ((Number) parents[i]).doubleValue();
			} else {
				to = ((Number) parents[i]).doubleValue();
			}
		}
		return definition.withParameterRange(from, to);
	}

	/**
	 * @return "'A' and 'B' and ..." listing the short type names of the first
	 *         {@code count} parents
	 */
	static String describeTypes(Object[] parents, int count) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < Math.min(count, parents.length); i++) {
			if (i > 0) {
				sb.append(" and ");
			}
			sb.append('\'').append(ClassUtils.getShortClassName(parents[i], "null")).append('\'');
		}
		return sb.toString();
	}
}
