package com.github.micycle1.conicsj;

import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.conicsj.definition.ConicDefinition;
import com.github.micycle1.conicsj.definition.ConicParents;
import com.github.micycle1.conicsj.geom.LineRef;
import com.github.micycle1.conicsj.geom.PointRef;

/**
 * Entry point for building conics, either from typed references or from
 * loosely typed parents by element name ({@code "ellipse"},
 * {@code "hyperbola"}, {@code "parabola"}, {@code "conic"}).
 * <p>
 * Conics are returned unrefreshed; call {@link Conic#refresh()} before the
 * first evaluation.
 */
public class ConicFactory {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConicFactory.class);

	private ConicFactory() {
	}

	public static Ellipse ellipse(PointRef f0, PointRef f1, PointRef surfacePoint) {
		return new Ellipse(ConicDefinition.fociAndPoint(f0, f1, surfacePoint));
	}

	public static Ellipse ellipse(PointRef f0, PointRef f1, DoubleSupplier majorAxis) {
		return new Ellipse(ConicDefinition.fociAndAxisLength(f0, f1, majorAxis));
	}

	public static Ellipse ellipse(PointRef f0, PointRef f1, double majorAxis) {
		return new Ellipse(ConicDefinition.fociAndAxisLength(f0, f1, majorAxis));
	}

	public static Hyperbola hyperbola(PointRef f0, PointRef f1, PointRef surfacePoint) {
		return new Hyperbola(ConicDefinition.fociAndPoint(f0, f1, surfacePoint));
	}

	public static Hyperbola hyperbola(PointRef f0, PointRef f1, DoubleSupplier majorAxis) {
		return new Hyperbola(ConicDefinition.fociAndAxisLength(f0, f1, majorAxis));
	}

	public static Hyperbola hyperbola(PointRef f0, PointRef f1, double majorAxis) {
		return new Hyperbola(ConicDefinition.fociAndAxisLength(f0, f1, majorAxis));
	}

	public static Parabola parabola(PointRef focus, LineRef directrix) {
		return new Parabola(ConicDefinition.focusAndDirectrix(focus, directrix));
	}

	public static GeneralConic conic(PointRef p0, PointRef p1, PointRef p2, PointRef p3, PointRef p4) {
		return new GeneralConic(ConicDefinition.fivePoints(p0, p1, p2, p3, p4));
	}

	/**
	 * Conic a00·x² + a11·y² + a22 + 2·a01·xy + 2·a02·x + 2·a12·y = 0.
	 */
	public static GeneralConic conic(double a00, double a11, double a22, double a01, double a02, double a12) {
		return new GeneralConic(ConicDefinition.sixCoefficients(a00, a11, a22, a01, a02, a12));
	}

	/**
	 * Builds a conic of the given type.
	 *
	 * @throws IllegalArgumentException if the definition's kind cannot describe
	 *                                  the type
	 */
	public static Conic create(ConicType type, ConicDefinition definition) {
		switch (definition.getKind()) {
			case FOCI_POINT:
			case FOCI_AXIS_LENGTH:
				if (type == ConicType.ELLIPSE) {
					return new Ellipse((ConicDefinition.Focal) definition);
				} else if (type == ConicType.HYPERBOLA) {
					return new Hyperbola((ConicDefinition.Focal) definition);
				}
				break;
			case FOCUS_DIRECTRIX:
				if (type == ConicType.PARABOLA) {
					return new Parabola((ConicDefinition.FocusDirectrix) definition);
				}
				break;
			case FIVE_POINTS:
				if (type == ConicType.CONIC) {
					return new GeneralConic((ConicDefinition.FivePoints) definition);
				}
				break;
			case SIX_COEFFICIENTS:
				if (type == ConicType.CONIC) {
					return new GeneralConic((ConicDefinition.SixCoefficients) definition);
				}
				break;
			default:
				break;
		}
		throw new IllegalArgumentException("A " + definition.getKind() + " definition cannot describe a " + type);
	}

	/**
	 * Builds a conic from loosely typed parents; see {@link ConicParents} for the
	 * accepted argument shapes. Ellipse and hyperbola take
	 * {@code [point, point, point|number, from?, to?]}, parabola
	 * {@code [point, line, from?, to?]}, conic five points or six numbers.
	 *
	 * @throws IllegalArgumentException for an unknown element name or parents of
	 *                                  the wrong shape
	 */
	public static Conic create(String elementName, Object... parents) {
		final ConicType type = ConicType.fromElementName(elementName);
		final ConicDefinition definition;
		switch (type) {
			case ELLIPSE:
				definition = ConicParents.focal("Ellipse", parents);
				break;
			case HYPERBOLA:
				definition = ConicParents.focal("Hyperbola", parents);
				break;
			case PARABOLA:
				definition = ConicParents.parabola(parents);
				break;
			default:
				definition = ConicParents.conic(parents);
				break;
		}
		LOGGER.debug("Creating {} from a {} definition", type, definition.getKind());
		return create(type, definition);
	}
}
