package com.github.micycle1.conicsj.geom;

import org.locationtech.jts.geom.Coordinate;

/**
 * Operations on 3-vectors in homogeneous (w, x, y) coordinates. Points and
 * lines share the representation: the line through two points is their cross
 * product, as is the meet of two lines.
 */
public class Homogeneous {

	private Homogeneous() {
	}

	public static double[] cross(double[] u, double[] v) {
		return new double[] { u[1] * v[2] - u[2] * v[1], u[2] * v[0] - u[0] * v[2], u[0] * v[1] - u[1] * v[0] };
	}

	public static double inner(double[] u, double[] v) {
		return u[0] * v[0] + u[1] * v[1] + u[2] * v[2];
	}

	public static double[] lineThrough(double[] p, double[] q) {
		return cross(p, q);
	}

	/**
	 * Intersection point of two lines given in standard form. Parallel lines
	 * yield a point at infinity, whose dehomogenized coordinates are infinite or
	 * NaN.
	 */
	public static Coordinate meet(double[] l, double[] m) {
		return toCoordinate(cross(l, m));
	}

	/**
	 * Line through {@code p} perpendicular to the line {@code l}: the cross
	 * product of the normal direction (0, a, b) of {@code l} with {@code p}.
	 */
	public static double[] perpendicularThrough(double[] l, double[] p) {
		return cross(new double[] { 0, l[1], l[2] }, p);
	}

	public static double[] of(Coordinate c) {
		return new double[] { 1, c.x, c.y };
	}

	public static Coordinate toCoordinate(double[] v) {
		return new Coordinate(v[1] / v[0], v[2] / v[0]);
	}
}
