package com.github.micycle1.conicsj.geom;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;

/**
 * A reference to an infinite line owned outside the conic, described by any
 * two distinct points on it.
 */
@FunctionalInterface
public interface LineRef {

	LineSegment getSegment();

	/**
	 * Slope dy/dx of the line. Vertical lines report
	 * {@link Double#POSITIVE_INFINITY} regardless of the direction of the
	 * defining segment.
	 */
	default double slope() {
		LineSegment s = getSegment();
		if (s.isVertical()) {
			return Double.POSITIVE_INFINITY;
		}
		return (s.p1.y - s.p0.y) / (s.p1.x - s.p0.x);
	}

	/**
	 * Homogeneous coefficients [c, a, b] of the line c + a*x + b*y = 0.
	 */
	default double[] standardForm() {
		LineSegment s = getSegment();
		return Homogeneous.lineThrough(new double[] { 1, s.p0.x, s.p0.y }, new double[] { 1, s.p1.x, s.p1.y });
	}

	/**
	 * Perpendicular distance from a point to the (infinite) line.
	 */
	default double distance(Coordinate p) {
		return getSegment().distancePerpendicular(p);
	}

	static LineRef through(PointRef a, PointRef b) {
		Objects.requireNonNull(a);
		Objects.requireNonNull(b);
		return () -> new LineSegment(a.getCoordinate(), b.getCoordinate());
	}

	/**
	 * A line backed by the given segment. Edits to the segment's endpoints are
	 * seen on the next read.
	 */
	static LineRef live(LineSegment segment) {
		Objects.requireNonNull(segment, "segment cannot be null");
		return () -> segment;
	}
}
