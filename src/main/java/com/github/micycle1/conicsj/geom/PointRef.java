package com.github.micycle1.conicsj.geom;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * A reference to a point owned outside the conic. The conic never stores the
 * coordinate it reads; every refresh calls {@link #getCoordinate()} again, so a
 * reference backed by a mutable {@link Coordinate} or by a computation follows
 * its source.
 */
@FunctionalInterface
public interface PointRef {

	Coordinate getCoordinate();

	default double x() {
		return getCoordinate().x;
	}

	default double y() {
		return getCoordinate().y;
	}

	default double distance(PointRef other) {
		return getCoordinate().distance(other.getCoordinate());
	}

	/**
	 * @return the point as a homogeneous vector (1, x, y)
	 */
	default double[] homogeneous() {
		Coordinate c = getCoordinate();
		return new double[] { 1, c.x, c.y };
	}

	/**
	 * A point that never moves.
	 */
	static PointRef fixed(double x, double y) {
		final Coordinate c = new Coordinate(x, y);
		return () -> c;
	}

	/**
	 * A point backed by the given (mutable) coordinate. Changes made to the
	 * coordinate by its owner are seen on the next read.
	 */
	static PointRef live(Coordinate coordinate) {
		Objects.requireNonNull(coordinate, "coordinate cannot be null");
		return () -> coordinate;
	}
}
