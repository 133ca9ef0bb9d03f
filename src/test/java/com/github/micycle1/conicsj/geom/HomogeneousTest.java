package com.github.micycle1.conicsj.geom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;

class HomogeneousTest {

	private static final double E = 1e-12;

	@Test
	@DisplayName("Line through two points contains both")
	void lineThroughContainsPoints() {
		double[] p = { 1, 2, 3 };
		double[] q = { 1, -4, 7 };
		double[] l = Homogeneous.lineThrough(p, q);
		assertEquals(0, Homogeneous.inner(l, p), E);
		assertEquals(0, Homogeneous.inner(l, q), E);
	}

	@Test
	@DisplayName("Meet of y = x and y = -x + 2 is (1, 1)")
	void meetOfCrossingLines() {
		double[] l = Homogeneous.lineThrough(new double[] { 1, 0, 0 }, new double[] { 1, 1, 1 });
		double[] m = Homogeneous.lineThrough(new double[] { 1, 0, 2 }, new double[] { 1, 2, 0 });
		Coordinate c = Homogeneous.meet(l, m);
		assertEquals(1, c.x, E);
		assertEquals(1, c.y, E);
	}

	@Test
	@DisplayName("Parallel lines meet at infinity")
	void meetOfParallelLines() {
		double[] l = Homogeneous.lineThrough(new double[] { 1, 0, 0 }, new double[] { 1, 1, 0 });
		double[] m = Homogeneous.lineThrough(new double[] { 1, 0, 1 }, new double[] { 1, 1, 1 });
		Coordinate c = Homogeneous.meet(l, m);
		assertTrue(Double.isInfinite(c.x) || Double.isNaN(c.x));
	}

	@Test
	@DisplayName("Perpendicular through a point drops onto its foot")
	void perpendicularFoot() {
		LineRef diagonal = LineRef.live(new LineSegment(0, 0, 1, 1));
		double[] l = diagonal.standardForm();
		double[] p = { 1, 0, 2 };
		Coordinate foot = Homogeneous.meet(Homogeneous.perpendicularThrough(l, p), l);
		assertEquals(1, foot.x, E);
		assertEquals(1, foot.y, E);
	}

	@Test
	void standardFormAndSlope() {
		LineRef l = LineRef.through(PointRef.fixed(0, 1), PointRef.fixed(2, 5));
		assertEquals(2, l.slope(), E);
		double[] s = l.standardForm();
		// c + a*x + b*y vanishes on the line
		assertEquals(0, s[0] + s[1] * 1 + s[2] * 3, E);

		LineRef vertical = LineRef.live(new LineSegment(3, 4, 3, -1));
		assertEquals(Double.POSITIVE_INFINITY, vertical.slope());
		assertEquals(2, vertical.distance(new Coordinate(1, 0)), E);
	}

	@Test
	@DisplayName("Live point reference follows its coordinate")
	void livePointFollowsSource() {
		Coordinate c = new Coordinate(1, 1);
		PointRef ref = PointRef.live(c);
		assertEquals(1, ref.x());
		c.x = 5;
		assertEquals(5, ref.x());
		assertEquals(4, ref.distance(PointRef.fixed(1, 1)), E);
	}
}
