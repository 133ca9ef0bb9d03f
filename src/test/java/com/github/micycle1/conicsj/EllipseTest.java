package com.github.micycle1.conicsj;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.conicsj.geom.PointRef;

class EllipseTest {

	private static final double E = 1e-9;
	private static final int SAMPLES = 64;

	private Coordinate f0, f1, c;
	private Ellipse ellipse;

	@BeforeEach
	void setUp() {
		f0 = new Coordinate(-1, 4);
		f1 = new Coordinate(-1, -4);
		c = new Coordinate(1, 1);
		ellipse = ConicFactory.ellipse(PointRef.live(f0), PointRef.live(f1), PointRef.live(c));
	}

	@Test
	@DisplayName("Foci (-1,4), (-1,-4) through (1,1)")
	void verticalFociScenario() {
		double expectedMajor = c.distance(f0) + c.distance(f1);
		assertEquals(expectedMajor, ellipse.getMajorAxis(), E);

		Coordinate m = ellipse.getMidpoint();
		assertEquals(-1, m.x, E);
		assertEquals(0, m.y, E);

		Coordinate p = ellipse.evaluate(0, false);
		// on the major axis x = -1, at semi-major distance from the midpoint
		assertEquals(-1, p.x, E);
		assertEquals(expectedMajor / 2, Math.abs(p.y), E);
	}

	@Test
	@DisplayName("Sum of focal distances equals the major axis")
	void focalSum() {
		ellipse.refresh();
		double major = ellipse.getMajorAxis();
		for (int i = 0; i < SAMPLES; i++) {
			double phi = 2 * Math.PI * i / SAMPLES;
			Coordinate p = ellipse.evaluate(phi);
			assertEquals(major, p.distance(f0) + p.distance(f1), E, "phi=" + phi);
		}
	}

	@Test
	@DisplayName("Rotated ellipse from axis length")
	void rotatedFromAxisLength() {
		Coordinate g0 = new Coordinate(1, 1);
		Coordinate g1 = new Coordinate(4, 5);
		Ellipse rotated = ConicFactory.ellipse(PointRef.live(g0), PointRef.live(g1), 8);
		rotated.refresh();
		assertEquals(4, rotated.getSemiMajorAxis(), E);
		assertEquals(Math.sqrt(16 - 6.25), rotated.getSemiMinorAxis(), E);

		double scale = NormOps_DDRM.normF(rotated.getQuadraticForm());
		for (int i = 0; i < SAMPLES; i++) {
			Coordinate p = rotated.evaluate(2 * Math.PI * i / SAMPLES);
			assertEquals(8, p.distance(g0) + p.distance(g1), E);
			assertEquals(0, rotated.evaluateForm(p) / scale, E);
		}
	}

	@Test
	void quadraticFormIsSymmetricAndVanishesOnCurve() {
		ellipse.refresh();
		assertTrue(MatrixFeatures_DDRM.isSymmetric(ellipse.getQuadraticForm(), E));
		for (int i = 0; i < SAMPLES; i++) {
			Coordinate p = ellipse.evaluate(2 * Math.PI * i / SAMPLES);
			assertEquals(0, ellipse.evaluateForm(p), E);
		}
		assertTrue(ellipse.evaluateForm(ellipse.getMidpoint()) < 0);
	}

	@Test
	@DisplayName("Cached evaluation is bit-identical to the refreshing call")
	void cachedEvaluationIdentical() {
		Coordinate fresh = ellipse.evaluate(0.7, false);
		Coordinate cached1 = ellipse.evaluate(0.7, true);
		Coordinate cached2 = ellipse.evaluate(0.7, true);
		assertEquals(fresh.x, cached1.x, 0);
		assertEquals(fresh.y, cached1.y, 0);
		assertEquals(cached1.x, cached2.x, 0);
		assertEquals(cached1.y, cached2.y, 0);
		assertEquals(fresh.x, ellipse.x(0.7, true), 0);
		assertEquals(fresh.y, ellipse.y(0.7, true), 0);
	}

	@Test
	@DisplayName("Moved inputs are only picked up on refresh")
	void staleUntilRefresh() {
		ellipse.refresh();
		Coordinate before = ellipse.evaluate(1.0);

		f0.x += 2;
		f1.x += 2;
		c.x += 2;

		// midpoint is live, the parametrization is not
		assertEquals(1, ellipse.getMidpoint().x, E);
		Coordinate stale = ellipse.evaluate(1.0);
		assertEquals(before.x, stale.x, 0);
		assertEquals(before.y, stale.y, 0);

		ellipse.refresh();
		Coordinate moved = ellipse.evaluate(1.0);
		assertEquals(before.x + 2, moved.x, E);
		assertEquals(before.y, moved.y, E);
	}

	@Test
	void evaluateBeforeRefreshFails() {
		assertFalse(ellipse.isRefreshed());
		assertThrows(IllegalStateException.class, () -> ellipse.evaluate(0));
		assertThrows(IllegalStateException.class, () -> ellipse.getQuadraticForm());
	}

	@Test
	@DisplayName("Axis shorter than the focal distance yields NaN rather than an error")
	void impossibleEllipseIsNaN() {
		Ellipse bad = ConicFactory.ellipse(PointRef.fixed(0, 0), PointRef.fixed(10, 0), 4);
		Coordinate p = bad.evaluate(0.5, false);
		assertTrue(Double.isNaN(p.y));
		assertTrue(Double.isNaN(bad.getSemiMinorAxis()));
	}

	@Test
	void defaultParameterRange() {
		assertEquals(-1.0001 * Math.PI, ellipse.getMinParameter(), 0);
		assertEquals(1.0001 * Math.PI, ellipse.getMaxParameter(), 0);
		assertEquals(ConicType.ELLIPSE, ellipse.getType());
		assertNotEquals(ellipse.getMinParameter(), ellipse.getMaxParameter());
	}
}
