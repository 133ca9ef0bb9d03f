package com.github.micycle1.conicsj;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.NormOps_DDRM;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.conicsj.geom.PointRef;

class GeneralConicTest {

	private static final double E = 1e-9;

	private Coordinate[] points;
	private GeneralConic conic;

	@BeforeEach
	void setUp() {
		points = new Coordinate[] { new Coordinate(1, 5), new Coordinate(1, 2), new Coordinate(2, 0), new Coordinate(0, 0),
				new Coordinate(-1, 5) };
		conic = ConicFactory.conic(PointRef.live(points[0]), PointRef.live(points[1]), PointRef.live(points[2]), PointRef.live(points[3]),
				PointRef.live(points[4]));
	}

	/**
	 * |pᵗMp| relative to the size of M and of p.
	 */
	private static double residual(Conic c, Coordinate p) {
		double scale = NormOps_DDRM.normF(c.getQuadraticForm()) * (1 + p.x * p.x + p.y * p.y);
		return Math.abs(c.evaluateForm(p)) / scale;
	}

	@Test
	@DisplayName("Five points (1,5),(1,2),(2,0),(0,0),(-1,5)")
	void fivePointScenario() {
		conic.refresh();
		for (Coordinate p : points) {
			assertEquals(0, residual(conic, p), E);
		}
		Coordinate m = conic.getMidpoint();
		assertTrue(Double.isFinite(m.x) && Double.isFinite(m.y));
		// -20x² - 8xy + 2y² + 40x - 6y = 0 has its center at (0.5, 2.5)
		assertEquals(0.5, m.x, E);
		assertEquals(2.5, m.y, E);
	}

	@Test
	@DisplayName("Sampled points lie on the conic through the five points")
	void sampledPointsOnConic() {
		conic.refresh();
		int finite = 0;
		for (int i = 0; i < 100; i++) {
			Coordinate p = conic.evaluate(2 * Math.PI * i / 100);
			if (Double.isFinite(p.x) && Double.isFinite(p.y) && Math.abs(p.x) < 1e4 && Math.abs(p.y) < 1e4) {
				assertEquals(0, residual(conic, p), 1e-8, p::toString);
				finite++;
			}
		}
		assertTrue(finite > 50);
	}

	@Test
	void primaryEigenvalueNonNegative() {
		conic.refresh();
		assertTrue(conic.getFrame().getEigenvalue(0) >= 0);

		points[2].x = 3;
		points[4].y = 7;
		conic.refresh();
		assertTrue(conic.getFrame().getEigenvalue(0) >= 0);
	}

	@Test
	@DisplayName("Midpoint tracks the quadratic form of the last refresh only")
	void midpointFollowsRefresh() {
		assertThrows(IllegalStateException.class, () -> conic.getMidpoint());
		conic.refresh();
		Coordinate before = conic.getMidpoint();

		for (Coordinate p : points) {
			p.x += 10;
		}
		Coordinate stale = conic.getMidpoint();
		assertEquals(before.x, stale.x, 0);

		conic.refresh();
		assertEquals(before.x + 10, conic.getMidpoint().x, E);
		assertEquals(before.y, conic.getMidpoint().y, E);
	}

	@Test
	@DisplayName("Ellipse given by coefficients")
	void ellipseFromCoefficients() {
		// x²/4 + y² - 1 = 0, shifted to center (1, -2): x² + 4y² - 2x + 16y + 13 = 0
		GeneralConic ellipse = ConicFactory.conic(1, 4, 13, 0, -1, 8);
		ellipse.refresh();
		Coordinate center = ellipse.getMidpoint();
		assertEquals(1, center.x, E);
		assertEquals(-2, center.y, E);

		for (int i = 0; i < 36; i++) {
			Coordinate p = ellipse.evaluate(2 * Math.PI * i / 36);
			double u = (p.x - 1) / 2;
			double v = p.y + 2;
			assertEquals(1, u * u + v * v, E);
		}
	}

	@Test
	@DisplayName("Hyperbola given by coefficients")
	void hyperbolaFromCoefficients() {
		// x² - y² - 1 = 0
		GeneralConic hyperbola = ConicFactory.conic(1, -1, -1, 0, 0, 0);
		hyperbola.refresh();
		for (int i = 0; i < 36; i++) {
			Coordinate p = hyperbola.evaluate(2 * Math.PI * i / 36 + 0.01);
			if (Math.abs(p.x) < 1e6) {
				assertEquals(1, p.x * p.x - p.y * p.y, E * (1 + p.x * p.x));
			}
		}
	}

	@Test
	@DisplayName("Ellipse whose form diagonalizes to eigenvalue signs (+, -, -)")
	void bothMinorEigenvaluesNegative() {
		// 1 - x²/4 - y² = 0
		GeneralConic ellipse = ConicFactory.conic(-0.25, -1, 1, 0, 0, 0);
		ellipse.refresh();
		assertTrue(ellipse.getFrame().getEigenvalue(1) <= 0);
		assertTrue(ellipse.getFrame().getEigenvalue(2) <= 0);

		for (int i = 0; i < 36; i++) {
			Coordinate p = ellipse.evaluate(2 * Math.PI * i / 36);
			assertEquals(0, residual(ellipse, p), E, p::toString);
			assertEquals(1, p.x * p.x / 4 + p.y * p.y, E);
		}
	}

	@Test
	@DisplayName("Hyperbola whose form diagonalizes to eigenvalue signs (+, +, -)")
	void lastEigenvalueNegative() {
		// y² - x² - 1 = 0
		GeneralConic hyperbola = ConicFactory.conic(-1, 1, -1, 0, 0, 0);
		hyperbola.refresh();
		assertTrue(hyperbola.getFrame().getEigenvalue(1) > 0);
		assertTrue(hyperbola.getFrame().getEigenvalue(2) < 0);

		for (int i = 0; i < 36; i++) {
			Coordinate p = hyperbola.evaluate(2 * Math.PI * i / 36 + 0.01);
			if (Math.abs(p.y) < 1e6) {
				assertEquals(0, residual(hyperbola, p), E, p::toString);
				assertEquals(1, p.y * p.y - p.x * p.x, E * (1 + p.y * p.y));
			}
		}
	}

	@Test
	@DisplayName("A form without real points evaluates to NaN")
	void emptyConicIsNaN() {
		GeneralConic empty = ConicFactory.conic(1, 1, 1, 0, 0, 0);
		empty.refresh();
		Coordinate p = empty.evaluate(1);
		assertTrue(Double.isNaN(p.x) && Double.isNaN(p.y));
	}

	@Test
	@DisplayName("Quadratic form is exposed as a copy")
	void quadraticFormCopy() {
		conic.refresh();
		DMatrixRMaj m = conic.getQuadraticForm();
		m.set(0, 0, 1e6);
		assertEquals(0, conic.getQuadraticForm().get(0, 0), E * NormOps_DDRM.normF(conic.getQuadraticForm()));
		assertEquals(ConicConstants.CONIC_MAX_PARAMETER, conic.getMaxParameter(), 0);
	}
}
