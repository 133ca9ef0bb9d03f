package com.github.micycle1.conicsj;

import org.ejml.data.DMatrixRMaj;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.conicsj.definition.ConicDefinition;
import com.github.micycle1.conicsj.geom.Homogeneous;
import com.github.micycle1.conicsj.geom.LineRef;
import com.github.micycle1.conicsj.geom.PointRef;
import com.github.micycle1.conicsj.math.QuadraticForms;

/**
 * Parabola given by its focus and directrix.
 * <p>
 * The canonical frame is the parabola (x − vx)² = 4e (y − vy) opening towards
 * +y, where (vx, vy) is the vertex and e the distance from vertex to focus,
 * rotated about the vertex by the angle of the directrix. The parameter t is
 * the offset along the directrix direction from the vertex.
 */
public class Parabola extends Conic {

	private final PointRef focus;
	private final LineRef directrix;

	// focal distance and vertex, as of the last refresh
	private double e, vx, vy;

	public Parabola(ConicDefinition.FocusDirectrix definition) {
		super(ConicType.PARABOLA, definition);
		this.focus = definition.getFocus();
		this.directrix = definition.getDirectrix();
	}

	@Override
	protected void computeFrame() {
		final Coordinate f = focus.getCoordinate();
		final Coordinate foot = getMidpoint();

		e = foot.distance(f) * 0.5;
		vx = (foot.x + f.x) * 0.5;
		vy = (foot.y + f.y) * 0.5;

		double beta = Math.atan(directrix.slope());
		// canonical +y maps to (-sin β, cos β); it must point from the directrix to the focus
		if ((f.x - foot.x) * -Math.sin(beta) + (f.y - foot.y) * Math.cos(beta) < 0) {
			beta += Math.PI;
		}

		rotationMatrix = rotationAbout(vx, vy, beta);
		quadraticForm = QuadraticForms.conjugate(QuadraticForms.parabolaForm(e, vx, vy), QuadraticForms.inverseRotationAbout(vx, vy, beta));
	}

	@Override
	protected double[] preRotation(double t) {
		final double e4 = e * 4;
		return new double[] { e4, e4 * (t + vx), t * t + vy * e4 };
	}

	/**
	 * Foot of the perpendicular from the focus onto the directrix, read live.
	 */
	@Override
	public Coordinate getMidpoint() {
		final double[] l = directrix.standardForm();
		final double[] normalThroughFocus = Homogeneous.perpendicularThrough(l, focus.homogeneous());
		return Homogeneous.meet(normalThroughFocus, l);
	}

	/**
	 * @return the vertex as of the last refresh
	 */
	public Coordinate getVertex() {
		checkRefreshed();
		return new Coordinate(vx, vy);
	}

	/**
	 * @return distance from vertex to focus as of the last refresh
	 */
	public double getFocalDistance() {
		checkRefreshed();
		return e;
	}

	public PointRef getFocus() {
		return focus;
	}

	public LineRef getDirectrix() {
		return directrix;
	}

	private static DMatrixRMaj rotationAbout(double px, double py, double beta) {
		final double co = Math.cos(beta);
		final double si = Math.sin(beta);
		return rotationThenTranslation(px * (1 - co) + py * si, py * (1 - co) - px * si, beta);
	}
}
