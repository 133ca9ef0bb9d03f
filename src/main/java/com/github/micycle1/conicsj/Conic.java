package com.github.micycle1.conicsj;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.conicsj.definition.ConicDefinition;
import com.github.micycle1.conicsj.geom.Homogeneous;
import com.github.micycle1.conicsj.math.QuadraticForms;

/**
 * A conic section with a parametrization phi -> (x, y).
 * <p>
 * Evaluation is split in two phases. {@link #refresh()} re-reads the live
 * inputs of the definition and rebuilds the quadratic form and the rotation
 * into the conic's canonical frame; {@link #evaluate(double)} only reads that
 * cached state. A caller that samples many parameter values for one unchanged
 * geometry therefore refreshes once and evaluates many times. Deciding when the
 * inputs changed is up to the caller.
 * <p>
 * Degenerate inputs (coincident points, an axis shorter than the focal
 * distance, and so on) are not rejected: they show up as NaN or infinite
 * coordinates.
 * <p>
 * Instances are not thread-safe.
 */
public abstract class Conic {

	private static final Logger LOGGER = LoggerFactory.getLogger(Conic.class);

	private final ConicType type;
	private final ConicDefinition definition;
	// parameter interval, fixed at construction
	private final double minParameter, maxParameter;

	protected DMatrixRMaj quadraticForm;
	/**
	 * Homogeneous transform from canonical coordinates into world coordinates.
	 */
	protected DMatrixRMaj rotationMatrix;
	private boolean refreshed = false;

	protected Conic(ConicType type, ConicDefinition definition) {
		this.type = Objects.requireNonNull(type);
		this.definition = Objects.requireNonNull(definition, "definition cannot be null");
		this.minParameter = Double.isNaN(definition.getFrom()) ? type.getDefaultFrom() : definition.getFrom();
		this.maxParameter = Double.isNaN(definition.getTo()) ? type.getDefaultTo() : definition.getTo();
	}

	/**
	 * Rebuilds the quadratic form, the rotation matrix and the scalars the
	 * parametrization depends on from the current state of the definition's
	 * references.
	 */
	public final void refresh() {
		computeFrame();
		refreshed = true;
		if (MatrixFeatures_DDRM.hasUncountable(quadraticForm)) {
			LOGGER.debug("{} has a non-finite quadratic form; its definition is degenerate", type);
		}
	}

	/**
	 * Recomputes {@link #quadraticForm}, {@link #rotationMatrix} and any cached
	 * per-family scalars.
	 */
	protected abstract void computeFrame();

	/**
	 * The point for parameter {@code phi}, in homogeneous canonical coordinates,
	 * before the rotation is applied.
	 */
	protected abstract double[] preRotation(double phi);

	/**
	 * Point on the conic for the parameter {@code phi}, computed from the state
	 * cached by the last {@link #refresh()}.
	 *
	 * @throws IllegalStateException if the conic was never refreshed
	 */
	public Coordinate evaluate(double phi) {
		checkRefreshed();
		DMatrixRMaj v = new DMatrixRMaj(3, 1);
		CommonOps_DDRM.mult(rotationMatrix, DMatrixRMaj.wrap(3, 1, preRotation(phi)), v);
		return Homogeneous.toCoordinate(v.getData());
	}

	/**
	 * Single-call form of the refresh/evaluate protocol.
	 *
	 * @param suspendUpdate true to reuse the cached frame, false to refresh
	 *                      first
	 */
	public Coordinate evaluate(double phi, boolean suspendUpdate) {
		if (!suspendUpdate) {
			refresh();
		}
		return evaluate(phi);
	}

	public double x(double phi, boolean suspendUpdate) {
		return evaluate(phi, suspendUpdate).x;
	}

	public double y(double phi, boolean suspendUpdate) {
		return evaluate(phi, suspendUpdate).y;
	}

	/**
	 * Center of the conic. For ellipses, hyperbolas and parabolas this is read
	 * live from the definition; for a general conic it is derived from the
	 * quadratic form of the last refresh.
	 */
	public abstract Coordinate getMidpoint();

	/**
	 * @return a copy of the quadratic form from the last refresh
	 */
	public DMatrixRMaj getQuadraticForm() {
		checkRefreshed();
		return quadraticForm.copy();
	}

	/**
	 * @return a copy of the rotation matrix from the last refresh
	 */
	public DMatrixRMaj getRotationMatrix() {
		checkRefreshed();
		return rotationMatrix.copy();
	}

	/**
	 * Value of the quadratic form at {@code p}; zero on the conic.
	 */
	public double evaluateForm(Coordinate p) {
		checkRefreshed();
		return QuadraticForms.evaluate(quadraticForm, Homogeneous.of(p));
	}

	public boolean isRefreshed() {
		return refreshed;
	}

	public ConicType getType() {
		return type;
	}

	public ConicDefinition getDefinition() {
		return definition;
	}

	public double getMinParameter() {
		return minParameter;
	}

	public double getMaxParameter() {
		return maxParameter;
	}

	protected void checkRefreshed() {
		if (!refreshed) {
			throw new IllegalStateException(type + " has not been refreshed yet; call refresh() before evaluating.");
		}
	}

	/**
	 * Homogeneous rigid motion: rotation by {@code beta} followed by translation
	 * by (tx, ty).
	 */
	protected static DMatrixRMaj rotationThenTranslation(double tx, double ty, double beta) {
		final double co = Math.cos(beta);
		final double si = Math.sin(beta);
		return new DMatrixRMaj(new double[][] { //
				{ 1, 0, 0 }, //
				{ tx, co, -si }, //
				{ ty, si, co } });
	}

	@Override
	public String toString() {
		return type + "{kind=" + definition.getKind() + ", refreshed=" + refreshed + '}';
	}
}
