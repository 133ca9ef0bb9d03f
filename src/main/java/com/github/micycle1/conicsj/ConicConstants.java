package com.github.micycle1.conicsj;

public class ConicConstants {

	/**
	 * Below this absolute x-difference the foci segment is treated as vertical and
	 * the rotation angle is taken as ±π/2 rather than from atan2.
	 */
	public static final double VERTICAL_FOCI_TOL = 1e-7;
	public static final double ZERO_EIGENVALUE = 1e-12;

	public static final double FOCAL_CONIC_MIN_PARAMETER = -1.0001 * Math.PI;
	public static final double FOCAL_CONIC_MAX_PARAMETER = 1.0001 * Math.PI;
	public static final double PARABOLA_MIN_PARAMETER = -10;
	public static final double PARABOLA_MAX_PARAMETER = 10;
	public static final double CONIC_MIN_PARAMETER = 0;
	public static final double CONIC_MAX_PARAMETER = 2 * Math.PI;
}
