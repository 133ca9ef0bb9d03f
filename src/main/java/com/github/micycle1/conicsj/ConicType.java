package com.github.micycle1.conicsj;

public enum ConicType {

	ELLIPSE("ellipse", ConicConstants.FOCAL_CONIC_MIN_PARAMETER, ConicConstants.FOCAL_CONIC_MAX_PARAMETER),
	HYPERBOLA("hyperbola", ConicConstants.FOCAL_CONIC_MIN_PARAMETER, ConicConstants.FOCAL_CONIC_MAX_PARAMETER),
	PARABOLA("parabola", ConicConstants.PARABOLA_MIN_PARAMETER, ConicConstants.PARABOLA_MAX_PARAMETER),
	/**
	 * A conic given by five points or by its quadratic form.
	 */
	CONIC("conic", ConicConstants.CONIC_MIN_PARAMETER, ConicConstants.CONIC_MAX_PARAMETER);

	private final String elementName;
	private final double defaultFrom, defaultTo;

	ConicType(String elementName, double defaultFrom, double defaultTo) {
		this.elementName = elementName;
		this.defaultFrom = defaultFrom;
		this.defaultTo = defaultTo;
	}

	/**
	 * Name under which {@link ConicFactory#create(String, Object...)} builds this
	 * type.
	 */
	public String getElementName() {
		return elementName;
	}

	public double getDefaultFrom() {
		return defaultFrom;
	}

	public double getDefaultTo() {
		return defaultTo;
	}

	public static ConicType fromElementName(String name) {
		for (ConicType t : values()) {
			if (t.elementName.equalsIgnoreCase(name)) {
				return t;
			}
		}
		throw new IllegalArgumentException("Unknown conic element: '" + name + "'");
	}
}
