package supersom.som.decay;

import supersom.ConfigException;

/**
 * A parameter that moves from <code>start</code> to <code>end</code> over the
 * training horizon along a linear or exponential curve. The curve is resolved
 * to a {@link DecayFunction} once, when the schedule is created.
 */
public final class Schedule {

	private final double start, end;
	private final Curve curve;
	private final DecayFunction df;

	public Schedule(double start, double end, Curve curve) {
		this("schedule", start, end, curve);
	}

	/**
	 * @param parameter name reported when the bounds are invalid
	 * @throws ConfigException for non-finite bounds, or exponential bounds that are not > 0
	 */
	public Schedule(String parameter, double start, double end, Curve curve) {
		if (curve == null)
			throw new ConfigException(parameter, "No curve");
		if (!Double.isFinite(start) || !Double.isFinite(end))
			throw new ConfigException(parameter, "Bounds must be finite: " + start + ", " + end);
		if (curve == Curve.exponential && (start <= 0 || end <= 0))
			throw new ConfigException(parameter, "Exponential schedule requires start, end > 0: " + start + ", " + end);
		this.start = start;
		this.end = end;
		this.curve = curve;

		if (start == end)
			df = new ConstantDecay(start);
		else if (curve == Curve.exponential)
			df = new ExponentialDecay(start, end);
		else
			df = new LinearDecay(start, end);
	}

	public static Schedule lin(double start, double end) {
		return new Schedule(start, end, Curve.linear);
	}

	public static Schedule exp(double start, double end) {
		return new Schedule(start, end, Curve.exponential);
	}

	public double interpolate(double progress) {
		if (!(progress >= 0 && progress <= 1))
			throw new IllegalArgumentException("Progress must be in [0,1]: " + progress);
		return df.getValue(progress);
	}

	public double getStart() {
		return start;
	}

	public double getEnd() {
		return end;
	}

	public Curve getCurve() {
		return curve;
	}

	public double getMin() {
		return Math.min(start, end);
	}

	public double getMax() {
		return Math.max(start, end);
	}

	@Override
	public String toString() {
		return "[" + start + "->" + end + " " + curve + "]";
	}
}
