package supersom.som.decay;

// i * (f/i)^x, from Ritter, Martinetz and Schulten. Requires i, f > 0.
public class ExponentialDecay extends DecayFunction {

	private final double i, f;

	public ExponentialDecay(double i, double f) {
		this.i = i;
		this.f = f;
	}

	@Override
	public double getValue(double x) {
		if (x == 1)
			return f; // exact end point
		return i * Math.pow(f / i, x);
	}
}
