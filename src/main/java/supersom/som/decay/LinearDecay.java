package supersom.som.decay;

public class LinearDecay extends DecayFunction {

	private final double from, to;

	public LinearDecay(double from, double to) {
		this.from = from;
		this.to = to;
	}

	@Override
	public double getValue(double x) {
		return (1 - x) * from + x * to;
	}
}
