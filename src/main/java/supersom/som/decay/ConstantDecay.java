package supersom.som.decay;

public class ConstantDecay extends DecayFunction {

	private final double value;

	public ConstantDecay(double value) {
		this.value = value;
	}

	@Override
	public double getValue(double progress) {
		return value;
	}
}
