package supersom.som.decay;

public abstract class DecayFunction {
	public abstract double getValue(double x);
}
