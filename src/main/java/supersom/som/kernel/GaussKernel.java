package supersom.som.kernel;

public class GaussKernel implements KernelFunction {

	@Override
	public double getValue(double dist, double radius) {
		if (dist == 0)
			return 1;
		if (!(radius > 0))
			return 0;
		return Math.exp(-(dist * dist) / (2 * radius * radius));
	}
}
