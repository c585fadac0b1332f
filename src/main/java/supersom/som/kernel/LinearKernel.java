package supersom.som.kernel;

public class LinearKernel implements KernelFunction {

	@Override
	public double getValue(double dist, double radius) {
		if (dist == 0)
			return 1;
		if (!(radius > 0))
			return 0;
		return Math.max(1.0 - dist / radius, 0);
	}
}
