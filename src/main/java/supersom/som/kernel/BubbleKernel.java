package supersom.som.kernel;

public class BubbleKernel implements KernelFunction {

	@Override
	public double getValue(double dist, double radius) {
		if (dist <= Math.max(radius, 0))
			return 1;
		else
			return 0;
	}
}
