package supersom.som.kernel;

public interface KernelFunction {
	public double getValue(double dist, double radius);
}
