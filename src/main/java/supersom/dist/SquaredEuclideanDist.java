package supersom.dist;

/**
 * Squared Euclidean distance over the index range <code>[offset, offset + length)</code>.
 * Dimensions where either vector is <code>NaN</code> are skipped.
 */
public class SquaredEuclideanDist implements Dist<double[]> {

	private final int offset, length;

	public SquaredEuclideanDist() {
		this(0, -1);
	}

	public SquaredEuclideanDist(int offset, int length) {
		this.offset = offset;
		this.length = length;
	}

	@Override
	public double dist(double[] a, double[] b) {
		int end = length < 0 ? a.length : offset + length;
		double sum = 0;
		for (int i = offset; i < end; i++) {
			double d = a[i] - b[i];
			if (!Double.isNaN(d))
				sum += d * d;
		}
		return sum;
	}
}
