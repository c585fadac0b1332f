package supersom.dist;

/**
 * Fraction of dimensions in <code>[offset, offset + length)</code> on which two
 * one-hot like vectors disagree, values >= 0.5 counting as set. Dimensions
 * where either vector is <code>NaN</code> are skipped; no comparable dimension
 * gives 0.
 */
public class TanimotoDist implements Dist<double[]> {

	private final int offset, length;

	public TanimotoDist(int offset, int length) {
		this.offset = offset;
		this.length = length;
	}

	@Override
	public double dist(double[] a, double[] b) {
		int counter = 0, sum = 0;
		for (int i = offset; i < offset + length; i++) {
			if (Double.isNaN(a[i]) || Double.isNaN(b[i]))
				continue;
			counter++;
			if ((a[i] >= 0.5) != (b[i] >= 0.5))
				sum++;
		}
		if (counter == 0)
			return 0;
		return (double) sum / counter;
	}
}
