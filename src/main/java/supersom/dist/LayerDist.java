package supersom.dist;

import java.util.List;

/**
 * Weighted sum of per-layer segment distances. Layer order is the order of
 * the given lists and never changes.
 */
public class LayerDist implements Dist<double[]> {

	private final Dist<double[]>[] dists;
	private final double[] weights;

	@SuppressWarnings("unchecked")
	public LayerDist(List<Dist<double[]>> dists, List<Double> weights) {
		if (dists.size() != weights.size())
			throw new IllegalArgumentException(dists.size() + " distances but " + weights.size() + " weights");
		this.dists = dists.toArray(new Dist[dists.size()]);
		this.weights = new double[weights.size()];
		for (int i = 0; i < this.weights.length; i++)
			this.weights[i] = weights.get(i);
	}

	@Override
	public double dist(double[] a, double[] b) {
		if (a.length != b.length)
			throw new IllegalArgumentException("Vectors have different lengths: " + a.length + " != " + b.length);
		double sum = 0;
		for (int i = 0; i < dists.length; i++)
			if (weights[i] != 0)
				sum += weights[i] * dists[i].dist(a, b);
		return sum;
	}

	public int getNumLayers() {
		return dists.length;
	}

	public double getWeight(int i) {
		return weights[i];
	}
}
