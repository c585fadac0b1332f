package supersom.layer;

import supersom.ConfigException;
import supersom.dist.Dist;
import supersom.dist.SquaredEuclideanDist;
import supersom.dist.TanimotoDist;

/** Distance used within one layer segment. */
public enum SegmentMetric {
	squaredEuclidean, tanimoto;

	public Dist<double[]> create(int offset, int length) {
		if (this == tanimoto)
			return new TanimotoDist(offset, length);
		return new SquaredEuclideanDist(offset, length);
	}

	public static SegmentMetric fromString(String parameter, String s) {
		switch (s.trim().toLowerCase()) {
		case "sqeuclidean":
		case "squaredeuclidean":
		case "euclidean":
			return squaredEuclidean;
		case "tanimoto":
			return tanimoto;
		default:
			throw new ConfigException(parameter, "Not a metric: " + s + ". Must be one of (sqeuclidean|tanimoto)");
		}
	}
}
