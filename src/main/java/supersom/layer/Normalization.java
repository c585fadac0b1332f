package supersom.layer;

import supersom.ConfigException;

public enum Normalization {
	/** identity */
	none,
	/** min/max to [0,1] */
	unit,
	/** (x - mean) / sd */
	zScore;

	public static Normalization fromString(String parameter, String s) {
		switch (s.trim().toLowerCase()) {
		case "none":
			return none;
		case "unit":
		case "scale01":
			return unit;
		case "zscore":
		case "z-score":
		case "gauss":
		case "gaussian":
			return zScore;
		default:
			throw new ConfigException(parameter, "Not a normalization: " + s + ". Must be one of (none|unit|zscore)");
		}
	}
}
