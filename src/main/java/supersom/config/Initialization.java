package supersom.config;

import supersom.ConfigException;

/** How prototypes are set before the first step. */
public enum Initialization {
	/** uniform within each dimension's data range */
	random,
	/** copies of randomly chosen samples, distinct while the data has enough rows */
	samples;

	public static Initialization fromString(String parameter, String s) {
		switch (s.trim().toLowerCase()) {
		case "random":
			return random;
		case "samples":
		case "sample":
			return samples;
		default:
			throw new ConfigException(parameter, "Not an initialization: " + s + ". Must be one of (random|samples)");
		}
	}
}
