package supersom.som.decay;

import supersom.ConfigException;

public enum Curve {
	linear, exponential;

	public static Curve fromString(String parameter, String s) {
		switch (s.trim().toLowerCase()) {
		case "lin":
		case "linear":
			return linear;
		case "exp":
		case "exponential":
			return exponential;
		default:
			throw new ConfigException(parameter, "Not a decay function: " + s + ". Must be one of (lin|exp)");
		}
	}
}
