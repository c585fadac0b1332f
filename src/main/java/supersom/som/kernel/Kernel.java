package supersom.som.kernel;

import supersom.ConfigException;

public enum Kernel {
	gauss, bubble, linear;

	public KernelFunction create() {
		switch (this) {
		case bubble:
			return new BubbleKernel();
		case linear:
			return new LinearKernel();
		default:
			return new GaussKernel();
		}
	}

	public static Kernel fromString(String parameter, String s) {
		switch (s.trim().toLowerCase()) {
		case "gauss":
		case "gaussian":
			return gauss;
		case "bubble":
		case "step":
			return bubble;
		case "linear":
			return linear;
		default:
			throw new ConfigException(parameter, "Not a kernel: " + s + ". Must be one of (gauss|bubble|linear)");
		}
	}
}
