package supersom;

/**
 * Invalid training configuration. Raised while a configuration is built or
 * parsed, before any training step runs.
 */
public class ConfigException extends RuntimeException {

	private static final long serialVersionUID = -3012489357201638841L;

	private final String parameter;

	public ConfigException(String parameter, String message) {
		super(parameter + ": " + message);
		this.parameter = parameter;
	}

	public ConfigException(String parameter, String message, Throwable cause) {
		super(parameter + ": " + message, cause);
		this.parameter = parameter;
	}

	/** Name of the offending configuration parameter, e.g. <code>grid.rows</code>. */
	public String getParameter() {
		return parameter;
	}
}
