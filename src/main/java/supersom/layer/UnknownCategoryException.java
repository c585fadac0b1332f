package supersom.layer;

import supersom.DataException;

/**
 * A categorical value that was not observed when the layer was fitted.
 */
public class UnknownCategoryException extends DataException {

	private static final long serialVersionUID = 1885203660911379740L;

	private final String layer, value;

	public UnknownCategoryException(String layer, String value, int row, String column) {
		super("unknown category '" + value + "' in layer '" + layer + "'", row, column);
		this.layer = layer;
		this.value = value;
	}

	public String getLayer() {
		return layer;
	}

	public String getValue() {
		return value;
	}
}
