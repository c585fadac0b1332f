package supersom;

/**
 * Input data that does not fit the declared columns or layers.
 */
public class DataException extends RuntimeException {

	private static final long serialVersionUID = 6625017842291093361L;

	public static final int NO_ROW = -1;

	private final int row;
	private final String column;

	public DataException(String message) {
		this(message, NO_ROW, null);
	}

	public DataException(String message, int row, String column) {
		super(context(row, column) + message);
		this.row = row;
		this.column = column;
	}

	private static String context(int row, String column) {
		String s = "";
		if (row != NO_ROW)
			s += "row " + row + ": ";
		if (column != null)
			s += "column '" + column + "': ";
		return s;
	}

	/** Row index the error refers to, or {@link #NO_ROW}. */
	public int getRow() {
		return row;
	}

	public String getColumn() {
		return column;
	}
}
