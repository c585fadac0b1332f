package supersom.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import supersom.DataException;

/**
 * Already parsed tabular input: ordered rows of named columns. Numeric cells
 * are held as <code>Double</code> (<code>NaN</code> marks a missing value),
 * categorical cells as <code>String</code> (<code>null</code> marks a missing
 * value). Each row may carry an optional label that is used for visualization
 * only.
 */
public class DataTable {

	public enum Binding {
		Numeric, Categorical
	};

	private final List<String> names;
	private final List<Binding> bindings;
	private final List<Object[]> rows = new ArrayList<>();
	private final List<String> labels = new ArrayList<>();
	private boolean labeled = false;

	public DataTable(String[] names, Binding[] bindings) {
		if (names.length != bindings.length)
			throw new DataException(names.length + " column names but " + bindings.length + " bindings");
		for (int i = 0; i < names.length; i++) {
			if (names[i] == null || names[i].isEmpty())
				throw new DataException("Column " + i + " has no name");
			for (int j = 0; j < i; j++)
				if (names[i].equals(names[j]))
					throw new DataException("Duplicate column", DataException.NO_ROW, names[i]);
		}
		this.names = Collections.unmodifiableList(Arrays.asList(names.clone()));
		this.bindings = Collections.unmodifiableList(Arrays.asList(bindings.clone()));
	}

	public void addRow(Object... values) {
		addLabeledRow(null, values);
	}

	public void addLabeledRow(String label, Object... values) {
		int r = rows.size();
		if (values.length != names.size())
			throw new DataException("row has " + values.length + " cells, expected " + names.size(), r, null);

		Object[] row = new Object[values.length];
		for (int i = 0; i < values.length; i++)
			row[i] = toCell(values[i], r, i);
		rows.add(row);
		labels.add(label);
		if (label != null)
			labeled = true;
	}

	private Object toCell(Object v, int r, int col) {
		if (bindings.get(col) == Binding.Numeric) {
			if (v == null)
				return Double.NaN;
			if (!(v instanceof Number))
				throw new DataException("numeric cell expected, got " + v.getClass().getSimpleName(), r, names.get(col));
			return ((Number) v).doubleValue();
		} else {
			if (v == null)
				return null;
			if (!(v instanceof String))
				throw new DataException("categorical cell expected, got " + v.getClass().getSimpleName(), r, names.get(col));
			return v;
		}
	}

	public int size() {
		return rows.size();
	}

	public int getNumColumns() {
		return names.size();
	}

	public String[] getNames() {
		return names.toArray(new String[] {});
	}

	/** Index of the named column or -1. */
	public int getColumnIndex(String name) {
		return names.indexOf(name);
	}

	public Binding getBinding(int col) {
		return bindings.get(col);
	}

	public Object get(int row, int col) {
		return rows.get(row)[col];
	}

	public double getNumeric(int row, int col) {
		if (bindings.get(col) != Binding.Numeric)
			throw new DataException("column is not numeric", row, names.get(col));
		return (Double) rows.get(row)[col];
	}

	public String getCategorical(int row, int col) {
		if (bindings.get(col) != Binding.Categorical)
			throw new DataException("column is not categorical", row, names.get(col));
		return (String) rows.get(row)[col];
	}

	/** Copy of a row, cells in column order. */
	public Object[] getRow(int row) {
		return rows.get(row).clone();
	}

	public boolean hasLabels() {
		return labeled;
	}

	/** Label of a row, <code>null</code> if the row has none. */
	public String getLabel(int row) {
		return labels.get(row);
	}

	public List<String> getLabels() {
		return Collections.unmodifiableList(labels);
	}
}
