package supersom.layer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import supersom.ConfigException;
import supersom.DataException;
import supersom.data.DataTable;
import supersom.dist.Dist;

/**
 * A named group of input columns that is normalized, encoded and weighted
 * as one segment of the sample vector. A layer is fitted exactly once and is
 * immutable afterwards.
 */
public abstract class Layer {

	public enum Kind {
		Numeric, Categorical
	}

	protected final String name;
	protected final String[] columns;
	protected final double weight;
	protected final SegmentMetric metric;
	private boolean fitted = false;

	protected Layer(String name, String[] columns, double weight, SegmentMetric metric) {
		if (name == null || name.trim().isEmpty())
			throw new ConfigException("layers", "Layer without name");
		if (columns.length == 0)
			throw new ConfigException("layer." + name + ".columns", "No columns");
		if (!(weight >= 0) || Double.isInfinite(weight))
			throw new ConfigException("layer." + name + ".weight", "Weight must be finite and >= 0, got " + weight);
		this.name = name;
		this.columns = columns.clone();
		this.weight = weight;
		this.metric = metric;
	}

	public abstract Kind getKind();

	/** Width of the encoded segment. */
	public abstract int getWidth();

	protected abstract void fit(DataTable t, int[] idx);

	/**
	 * Encodes the layer's cells of one row into <code>dst</code>, starting at
	 * <code>offset</code>. <code>values</code> holds the layer's columns in
	 * declaration order.
	 */
	public abstract void encode(Object[] values, int row, double[] dst, int offset);

	public final void fit(DataTable t) {
		if (fitted)
			throw new IllegalStateException("Layer '" + name + "' is already fitted");
		int[] idx;
		try {
			idx = getColumnIndices(t);
		} catch (DataException e) {
			throw new ConfigException("layer." + name + ".columns", e.getMessage(), e);
		}
		fit(t, idx);
		fitted = true;
	}

	/**
	 * Indices of the layer's columns in the given table.
	 *
	 * @throws DataException if a column is missing or has the wrong binding
	 */
	public int[] getColumnIndices(DataTable t) {
		DataTable.Binding b = getKind() == Kind.Numeric ? DataTable.Binding.Numeric : DataTable.Binding.Categorical;
		int[] idx = new int[columns.length];
		for (int i = 0; i < columns.length; i++) {
			idx[i] = t.getColumnIndex(columns[i]);
			if (idx[i] < 0)
				throw new DataException("column not found for layer '" + name + "'", DataException.NO_ROW, columns[i]);
			if (t.getBinding(idx[i]) != b)
				throw new DataException("layer '" + name + "' expects a " + b + " column", DataException.NO_ROW, columns[i]);
		}
		return idx;
	}

	public Dist<double[]> createDist(int offset) {
		checkFitted();
		return metric.create(offset, getWidth());
	}

	protected void checkFitted() {
		if (!fitted)
			throw new IllegalStateException("Layer '" + name + "' is not fitted");
	}

	protected void setFitted() {
		this.fitted = true;
	}

	public boolean isFitted() {
		return fitted;
	}

	public String getName() {
		return name;
	}

	public List<String> getColumns() {
		return Collections.unmodifiableList(Arrays.asList(columns));
	}

	public double getWeight() {
		return weight;
	}

	public SegmentMetric getMetric() {
		return metric;
	}

	@Override
	public String toString() {
		return getKind() + "Layer[" + name + "," + Arrays.toString(columns) + ",w=" + weight + "]";
	}
}
