package supersom.layer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import supersom.ConfigException;
import supersom.DataException;
import supersom.data.DataTable;
import supersom.dist.Dist;
import supersom.dist.LayerDist;

/**
 * The ordered layers of a Super-SOM. Layer <code>i</code> owns the index range
 * <code>[getOffset(i), getOffset(i) + getLayer(i).getWidth())</code> of every
 * sample and prototype vector.
 */
public class LayerStack implements Iterable<Layer> {

	private final List<Layer> layers;
	private int[] offsets;
	private int width = -1;
	private String[] header;
	private LayerDist dist;

	public LayerStack(List<Layer> layers) {
		if (layers.isEmpty())
			throw new ConfigException("layers", "No layers");
		Set<String> names = new HashSet<>();
		for (Layer l : layers)
			if (!names.add(l.getName()))
				throw new ConfigException("layers", "Duplicate layer name: " + l.getName());
		this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
	}

	/** Creates a stack of already fitted layers for a table with the given header. */
	public static LayerStack restore(List<Layer> layers, String[] header) {
		LayerStack ls = new LayerStack(layers);
		for (Layer l : layers)
			if (!l.isFitted())
				throw new IllegalArgumentException("Layer " + l.getName() + " is not fitted");
		ls.header = header.clone();
		ls.init();
		return ls;
	}

	public void fit(DataTable t) {
		if (width >= 0)
			throw new IllegalStateException("Layers are already fitted");
		if (t.size() == 0)
			throw new DataException("Empty data table");
		for (Layer l : layers)
			l.fit(t);
		header = t.getNames();
		init();
	}

	private void init() {
		offsets = new int[layers.size()];
		int off = 0;
		List<Dist<double[]>> dists = new ArrayList<>();
		List<Double> weights = new ArrayList<>();
		for (int i = 0; i < layers.size(); i++) {
			offsets[i] = off;
			dists.add(layers.get(i).createDist(off));
			weights.add(layers.get(i).getWeight());
			off += layers.get(i).getWidth();
		}
		width = off;
		dist = new LayerDist(dists, weights);
	}

	/** Encodes every row of a table. Columns are matched by name. */
	public List<double[]> encode(DataTable t) {
		checkFitted();
		int[][] idx = new int[layers.size()][];
		for (int i = 0; i < idx.length; i++)
			idx[i] = layers.get(i).getColumnIndices(t);

		List<double[]> samples = new ArrayList<>(t.size());
		for (int r = 0; r < t.size(); r++) {
			double[] d = new double[width];
			for (int i = 0; i < idx.length; i++) {
				Object[] values = new Object[idx[i].length];
				for (int j = 0; j < values.length; j++)
					values[j] = t.get(r, idx[i][j]);
				layers.get(i).encode(values, r, d, offsets[i]);
			}
			samples.add(d);
		}
		return samples;
	}

	/**
	 * Encodes a single row whose cells follow the column layout of the table
	 * the layers were fitted on.
	 */
	public double[] encode(Object[] row, int rowIndex) {
		checkFitted();
		if (row.length != header.length)
			throw new DataException("row has " + row.length + " cells, expected " + header.length, rowIndex, null);
		double[] d = new double[width];
		for (int i = 0; i < layers.size(); i++) {
			Layer l = layers.get(i);
			List<String> cols = l.getColumns();
			Object[] values = new Object[cols.size()];
			for (int j = 0; j < values.length; j++)
				values[j] = row[getHeaderIndex(cols.get(j))];
			l.encode(values, rowIndex, d, offsets[i]);
		}
		return d;
	}

	private int getHeaderIndex(String column) {
		for (int i = 0; i < header.length; i++)
			if (header[i].equals(column))
				return i;
		throw new DataException("column not in header", DataException.NO_ROW, column);
	}

	private void checkFitted() {
		if (width < 0)
			throw new IllegalStateException("Layers are not fitted");
	}

	public boolean isFitted() {
		return width >= 0;
	}

	/** Weighted multi-layer distance between two encoded vectors. */
	public Dist<double[]> getDist() {
		checkFitted();
		return dist;
	}

	public int getWidth() {
		checkFitted();
		return width;
	}

	public int getOffset(int i) {
		checkFitted();
		return offsets[i];
	}

	public int size() {
		return layers.size();
	}

	public Layer getLayer(int i) {
		return layers.get(i);
	}

	public int indexOf(String name) {
		for (int i = 0; i < layers.size(); i++)
			if (layers.get(i).getName().equals(name))
				return i;
		return -1;
	}

	/** Column names of the table the layers were fitted on. */
	public String[] getHeader() {
		checkFitted();
		return header.clone();
	}

	@Override
	public Iterator<Layer> iterator() {
		return layers.iterator();
	}
}
