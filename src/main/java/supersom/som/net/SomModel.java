package supersom.som.net;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import supersom.DataException;
import supersom.config.SomConfig;
import supersom.data.DataTable;
import supersom.layer.LayerStack;
import supersom.som.bmu.BmuGetter;
import supersom.som.bmu.DefaultBmuGetter;
import supersom.som.grid.Grid2D;
import supersom.som.grid.GridPos;
import supersom.som.utils.SomUtils;
import supersom.som.utils.UnitTable;

/**
 * A trained Super-SOM. Owns a frozen grid and the fitted layers; all
 * operations are read only, a failing query leaves the model as it was.
 */
public class SomModel {

	private final Grid2D<double[]> grid;
	private final LayerStack layers;
	private final SomConfig config;
	private final long trainedSteps;
	private final BmuGetter<double[]> bmuGetter;

	/** Takes ownership of the grid and freezes it. */
	public SomModel(Grid2D<double[]> grid, LayerStack layers, SomConfig config, long trainedSteps) {
		if (!layers.isFitted())
			throw new IllegalArgumentException("Layers are not fitted");
		for (GridPos p : grid.getPositions())
			if (grid.getPrototypeAt(p) == null || grid.getPrototypeAt(p).length != layers.getWidth())
				throw new IllegalArgumentException("Prototype at " + p + " does not match the layer width " + layers.getWidth());
		grid.freeze();
		this.grid = grid;
		this.layers = layers;
		this.config = config;
		this.trainedSteps = trainedSteps;
		this.bmuGetter = new DefaultBmuGetter<>(layers.getDist());
	}

	/**
	 * Best matching unit of a raw row, cells in the column layout of the
	 * training table.
	 *
	 * @throws supersom.layer.UnknownCategoryException for a category not seen in training
	 */
	public GridPos query(Object... row) {
		return bmuGetter.getBmuPos(layers.encode(row, DataException.NO_ROW), grid);
	}

	/** Best matching unit of an already encoded sample. */
	public GridPos query(double[] sample) {
		if (sample.length != layers.getWidth())
			throw new DataException("sample has width " + sample.length + ", expected " + layers.getWidth());
		return bmuGetter.getBmuPos(sample, grid);
	}

	/** Best matching units of all rows of a table, columns matched by name. */
	public List<GridPos> queryAll(DataTable t) {
		List<GridPos> l = new ArrayList<>();
		for (double[] d : layers.encode(t))
			l.add(bmuGetter.getBmuPos(d, grid));
		return l;
	}

	/** Weighted layer distance between a unit's prototype and an encoded sample. */
	public double distance(GridPos p, double[] sample) {
		return layers.getDist().dist(grid.getPrototypeAt(p), sample);
	}

	public double getQuantizationError(DataTable t) {
		return SomUtils.getMeanQuantError(grid, bmuGetter, layers.getDist(), layers.encode(t));
	}

	public double getTopographicError(DataTable t) {
		return SomUtils.getTopoError(grid, bmuGetter, layers.encode(t));
	}

	/** Label frequencies per unit of the labeled rows of a table. */
	public Map<GridPos, Map<String, Integer>> getLabelDistribution(DataTable t) {
		if (!t.hasLabels())
			throw new DataException("Table has no labels");
		return SomUtils.getLabelDist(layers.encode(t), t.getLabels(), grid, bmuGetter);
	}

	/** Units with decoded, de-normalized prototype values. */
	public UnitTable getUnitTable() {
		return new UnitTable(grid, layers);
	}

	public double[] getPrototype(GridPos p) {
		if (!grid.contains(p))
			throw new IllegalArgumentException("No unit at " + p);
		double[] v = grid.getPrototypeAt(p);
		return Arrays.copyOf(v, v.length);
	}

	public double[] getPrototype(int row, int col) {
		return getPrototype(new GridPos(row, col));
	}

	public double gridDist(GridPos a, GridPos b) {
		return grid.dist(a, b);
	}

	public List<GridPos> getPositions() {
		return grid.getPositions();
	}

	public GridSnapshot getSnapshot() {
		return new GridSnapshot(trainedSteps, trainedSteps, grid.getRows(), grid.getCols(), SomUtils.copyPrototypes(grid), null);
	}

	public int getRows() {
		return grid.getRows();
	}

	public int getCols() {
		return grid.getCols();
	}

	public boolean isToroidal() {
		return grid.isToroidal();
	}

	public LayerStack getLayers() {
		return layers;
	}

	public SomConfig getConfig() {
		return config;
	}

	public long getTrainedSteps() {
		return trainedSteps;
	}
}
