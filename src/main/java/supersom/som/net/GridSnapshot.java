package supersom.som.net;

import java.util.Arrays;

/**
 * Read-only copy of the grid at some training step, handed to
 * {@link TrainingListener}s. Prototypes are indexed
 * <code>row * cols + col</code>.
 */
public class GridSnapshot {

	private final long step, totalSteps;
	private final int rows, cols;
	private final double[][] prototypes;
	private final String[] labels;

	public GridSnapshot(long step, long totalSteps, int rows, int cols, double[][] prototypes, String[] labels) {
		if (prototypes.length != rows * cols)
			throw new IllegalArgumentException(prototypes.length + " prototypes for a " + rows + "x" + cols + " grid");
		this.step = step;
		this.totalSteps = totalSteps;
		this.rows = rows;
		this.cols = cols;
		this.prototypes = prototypes;
		this.labels = labels;
	}

	/** Number of steps applied so far. */
	public long getStep() {
		return step;
	}

	public long getTotalSteps() {
		return totalSteps;
	}

	public int getRows() {
		return rows;
	}

	public int getCols() {
		return cols;
	}

	public double[] getPrototype(int row, int col) {
		double[] v = prototypes[index(row, col)];
		return Arrays.copyOf(v, v.length);
	}

	public boolean hasLabels() {
		return labels != null;
	}

	/** Majority label of the unit, <code>null</code> if no labeled sample maps to it or there are no labels. */
	public String getLabel(int row, int col) {
		int i = index(row, col);
		if (labels == null)
			return null;
		return labels[i];
	}

	private int index(int row, int col) {
		if (row < 0 || row >= rows || col < 0 || col >= cols)
			throw new IllegalArgumentException("No unit at [" + row + ", " + col + "] in a " + rows + "x" + cols + " grid");
		return row * cols + col;
	}
}
