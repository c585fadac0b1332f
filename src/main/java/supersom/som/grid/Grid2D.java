package supersom.som.grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public class Grid2D<T> extends Grid<T> {

	private final int rows, cols;
	private final Object[][] grid;
	private final List<GridPos> positions;
	private volatile boolean frozen = false;

	public Grid2D(int rows, int cols) {
		if (rows <= 0 || cols <= 0)
			throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
		this.rows = rows;
		this.cols = cols;
		this.grid = new Object[rows][cols];

		List<GridPos> l = new ArrayList<>(rows * cols);
		for (int i = 0; i < rows; i++)
			for (int j = 0; j < cols; j++)
				l.add(new GridPos(i, j));
		this.positions = Collections.unmodifiableList(l);
	}

	@Override
	public double dist(GridPos aPos, GridPos bPos) {
		double dr = aPos.getRow() - bPos.getRow();
		double dc = aPos.getCol() - bPos.getCol();
		return Math.sqrt(dr * dr + dc * dc);
	}

	protected List<GridPos> getNeighborCandidates(GridPos pos) {
		List<GridPos> l = new ArrayList<>();
		int r = pos.getRow();
		int c = pos.getCol();

		l.add(new GridPos(r - 1, c));
		l.add(new GridPos(r, c - 1));
		l.add(new GridPos(r, c + 1));
		l.add(new GridPos(r + 1, c));
		return l;
	}

	// rook
	@Override
	public Collection<GridPos> getNeighbours(GridPos pos) {
		List<GridPos> l = new ArrayList<>();
		for (GridPos p : getNeighborCandidates(pos))
			if (contains(p) && !l.contains(p) && !p.equals(pos))
				l.add(p);
		return l;
	}

	public boolean contains(GridPos p) {
		return p.length() == 2 && p.getRow() >= 0 && p.getRow() < rows && p.getCol() >= 0 && p.getCol() < cols;
	}

	@Override
	public List<GridPos> getPositions() {
		return positions;
	}

	@Override
	public int size() {
		return rows * cols;
	}

	@SuppressWarnings("unchecked")
	@Override
	public T getPrototypeAt(GridPos pos) {
		return (T) grid[pos.getRow()][pos.getCol()];
	}

	@Override
	public T setPrototypeAt(GridPos pos, T v) {
		if (frozen)
			throw new IllegalStateException("Grid is frozen");
		T old = getPrototypeAt(pos);
		grid[pos.getRow()][pos.getCol()] = v;
		return old;
	}

	public void freeze() {
		frozen = true;
	}

	public boolean isFrozen() {
		return frozen;
	}

	public int getRows() {
		return rows;
	}

	public int getCols() {
		return cols;
	}

	public boolean isToroidal() {
		return false;
	}
}
