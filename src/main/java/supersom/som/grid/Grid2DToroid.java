package supersom.som.grid;

import java.util.List;

public class Grid2DToroid<T> extends Grid2D<T> {

	public Grid2DToroid(int rows, int cols) {
		super(rows, cols);
	}

	@Override
	public double dist(GridPos aPos, GridPos bPos) {
		int dr = Math.abs(aPos.getRow() - bPos.getRow());
		int dc = Math.abs(aPos.getCol() - bPos.getCol());
		dr = Math.min(dr, getRows() - dr);
		dc = Math.min(dc, getCols() - dc);
		return Math.sqrt((double) dr * dr + (double) dc * dc);
	}

	@Override
	protected List<GridPos> getNeighborCandidates(GridPos pos) {
		List<GridPos> l = super.getNeighborCandidates(pos);
		for (int i = 0; i < l.size(); i++) {
			GridPos p = l.get(i);
			l.set(i, new GridPos(Math.floorMod(p.getRow(), getRows()), Math.floorMod(p.getCol(), getCols())));
		}
		return l;
	}

	@Override
	public boolean isToroidal() {
		return true;
	}
}
