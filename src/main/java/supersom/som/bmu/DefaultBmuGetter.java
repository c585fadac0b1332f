package supersom.som.bmu;

import java.util.Set;

import supersom.dist.Dist;
import supersom.som.grid.Grid;
import supersom.som.grid.GridPos;

public class DefaultBmuGetter<T> extends BmuGetter<T> {

	private final Dist<T> di;

	public DefaultBmuGetter(Dist<T> d) {
		this.di = d;
	}

	@Override
	public GridPos getBmuPos(T x, Grid<T> grid, Set<GridPos> ign) {
		double dist = Double.POSITIVE_INFINITY;

		GridPos bmu = null;
		// positions come in ascending order, so strict < keeps the smallest on ties
		for (GridPos p : grid.getPositions()) {
			if (ign != null && ign.contains(p))
				continue;

			double d = di.dist(grid.getPrototypeAt(p), x);
			if (d < dist || bmu == null && d == Double.POSITIVE_INFINITY) {
				dist = d;
				bmu = p;
			}
		}

		if (bmu == null)
			throw new IllegalStateException("No bmu found");

		return bmu;
	}

	public Dist<T> getDist() {
		return di;
	}
}
