package supersom.som.bmu;

import java.util.Collections;
import java.util.Set;

import supersom.som.grid.Grid;
import supersom.som.grid.GridPos;

public abstract class BmuGetter<T> {

	public GridPos getBmuPos(T x, Grid<T> grid) {
		return getBmuPos(x, grid, Collections.<GridPos> emptySet());
	}

	public abstract GridPos getBmuPos(T x, Grid<T> grid, Set<GridPos> ign);
}
