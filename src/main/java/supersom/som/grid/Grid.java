package supersom.som.grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public abstract class Grid<T> {

	public abstract double dist(GridPos aPos, GridPos bPos);

	public abstract Collection<GridPos> getNeighbours(GridPos pos);

	public abstract List<GridPos> getPositions();

	public abstract int size();

	public abstract T getPrototypeAt(GridPos pos);

	public abstract T setPrototypeAt(GridPos pos, T v);

	public double getMaxDist() {
		double max = 0;
		for (GridPos p1 : getPositions())
			for (GridPos p2 : getPositions())
				max = Math.max(max, dist(p1, p2));
		return max;
	}

	public List<T> getPrototypes() {
		List<T> l = new ArrayList<>();
		for (GridPos p : getPositions())
			l.add(getPrototypeAt(p));
		return l;
	}
}
