package supersom.som.grid;

import java.util.Arrays;

public class GridPos implements Comparable<GridPos> {

	private final int[] coords;

	public GridPos(int... coords) {
		this.coords = coords.clone();
	}

	public int getPos(int i) {
		return coords[i];
	}

	public int getRow() {
		return coords[0];
	}

	public int getCol() {
		return coords[1];
	}

	public int length() {
		return coords.length;
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(coords);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof GridPos && Arrays.equals(coords, ((GridPos) obj).coords);
	}

	@Override
	public String toString() {
		return Arrays.toString(coords);
	}

	@Override
	public int compareTo(GridPos o) {
		if (o.coords.length != coords.length)
			throw new IllegalArgumentException("Cannot compare " + this + " with " + o);
		for (int i = 0; i < coords.length; i++) {
			int c = Integer.compare(coords[i], o.coords[i]);
			if (c != 0)
				return c;
		}
		return 0;
	}
}
