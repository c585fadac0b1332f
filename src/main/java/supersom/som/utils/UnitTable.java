package supersom.som.utils;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import supersom.layer.CategoricalLayer;
import supersom.layer.Layer;
import supersom.layer.LayerStack;
import supersom.layer.NumericLayer;
import supersom.som.grid.Grid2D;
import supersom.som.grid.GridPos;

/**
 * One row per unit: index, row, col, then the de-normalized values of every
 * numeric column and the decoded class of every categorical layer.
 */
public class UnitTable {

	private final List<String> names = new ArrayList<>();
	private final List<Object[]> rows = new ArrayList<>();

	public UnitTable(Grid2D<double[]> grid, LayerStack layers) {
		names.add("index");
		names.add("row");
		names.add("col");
		for (Layer l : layers) {
			if (l instanceof NumericLayer)
				names.addAll(l.getColumns());
			else
				names.add(l.getName());
		}

		int index = 0;
		for (GridPos p : grid.getPositions()) {
			double[] v = grid.getPrototypeAt(p);
			List<Object> row = new ArrayList<>();
			row.add(index++);
			row.add(p.getRow());
			row.add(p.getCol());
			for (int i = 0; i < layers.size(); i++) {
				Layer l = layers.getLayer(i);
				if (l instanceof NumericLayer)
					for (double d : ((NumericLayer) l).denormalize(v, layers.getOffset(i)))
						row.add(d);
				else
					row.add(((CategoricalLayer) l).decode(v, layers.getOffset(i)));
			}
			rows.add(row.toArray());
		}
	}

	public List<String> getNames() {
		return Collections.unmodifiableList(names);
	}

	public int size() {
		return rows.size();
	}

	public Object[] getRow(int i) {
		return rows.get(i).clone();
	}

	public void writeCSV(Writer w, char sep, String noData) throws IOException {
		w.write(String.join(String.valueOf(sep), names));
		w.write("\n");
		for (Object[] r : rows) {
			for (int i = 0; i < r.length; i++) {
				if (i > 0)
					w.write(sep);
				Object o = r[i];
				if (o == null || o instanceof Double && ((Double) o).isNaN())
					w.write(noData);
				else
					w.write(o.toString());
			}
			w.write("\n");
		}
		w.flush();
	}
}
