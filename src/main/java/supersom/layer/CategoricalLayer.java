package supersom.layer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import supersom.DataException;
import supersom.data.DataTable;

/**
 * A single categorical column, one-hot encoded over the categories seen when
 * fitting, in lexicographic order. A missing value encodes as a segment of
 * <code>NaN</code>.
 */
public class CategoricalLayer extends Layer {

	private static Logger log = LogManager.getLogger(CategoricalLayer.class);

	private List<String> categories;
	private Map<String, Integer> codes;

	public CategoricalLayer(String name, String column, double weight) {
		this(name, column, weight, SegmentMetric.squaredEuclidean);
	}

	public CategoricalLayer(String name, String column, double weight, SegmentMetric metric) {
		super(name, new String[] { column }, weight, metric);
	}

	/** Creates an already fitted layer from stored categories. */
	public static CategoricalLayer restore(String name, String column, double weight, SegmentMetric metric, List<String> categories) {
		CategoricalLayer l = new CategoricalLayer(name, column, weight, metric);
		l.setCategories(categories);
		l.setFitted();
		return l;
	}

	@Override
	protected void fit(DataTable t, int[] idx) {
		TreeSet<String> levels = new TreeSet<>();
		for (int r = 0; r < t.size(); r++) {
			String v = t.getCategorical(r, idx[0]);
			if (v != null)
				levels.add(v);
		}
		if (levels.isEmpty())
			log.warn("Layer " + name + ": no categories, segment is empty");
		setCategories(new ArrayList<>(levels));
		log.debug("Fitted " + this + ": " + categories);
	}

	private void setCategories(List<String> l) {
		categories = Collections.unmodifiableList(new ArrayList<>(l));
		codes = new HashMap<>();
		for (int i = 0; i < categories.size(); i++)
			codes.put(categories.get(i), i);
	}

	@Override
	public Kind getKind() {
		return Kind.Categorical;
	}

	@Override
	public int getWidth() {
		checkFitted();
		return categories.size();
	}

	@Override
	public void encode(Object[] values, int row, double[] dst, int off) {
		checkFitted();
		Object v = values[0];
		int w = categories.size();
		if (v == null) {
			for (int i = 0; i < w; i++)
				dst[off + i] = Double.NaN;
			return;
		}
		if (!(v instanceof String))
			throw new DataException("categorical value expected, got '" + v + "'", row, columns[0]);
		Integer code = codes.get(v);
		if (code == null)
			throw new UnknownCategoryException(name, (String) v, row, columns[0]);
		for (int i = 0; i < w; i++)
			dst[off + i] = 0;
		dst[off + code] = 1;
	}

	/**
	 * The category with the largest value in the segment, <code>null</code> if
	 * the segment is empty or all <code>NaN</code>. Ties go to the first
	 * category.
	 */
	public String decode(double[] v, int off) {
		checkFitted();
		int best = -1;
		for (int i = 0; i < categories.size(); i++) {
			if (Double.isNaN(v[off + i]))
				continue;
			if (best < 0 || v[off + i] > v[off + best])
				best = i;
		}
		return best < 0 ? null : categories.get(best);
	}

	public List<String> getCategories() {
		checkFitted();
		return categories;
	}
}
