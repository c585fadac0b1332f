package supersom.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import supersom.ConfigException;
import supersom.layer.CategoricalLayer;
import supersom.layer.Layer;
import supersom.layer.Normalization;
import supersom.layer.NumericLayer;
import supersom.layer.SegmentMetric;

/**
 * Declaration of one layer. Every training run creates fresh, unfitted
 * {@link Layer} instances from it.
 */
public final class LayerConfig {

	private final String name;
	private final String[] columns;
	private final boolean categorical;
	private final double weight, scale;
	private final Normalization norm;
	private final SegmentMetric metric;

	public LayerConfig(String name, String[] columns, boolean categorical, double weight, Normalization norm, double scale, SegmentMetric metric) {
		if (name == null || name.trim().isEmpty())
			throw new ConfigException("layers", "Layer without name");
		String p = "layer." + name;
		if (columns == null || columns.length == 0)
			throw new ConfigException(p + ".columns", "No columns");
		if (categorical && columns.length != 1)
			throw new ConfigException(p + ".columns", "A categorical layer has exactly one column, got " + columns.length);
		if (categorical && norm != Normalization.none)
			throw new ConfigException(p + ".norm", "Categorical layers are not normalized");
		if (!(weight >= 0) || Double.isInfinite(weight))
			throw new ConfigException(p + ".weight", "Weight must be finite and >= 0, got " + weight);
		if (!(scale > 0) || Double.isInfinite(scale))
			throw new ConfigException(p + ".scale", "Scale must be finite and > 0, got " + scale);
		this.name = name;
		this.columns = columns.clone();
		this.categorical = categorical;
		this.weight = weight;
		this.norm = norm;
		this.scale = scale;
		this.metric = metric;
	}

	public static LayerConfig numeric(String name, double weight, Normalization norm, String... columns) {
		return new LayerConfig(name, columns, false, weight, norm, 1.0, SegmentMetric.squaredEuclidean);
	}

	public static LayerConfig categorical(String name, String column, double weight) {
		return new LayerConfig(name, new String[] { column }, true, weight, Normalization.none, 1.0, SegmentMetric.squaredEuclidean);
	}

	public Layer createLayer() {
		if (categorical)
			return new CategoricalLayer(name, columns[0], weight, metric);
		return new NumericLayer(name, columns, weight, norm, scale, metric);
	}

	public String getName() {
		return name;
	}

	public List<String> getColumns() {
		return Collections.unmodifiableList(Arrays.asList(columns));
	}

	public boolean isCategorical() {
		return categorical;
	}

	public double getWeight() {
		return weight;
	}

	public Normalization getNormalization() {
		return norm;
	}

	public double getScale() {
		return scale;
	}

	public SegmentMetric getMetric() {
		return metric;
	}
}
