package supersom.layer;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import supersom.ConfigException;
import supersom.DataException;
import supersom.data.DataTable;

/**
 * One or more numeric columns. Every column is encoded as
 * <code>(x - offset) * factor</code>, where offset and factor come from the
 * normalization fitted on the data and factor includes the layer's scale.
 */
public class NumericLayer extends Layer {

	private static Logger log = LogManager.getLogger(NumericLayer.class);

	private final Normalization norm;
	private final double scale;
	private double[] offset, factor;

	public NumericLayer(String name, String[] columns, double weight, Normalization norm) {
		this(name, columns, weight, norm, 1.0, SegmentMetric.squaredEuclidean);
	}

	public NumericLayer(String name, String[] columns, double weight, Normalization norm, double scale, SegmentMetric metric) {
		super(name, columns, weight, metric);
		if (!(scale > 0) || Double.isInfinite(scale))
			throw new ConfigException("layer." + name + ".scale", "Scale must be finite and > 0, got " + scale);
		this.norm = norm;
		this.scale = scale;
	}

	/** Creates an already fitted layer from stored parameters. */
	public static NumericLayer restore(String name, String[] columns, double weight, Normalization norm, double scale, SegmentMetric metric, double[] offset, double[] factor) {
		if (offset.length != columns.length || factor.length != columns.length)
			throw new IllegalArgumentException("Need one offset and factor per column");
		NumericLayer l = new NumericLayer(name, columns, weight, norm, scale, metric);
		l.offset = offset.clone();
		l.factor = factor.clone();
		l.setFitted();
		return l;
	}

	@Override
	protected void fit(DataTable t, int[] idx) {
		SummaryStatistics[] ds = new SummaryStatistics[idx.length];
		for (int i = 0; i < idx.length; i++)
			ds[i] = new SummaryStatistics();
		for (int r = 0; r < t.size(); r++)
			for (int i = 0; i < idx.length; i++) {
				double v = t.getNumeric(r, idx[i]);
				if (!Double.isNaN(v))
					ds[i].addValue(v);
			}

		offset = new double[idx.length];
		factor = new double[idx.length];
		for (int i = 0; i < idx.length; i++) {
			offset[i] = 0;
			factor[i] = 1;
			if (norm == Normalization.zScore) {
				double sd = ds[i].getStandardDeviation();
				if (ds[i].getN() < 2 || !(sd > 0))
					log.warn("Layer " + name + ", column " + columns[i] + ": zero variance, not normalized");
				else {
					offset[i] = ds[i].getMean();
					factor[i] = 1.0 / sd;
				}
			} else if (norm == Normalization.unit) {
				double range = ds[i].getMax() - ds[i].getMin();
				if (ds[i].getN() == 0 || !(range > 0))
					log.warn("Layer " + name + ", column " + columns[i] + ": zero range, not normalized");
				else {
					offset[i] = ds[i].getMin();
					factor[i] = 1.0 / range;
				}
			}
			factor[i] *= scale;
		}
		log.debug("Fitted " + this + ": offset=" + Arrays.toString(offset) + ", factor=" + Arrays.toString(factor));
	}

	@Override
	public Kind getKind() {
		return Kind.Numeric;
	}

	@Override
	public int getWidth() {
		return columns.length;
	}

	@Override
	public void encode(Object[] values, int row, double[] dst, int off) {
		checkFitted();
		for (int i = 0; i < columns.length; i++) {
			Object v = values[i];
			if (v == null) {
				dst[off + i] = Double.NaN;
				continue;
			}
			if (!(v instanceof Number))
				throw new DataException("numeric value expected, got '" + v + "'", row, columns[i]);
			dst[off + i] = (((Number) v).doubleValue() - offset[i]) * factor[i];
		}
	}

	/** Maps an encoded segment back to the original units of the columns. */
	public double[] denormalize(double[] v, int off) {
		checkFitted();
		double[] d = new double[columns.length];
		for (int i = 0; i < d.length; i++)
			d[i] = v[off + i] / factor[i] + offset[i];
		return d;
	}

	public Normalization getNormalization() {
		return norm;
	}

	public double getScale() {
		return scale;
	}

	public double[] getOffsets() {
		checkFitted();
		return offset.clone();
	}

	public double[] getFactors() {
		checkFitted();
		return factor.clone();
	}
}
