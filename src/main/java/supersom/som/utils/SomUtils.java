package supersom.som.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import supersom.dist.Dist;
import supersom.som.bmu.BmuGetter;
import supersom.som.grid.Grid;
import supersom.som.grid.GridPos;

public class SomUtils {

	/**
	 * Sets every prototype to a random vector, each dimension uniform within
	 * the range of that dimension in the samples.
	 */
	public static void initRandom(Grid<double[]> grid, List<double[]> samples, Random r) {
		SummaryStatistics[] ds = getColumnStatistics(samples);
		for (GridPos p : grid.getPositions()) {
			double[] d = new double[ds.length];
			for (int i = 0; i < d.length; i++) {
				double min = 0, max = 1;
				if (ds[i].getN() > 0) {
					min = ds[i].getMin();
					max = ds[i].getMax();
				}
				d[i] = min + r.nextDouble() * (max - min);
			}
			grid.setPrototypeAt(p, d);
		}
	}

	/**
	 * Sets every prototype to a copy of a randomly chosen sample. Samples are
	 * drawn without replacement as long as there are enough of them. Missing
	 * values are replaced by the mean of their dimension.
	 */
	public static void initSamples(Grid<double[]> grid, List<double[]> samples, Random r) {
		double[] means = getColumnMeans(samples);
		List<Integer> idx = new ArrayList<>();
		for (int i = 0; i < samples.size(); i++)
			idx.add(i);
		Collections.shuffle(idx, r);

		int k = 0;
		for (GridPos p : grid.getPositions()) {
			double[] s = samples.get(idx.get(k++ % idx.size()));
			double[] d = Arrays.copyOf(s, s.length);
			for (int i = 0; i < d.length; i++)
				if (Double.isNaN(d[i]))
					d[i] = means[i];
			grid.setPrototypeAt(p, d);
		}
	}

	private static SummaryStatistics[] getColumnStatistics(List<double[]> samples) {
		SummaryStatistics[] ds = new SummaryStatistics[samples.get(0).length];
		for (int i = 0; i < ds.length; i++)
			ds[i] = new SummaryStatistics();
		for (double[] d : samples)
			for (int i = 0; i < ds.length; i++)
				if (!Double.isNaN(d[i]))
					ds[i].addValue(d[i]);
		return ds;
	}

	/** Per dimension mean, ignoring missing values. 0 for dimensions without values. */
	public static double[] getColumnMeans(List<double[]> samples) {
		SummaryStatistics[] ds = getColumnStatistics(samples);
		double[] m = new double[ds.length];
		for (int i = 0; i < m.length; i++)
			m[i] = ds[i].getN() > 0 ? ds[i].getMean() : 0;
		return m;
	}

	public static double[] getPrototypeMeans(Grid<double[]> grid) {
		return getColumnMeans(grid.getPrototypes());
	}

	/** Prototype copies in position order. */
	public static double[][] copyPrototypes(Grid<double[]> grid) {
		double[][] d = new double[grid.size()][];
		int i = 0;
		for (GridPos p : grid.getPositions()) {
			double[] v = grid.getPrototypeAt(p);
			d[i++] = Arrays.copyOf(v, v.length);
		}
		return d;
	}

	/** Indices of the samples mapped to each position. */
	public static Map<GridPos, List<Integer>> getBmuMapping(List<double[]> samples, Grid<double[]> grid, BmuGetter<double[]> b, boolean includeEmpty) {
		Map<GridPos, List<Integer>> r = new TreeMap<>();
		if (includeEmpty)
			for (GridPos p : grid.getPositions())
				r.put(p, new ArrayList<Integer>());
		for (int i = 0; i < samples.size(); i++) {
			GridPos bmu = b.getBmuPos(samples.get(i), grid);
			if (!r.containsKey(bmu))
				r.put(bmu, new ArrayList<Integer>());
			r.get(bmu).add(i);
		}
		return r;
	}

	// mean distance of samples to their bmu prototype
	public static double getMeanQuantError(Grid<double[]> grid, BmuGetter<double[]> bmuGetter, Dist<double[]> d, List<double[]> samples) {
		if (samples.isEmpty())
			return 0;
		double sum = 0;
		for (double[] x : samples)
			sum += d.dist(grid.getPrototypeAt(bmuGetter.getBmuPos(x, grid)), x);
		return sum / samples.size();
	}

	// how often are first and second nearest units in input space not neighbours in output space
	public static double getTopoError(Grid<double[]> grid, BmuGetter<double[]> bmuGetter, List<double[]> samples) {
		if (grid.size() <= 2 || samples.isEmpty())
			return 0;

		int nAdj = 0;
		for (double[] x : samples) {
			GridPos firstPos = bmuGetter.getBmuPos(x, grid);
			Set<GridPos> ign = new HashSet<GridPos>();
			ign.add(firstPos);
			GridPos secondPos = bmuGetter.getBmuPos(x, grid, ign);

			if (grid.dist(firstPos, secondPos) > 1)
				nAdj++;
		}
		return (double) nAdj / samples.size();
	}

	/** Label frequencies per position. Samples without label are not counted. */
	public static Map<GridPos, Map<String, Integer>> getLabelDist(List<double[]> samples, List<String> labels, Grid<double[]> grid, BmuGetter<double[]> bmuGetter) {
		Map<GridPos, Map<String, Integer>> r = new TreeMap<>();
		for (GridPos p : grid.getPositions())
			r.put(p, new TreeMap<String, Integer>());
		for (int i = 0; i < samples.size(); i++) {
			String l = labels.get(i);
			if (l == null)
				continue;
			Map<String, Integer> m = r.get(bmuGetter.getBmuPos(samples.get(i), grid));
			m.put(l, m.getOrDefault(l, 0) + 1);
		}
		return r;
	}

	/** Most frequent label per position, <code>null</code> for positions without labels. Ties go to the smaller label. */
	public static Map<GridPos, String> getMajorityLabels(Map<GridPos, Map<String, Integer>> labelDist) {
		Map<GridPos, String> r = new TreeMap<>();
		for (Entry<GridPos, Map<String, Integer>> e : labelDist.entrySet()) {
			String best = null;
			int max = 0;
			for (Entry<String, Integer> f : e.getValue().entrySet())
				if (f.getValue() > max) {
					max = f.getValue();
					best = f.getKey();
				}
			r.put(e.getKey(), best);
		}
		return r;
	}
}
