package supersom.layer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import supersom.ConfigException;
import supersom.DataException;
import supersom.data.DataTable;
import supersom.data.DataTable.Binding;

public class LayerStackTest {

	private static final double EPS = 1e-12;

	private static DataTable data() {
		DataTable t = new DataTable(new String[] { "c", "x", "y" }, new Binding[] { Binding.Categorical, Binding.Numeric, Binding.Numeric });
		t.addRow("a", 1.0, 2.0);
		t.addRow("b", 3.0, 4.0);
		t.addRow("c", 5.0, 6.0);
		return t;
	}

	private static LayerStack stack() {
		return new LayerStack(Arrays.<Layer> asList(new NumericLayer("num", new String[] { "x", "y" }, 1, Normalization.none), new CategoricalLayer("cat", "c", 2)));
	}

	@Test
	public void testOffsetsFollowLayerOrder() {
		LayerStack ls = stack();
		ls.fit(data());
		assertEquals(5, ls.getWidth());
		assertEquals(0, ls.getOffset(0));
		assertEquals(2, ls.getOffset(1));
		assertEquals(1, ls.indexOf("cat"));
		assertEquals(-1, ls.indexOf("none"));
	}

	@Test
	public void testEncode() {
		LayerStack ls = stack();
		ls.fit(data());
		List<double[]> l = ls.encode(data());
		assertEquals(3, l.size());
		assertArrayEquals(new double[] { 3, 4, 0, 1, 0 }, l.get(1), EPS);
		assertArrayEquals(new double[] { 5, 6, 0, 0, 1 }, ls.encode(new Object[] { "c", 5.0, 6.0 }, 0), EPS);
	}

	@Test
	public void testWeightedDistance() {
		LayerStack ls = stack();
		ls.fit(data());
		List<double[]> l = ls.encode(data());
		// num: (1-3)^2 + (2-4)^2 = 8, cat: 2 differing one-hot entries, weight 2
		assertEquals(8 + 2 * 2, ls.getDist().dist(l.get(0), l.get(1)), EPS);
	}

	@Test
	public void testRejectsDuplicateNames() {
		assertThrows(ConfigException.class, () -> new LayerStack(Arrays.<Layer> asList(new CategoricalLayer("a", "c", 1), new CategoricalLayer("a", "c", 1))));
	}

	@Test
	public void testEmptyTable() {
		DataTable t = new DataTable(new String[] { "c", "x", "y" }, new Binding[] { Binding.Categorical, Binding.Numeric, Binding.Numeric });
		assertThrows(DataException.class, () -> stack().fit(t));
	}

	@Test
	public void testNotFitted() {
		assertThrows(IllegalStateException.class, () -> stack().getWidth());
	}

	@Test
	public void testUnknownCategoryInRow() {
		LayerStack ls = stack();
		ls.fit(data());
		assertThrows(UnknownCategoryException.class, () -> ls.encode(new Object[] { "d", 1.0, 1.0 }, 7));
	}
}
