package supersom.som.net;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import supersom.DataException;
import supersom.data.DataTable;
import supersom.layer.UnknownCategoryException;
import supersom.som.grid.Grid2D;
import supersom.som.grid.GridPos;
import supersom.som.utils.UnitTable;

public class SomModelTest {

	private static SomModel model;

	@BeforeAll
	public static void train() {
		try (Trainer t = new Trainer(TrainerTest.config().build(), TrainerTest.data())) {
			t.train();
			model = t.finalizeModel();
		}
	}

	@Test
	public void testClustersSeparate() {
		GridPos a0 = model.query(0.0, "a"), a1 = model.query(1.0, "a");
		GridPos b0 = model.query(10.0, "b"), b1 = model.query(11.0, "b");
		assertEquals(a0, a1);
		assertEquals(b0, b1);
		assertNotEquals(a0, b0);
		assertEquals(Arrays.asList(a0, a1, b0, b1), model.queryAll(TrainerTest.data()));
	}

	@Test
	public void testUnitTable() {
		UnitTable ut = model.getUnitTable();
		assertEquals(Arrays.asList("index", "row", "col", "x", "cat"), ut.getNames());
		assertEquals(4, ut.size());

		GridPos a = model.query(0.0, "a"), b = model.query(11.0, "b");
		Object[] ra = ut.getRow(a.getRow() * 2 + a.getCol());
		Object[] rb = ut.getRow(b.getRow() * 2 + b.getCol());
		assertEquals(a.getRow(), ra[1]);
		assertEquals(a.getCol(), ra[2]);
		assertTrue((Double) ra[3] >= 0 && (Double) ra[3] <= 1);
		assertEquals("a", ra[4]);
		assertTrue((Double) rb[3] >= 10 && (Double) rb[3] <= 11);
		assertEquals("b", rb[4]);
	}

	@Test
	public void testQualityMeasures() {
		assertTrue(model.getQuantizationError(TrainerTest.data()) < 0.05);
		assertEquals(0, model.getTopographicError(TrainerTest.data()), 0);

		Map<GridPos, Map<String, Integer>> ld = model.getLabelDistribution(TrainerTest.data());
		assertEquals(Integer.valueOf(2), ld.get(model.query(0.0, "a")).get("low"));
		assertEquals(Integer.valueOf(2), ld.get(model.query(10.0, "b")).get("high"));
	}

	@Test
	public void testUnknownCategoryLeavesModelUnchanged() {
		double[][] before = prototypes();
		for (int i = 0; i < 2; i++) {
			UnknownCategoryException e = assertThrows(UnknownCategoryException.class, () -> model.query(0.0, "z"));
			assertEquals("cat", e.getLayer());
			assertEquals("z", e.getValue());
		}
		assertArrayEquals(before, prototypes());
		assertEquals(model.query(0.0, "a"), model.query(1.0, "a"));
	}

	private static double[][] prototypes() {
		List<GridPos> l = model.getPositions();
		double[][] d = new double[l.size()][];
		for (int i = 0; i < d.length; i++)
			d[i] = model.getPrototype(l.get(i));
		return d;
	}

	@Test
	public void testMissingValuesInQuery() {
		assertEquals(model.query(0.0, "a"), model.query(null, "a"));
		assertEquals(model.query(11.0, "b"), model.query(11.0, null));
	}

	@Test
	public void testPrototypesAreCopies() {
		double[] p = model.getPrototype(0, 0);
		p[0] = 1000;
		assertNotEquals(1000, model.getPrototype(0, 0)[0]);
	}

	@Test
	public void testWrongInput() {
		assertThrows(DataException.class, () -> model.query(new double[] { 1, 2 }));
		assertThrows(DataException.class, () -> model.query(1.0));
		assertThrows(IllegalArgumentException.class, () -> model.getPrototype(2, 0));
		DataTable t = new DataTable(new String[] { "x" }, new DataTable.Binding[] { DataTable.Binding.Numeric });
		t.addRow(1.0);
		assertThrows(DataException.class, () -> model.queryAll(t));
	}

	@Test
	public void testGridIsFrozen() {
		Grid2D<double[]> g = new Grid2D<>(1, 1);
		g.setPrototypeAt(new GridPos(0, 0), new double[3]);
		new SomModel(g, model.getLayers(), model.getConfig(), 0);
		assertTrue(g.isFrozen());
		assertThrows(IllegalStateException.class, () -> g.setPrototypeAt(new GridPos(0, 0), new double[3]));
	}

	@Test
	public void testPrototypeWidthMustMatch() {
		Grid2D<double[]> g = new Grid2D<>(1, 1);
		g.setPrototypeAt(new GridPos(0, 0), new double[2]);
		assertThrows(IllegalArgumentException.class, () -> new SomModel(g, model.getLayers(), model.getConfig(), 0));
	}
}
