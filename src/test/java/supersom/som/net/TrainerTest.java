package supersom.som.net;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import supersom.ConfigException;
import supersom.DataException;
import supersom.config.Horizon;
import supersom.config.Initialization;
import supersom.config.LayerConfig;
import supersom.config.SomConfig;
import supersom.data.DataTable;
import supersom.data.DataTable.Binding;
import supersom.layer.Normalization;
import supersom.som.decay.Schedule;
import supersom.som.grid.GridPos;

public class TrainerTest {

	static DataTable data() {
		DataTable t = new DataTable(new String[] { "x", "c" }, new Binding[] { Binding.Numeric, Binding.Categorical });
		t.addLabeledRow("low", 0, "a");
		t.addLabeledRow("low", 1, "a");
		t.addLabeledRow("high", 10, "b");
		t.addLabeledRow("high", 11, "b");
		return t;
	}

	static SomConfig.Builder config() {
		return SomConfig.builder().grid(2, 2) //
				.layer(LayerConfig.numeric("num", 1, Normalization.zScore, "x")) //
				.layer(LayerConfig.categorical("cat", "c", 1)) //
				.alpha(Schedule.lin(0.5, 0.01)) //
				.radius(Schedule.lin(1, 0.1)) //
				.horizon(Horizon.epochs(20)) //
				.seed(7);
	}

	private static void assertSamePrototypes(Trainer a, Trainer b) {
		for (int r = 0; r < 2; r++)
			for (int c = 0; c < 2; c++)
				assertArrayEquals(a.getPrototype(new GridPos(r, c)), b.getPrototype(new GridPos(r, c)), 0);
	}

	@Test
	public void testSameSeedSameResult() {
		try (Trainer a = new Trainer(config().build(), data()); Trainer b = new Trainer(config().build(), data())) {
			a.train();
			b.train();
			assertSamePrototypes(a, b);
		}
	}

	@Test
	public void testThreadsDoNotChangeResult() {
		try (Trainer a = new Trainer(config().build(), data()); Trainer b = new Trainer(config().threads(3).build(), data())) {
			a.train();
			b.train();
			assertSamePrototypes(a, b);
		}
	}

	@Test
	public void testRandomInitWithinDataRange() {
		try (Trainer t = new Trainer(config().initialization(Initialization.random).build(), data())) {
			for (int r = 0; r < 2; r++)
				for (int c = 0; c < 2; c++)
					for (double d : t.getPrototype(new GridPos(r, c)))
						assertTrue(d >= -1 && d <= 1);
		}
	}

	@Test
	public void testSampleInitUsesDistinctRows() {
		try (Trainer t = new Trainer(config().build(), data())) {
			List<double[]> protos = new ArrayList<>();
			for (int r = 0; r < 2; r++)
				for (int c = 0; c < 2; c++)
					protos.add(t.getPrototype(new GridPos(r, c)));
			for (double[] s : t.getSamples()) {
				int n = 0;
				for (double[] p : protos)
					if (Arrays.equals(p, s))
						n++;
				assertEquals(1, n);
			}
		}
	}

	@Test
	public void testStates() {
		try (Trainer t = new Trainer(config().horizon(Horizon.epochs(2)).build(), data())) {
			assertEquals(Trainer.State.Initialized, t.getState());
			assertEquals(8, t.getTotalSteps());
			t.step();
			assertEquals(Trainer.State.Training, t.getState());
			assertEquals(1, t.getStep());
			for (int i = 1; i < 8; i++)
				t.step();
			assertEquals(Trainer.State.Finished, t.getState());
			assertThrows(IllegalStateException.class, () -> t.step());
			assertThrows(IllegalStateException.class, () -> t.train());
		}
	}

	@Test
	public void testEpisodes() {
		try (Trainer t = new Trainer(config().horizon(Horizon.episodes(5)).build(), data())) {
			assertEquals(5, t.getTotalSteps());
			t.train();
			assertEquals(5, t.getStep());
		}
	}

	@Test
	public void testSnapshots() {
		final List<GridSnapshot> l = new ArrayList<>();
		try (Trainer t = new Trainer(config().horizon(Horizon.epochs(2)).snapshotInterval(2).build(), data())) {
			t.addTrainingListener(new TrainingListener() {
				@Override
				public void snapshotTaken(GridSnapshot s) {
					l.add(s);
				}
			});
			t.train();
		}
		assertEquals(4, l.size());
		for (int i = 0; i < l.size(); i++) {
			GridSnapshot s = l.get(i);
			assertEquals(2 * (i + 1), s.getStep());
			assertEquals(8, s.getTotalSteps());
			assertEquals(3, s.getPrototype(1, 1).length);
			assertTrue(s.hasLabels());
		}
	}

	@Test
	public void testCancelFromListener() {
		final Trainer t = new Trainer(config().snapshotInterval(3).build(), data());
		t.addTrainingListener(new TrainingListener() {
			@Override
			public void snapshotTaken(GridSnapshot s) {
				t.cancel();
			}
		});
		t.train();
		assertTrue(t.isCancelled());
		assertEquals(3, t.getStep());
		assertEquals(Trainer.State.Finished, t.getState());

		SomModel m = t.finalizeModel();
		assertEquals(3, m.getTrainedSteps());
	}

	@Test
	public void testTimeout() {
		try (Trainer t = new Trainer(config().horizon(Horizon.episodes(1000000000L)).timeout(Duration.ofMillis(20)).build(), data())) {
			t.train();
			assertTrue(t.isCancelled());
			assertTrue(t.getStep() < t.getTotalSteps());
		}
	}

	@Test
	public void testTrainWithoutTimeoutRunsAllSteps() {
		try (Trainer t = new Trainer(config().build(), data())) {
			t.train();
			assertFalse(t.isCancelled());
			assertEquals(t.getTotalSteps(), t.getStep());
		}
	}

	@Test
	public void testInterruptedStepIsComplete() {
		try (Trainer a = new Trainer(config().threads(3).build(), data()); Trainer b = new Trainer(config().build(), data())) {
			try {
				Thread.currentThread().interrupt();
				a.step();
				assertTrue(Thread.interrupted());
			} finally {
				Thread.interrupted();
			}
			assertEquals(1, a.getStep());
			b.step();
			assertSamePrototypes(a, b);

			a.train();
			b.train();
			assertEquals(b.getStep(), a.getStep());
			assertSamePrototypes(a, b);
		}
	}

	@Test
	public void testInterruptStopsTraining() {
		try (Trainer t = new Trainer(config().build(), data())) {
			try {
				Thread.currentThread().interrupt();
				t.train();
				assertTrue(Thread.currentThread().isInterrupted());
			} finally {
				Thread.interrupted();
			}
			assertTrue(t.isCancelled());
			assertEquals(0, t.getStep());
			assertEquals(Trainer.State.Finished, t.getState());
		}
	}

	@Test
	public void testSingleEpochSeparatesGroups() {
		for (long seed = 0; seed < 12; seed++) {
			Trainer t = new Trainer(config().horizon(Horizon.epochs(1)).seed(seed).build(), data());
			t.train();
			assertEquals(4, t.getStep());
			List<GridPos> bmus = t.finalizeModel().queryAll(data());
			Set<GridPos> low = new HashSet<>(bmus.subList(0, 2));
			Set<GridPos> high = new HashSet<>(bmus.subList(2, 4));
			low.retainAll(high);
			assertTrue(low.isEmpty(), "seed " + seed + ": " + bmus);
		}
	}

	@Test
	public void testSnapshotRejectsPositionOutsideGrid() {
		try (Trainer t = new Trainer(config().build(), data())) {
			GridSnapshot s = t.getSnapshot();
			assertNotNull(s.getPrototype(1, 1));
			assertThrows(IllegalArgumentException.class, () -> s.getPrototype(0, 2));
			assertThrows(IllegalArgumentException.class, () -> s.getPrototype(-1, 0));
			assertThrows(IllegalArgumentException.class, () -> s.getLabel(2, 0));
		}
	}

	@Test
	public void testFinalizeOnce() {
		Trainer t = new Trainer(config().build(), data());
		t.train();
		t.finalizeModel();
		assertThrows(IllegalStateException.class, () -> t.finalizeModel());
		assertThrows(IllegalStateException.class, () -> t.step());
	}

	@Test
	public void testDecayPullsTowardsMean() {
		try (Trainer t = new Trainer(config().decay(Schedule.lin(1, 1)).build(), data())) {
			t.train();
			double[] first = t.getPrototype(new GridPos(0, 0));
			for (int r = 0; r < 2; r++)
				for (int c = 0; c < 2; c++)
					assertArrayEquals(first, t.getPrototype(new GridPos(r, c)), 1e-12);
		}
	}

	@Test
	public void testMissingValues() {
		DataTable d = data();
		d.addRow(null, "b");
		d.addRow(5, null);
		try (Trainer t = new Trainer(config().build(), d)) {
			t.train();
			for (int r = 0; r < 2; r++)
				for (int c = 0; c < 2; c++)
					for (double v : t.getPrototype(new GridPos(r, c)))
						assertFalse(Double.isNaN(v));
		}
	}

	@Test
	public void testMissingColumn() {
		SomConfig c = config().layer(LayerConfig.numeric("other", 1, Normalization.none, "y")).build();
		ConfigException e = assertThrows(ConfigException.class, () -> new Trainer(c, data()));
		assertEquals("layer.other.columns", e.getParameter());
	}

	@Test
	public void testEmptyTable() {
		DataTable d = new DataTable(new String[] { "x", "c" }, new Binding[] { Binding.Numeric, Binding.Categorical });
		assertThrows(DataException.class, () -> new Trainer(config().build(), d));
	}
}
