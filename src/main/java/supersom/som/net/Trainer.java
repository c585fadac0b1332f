package supersom.som.net;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import supersom.DataException;
import supersom.config.Horizon;
import supersom.config.Initialization;
import supersom.config.SomConfig;
import supersom.data.DataTable;
import supersom.layer.LayerStack;
import supersom.som.bmu.BmuGetter;
import supersom.som.bmu.DefaultBmuGetter;
import supersom.som.decay.Schedule;
import supersom.som.grid.Grid2D;
import supersom.som.grid.Grid2DToroid;
import supersom.som.grid.GridPos;
import supersom.som.utils.SomUtils;

/**
 * Runs one Super-SOM training. The trainer fits fresh layers on the data,
 * encodes it, creates and initializes the grid, and then applies a fixed
 * number of steps. It exclusively owns grid, schedules and random generator
 * until {@link #finalizeModel()} hands the grid to a {@link SomModel}.
 * <p>
 * Not thread safe, except for {@link #cancel()}.
 */
public class Trainer implements AutoCloseable {

	private static Logger log = LogManager.getLogger(Trainer.class);

	public enum State {
		Initialized, Training, Finished
	}

	private final SomConfig config;
	private final LayerStack layers;
	private final List<double[]> samples;
	private final List<String> labels;
	private final Grid2D<double[]> grid;
	private final BmuGetter<double[]> bmuGetter;
	private final SOM som;
	private final Schedule decay;
	private final JDKRandomGenerator rnd;
	private final ExecutorService es;
	private final long totalSteps;
	private final List<Integer> order;
	private final List<TrainingListener> listeners = new CopyOnWriteArrayList<>();

	private State state = State.Initialized;
	private long step = 0;
	private volatile boolean cancelled = false;
	private boolean finalized = false;

	/**
	 * @throws supersom.ConfigException if the layers do not match the table's columns
	 * @throws DataException if the table is empty or holds invalid cells
	 */
	public Trainer(SomConfig config, DataTable data) {
		this.config = config;
		this.layers = config.createLayers();
		layers.fit(data);
		this.samples = Collections.unmodifiableList(layers.encode(data));
		this.labels = data.hasLabels() ? data.getLabels() : null;
		if (layers.getWidth() == 0)
			throw new DataException("Samples have no dimensions");

		this.totalSteps = config.getHorizon().getTotalSteps(samples.size());
		this.rnd = new JDKRandomGenerator();
		rnd.setSeed(config.getSeed());

		if (config.isToroidal())
			grid = new Grid2DToroid<>(config.getRows(), config.getCols());
		else
			grid = new Grid2D<>(config.getRows(), config.getCols());
		if (config.getInitialization() == Initialization.random)
			SomUtils.initRandom(grid, samples, rnd);
		else
			SomUtils.initSamples(grid, samples, rnd);

		order = new ArrayList<>();
		for (int i = 0; i < samples.size(); i++)
			order.add(i);

		bmuGetter = new DefaultBmuGetter<>(layers.getDist());
		decay = config.getDecay();
		if (config.getThreads() > 1) {
			es = Executors.newFixedThreadPool(config.getThreads());
			som = new SOM(config.getKernel().create(), config.getAlpha(), config.getRadius(), grid, bmuGetter, es, config.getThreads());
		} else {
			es = null;
			som = new SOM(config.getKernel().create(), config.getAlpha(), config.getRadius(), grid, bmuGetter);
		}
		log.debug("Initialized " + config + ": " + samples.size() + " samples of width " + layers.getWidth() + ", " + totalSteps + " steps");
	}

	/**
	 * Applies the next step.
	 *
	 * @return the bmu of the step's sample
	 * @throws IllegalStateException if the horizon is exhausted or the trainer is finished
	 */
	public GridPos step() {
		if (finalized || state == State.Finished)
			throw new IllegalStateException("Trainer is finished");
		if (step >= totalSteps)
			throw new IllegalStateException("All " + totalSteps + " steps applied");
		state = State.Training;

		double t = (double) step / totalSteps;
		double[] x = nextSample();
		GridPos bmu = som.train(t, x);

		if (decay != null && (step + 1) % samples.size() == 0)
			decayPrototypes(decay.interpolate(t));

		step++;
		if (step == totalSteps)
			state = State.Finished;
		if (config.getSnapshotInterval() > 0 && step % config.getSnapshotInterval() == 0 && !listeners.isEmpty())
			fireSnapshot();
		return bmu;
	}

	/**
	 * Applies all remaining steps, unless cancelled, interrupted or timed out
	 * in between. The trainer is finished afterwards either way, the interrupt
	 * flag of the calling thread is left as it is.
	 */
	public void train() {
		if (finalized || state == State.Finished)
			throw new IllegalStateException("Trainer is finished");
		log.info("Training " + grid.getRows() + "x" + grid.getCols() + " grid, " + (totalSteps - step) + " steps");
		long time = System.currentTimeMillis();
		boolean timed = config.getTimeout() != null;
		long deadline = timed ? System.nanoTime() + config.getTimeout().toNanos() : 0;

		while (step < totalSteps) {
			if (cancelled || Thread.currentThread().isInterrupted()) {
				log.warn("Training cancelled after " + step + " of " + totalSteps + " steps");
				cancelled = true;
				break;
			}
			if (timed && System.nanoTime() - deadline > 0) {
				log.warn("Training timed out after " + step + " of " + totalSteps + " steps");
				cancelled = true;
				break;
			}
			step();
			if (log.isDebugEnabled() && totalSteps >= 10 && step % (totalSteps / 10) == 0)
				log.debug("step " + step + "/" + totalSteps);
		}
		state = State.Finished;
		log.info("Training finished, took " + (System.currentTimeMillis() - time) + "ms");
	}

	/** Stops {@link #train()} before its next step. May be called from any thread. */
	public void cancel() {
		cancelled = true;
	}

	private double[] nextSample() {
		int n = samples.size();
		if (config.getHorizon().getUnit() == Horizon.Unit.episodes)
			return samples.get(rnd.nextInt(n));

		int pos = (int) (step % n);
		if (pos == 0 && config.isShuffle())
			Collections.shuffle(order, rnd);
		return samples.get(order.get(pos));
	}

	// pulls all prototypes towards their mean
	private void decayPrototypes(double d) {
		if (d == 0)
			return;
		double[] means = SomUtils.getPrototypeMeans(grid);
		for (GridPos p : grid.getPositions()) {
			double[] v = grid.getPrototypeAt(p);
			for (int i = 0; i < v.length; i++)
				v[i] = v[i] - d * (v[i] - means[i]);
			grid.setPrototypeAt(p, v);
		}
	}

	private void fireSnapshot() {
		GridSnapshot s = getSnapshot();
		for (TrainingListener l : listeners)
			l.snapshotTaken(s);
	}

	/** Copy of the current grid state. */
	public GridSnapshot getSnapshot() {
		String[] majority = null;
		if (labels != null) {
			Map<GridPos, String> m = SomUtils.getMajorityLabels(SomUtils.getLabelDist(samples, labels, grid, bmuGetter));
			majority = new String[grid.size()];
			int i = 0;
			for (GridPos p : grid.getPositions())
				majority[i++] = m.get(p);
		}
		return new GridSnapshot(step, totalSteps, grid.getRows(), grid.getCols(), SomUtils.copyPrototypes(grid), majority);
	}

	/**
	 * Freezes the grid and hands it to a new model. Works in any state, a
	 * cancelled or partially trained grid gives a partially trained model. The
	 * trainer cannot be used afterwards.
	 */
	public SomModel finalizeModel() {
		if (finalized)
			throw new IllegalStateException("Trainer is already finalized");
		finalized = true;
		state = State.Finished;
		close();
		grid.freeze();
		log.debug("Finalized after " + step + " of " + totalSteps + " steps");
		return new SomModel(grid, layers, config, step);
	}

	@Override
	public void close() {
		if (es != null)
			es.shutdown();
	}

	public void addTrainingListener(TrainingListener l) {
		listeners.add(l);
	}

	public void removeTrainingListener(TrainingListener l) {
		listeners.remove(l);
	}

	public State getState() {
		return state;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public long getStep() {
		return step;
	}

	public long getTotalSteps() {
		return totalSteps;
	}

	public LayerStack getLayers() {
		return layers;
	}

	/** Encoded training samples, in table order. */
	public List<double[]> getSamples() {
		return samples;
	}

	/** Copy of the prototype at the given position. */
	public double[] getPrototype(GridPos p) {
		double[] v = grid.getPrototypeAt(p);
		return Arrays.copyOf(v, v.length);
	}

	public SomConfig getConfig() {
		return config;
	}
}
