package supersom.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import supersom.ConfigException;
import supersom.layer.Layer;
import supersom.layer.LayerStack;
import supersom.som.decay.Schedule;
import supersom.som.kernel.Kernel;

/**
 * Immutable, validated configuration of a Super-SOM training run. Use
 * {@link #builder()} or {@link SomConfigParser}.
 */
public final class SomConfig {

	private final int rows, cols;
	private final boolean toroidal;
	private final List<LayerConfig> layers;
	private final Schedule alpha, radius, decay;
	private final Kernel kernel;
	private final Horizon horizon;
	private final boolean shuffle;
	private final Initialization init;
	private final long seed;
	private final int threads;
	private final long snapshotInterval;
	private final Duration timeout;

	private SomConfig(Builder b) {
		this.rows = b.rows;
		this.cols = b.cols;
		this.toroidal = b.toroidal;
		this.layers = Collections.unmodifiableList(new ArrayList<>(b.layers));
		this.alpha = b.alpha;
		this.radius = b.radius;
		this.decay = b.decay;
		this.kernel = b.kernel;
		this.horizon = b.horizon;
		this.shuffle = b.shuffle;
		this.init = b.init;
		this.seed = b.seed;
		this.threads = b.threads;
		this.snapshotInterval = b.snapshotInterval;
		this.timeout = b.timeout;
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Fresh, unfitted layers in configuration order. */
	public LayerStack createLayers() {
		List<Layer> l = new ArrayList<>();
		for (LayerConfig lc : layers)
			l.add(lc.createLayer());
		return new LayerStack(l);
	}

	public int getRows() {
		return rows;
	}

	public int getCols() {
		return cols;
	}

	public boolean isToroidal() {
		return toroidal;
	}

	public List<LayerConfig> getLayers() {
		return layers;
	}

	public Schedule getAlpha() {
		return alpha;
	}

	public Schedule getRadius() {
		return radius;
	}

	/** Prototype decay, <code>null</code> if disabled. */
	public Schedule getDecay() {
		return decay;
	}

	public Kernel getKernel() {
		return kernel;
	}

	public Horizon getHorizon() {
		return horizon;
	}

	public boolean isShuffle() {
		return shuffle;
	}

	public Initialization getInitialization() {
		return init;
	}

	public long getSeed() {
		return seed;
	}

	public int getThreads() {
		return threads;
	}

	/** Steps between two snapshots, 0 for none. */
	public long getSnapshotInterval() {
		return snapshotInterval;
	}

	/** Wall clock limit of {@link supersom.som.net.Trainer#train()}, <code>null</code> for none. */
	public Duration getTimeout() {
		return timeout;
	}

	@Override
	public String toString() {
		return "SomConfig[" + rows + "x" + cols + (toroidal ? " toroid" : "") + ", " + layers.size() + " layers, alpha=" + alpha + ", radius=" + radius + ", decay=" + decay + ", " + kernel + ", " + horizon + ", seed=" + seed + "]";
	}

	public static class Builder {

		private int rows, cols;
		private boolean toroidal = false;
		private final List<LayerConfig> layers = new ArrayList<>();
		private Schedule alpha, radius, decay;
		private Kernel kernel = Kernel.gauss;
		private Horizon horizon;
		private boolean shuffle = true;
		private Initialization init = Initialization.samples;
		private long seed = 0;
		private int threads = 1;
		private long snapshotInterval = 0;
		private Duration timeout;

		private Builder() {
		}

		public Builder grid(int rows, int cols) {
			this.rows = rows;
			this.cols = cols;
			return this;
		}

		public Builder toroidal(boolean toroidal) {
			this.toroidal = toroidal;
			return this;
		}

		public Builder layer(LayerConfig l) {
			layers.add(l);
			return this;
		}

		public Builder alpha(Schedule alpha) {
			this.alpha = alpha;
			return this;
		}

		public Builder radius(Schedule radius) {
			this.radius = radius;
			return this;
		}

		public Builder decay(Schedule decay) {
			this.decay = decay;
			return this;
		}

		public Builder kernel(Kernel kernel) {
			this.kernel = kernel;
			return this;
		}

		public Builder horizon(Horizon horizon) {
			this.horizon = horizon;
			return this;
		}

		public Builder shuffle(boolean shuffle) {
			this.shuffle = shuffle;
			return this;
		}

		public Builder initialization(Initialization init) {
			this.init = init;
			return this;
		}

		public Builder seed(long seed) {
			this.seed = seed;
			return this;
		}

		public Builder threads(int threads) {
			this.threads = threads;
			return this;
		}

		public Builder snapshotInterval(long steps) {
			this.snapshotInterval = steps;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		/** @throws ConfigException naming the first invalid parameter */
		public SomConfig build() {
			if (rows <= 0)
				throw new ConfigException("grid.rows", "Must be > 0, got " + rows);
			if (cols <= 0)
				throw new ConfigException("grid.cols", "Must be > 0, got " + cols);
			if (layers.isEmpty())
				throw new ConfigException("layers", "No layers");
			Set<String> names = new HashSet<>();
			for (LayerConfig l : layers)
				if (!names.add(l.getName()))
					throw new ConfigException("layers", "Duplicate layer name: " + l.getName());
			if (alpha == null)
				throw new ConfigException("alpha", "Missing");
			if (alpha.getMin() < 0 || alpha.getMax() > 1)
				throw new ConfigException("alpha", "Bounds must be in [0,1]: " + alpha);
			if (radius == null)
				throw new ConfigException("radius", "Missing");
			if (radius.getMin() < 0)
				throw new ConfigException("radius", "Bounds must be >= 0: " + radius);
			if (decay != null && (decay.getMin() < 0 || decay.getMax() > 1))
				throw new ConfigException("decay", "Bounds must be in [0,1]: " + decay);
			if (kernel == null)
				throw new ConfigException("kernel", "Missing");
			if (horizon == null)
				throw new ConfigException("horizon", "Missing");
			if (init == null)
				throw new ConfigException("init", "Missing");
			if (threads < 1)
				throw new ConfigException("threads", "Must be >= 1, got " + threads);
			if (snapshotInterval < 0)
				throw new ConfigException("snapshot.interval", "Must be >= 0, got " + snapshotInterval);
			if (timeout != null && (timeout.isNegative() || timeout.isZero()))
				throw new ConfigException("timeout", "Must be positive, got " + timeout);
			return new SomConfig(this);
		}
	}
}
