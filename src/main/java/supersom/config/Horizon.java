package supersom.config;

import supersom.ConfigException;

/**
 * Length of a training run. An epoch is one full pass over the data set, an
 * episode is a single sample drawn at random.
 */
public final class Horizon {

	public enum Unit {
		epochs, episodes
	}

	private final Unit unit;
	private final long count;

	private Horizon(Unit unit, long count) {
		if (count <= 0)
			throw new ConfigException("horizon." + unit, "Must be > 0, got " + count);
		this.unit = unit;
		this.count = count;
	}

	public static Horizon epochs(long n) {
		return new Horizon(Unit.epochs, n);
	}

	public static Horizon episodes(long n) {
		return new Horizon(Unit.episodes, n);
	}

	/** Total number of training steps for a data set of the given size. */
	public long getTotalSteps(int dataSize) {
		if (unit == Unit.episodes)
			return count;
		try {
			return Math.multiplyExact(count, (long) dataSize);
		} catch (ArithmeticException e) {
			throw new ConfigException("horizon.epochs", "Too many steps: " + count + " x " + dataSize, e);
		}
	}

	public Unit getUnit() {
		return unit;
	}

	public long getCount() {
		return count;
	}

	@Override
	public String toString() {
		return count + " " + unit;
	}
}
