package supersom.som.net;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import supersom.som.bmu.BmuGetter;
import supersom.som.decay.Schedule;
import supersom.som.grid.Grid;
import supersom.som.grid.GridPos;
import supersom.som.kernel.KernelFunction;

/**
 * Online Kohonen update. For a sample <code>x</code> every prototype
 * <code>v</code> moves by <code>alpha * theta * (x - v)</code>, where theta is the
 * kernel value of its grid distance to the bmu. Missing (<code>NaN</code>)
 * sample dimensions are left alone.
 * <p>
 * With an executor the positions are split into contiguous chunks, one task
 * per chunk. Every task only writes the prototypes of its own positions, so
 * the result equals the sequential update bit for bit. An update always
 * completes; interrupting the calling thread only sets its interrupt flag.
 */
public class SOM {

	protected final Grid<double[]> grid;
	protected final BmuGetter<double[]> bmuGetter;
	protected final Schedule lr, radius;
	protected final KernelFunction nb;

	private final ExecutorService es;
	private final int chunks;

	public SOM(KernelFunction nb, Schedule lr, Schedule radius, Grid<double[]> grid, BmuGetter<double[]> bmuGetter) {
		this(nb, lr, radius, grid, bmuGetter, null, 1);
	}

	public SOM(KernelFunction nb, Schedule lr, Schedule radius, Grid<double[]> grid, BmuGetter<double[]> bmuGetter, ExecutorService es, int chunks) {
		this.grid = grid;
		this.bmuGetter = bmuGetter;
		this.nb = nb;
		this.lr = lr;
		this.radius = radius;
		this.es = es;
		this.chunks = Math.max(1, Math.min(chunks, grid.size()));
	}

	/**
	 * One training step at progress <code>t</code> in [0,1].
	 *
	 * @return the bmu of <code>x</code>
	 */
	public GridPos train(double t, double[] x) {
		GridPos bmuPos = bmuGetter.getBmuPos(x, grid);
		update(bmuPos, x, lr.interpolate(t), radius.interpolate(t));
		return bmuPos;
	}

	public void update(final GridPos bmuPos, final double[] x, final double alpha, final double r) {
		final List<GridPos> positions = grid.getPositions();
		if (es == null || chunks == 1) {
			update(positions, bmuPos, x, alpha, r);
			return;
		}

		List<Future<Void>> futures = new ArrayList<>();
		int n = positions.size();
		for (int c = 0; c < chunks; c++) {
			final List<GridPos> part = positions.subList(c * n / chunks, (c + 1) * n / chunks);
			futures.add(es.submit(new Callable<Void>() {
				@Override
				public Void call() {
					update(part, bmuPos, x, alpha, r);
					return null;
				}
			}));
		}
		// all chunks must be done before returning, an interrupt is only passed on
		boolean interrupted = false;
		Throwable failure = null;
		for (Future<Void> f : futures) {
			while (true) {
				try {
					f.get();
					break;
				} catch (InterruptedException e) {
					interrupted = true;
				} catch (ExecutionException e) {
					if (failure == null)
						failure = e.getCause();
					break;
				}
			}
		}
		if (interrupted)
			Thread.currentThread().interrupt();
		if (failure instanceof RuntimeException)
			throw (RuntimeException) failure;
		if (failure != null)
			throw new RuntimeException(failure);
	}

	private void update(List<GridPos> positions, GridPos bmuPos, double[] x, double alpha, double r) {
		for (GridPos p : positions) {
			double theta = nb.getValue(grid.dist(bmuPos, p), r);
			if (theta <= 0)
				continue;

			double[] v = grid.getPrototypeAt(p);
			adapt(v, x, theta * alpha);
			grid.setPrototypeAt(p, v);
		}
	}

	protected static void adapt(double[] v, double[] x, double f) {
		for (int j = 0; j < v.length; j++)
			if (!Double.isNaN(x[j]))
				v[j] = v[j] + f * (x[j] - v[j]);
	}

	public Grid<double[]> getGrid() {
		return grid;
	}

	public BmuGetter<double[]> getBmuGetter() {
		return bmuGetter;
	}
}
