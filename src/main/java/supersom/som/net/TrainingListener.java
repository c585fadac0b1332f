package supersom.som.net;

import java.util.EventListener;

/**
 * Receives grid snapshots every configured number of steps. Called on the
 * training thread between two steps; implementations should hand the
 * snapshot off instead of doing slow work.
 */
public interface TrainingListener extends EventListener {
	public void snapshotTaken(GridSnapshot snapshot);
}
