package supersom.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import supersom.ConfigException;
import supersom.layer.Normalization;
import supersom.layer.SegmentMetric;
import supersom.som.decay.Curve;
import supersom.som.decay.Schedule;
import supersom.som.kernel.Kernel;

/**
 * Reads a {@link SomConfig} from properties. Recognized keys:
 *
 * <pre>
 * grid.rows, grid.cols          required
 * grid.toroidal                 false
 * layers                        required, comma separated layer names in order
 * layer.NAME.columns            required, comma separated
 * layer.NAME.categorical        false
 * layer.NAME.weight             1
 * layer.NAME.norm               zscore for numeric layers, none for categorical ones
 * layer.NAME.scale              1
 * layer.NAME.metric             sqeuclidean
 * alpha.start, alpha.end        required
 * alpha.curve                   lin
 * radius.start, radius.end      required
 * radius.curve                  lin
 * decay.start, decay.end        optional
 * decay.curve                   lin
 * kernel                        gauss
 * horizon.epochs | horizon.episodes   exactly one required
 * shuffle                       true
 * init                          samples
 * seed                          0
 * threads                       1
 * snapshot.interval             0
 * timeout.ms                    none
 * </pre>
 */
public class SomConfigParser {

	private static Logger log = LogManager.getLogger(SomConfigParser.class);

	public static SomConfig parse(InputStream is) throws IOException {
		Properties p = new Properties();
		p.load(is);
		return parse(p);
	}

	public static SomConfig parse(Reader r) throws IOException {
		Properties p = new Properties();
		p.load(r);
		return parse(p);
	}

	public static SomConfig parse(Properties p) {
		SomConfig.Builder b = SomConfig.builder();
		b.grid(getInt(p, "grid.rows", null), getInt(p, "grid.cols", null));
		b.toroidal(getBoolean(p, "grid.toroidal", false));

		for (String name : getList(p, "layers"))
			b.layer(parseLayer(p, name));

		b.alpha(parseSchedule(p, "alpha", true));
		b.radius(parseSchedule(p, "radius", true));
		b.decay(parseSchedule(p, "decay", false));

		b.kernel(Kernel.fromString("kernel", p.getProperty("kernel", "gauss")));

		boolean epochs = p.getProperty("horizon.epochs") != null;
		boolean episodes = p.getProperty("horizon.episodes") != null;
		if (epochs == episodes)
			throw new ConfigException("horizon", "Exactly one of horizon.epochs and horizon.episodes is required");
		if (epochs)
			b.horizon(Horizon.epochs(getLong(p, "horizon.epochs", null)));
		else
			b.horizon(Horizon.episodes(getLong(p, "horizon.episodes", null)));

		b.shuffle(getBoolean(p, "shuffle", true));
		b.initialization(Initialization.fromString("init", p.getProperty("init", "samples")));
		b.seed(getLong(p, "seed", 0L));
		b.threads(getInt(p, "threads", 1));
		b.snapshotInterval(getLong(p, "snapshot.interval", 0L));
		if (p.getProperty("timeout.ms") != null)
			b.timeout(Duration.ofMillis(getLong(p, "timeout.ms", null)));

		SomConfig c = b.build();
		log.debug("Parsed " + c);
		return c;
	}

	private static LayerConfig parseLayer(Properties p, String name) {
		String k = "layer." + name;
		List<String> cols = getList(p, k + ".columns");
		boolean cat = getBoolean(p, k + ".categorical", false);
		Normalization norm = Normalization.fromString(k + ".norm", p.getProperty(k + ".norm", cat ? "none" : "zscore"));
		SegmentMetric metric = SegmentMetric.fromString(k + ".metric", p.getProperty(k + ".metric", "sqeuclidean"));
		return new LayerConfig(name, cols.toArray(new String[] {}), cat, getDouble(p, k + ".weight", 1.0), norm, getDouble(p, k + ".scale", 1.0), metric);
	}

	private static Schedule parseSchedule(Properties p, String k, boolean required) {
		if (!required && p.getProperty(k + ".start") == null && p.getProperty(k + ".end") == null)
			return null;
		Curve c = Curve.fromString(k + ".curve", p.getProperty(k + ".curve", "lin"));
		return new Schedule(k, getDouble(p, k + ".start", null), getDouble(p, k + ".end", null), c);
	}

	private static String get(Properties p, String k, boolean required) {
		String v = p.getProperty(k);
		if (v == null || v.trim().isEmpty()) {
			if (required)
				throw new ConfigException(k, "Missing");
			return null;
		}
		return v.trim();
	}

	private static List<String> getList(Properties p, String k) {
		List<String> l = new ArrayList<>();
		for (String s : get(p, k, true).split(","))
			if (!s.trim().isEmpty())
				l.add(s.trim());
		if (l.isEmpty())
			throw new ConfigException(k, "Empty list");
		return l;
	}

	private static int getInt(Properties p, String k, Integer def) {
		String v = get(p, k, def == null);
		if (v == null)
			return def;
		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			throw new ConfigException(k, "Not an integer: " + v, e);
		}
	}

	private static long getLong(Properties p, String k, Long def) {
		String v = get(p, k, def == null);
		if (v == null)
			return def;
		try {
			return Long.parseLong(v);
		} catch (NumberFormatException e) {
			throw new ConfigException(k, "Not an integer: " + v, e);
		}
	}

	private static double getDouble(Properties p, String k, Double def) {
		String v = get(p, k, def == null);
		if (v == null)
			return def;
		try {
			return Double.parseDouble(v);
		} catch (NumberFormatException e) {
			throw new ConfigException(k, "Not a number: " + v, e);
		}
	}

	private static boolean getBoolean(Properties p, String k, boolean def) {
		String v = get(p, k, false);
		if (v == null)
			return def;
		if (v.equalsIgnoreCase("true"))
			return true;
		if (v.equalsIgnoreCase("false"))
			return false;
		throw new ConfigException(k, "Not a boolean: " + v);
	}
}
