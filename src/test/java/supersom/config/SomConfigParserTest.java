package supersom.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import supersom.ConfigException;
import supersom.layer.Normalization;
import supersom.layer.SegmentMetric;
import supersom.som.decay.Curve;
import supersom.som.kernel.Kernel;

public class SomConfigParserTest {

	private static final String CONFIG = "grid.rows = 4\n" //
			+ "grid.cols = 6\n" //
			+ "grid.toroidal = true\n" //
			+ "layers = climate, landuse\n" //
			+ "layer.climate.columns = temp, rain\n" //
			+ "layer.climate.weight = 0.7\n" //
			+ "layer.landuse.columns = lu\n" //
			+ "layer.landuse.categorical = true\n" //
			+ "layer.landuse.weight = 0.3\n" //
			+ "layer.landuse.metric = tanimoto\n" //
			+ "alpha.start = 0.5\n" //
			+ "alpha.end = 0.01\n" //
			+ "alpha.curve = exp\n" //
			+ "radius.start = 3\n" //
			+ "radius.end = 1\n" //
			+ "horizon.epochs = 20\n" //
			+ "kernel = bubble\n" //
			+ "seed = 42\n" //
			+ "threads = 2\n" //
			+ "timeout.ms = 1500\n";

	private static Properties props() throws IOException {
		Properties p = new Properties();
		p.load(new StringReader(CONFIG));
		return p;
	}

	@Test
	public void testParse() throws IOException {
		SomConfig c = SomConfigParser.parse(new StringReader(CONFIG));
		assertEquals(4, c.getRows());
		assertEquals(6, c.getCols());
		assertTrue(c.isToroidal());
		assertEquals(2, c.getLayers().size());

		LayerConfig climate = c.getLayers().get(0);
		assertEquals("climate", climate.getName());
		assertEquals(2, climate.getColumns().size());
		assertEquals(Normalization.zScore, climate.getNormalization());
		assertEquals(0.7, climate.getWeight(), 0);

		LayerConfig lu = c.getLayers().get(1);
		assertTrue(lu.isCategorical());
		assertEquals(Normalization.none, lu.getNormalization());
		assertEquals(SegmentMetric.tanimoto, lu.getMetric());

		assertEquals(Curve.exponential, c.getAlpha().getCurve());
		assertEquals(Curve.linear, c.getRadius().getCurve());
		assertNull(c.getDecay());
		assertEquals(Kernel.bubble, c.getKernel());
		assertEquals(Horizon.Unit.epochs, c.getHorizon().getUnit());
		assertEquals(42, c.getSeed());
		assertEquals(2, c.getThreads());
		assertEquals(Duration.ofMillis(1500), c.getTimeout());
	}

	private static String failing(Properties p) {
		return assertThrows(ConfigException.class, () -> SomConfigParser.parse(p)).getParameter();
	}

	@Test
	public void testMissingRequired() throws IOException {
		Properties p = props();
		p.remove("grid.cols");
		assertEquals("grid.cols", failing(p));

		p = props();
		p.remove("alpha.end");
		assertEquals("alpha.end", failing(p));
	}

	@Test
	public void testBadValues() throws IOException {
		Properties p = props();
		p.setProperty("grid.rows", "four");
		assertEquals("grid.rows", failing(p));

		p = props();
		p.setProperty("layer.climate.norm", "log");
		assertEquals("layer.climate.norm", failing(p));

		p = props();
		p.setProperty("grid.toroidal", "yes");
		assertEquals("grid.toroidal", failing(p));

		p = props();
		p.setProperty("alpha.start", "2");
		assertEquals("alpha", failing(p));
	}

	@Test
	public void testExactlyOneHorizon() throws IOException {
		Properties p = props();
		p.setProperty("horizon.episodes", "100");
		assertEquals("horizon", failing(p));

		p.remove("horizon.epochs");
		SomConfig c = SomConfigParser.parse(p);
		assertEquals(Horizon.Unit.episodes, c.getHorizon().getUnit());
		assertEquals(100, c.getHorizon().getCount());
	}

	@Test
	public void testOptionalDecay() throws IOException {
		Properties p = props();
		p.setProperty("decay.start", "0.1");
		p.setProperty("decay.end", "0");
		assertEquals(0.1, SomConfigParser.parse(p).getDecay().getStart(), 0);
	}

	@Test
	public void testCategoricalLayerWithTwoColumns() throws IOException {
		Properties p = props();
		p.setProperty("layer.landuse.columns", "lu, lu2");
		assertEquals("layer.landuse.columns", failing(p));
	}
}
