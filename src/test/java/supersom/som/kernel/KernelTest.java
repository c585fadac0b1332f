package supersom.som.kernel;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import supersom.ConfigException;

public class KernelTest {

	@Test
	public void testOneAtBmu() {
		for (Kernel k : Kernel.values())
			for (double r : new double[] { 0, 0.5, 3 })
				assertEquals(1, k.create().getValue(0, r), 1e-12, k + " r=" + r);
	}

	@Test
	public void testNonIncreasing() {
		for (Kernel k : Kernel.values()) {
			KernelFunction f = k.create();
			double last = 1;
			for (double d = 0; d < 6; d += 0.25) {
				double v = f.getValue(d, 2);
				assertTrue(v <= last && v >= 0, k + " d=" + d);
				last = v;
			}
		}
	}

	@Test
	public void testZeroRadiusOnlyBmu() {
		for (Kernel k : Kernel.values()) {
			assertEquals(0, k.create().getValue(1, 0), 1e-12);
			assertEquals(0, k.create().getValue(0.5, 0), 1e-12);
		}
	}

	@Test
	public void testValues() {
		assertEquals(Math.exp(-0.5), new GaussKernel().getValue(2, 2), 1e-12);
		assertEquals(1, new BubbleKernel().getValue(2, 2), 1e-12);
		assertEquals(0, new BubbleKernel().getValue(2.01, 2), 1e-12);
		assertEquals(0.5, new LinearKernel().getValue(1, 2), 1e-12);
	}

	@Test
	public void testFromString() {
		assertEquals(Kernel.gauss, Kernel.fromString("kernel", "Gaussian"));
		assertEquals(Kernel.bubble, Kernel.fromString("kernel", "bubble"));
		ConfigException e = assertThrows(ConfigException.class, () -> Kernel.fromString("kernel", "mexican"));
		assertEquals("kernel", e.getParameter());
	}
}
