package supersom.som.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import org.jdom.Document;
import org.jdom.Element;
import org.jdom.JDOMException;
import org.jdom.input.SAXBuilder;
import org.jdom.output.Format;
import org.jdom.output.XMLOutputter;

import supersom.config.Horizon;
import supersom.config.Initialization;
import supersom.config.LayerConfig;
import supersom.config.SomConfig;
import supersom.layer.CategoricalLayer;
import supersom.layer.Layer;
import supersom.layer.LayerStack;
import supersom.layer.Normalization;
import supersom.layer.NumericLayer;
import supersom.layer.SegmentMetric;
import supersom.som.decay.Curve;
import supersom.som.decay.Schedule;
import supersom.som.grid.Grid2D;
import supersom.som.grid.Grid2DToroid;
import supersom.som.grid.GridPos;
import supersom.som.kernel.Kernel;
import supersom.som.net.SomModel;

/**
 * Saves and loads trained models as XML: configuration, fitted layers and
 * unit prototypes. Doubles are written with {@link Double#toString(double)},
 * so a loaded model answers queries exactly like the saved one.
 */
public class SomModelIO {

	public static void save(SomModel model, OutputStream os) throws IOException {
		SomConfig c = model.getConfig();
		LayerStack layers = model.getLayers();

		Element root = new Element("som");
		root.setAttribute("rows", model.getRows() + "");
		root.setAttribute("cols", model.getCols() + "");
		root.setAttribute("toroid", model.isToroidal() + "");
		root.setAttribute("kernel", c.getKernel().name());
		root.setAttribute("seed", c.getSeed() + "");
		root.setAttribute("shuffle", c.isShuffle() + "");
		root.setAttribute("init", c.getInitialization().name());
		root.setAttribute("steps", model.getTrainedSteps() + "");

		Element h = new Element("horizon");
		h.setAttribute("unit", c.getHorizon().getUnit().name());
		h.setAttribute("count", c.getHorizon().getCount() + "");
		root.addContent(h);

		root.addContent(schedule("alpha", c.getAlpha()));
		root.addContent(schedule("radius", c.getRadius()));
		if (c.getDecay() != null)
			root.addContent(schedule("decay", c.getDecay()));

		Element header = new Element("header");
		for (String s : layers.getHeader()) {
			Element e = new Element("column");
			e.setAttribute("name", s);
			header.addContent(e);
		}
		root.addContent(header);

		Element le = new Element("layers");
		for (Layer l : layers) {
			Element e = new Element("layer");
			e.setAttribute("name", l.getName());
			e.setAttribute("kind", l.getKind().name());
			e.setAttribute("weight", l.getWeight() + "");
			e.setAttribute("metric", l.getMetric().name());
			if (l instanceof NumericLayer) {
				NumericLayer nl = (NumericLayer) l;
				e.setAttribute("norm", nl.getNormalization().name());
				e.setAttribute("scale", nl.getScale() + "");
				double[] offset = nl.getOffsets(), factor = nl.getFactors();
				for (int i = 0; i < offset.length; i++) {
					Element col = new Element("column");
					col.setAttribute("name", l.getColumns().get(i));
					col.setAttribute("offset", offset[i] + "");
					col.setAttribute("factor", factor[i] + "");
					e.addContent(col);
				}
			} else {
				Element col = new Element("column");
				col.setAttribute("name", l.getColumns().get(0));
				e.addContent(col);
				for (String s : ((CategoricalLayer) l).getCategories()) {
					Element cat = new Element("category");
					cat.setText(s);
					e.addContent(cat);
				}
			}
			le.addContent(e);
		}
		root.addContent(le);

		Element u = new Element("units");
		for (GridPos pos : model.getPositions()) {
			Element p = new Element("unit");
			p.setAttribute("row", pos.getRow() + "");
			p.setAttribute("col", pos.getCol() + "");
			for (double d : model.getPrototype(pos)) {
				Element v = new Element("value");
				v.setText(d + "");
				p.addContent(v);
			}
			u.addContent(p);
		}
		root.addContent(u);

		XMLOutputter serializer = new XMLOutputter();
		serializer.setFormat(Format.getPrettyFormat());
		serializer.output(new Document(root), os);
	}

	private static Element schedule(String name, Schedule s) {
		Element e = new Element("schedule");
		e.setAttribute("name", name);
		e.setAttribute("start", s.getStart() + "");
		e.setAttribute("end", s.getEnd() + "");
		e.setAttribute("curve", s.getCurve().name());
		return e;
	}

	public static SomModel load(InputStream is) throws IOException {
		Document doc;
		try {
			doc = new SAXBuilder().build(is);
		} catch (JDOMException e) {
			throw new IOException("Not a valid model file", e);
		}

		try {
			Element root = doc.getRootElement();
			int rows = Integer.parseInt(root.getAttributeValue("rows"));
			int cols = Integer.parseInt(root.getAttributeValue("cols"));
			boolean toroid = Boolean.parseBoolean(root.getAttributeValue("toroid"));

			SomConfig.Builder b = SomConfig.builder();
			b.grid(rows, cols).toroidal(toroid);
			b.kernel(Kernel.valueOf(root.getAttributeValue("kernel")));
			b.seed(Long.parseLong(root.getAttributeValue("seed")));
			b.shuffle(Boolean.parseBoolean(root.getAttributeValue("shuffle")));
			b.initialization(Initialization.valueOf(root.getAttributeValue("init")));

			Element h = root.getChild("horizon");
			long count = Long.parseLong(h.getAttributeValue("count"));
			b.horizon(Horizon.Unit.valueOf(h.getAttributeValue("unit")) == Horizon.Unit.episodes ? Horizon.episodes(count) : Horizon.epochs(count));

			for (Object o : root.getChildren("schedule")) {
				Element e = (Element) o;
				String name = e.getAttributeValue("name");
				Schedule s = new Schedule(name, Double.parseDouble(e.getAttributeValue("start")), Double.parseDouble(e.getAttributeValue("end")), Curve.valueOf(e.getAttributeValue("curve")));
				if (name.equals("alpha"))
					b.alpha(s);
				else if (name.equals("radius"))
					b.radius(s);
				else if (name.equals("decay"))
					b.decay(s);
			}

			List<String> header = new ArrayList<>();
			for (Object o : root.getChild("header").getChildren("column"))
				header.add(((Element) o).getAttributeValue("name"));

			List<Layer> layers = new ArrayList<>();
			for (Object o : root.getChild("layers").getChildren("layer")) {
				Element e = (Element) o;
				String name = e.getAttributeValue("name");
				double weight = Double.parseDouble(e.getAttributeValue("weight"));
				SegmentMetric metric = SegmentMetric.valueOf(e.getAttributeValue("metric"));
				List<?> colElements = e.getChildren("column");
				String[] columns = new String[colElements.size()];
				for (int i = 0; i < columns.length; i++)
					columns[i] = ((Element) colElements.get(i)).getAttributeValue("name");

				if (Layer.Kind.valueOf(e.getAttributeValue("kind")) == Layer.Kind.Numeric) {
					Normalization norm = Normalization.valueOf(e.getAttributeValue("norm"));
					double scale = Double.parseDouble(e.getAttributeValue("scale"));
					double[] offset = new double[columns.length], factor = new double[columns.length];
					for (int i = 0; i < columns.length; i++) {
						Element col = (Element) colElements.get(i);
						offset[i] = Double.parseDouble(col.getAttributeValue("offset"));
						factor[i] = Double.parseDouble(col.getAttributeValue("factor"));
					}
					layers.add(NumericLayer.restore(name, columns, weight, norm, scale, metric, offset, factor));
					b.layer(new LayerConfig(name, columns, false, weight, norm, scale, metric));
				} else {
					List<String> cats = new ArrayList<>();
					for (Object c : e.getChildren("category"))
						cats.add(((Element) c).getText());
					layers.add(CategoricalLayer.restore(name, columns[0], weight, metric, cats));
					b.layer(new LayerConfig(name, columns, true, weight, Normalization.none, 1.0, metric));
				}
			}
			LayerStack stack = LayerStack.restore(layers, header.toArray(new String[] {}));

			Grid2D<double[]> grid = toroid ? new Grid2DToroid<double[]>(rows, cols) : new Grid2D<double[]>(rows, cols);
			for (Object o : root.getChild("units").getChildren("unit")) {
				Element e = (Element) o;
				GridPos p = new GridPos(Integer.parseInt(e.getAttributeValue("row")), Integer.parseInt(e.getAttributeValue("col")));
				List<?> values = e.getChildren("value");
				double[] v = new double[values.size()];
				for (int i = 0; i < v.length; i++)
					v[i] = Double.parseDouble(((Element) values.get(i)).getText());
				grid.setPrototypeAt(p, v);
			}

			return new SomModel(grid, stack, b.build(), Long.parseLong(root.getAttributeValue("steps")));
		} catch (RuntimeException e) {
			throw new IOException("Invalid model file: " + e.getMessage(), e);
		}
	}
}
