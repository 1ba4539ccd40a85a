package edu.upf.taln.textnetwork.core.io;

import edu.upf.taln.textnetwork.core.structures.Relation;
import edu.upf.taln.textnetwork.core.structures.TextNetwork;
import edu.upf.taln.textnetwork.core.structures.Topic;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.GraphExporter;
import org.jgrapht.nio.dot.DOTExporter;
import org.jgrapht.nio.gexf.GEXFExporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.StringWriter;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes text networks to standard graph formats.
 */
public class NetworkWriter
{
	public enum Format
	{
		GEXF("gexf"), DOT("dot");

		private final String extension;
		Format(String extension) { this.extension = extension; }
		public String getExtension() { return extension; }
	}

	private final Format format;
	private final static Logger log = LogManager.getLogger();

	public NetworkWriter(Format format)
	{
		this.format = format;
	}

	public String write(TextNetwork network)
	{
		StringWriter writer = new StringWriter();
		write(network, writer);
		return writer.toString();
	}

	public void write(TextNetwork network, Writer writer)
	{
		log.debug("Exporting network with " + network.vertexSet().size() + " topics as " + format);
		createExporter().exportGraph(network, writer);
	}

	private GraphExporter<Topic, Relation> createExporter()
	{
		switch (format)
		{
			case DOT:
			{
				DOTExporter<Topic, Relation> exporter = new DOTExporter<>(NetworkWriter::quote);
				exporter.setVertexAttributeProvider(NetworkWriter::getTopicAttributes);
				exporter.setEdgeAttributeProvider(NetworkWriter::getRelationAttributes);
				return exporter;
			}
			case GEXF:
			default:
			{
				GEXFExporter<Topic, Relation> exporter = new GEXFExporter<>();
				exporter.setVertexIdProvider(Topic::getId);
				exporter.setEdgeIdProvider(e -> Long.toString(e.getId()));
				exporter.setParameter(GEXFExporter.Parameter.EXPORT_EDGE_LABELS, true);
				exporter.setVertexAttributeProvider(NetworkWriter::getTopicAttributes);
				exporter.setEdgeAttributeProvider(NetworkWriter::getRelationAttributes);
				return exporter;
			}
		}
	}

	// DOT identifiers containing spaces or punctuation must be quoted
	private static String quote(Topic t)
	{
		return "\"" + t.getId().replace("\"", "\\\"") + "\"";
	}

	private static Map<String, Attribute> getTopicAttributes(Topic t)
	{
		Map<String, Attribute> attributes = new LinkedHashMap<>();
		attributes.put("label", DefaultAttribute.createAttribute(t.getLabel()));
		return attributes;
	}

	private static Map<String, Attribute> getRelationAttributes(Relation r)
	{
		Map<String, Attribute> attributes = new LinkedHashMap<>();
		attributes.put("label", DefaultAttribute.createAttribute(r.getLabel()));
		return attributes;
	}
}
