package edu.upf.taln.textnetwork.core.structures;

import org.jgrapht.graph.DirectedPseudograph;

import java.io.Serializable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Directed graph of topics and relations. Loops and multiple edges between the same pair of topics are allowed.
 */
public class TextNetwork extends DirectedPseudograph<Topic, Relation> implements GraphStore, Serializable
{
	private final Map<String, Topic> topics = new HashMap<>(); // from labels to vertices
	private final static long serialVersionUID = 1L;

	public TextNetwork()
	{
		super(null, null, false);
	}

	@Override
	public Optional<Topic> findNode(String label) { return Optional.ofNullable(topics.get(label)); }

	@Override
	public Topic createNode(String label) { return new Topic(label); }

	@Override
	public void addNode(Topic node)
	{
		if (addVertex(node))
			topics.put(node.getId(), node);
	}

	@Override
	public Relation createEdge(Topic source, Topic target) { return new Relation(source, target); }

	@Override
	public void addEdge(Relation edge)
	{
		addEdge(edge.getSource(), edge.getTarget(), edge);
	}

	@Override
	public boolean removeVertex(Topic v)
	{
		final boolean removed = super.removeVertex(v);
		if (removed)
			topics.remove(v.getId());
		return removed;
	}

	public List<Relation> getRelations(String label)
	{
		return edgeSet().stream()
				.filter(e -> e.getLabel().equals(label))
				.collect(toList());
	}

	/**
	 * Copies the contents of another network into this one. Topics are shared by label, every relation of the
	 * other network is added as a new relation.
	 */
	public synchronized void merge(TextNetwork other)
	{
		final Map<Topic, Topic> mapping = new HashMap<>();
		other.vertexSet().forEach(v ->
		{
			final Topic topic = findNode(v.getId()).orElseGet(() ->
			{
				Topic t = createNode(v.getId());
				t.setLabel(v.getLabel());
				t.setColor(v.getColor());
				addNode(t);
				return t;
			});
			mapping.put(v, topic);
		});

		other.edgeSet().forEach(e ->
		{
			Relation r = createEdge(mapping.get(e.getSource()), mapping.get(e.getTarget()));
			r.setLabel(e.getLabel());
			r.setColor(e.getColor());
			addEdge(r);
		});
	}
}
