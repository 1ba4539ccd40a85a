package edu.upf.taln.textnetwork.core.structures;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;

/**
 * Outcome of compiling a (sub)tree: the nodes still open for attachment by an enclosing constituent, and the
 * edges produced so far.
 */
public final class CompilationResult
{
	private static final CompilationResult EMPTY = new CompilationResult(List.of(), List.of());
	private final ImmutableList<Topic> nodes;
	private final ImmutableList<Relation> edges;

	public static CompilationResult empty() { return EMPTY; }

	public CompilationResult(Collection<Topic> nodes, Collection<Relation> edges)
	{
		this.nodes = ImmutableList.copyOf(nodes);
		this.edges = ImmutableList.copyOf(edges);
	}

	public List<Topic> getNodes() { return nodes; }
	public List<Relation> getEdges() { return edges; }
	public boolean isEmpty() { return nodes.isEmpty() && edges.isEmpty(); }

	@Override
	public String toString() { return "nodes=" + nodes + " edges=" + edges; }
}
