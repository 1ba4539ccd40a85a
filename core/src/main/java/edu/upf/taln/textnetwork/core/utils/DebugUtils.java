package edu.upf.taln.textnetwork.core.utils;

import edu.upf.taln.textnetwork.core.structures.Relation;
import edu.upf.taln.textnetwork.core.structures.TextNetwork;
import edu.upf.taln.textnetwork.core.structures.Topic;

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Collection;
import java.util.Comparator;
import java.util.stream.Collectors;

public class DebugUtils
{
	private final static NumberFormat int_format = new DecimalFormat("#,###");
	public static String printInteger(int i)
	{
		return int_format.format(i);
	}

	public static String printRelation(Relation r)
	{
		return r.getLabel() + "(" + r.getSource().getLabel() + ", " + r.getTarget().getLabel() + ")";
	}

	// One relation per line
	public static String printRelations(Collection<Relation> relations)
	{
		return relations.stream()
				.map(DebugUtils::printRelation)
				.collect(Collectors.joining("\n\t"));
	}

	public static String printNetwork(TextNetwork network)
	{
		final String topics = network.vertexSet().stream()
				.sorted(Comparator.<Topic>comparingInt(network::degreeOf).reversed())
				.limit(10)
				.map(v -> v.getLabel() + " (" + network.degreeOf(v) + ")")
				.collect(Collectors.joining(", "));
		final long loops = network.edgeSet().stream()
				.filter(Relation::isLoop)
				.count();

		return "Network with " + printInteger(network.vertexSet().size()) + " topics and " +
				printInteger(network.edgeSet().size()) + " relations (" + loops + " loops)" +
				(topics.isEmpty() ? "" : "\n\tMost connected topics: " + topics);
	}
}
