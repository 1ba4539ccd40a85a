package edu.upf.taln.textnetwork.core.utils;

import edu.upf.taln.textnetwork.core.structures.Relation;
import edu.upf.taln.textnetwork.core.structures.TextNetwork;
import edu.upf.taln.textnetwork.core.structures.Topic;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DebugUtilsTest
{
	@Test
	public void printsRelationsOnePerLine()
	{
		Topic dog = new Topic("dog");
		Topic cat = new Topic("cat");
		Relation chases = new Relation(dog, cat);
		chases.setLabel("chases");
		Relation barks = new Relation(dog, dog);
		barks.setLabel("barks");

		assertEquals("chases(dog, cat)", DebugUtils.printRelation(chases));
		assertEquals("chases(dog, cat)\n\tbarks(dog, dog)", DebugUtils.printRelations(List.of(chases, barks)));
		assertEquals("", DebugUtils.printRelations(List.of()));
	}

	@Test
	public void printsNetworkSummary()
	{
		TextNetwork network = new TextNetwork();
		assertEquals("Network with 0 topics and 0 relations (0 loops)", DebugUtils.printNetwork(network));

		Topic dog = new Topic("dog");
		network.addNode(dog);
		Relation barks = network.createEdge(dog, dog);
		barks.setLabel("barks");
		network.addEdge(barks);

		final String summary = DebugUtils.printNetwork(network);
		assertTrue(summary.startsWith("Network with 1 topics and 1 relations (1 loops)"));
		assertTrue(summary.contains("dog"));
	}
}
