package edu.upf.taln.textnetwork.core.structures;

import edu.stanford.nlp.trees.LabeledScoredTreeFactory;
import edu.stanford.nlp.trees.PennTreeReader;
import edu.stanford.nlp.trees.Tree;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.io.StringReader;
import java.util.Optional;
import java.util.Set;

import static edu.upf.taln.textnetwork.core.structures.ConstituencyTree.leaf;
import static edu.upf.taln.textnetwork.core.structures.ConstituencyTree.node;
import static org.junit.Assert.*;

public class ConstituencyTreeTest
{
	private final ConstituencyTree dog = node("NP", node("DT", leaf("the")), node("NN", leaf("dog")));

	@Test
	public void terminalValues()
	{
		assertEquals("dog", leaf("dog").getTerminalValue());
		assertEquals("dog", node("NN", leaf("dog")).getTerminalValue());
		assertEquals("the dog", dog.getTerminalValue());
		assertEquals("", node("NN", leaf("")).getTerminalValue());
	}

	@Test
	public void binaryRules()
	{
		final Set<Pair<String, String>> rules = Set.of(Pair.of("DT", "NN"));
		assertTrue(dog.hasBinaryRule(rules));
		assertFalse(dog.hasBinaryRule(Set.of(Pair.of("NN", "DT"))));

		final Optional<Pair<ConstituencyTree, ConstituencyTree>> children = dog.matchBinaryRule(rules);
		assertTrue(children.isPresent());
		assertSame(dog.getChildren().get(0), children.get().getLeft());
		assertSame(dog.getChildren().get(1), children.get().getRight());
	}

	@Test
	public void binaryRulesRequireTwoChildren()
	{
		final ConstituencyTree three = node("NP", node("DT", leaf("the")), node("NN", leaf("dog")), node("NN", leaf("house")));
		assertFalse(three.hasBinaryRule(Set.of(Pair.of("DT", "NN"))));
		assertFalse(node("NN", leaf("dog")).matchBinaryRule(Set.of(Pair.of("dog", "dog"))).isPresent());
		assertFalse(leaf("dog").hasBinaryRule(Set.of(Pair.of("DT", "NN"))));
	}

	@Test
	public void copiesCoreNLPTrees() throws Exception
	{
		final Tree tree = new PennTreeReader(new StringReader("(ROOT (S (NP (NN dog)) (@VP (VBZ barks))))"),
				new LabeledScoredTreeFactory()).readTree();
		final ConstituencyTree copy = ConstituencyTree.of(tree);

		assertEquals("ROOT", copy.getLabel());
		assertEquals("@VP", copy.getChildren().get(0).getChildren().get(1).getLabel());
		assertEquals("dog barks", copy.getTerminalValue());
		assertEquals("(ROOT (S (NP (NN dog)) (@VP (VBZ barks))))", copy.toString());
		assertEquals(node("ROOT", node("S", node("NP", node("NN", leaf("dog"))), node("@VP", node("VBZ", leaf("barks"))))), copy);
	}

	@Test
	public void childrenAreImmutable()
	{
		assertThrows(UnsupportedOperationException.class, () -> dog.getChildren().add(leaf("x")));
		assertTrue(leaf("x").isLeaf());
		assertFalse(dog.isLeaf());
	}
}
