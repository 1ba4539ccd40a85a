package edu.upf.taln.textnetwork.core.io;

import edu.upf.taln.textnetwork.core.structures.ConstituencyTree;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.Assert.*;

public class ConstituencyTreeReaderTest
{
	@Test
	public void readsTreesFromFile() throws Exception
	{
		final Path path = Paths.get(getClass().getResource("/trees.mrg").toURI());
		final String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		final List<ConstituencyTree> trees = new ConstituencyTreeReader().read(text);

		assertEquals(3, trees.size());
		assertEquals("The dog barks .", trees.get(0).getTerminalValue());
		assertEquals("ROOT", trees.get(1).getLabel());
	}

	@Test
	public void keepsLabelsVerbatim()
	{
		final ConstituencyTree tree = ConstituencyTreeReader.readTree(
				"(ROOT (S (NP (NN dog)) (@VP (VBZ barks) (-LRB- -LRB-))))");
		final ConstituencyTree vp = tree.getChildren().get(0).getChildren().get(1);

		assertEquals("@VP", vp.getLabel());
		assertEquals("-LRB-", vp.getChildren().get(1).getLabel());
		assertEquals("barks -LRB-", vp.getTerminalValue());
	}

	@Test
	public void keepsEscapedBracketLeaves()
	{
		final ConstituencyTree tree = ConstituencyTreeReader.readTree("(NP (NN dog) (-LRB- -LRB-) (NN aside) (-RRB- -RRB-))");
		assertEquals("-LRB-", tree.getChildren().get(1).getChildren().get(0).getLabel());
		assertEquals("-RRB-", tree.getChildren().get(3).getChildren().get(0).getLabel());
		assertEquals("dog -LRB- aside -RRB-", tree.getTerminalValue());
	}

	@Test
	public void readsEmptyInput()
	{
		assertTrue(new ConstituencyTreeReader().read("").isEmpty());
		assertTrue(new ConstituencyTreeReader().read("  \n ").isEmpty());
	}

	@Test
	public void rejectsUnbalancedBrackets()
	{
		assertThrows(IllegalArgumentException.class, () -> new ConstituencyTreeReader().read("(S (NP (NN dog))"));
		assertThrows(IllegalArgumentException.class, () -> new ConstituencyTreeReader().read("(NN dog))("));
	}

	@Test
	public void readTreeExpectsExactlyOneTree()
	{
		assertThrows(IllegalArgumentException.class, () -> ConstituencyTreeReader.readTree("(NN dog) (NN cat)"));
		assertThrows(IllegalArgumentException.class, () -> ConstituencyTreeReader.readTree(""));
	}
}
