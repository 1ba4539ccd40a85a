package edu.upf.taln.textnetwork.core.io;

import com.google.common.base.Stopwatch;
import edu.stanford.nlp.trees.LabeledScoredTreeFactory;
import edu.stanford.nlp.trees.PennTreeReader;
import edu.stanford.nlp.trees.Tree;
import edu.stanford.nlp.trees.TreeReader;
import edu.upf.taln.textnetwork.core.structures.ConstituencyTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads constituency trees in Penn Treebank bracketed format. Labels are kept as they appear in the input,
 * including escaped brackets such as -LRB- and -RRB-.
 */
public class ConstituencyTreeReader
{
	private final static Logger log = LogManager.getLogger();

	public static ConstituencyTree readTree(String bracketed)
	{
		final List<ConstituencyTree> trees = new ConstituencyTreeReader().read(bracketed);
		if (trees.size() != 1)
			throw new IllegalArgumentException("Expected a single tree, found " + trees.size() + " in " + bracketed);
		return trees.get(0);
	}

	public List<ConstituencyTree> read(String text)
	{
		if (!isBalanced(text))
			throw new IllegalArgumentException("Unbalanced brackets in " + abbreviate(text));

		Stopwatch timer = Stopwatch.createStarted();
		List<ConstituencyTree> trees = new ArrayList<>();
		try (TreeReader reader = new PennTreeReader(new StringReader(text), new LabeledScoredTreeFactory()))
		{
			Tree tree;
			while ((tree = reader.readTree()) != null)
			{
				escapeBrackets(tree);
				trees.add(ConstituencyTree.of(tree));
			}
		}
		catch (IOException | RuntimeException e)
		{
			log.error("Cannot read trees: " + e);
			throw new IllegalArgumentException("Malformed bracketed trees: " + abbreviate(text), e);
		}

		log.debug("Read " + trees.size() + " trees in " + timer.stop());
		return trees;
	}

	// PennTreeReader turns -LRB- and -RRB- leaves into brackets
	private static void escapeBrackets(Tree tree)
	{
		for (Tree leaf : tree.getLeaves())
		{
			if ("(".equals(leaf.value()))
				leaf.setValue("-LRB-");
			else if (")".equals(leaf.value()))
				leaf.setValue("-RRB-");
		}
	}

	// Parentheses within words are escaped as -LRB- and -RRB- in Penn Treebank trees
	private static boolean isBalanced(String text)
	{
		int depth = 0;
		for (char c : text.toCharArray())
		{
			if (c == '(')
				++depth;
			else if (c == ')' && --depth < 0)
				return false;
		}
		return depth == 0;
	}

	private static String abbreviate(String text)
	{
		return text.length() > 80 ? text.substring(0, 80) + "..." : text;
	}
}
