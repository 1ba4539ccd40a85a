package edu.upf.taln.textnetwork.core.extraction;

import edu.upf.taln.textnetwork.core.structures.ConstituencyTree;
import org.apache.commons.lang3.tuple.Pair;

import static com.google.common.base.Preconditions.checkState;

/**
 * A tree matched by an extractor, with the pair of children it was decomposed into, if any.
 */
public final class Match
{
	private final Extractor extractor;
	private final ConstituencyTree tree;
	private final Pair<ConstituencyTree, ConstituencyTree> children; // null for extractors that only test the tree

	Match(Extractor extractor, ConstituencyTree tree, Pair<ConstituencyTree, ConstituencyTree> children)
	{
		this.extractor = extractor;
		this.tree = tree;
		this.children = children;
	}

	public Extractor getExtractor() { return extractor; }
	public boolean isDecomposed() { return children != null; }

	public ConstituencyTree getLeft()
	{
		checkState(children != null, "%s does not decompose %s", extractor, tree);
		return children.getLeft();
	}

	public ConstituencyTree getRight()
	{
		checkState(children != null, "%s does not decompose %s", extractor, tree);
		return children.getRight();
	}

	@Override
	public String toString() { return extractor + " " + tree; }
}
