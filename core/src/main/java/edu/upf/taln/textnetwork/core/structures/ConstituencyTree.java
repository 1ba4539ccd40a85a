package edu.upf.taln.textnetwork.core.structures;

import com.google.common.collect.ImmutableList;
import edu.stanford.nlp.trees.Tree;
import org.apache.commons.lang3.tuple.Pair;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.util.stream.Collectors.joining;

/**
 * Immutable constituency tree of a sentence. Internal nodes are labelled with syntactic categories
 * (S, NP, @VP...), leaves with words.
 */
public final class ConstituencyTree implements Serializable
{
	private final String label;
	private final ImmutableList<ConstituencyTree> children;
	private final static long serialVersionUID = 1L;

	public static ConstituencyTree leaf(String word) { return new ConstituencyTree(word, List.of()); }
	public static ConstituencyTree node(String label, ConstituencyTree... children)
	{
		return new ConstituencyTree(label, Arrays.asList(children));
	}

	// Copies a CoreNLP tree, labels are taken verbatim
	public static ConstituencyTree of(Tree tree)
	{
		final String value = tree.value() != null ? tree.value() : "";
		if (tree.isLeaf())
			return leaf(value);

		final ConstituencyTree[] children = Arrays.stream(tree.children())
				.map(ConstituencyTree::of)
				.toArray(ConstituencyTree[]::new);
		return node(value, children);
	}

	private ConstituencyTree(String label, List<ConstituencyTree> children)
	{
		this.label = Objects.requireNonNull(label);
		this.children = ImmutableList.copyOf(children);
	}

	public String getLabel() { return label; }
	public List<ConstituencyTree> getChildren() { return children; }
	public boolean isLeaf() { return children.isEmpty(); }

	/**
	 * Surface string dominated by this tree: the word itself for a leaf, the words of its yield separated by
	 * spaces otherwise.
	 */
	public String getTerminalValue()
	{
		if (isLeaf())
			return label;
		return children.stream()
				.map(ConstituencyTree::getTerminalValue)
				.filter(s -> !s.isEmpty())
				.collect(joining(" "));
	}

	public boolean hasBinaryRule(Set<Pair<String, String>> rules)
	{
		return matchBinaryRule(rules).isPresent();
	}

	public Optional<Pair<ConstituencyTree, ConstituencyTree>> matchBinaryRule(Set<Pair<String, String>> rules)
	{
		if (children.size() != 2)
			return Optional.empty();

		final ConstituencyTree left = children.get(0);
		final ConstituencyTree right = children.get(1);
		if (rules.contains(Pair.of(left.label, right.label)))
			return Optional.of(Pair.of(left, right));
		return Optional.empty();
	}

	@Override
	public String toString()
	{
		if (isLeaf())
			return label;
		return "(" + label + " " + children.stream().map(ConstituencyTree::toString).collect(joining(" ")) + ")";
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ConstituencyTree tree = (ConstituencyTree) o;
		return label.equals(tree.label) && children.equals(tree.children);
	}

	@Override
	public int hashCode() { return Objects.hash(label, children); }
}
