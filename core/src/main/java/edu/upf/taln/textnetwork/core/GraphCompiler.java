package edu.upf.taln.textnetwork.core;

import edu.upf.taln.textnetwork.core.extraction.Extractor;
import edu.upf.taln.textnetwork.core.extraction.Match;
import edu.upf.taln.textnetwork.core.structures.*;
import edu.upf.taln.textnetwork.core.utils.DebugUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiles constituency trees into a graph of topics and relations encoding their predicate-argument structure.
 * Works as a one-state pushdown automaton: the only state carried across recursive calls is the compilation
 * result threaded through them.
 * Nodes and edges are created in a graph store, which must not be shared with other writers during compilation.
 */
public final class GraphCompiler
{
	private final GraphStore store;
	private final Options options;
	private final static Logger log = LogManager.getLogger();

	public GraphCompiler(GraphStore store, Options options)
	{
		this.store = store;
		this.options = new Options(options);
	}

	/**
	 * Compiles the tree of a sentence into the graph store
	 */
	public CompilationResult apply(ConstituencyTree tree)
	{
		final CompilationResult result = compile(tree);
		if (options.verbose)
			log.debug("Propositions:\n\t" + DebugUtils.printRelations(result.getEdges()));

		return result;
	}

	public CompilationResult compile(ConstituencyTree tree)
	{
		return compile(tree, CompilationResult.empty());
	}

	/**
	 * Compiles a tree given the nodes and edges of the enclosing context.
	 * @param seed nodes left open by the enclosing constituents, and the edges accumulated so far
	 */
	public CompilationResult compile(ConstituencyTree tree, CompilationResult seed)
	{
		final Match match = Extractor.classify(tree);
		switch (match.getExtractor())
		{
			case TrivalentPredicate:
				return compile(match.getLeft(), compile(match.getRight(), compile(match.getLeft(), seed)));
			case DivalentPredicate:
				return compileDivalent(match.getLeft(), match.getRight(), seed);
			case MonovalentPredicate:
				return compileMonovalent(tree, seed);
			case PredicateArgument:
				return createNode(tree.getTerminalValue())
						.map(node -> new CompilationResult(List.of(node), List.of()))
						.orElse(CompilationResult.empty());
			case NounVerbDeclarativeClause:
				return compileClause(match.getLeft(), match.getRight(), seed);
			case NounPhraseWithPreposition:
				return compileNounPhraseWithPreposition(match.getLeft(), match.getRight(), seed);
			case NonfiniteVerbPhrase:
				return compile(match.getRight(), seed);
			case IgnoredConstituent:
				return CompilationResult.empty();
			default:
				return compileChildren(tree, seed);
		}
	}

	// Links every open node to every argument in the right subtree
	private CompilationResult compileDivalent(ConstituencyTree left, ConstituencyTree right, CompilationResult seed)
	{
		final CompilationResult arguments = compile(right, seed);
		final String label = left.getTerminalValue();

		final List<Relation> edges = new ArrayList<>();
		for (Topic source : seed.getNodes())
		{
			for (Topic target : arguments.getNodes())
				edges.add(createEdge(source, target, label));
		}
		edges.addAll(arguments.getEdges());

		return new CompilationResult(arguments.getNodes(), edges);
	}

	// Annotates every open node with a loop
	private CompilationResult compileMonovalent(ConstituencyTree tree, CompilationResult seed)
	{
		final String label = tree.getTerminalValue();
		final List<Relation> edges = new ArrayList<>();
		for (Topic node : seed.getNodes())
			edges.add(createEdge(node, node, label));

		return new CompilationResult(List.of(), edges);
	}

	// Each subject gets its own copy of the predicate
	private CompilationResult compileClause(ConstituencyTree left, ConstituencyTree right, CompilationResult seed)
	{
		final CompilationResult subjects = compile(left);

		final List<Topic> nodes = new ArrayList<>();
		final List<Relation> edges = new ArrayList<>();
		for (Topic subject : subjects.getNodes())
		{
			final CompilationResult predicate = compile(right, new CompilationResult(List.of(subject), seed.getEdges()));
			nodes.addAll(predicate.getNodes());
			edges.addAll(predicate.getEdges());
		}
		nodes.addAll(subjects.getNodes());
		edges.addAll(subjects.getEdges());

		return new CompilationResult(nodes, edges);
	}

	// Noun phrases in the prepositional complement possess the head noun phrase
	private CompilationResult compileNounPhraseWithPreposition(ConstituencyTree left, ConstituencyTree right,
	                                                           CompilationResult seed)
	{
		final CompilationResult targets = compile(left, seed);
		final CompilationResult sources = compile(right, seed);

		final List<Relation> edges = new ArrayList<>();
		for (Topic source : sources.getNodes())
		{
			for (Topic target : targets.getNodes())
				edges.add(createEdge(source, target, options.possession_label));
		}
		edges.addAll(sources.getEdges());
		edges.addAll(targets.getEdges());

		return new CompilationResult(sources.getNodes(), edges);
	}

	private CompilationResult compileChildren(ConstituencyTree tree, CompilationResult seed)
	{
		final List<Topic> nodes = new ArrayList<>();
		final List<Relation> edges = new ArrayList<>();
		for (ConstituencyTree child : tree.getChildren())
		{
			final CompilationResult result = compile(child, seed);
			nodes.addAll(result.getNodes());
			edges.addAll(result.getEdges());
		}

		return new CompilationResult(nodes, edges);
	}

	private Optional<Topic> createNode(String label)
	{
		if (label.isEmpty())
			return Optional.empty();

		final Topic node = store.findNode(label).orElseGet(() ->
		{
			Topic topic = store.createNode(label);
			topic.setLabel(label);
			topic.setColor(options.node_color);
			store.addNode(topic);
			return topic;
		});

		return Optional.of(node);
	}

	private Relation createEdge(Topic source, Topic target, String label)
	{
		final Relation edge = store.createEdge(source, target);
		edge.setColor(options.edge_color);
		edge.setLabel(label);
		store.addEdge(edge);

		return edge;
	}
}
