package edu.upf.taln.textnetwork.core.extraction;

import edu.upf.taln.textnetwork.core.structures.ConstituencyTree;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

import static edu.upf.taln.textnetwork.core.extraction.Grammar.*;

/**
 * Structural patterns over constituency trees. Constants are declared in priority order: the first extractor
 * matching a tree is the one that applies to it, and Default matches any tree.
 */
public enum Extractor
{
	TrivalentPredicate
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return decompose(tree, verb_phrases, trivalent_rules);
		}
	},
	DivalentPredicate
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return decompose(tree, predicate_phrases, divalent_rules);
		}
	},
	MonovalentPredicate
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return test(tree, verb_tags.contains(tree.getLabel()));
		}
	},
	PredicateArgument
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			final String label = tree.getLabel();
			return test(tree, noun_tags.contains(label) ||
					(noun_phrases.contains(label) && tree.hasBinaryRule(noun_adjunct_rules)));
		}
	},
	NounVerbDeclarativeClause
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return decompose(tree, clauses, noun_verb_rules);
		}
	},
	NounPhraseWithPreposition
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return decompose(tree, noun_phrases, noun_phrase_with_preposition_rules);
		}
	},
	NonfiniteVerbPhrase
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return decompose(tree, verb_phrases, nonfinite_verb_rules);
		}
	},
	IgnoredConstituent
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return test(tree, ignored_labels.contains(tree.getLabel()));
		}
	},
	Default
	{
		@Override
		public Optional<Match> match(ConstituencyTree tree)
		{
			return test(tree, true);
		}
	};

	public abstract Optional<Match> match(ConstituencyTree tree);

	/**
	 * Returns the match of the highest priority extractor applicable to the tree.
	 */
	public static Match classify(ConstituencyTree tree)
	{
		return Arrays.stream(values())
				.map(e -> e.match(tree))
				.flatMap(Optional::stream)
				.findFirst()
				.orElseThrow(() -> new IllegalStateException("No extractor for " + tree));
	}

	Optional<Match> test(ConstituencyTree tree, boolean matches)
	{
		return matches ? Optional.of(new Match(this, tree, null)) : Optional.empty();
	}

	Optional<Match> decompose(ConstituencyTree tree, Set<String> labels, Set<Pair<String, String>> rules)
	{
		if (!labels.contains(tree.getLabel()))
			return Optional.empty();
		return tree.matchBinaryRule(rules).map(children -> new Match(this, tree, children));
	}
}
