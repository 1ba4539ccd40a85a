package edu.upf.taln.textnetwork.core.extraction;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Set;

/**
 * Penn Treebank labels and binary rules recognised by the extractors. Labels starting with '@' are the
 * intermediate categories introduced by binarized grammars.
 */
public final class Grammar
{
	public static final Set<String> verb_tags = ImmutableSet.of("VB", "VBD", "VBZ", "VBP", "VBG", "VBN");
	public static final Set<String> noun_tags = ImmutableSet.of("NN", "NNS", "NNP", "NNPS");
	public static final Set<String> ignored_labels = ImmutableSet.of("ADVP", "X", "@X", "NX", "@NX", "DT", "JJ",
			"JJS", "JJR", "-LRB-", "-RRB-", "PRN");

	public static final Set<String> verb_phrases = ImmutableSet.of("VP", "@VP");
	public static final Set<String> predicate_phrases = ImmutableSet.of("VP", "@VP", "PP");
	public static final Set<String> noun_phrases = ImmutableSet.of("NP", "@NP");
	public static final Set<String> clauses = ImmutableSet.of("S", "@S", "NP");

	public static final Set<Pair<String, String>> noun_adjunct_rules = ImmutableSet.of(
			Pair.of("NN", "NNS"), Pair.of("NN", "NN"), Pair.of("NN", "NNPS"),
			Pair.of("NNP", "NNS"), Pair.of("NNP", "NN"), Pair.of("NNP", "NNPS"),
			Pair.of("@NP", "NNS"), Pair.of("@NP", "NN"), Pair.of("@NP", "NNPS"));

	public static final Set<Pair<String, String>> divalent_rules = ImmutableSet.of(
			Pair.of("VB", "S"), Pair.of("VB", "NP"), Pair.of("VB", "PP"), Pair.of("VB", "SBAR"),
			Pair.of("VBD", "S"), Pair.of("VBD", "NP"), Pair.of("VBD", "PP"), Pair.of("VBD", "SBAR"),
			Pair.of("VBP", "S"), Pair.of("VBP", "NP"), Pair.of("VBP", "PP"), Pair.of("VBP", "SBAR"),
			Pair.of("VBG", "S"), Pair.of("VBG", "NP"), Pair.of("VBG", "PP"), Pair.of("VBG", "SBAR"),
			Pair.of("VBN", "S"), Pair.of("VBN", "NP"), Pair.of("VBN", "PP"), Pair.of("VBN", "SBAR"),
			Pair.of("@VP", "PP"));

	public static final Set<Pair<String, String>> trivalent_rules = ImmutableSet.of(Pair.of("@VP", "NP"));

	public static final Set<Pair<String, String>> nonfinite_verb_rules = ImmutableSet.of(
			Pair.of("VBZ", "VP"), Pair.of("VB", "VP"),
			Pair.of("VBD", "VP"), Pair.of("VBP", "VP"),
			Pair.of("VBG", "VP"), Pair.of("VBN", "VP"),
			Pair.of("TO", "VP"), Pair.of("MD", "VP"));

	public static final Set<Pair<String, String>> noun_phrase_with_preposition_rules = ImmutableSet.of(
			Pair.of("NP", "PP"), Pair.of("@NP", "PP"));

	public static final Set<Pair<String, String>> noun_verb_rules = ImmutableSet.of(
			Pair.of("NP", "VP"), Pair.of("@S", "VP"));

	private Grammar() {}
}
