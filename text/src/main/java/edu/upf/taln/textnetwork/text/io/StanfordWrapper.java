package edu.upf.taln.textnetwork.text.io;

import com.google.common.base.Stopwatch;
import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreSentence;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.trees.Tree;
import edu.stanford.nlp.util.logging.RedwoodConfiguration;
import edu.upf.taln.textnetwork.core.structures.ConstituencyTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Properties;

import static java.util.stream.Collectors.toList;

/**
 * Parses raw text into one constituency tree per sentence with Stanford CoreNLP.
 */
public class StanfordWrapper
{
	private final StanfordCoreNLP pipeline;
	private final static Logger log = LogManager.getLogger();

	public StanfordWrapper(boolean eol_only)
	{
		log.info("Setting up Stanford CoreNLP");
		Properties props = new Properties();
		props.setProperty("annotators", "tokenize,ssplit,pos,parse");
		if (eol_only)
			props.setProperty("ssplit.eolonly", "true"); // one sentence per line

		Stopwatch timer = Stopwatch.createStarted();
		RedwoodConfiguration.current().clear().apply(); // shut up, CoreNLP
		pipeline = new StanfordCoreNLP(props);
		log.info("CoreNLP pipeline created in " + timer.stop());
	}

	public List<ConstituencyTree> parse(String text)
	{
		log.info("Parsing text with CoreNLP");
		Stopwatch timer = Stopwatch.createStarted();

		CoreDocument document = new CoreDocument(text);
		pipeline.annotate(document);

		final List<ConstituencyTree> trees = document.sentences().stream()
				.map(CoreSentence::constituencyParse)
				.map(StanfordWrapper::convert)
				.collect(toList());

		log.info("Parsed " + trees.size() + " sentences in " + timer.stop());
		return trees;
	}

	private static ConstituencyTree convert(Tree tree)
	{
		if (tree == null)
			throw new IllegalStateException("CoreNLP failed to produce a constituency tree");
		return ConstituencyTree.of(tree);
	}
}
