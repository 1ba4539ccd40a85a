package edu.upf.taln.textnetwork.text;

import com.google.common.base.Stopwatch;
import edu.upf.taln.textnetwork.core.GraphCompiler;
import edu.upf.taln.textnetwork.core.Options;
import edu.upf.taln.textnetwork.core.structures.ConstituencyTree;
import edu.upf.taln.textnetwork.core.structures.TextNetwork;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.stream.Collectors.toList;

/**
 * Compiles all sentences of a document into a single network.
 * With more than one thread each sentence is compiled into a private network, and private networks are merged
 * into the document network in sentence order.
 */
public class DocumentCompiler
{
	private final Options options;
	private final int threads;
	private final static int LOGGING_STEP_SIZE = 1000;
	private final static Logger log = LogManager.getLogger();

	public DocumentCompiler(Options options, int threads)
	{
		if (threads < 1)
			throw new IllegalArgumentException("Number of threads must be greater than 0: " + threads);
		this.options = new Options(options);
		this.threads = threads;
	}

	public TextNetwork compile(List<ConstituencyTree> sentences)
	{
		TextNetwork network = new TextNetwork();
		compile(sentences, network);
		return network;
	}

	public void compile(List<ConstituencyTree> sentences, TextNetwork network)
	{
		log.info("Compiling " + sentences.size() + " sentences with " + threads + " thread(s)");
		Stopwatch timer = Stopwatch.createStarted();

		if (threads == 1 || sentences.size() < 2)
			compileSequential(sentences, network);
		else
			compileParallel(sentences, network);

		log.info("Compilation took " + timer.stop());
	}

	private void compileSequential(List<ConstituencyTree> sentences, TextNetwork network)
	{
		GraphCompiler compiler = new GraphCompiler(network, options);
		long i = 0;
		for (ConstituencyTree sentence : sentences)
		{
			compiler.apply(sentence);
			if (++i % LOGGING_STEP_SIZE == 0) log.info(i + " sentences compiled");
		}
	}

	private void compileParallel(List<ConstituencyTree> sentences, TextNetwork network)
	{
		AtomicLong counter = new AtomicLong(0);
		ForkJoinPool pool = new ForkJoinPool(threads);
		try
		{
			final List<TextNetwork> networks = pool.submit(() -> sentences.parallelStream()
					.map(sentence ->
					{
						TextNetwork sentence_network = new TextNetwork();
						new GraphCompiler(sentence_network, options).apply(sentence);
						long i = counter.incrementAndGet();
						if (i % LOGGING_STEP_SIZE == 0) log.info(i + " sentences compiled");
						return sentence_network;
					})
					.collect(toList())).get();

			// sentence order
			networks.forEach(network::merge);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			log.error("Compilation interrupted");
			throw new RuntimeException("Compilation interrupted", e);
		}
		catch (ExecutionException e)
		{
			log.error("Compilation failed: " + e.getCause());
			throw new RuntimeException("Compilation failed", e.getCause());
		}
		finally
		{
			pool.shutdown();
		}
	}
}
