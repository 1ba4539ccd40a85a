package edu.upf.taln.textnetwork.text;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.base.Stopwatch;
import edu.upf.taln.textnetwork.common.CMLCheckers;
import edu.upf.taln.textnetwork.common.CompilerProperties;
import edu.upf.taln.textnetwork.common.FileUtils;
import edu.upf.taln.textnetwork.core.Options;
import edu.upf.taln.textnetwork.core.io.ConstituencyTreeReader;
import edu.upf.taln.textnetwork.core.io.NetworkWriter;
import edu.upf.taln.textnetwork.core.io.NetworkWriter.Format;
import edu.upf.taln.textnetwork.core.structures.ConstituencyTree;
import edu.upf.taln.textnetwork.core.structures.TextNetwork;
import edu.upf.taln.textnetwork.core.utils.DebugUtils;
import edu.upf.taln.textnetwork.text.io.StanfordWrapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;

public class Driver
{
	private final static String default_output_folder = "out";
	private final static String compile_text_command = "compile_text";
	private final static String compile_trees_command = "compile_trees";
	private final static Logger log = LogManager.getLogger();

	/**
	 * Settings of a run, command-line values take precedence over those in the properties file
	 */
	static class Settings
	{
		Format format;
		Path output_folder;
		int threads;
		boolean verbose;
		boolean eol_only;

		Settings(CompilerProperties properties, Format format, Integer threads, boolean verbose, boolean eol_only)
		{
			this.format = format != null ? format : properties.getFormat();
			this.output_folder = properties.getOutputFolder();
			this.threads = threads != null ? threads : properties.getThreads();
			this.verbose = verbose || properties.isVerbose();
			this.eol_only = eol_only || properties.isEolOnly();
		}
	}

	void compile_text(Path text_file, Path output_file, Settings settings)
	{
		log.info("Running from " + text_file);
		final String text = FileUtils.readTextFile(text_file);

		StanfordWrapper parser = new StanfordWrapper(settings.eol_only);
		final List<ConstituencyTree> trees = parser.parse(text);
		compile(trees, text_file, output_file, settings);
	}

	void compile_trees(Path trees_file, Path output_file, Settings settings)
	{
		log.info("Running from " + trees_file);
		final String text = FileUtils.readTextFile(trees_file);

		final List<ConstituencyTree> trees = new ConstituencyTreeReader().read(text);
		compile(trees, trees_file, output_file, settings);
	}

	private void compile(List<ConstituencyTree> trees, Path input_file, Path output_file, Settings settings)
	{
		Stopwatch timer = Stopwatch.createStarted();
		Options options = new Options();
		options.verbose = settings.verbose;
		log.debug(options);

		DocumentCompiler compiler = new DocumentCompiler(options, settings.threads);
		final TextNetwork network = compiler.compile(trees);
		log.info(DebugUtils.printNetwork(network));

		final Path output = getOutputPath(input_file, output_file, settings);
		NetworkWriter writer = new NetworkWriter(settings.format);
		FileUtils.writeTextToFile(output, writer.write(network));
		log.info("Network written to " + output + " in " + timer.stop());
	}

	static Path getOutputPath(Path input_file, Path output_file, Settings settings)
	{
		if (output_file != null)
			return output_file;

		final Path output_folder = settings.output_folder != null ? settings.output_folder :
				input_file.toAbsolutePath().getParent().resolve(default_output_folder);
		return FileUtils.createOutputPath(input_file, output_folder, settings.format.getExtension());
	}

	@Parameters(commandDescription = "Parse a text with CoreNLP and compile it into a network")
	private static class CompileTextCommand
	{
		@Parameter(names = {"-i", "-input"}, description = "Input text file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path inputFile;
		@Parameter(names = {"-o", "-output"}, description = "Output file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path outputFile;
		@Parameter(names = {"-f", "-format"}, description = "Output format (GEXF or DOT)", arity = 1,
				converter = CMLCheckers.FormatConverter.class, validateWith = CMLCheckers.FormatValidator.class)
		private Format format;
		@Parameter(names = {"-l", "-lines"}, description = "Treat each line of the input as a sentence")
		private boolean eol_only = false;
		@Parameter(names = {"-t", "-threads"}, description = "Number of threads used to compile sentences", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		private Integer threads;
		@Parameter(names = {"-v", "-verbose"}, description = "Log the propositions extracted from each sentence")
		private boolean verbose = false;
		@Parameter(names = {"-p", "-properties"}, description = "Properties file with default settings", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path properties;
	}

	@Parameters(commandDescription = "Compile a file of bracketed constituency trees into a network")
	private static class CompileTreesCommand
	{
		@Parameter(names = {"-i", "-input"}, description = "Input file with bracketed trees", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path inputFile;
		@Parameter(names = {"-o", "-output"}, description = "Output file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path outputFile;
		@Parameter(names = {"-f", "-format"}, description = "Output format (GEXF or DOT)", arity = 1,
				converter = CMLCheckers.FormatConverter.class, validateWith = CMLCheckers.FormatValidator.class)
		private Format format;
		@Parameter(names = {"-t", "-threads"}, description = "Number of threads used to compile sentences", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		private Integer threads;
		@Parameter(names = {"-v", "-verbose"}, description = "Log the propositions extracted from each sentence")
		private boolean verbose = false;
		@Parameter(names = {"-p", "-properties"}, description = "Properties file with default settings", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path properties;
	}

	private static CompilerProperties loadProperties(Path file)
	{
		return file != null ? new CompilerProperties(file) : new CompilerProperties();
	}

	public static void main(String[] args)
	{
		CompileTextCommand compile_text = new CompileTextCommand();
		CompileTreesCommand compile_trees = new CompileTreesCommand();

		JCommander jc = new JCommander();
		jc.addCommand(compile_text_command, compile_text);
		jc.addCommand(compile_trees_command, compile_trees);

		try
		{
			jc.parse(args);
		}
		catch (ParameterException e)
		{
			log.error(e.getMessage());
			jc.usage();
			throw e;
		}

		if (jc.getParsedCommand() == null)
		{
			jc.usage();
			return;
		}

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		log.info(dateFormat.format(new Date()) + " running " + String.join(" ", args));
		log.debug("*********************************************************");

		Driver driver = new Driver();
		if (jc.getParsedCommand().equals(compile_text_command))
		{
			Settings settings = new Settings(loadProperties(compile_text.properties), compile_text.format,
					compile_text.threads, compile_text.verbose, compile_text.eol_only);
			driver.compile_text(compile_text.inputFile, compile_text.outputFile, settings);
		}
		else if (jc.getParsedCommand().equals(compile_trees_command))
		{
			Settings settings = new Settings(loadProperties(compile_trees.properties), compile_trees.format,
					compile_trees.threads, compile_trees.verbose, false);
			driver.compile_trees(compile_trees.inputFile, compile_trees.outputFile, settings);
		}
	}
}
