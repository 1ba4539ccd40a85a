package edu.upf.taln.textnetwork.text;

import edu.upf.taln.textnetwork.common.CompilerProperties;
import edu.upf.taln.textnetwork.core.io.NetworkWriter.Format;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.Assert.*;

public class DriverTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path copySentences() throws Exception
	{
		final Path source = Paths.get(getClass().getResource("/sentences.mrg").toURI());
		final Path input = folder.getRoot().toPath().resolve("sentences.mrg");
		Files.copy(source, input);
		return input;
	}

	@Test
	public void commandLineOverridesProperties()
	{
		Properties prop = new Properties();
		prop.setProperty("tn.output.format", "DOT");
		prop.setProperty("tn.threads", "3");
		final CompilerProperties properties = new CompilerProperties(prop);

		final Driver.Settings defaults = new Driver.Settings(properties, null, null, false, false);
		assertEquals(Format.DOT, defaults.format);
		assertEquals(3, defaults.threads);
		assertFalse(defaults.verbose);

		final Driver.Settings overridden = new Driver.Settings(properties, Format.GEXF, 1, true, true);
		assertEquals(Format.GEXF, overridden.format);
		assertEquals(1, overridden.threads);
		assertTrue(overridden.verbose);
		assertTrue(overridden.eol_only);
	}

	@Test
	public void defaultOutputPath()
	{
		final Driver.Settings settings = new Driver.Settings(new CompilerProperties(new Properties()), Format.DOT, null, false, false);
		final Path input = folder.getRoot().toPath().resolve("news.mrg");

		assertEquals(folder.getRoot().toPath().resolve("out").resolve("news.dot"), Driver.getOutputPath(input, null, settings));
		assertEquals(Paths.get("graph.gv"), Driver.getOutputPath(input, Paths.get("graph.gv"), settings));

		settings.output_folder = folder.getRoot().toPath().resolve("networks");
		assertEquals(settings.output_folder.resolve("news.dot"), Driver.getOutputPath(input, null, settings));
	}

	@Test
	public void compilesTreesFile() throws Exception
	{
		final Path input = copySentences();
		final Path output = folder.getRoot().toPath().resolve("sentences.gexf");

		Driver.main(new String[]{"compile_trees", "-i", input.toString(), "-o", output.toString(), "-t", "2"});

		final String gexf = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
		assertTrue(gexf.contains("<gexf"));
		assertTrue(gexf.contains("chased"));
		assertTrue(gexf.contains("id=\"house\""));
	}

	@Test
	public void writesDotToDefaultFolder() throws Exception
	{
		final Path input = copySentences();

		Driver.main(new String[]{"compile_trees", "-i", input.toString(), "-f", "dot", "-v"});

		final Path output = folder.getRoot().toPath().resolve("out").resolve("sentences.dot");
		assertTrue(Files.exists(output));
		final String dot = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
		assertTrue(dot.contains("\"Mary\" -> \"John\""));
	}
}
