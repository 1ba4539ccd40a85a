package edu.upf.taln.textnetwork.common;

import com.beust.jcommander.ParameterException;
import edu.upf.taln.textnetwork.core.io.NetworkWriter.Format;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;

import static org.junit.Assert.*;

public class CMLCheckersTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void convertsFormats()
	{
		assertEquals(Format.GEXF, new CMLCheckers.FormatConverter().convert("GEXF"));
		assertEquals(Format.DOT, new CMLCheckers.FormatConverter().convert("dot"));
		new CMLCheckers.FormatValidator().validate("-f", "Dot");
		assertThrows(ParameterException.class, () -> new CMLCheckers.FormatValidator().validate("-f", "graphml"));
	}

	@Test
	public void validatesThreads()
	{
		new CMLCheckers.IntegerGreaterThanZero().validate("-t", "4");
		assertThrows(ParameterException.class, () -> new CMLCheckers.IntegerGreaterThanZero().validate("-t", "0"));
		assertThrows(ParameterException.class, () -> new CMLCheckers.IntegerGreaterThanZero().validate("-t", "many"));
	}

	@Test
	public void validatesInputFiles() throws Exception
	{
		final File file = folder.newFile("trees.mrg");
		new CMLCheckers.PathToExistingFile().validate("-i", file.getPath());
		assertThrows(ParameterException.class,
				() -> new CMLCheckers.PathToExistingFile().validate("-i", folder.getRoot().getPath()));
		assertThrows(ParameterException.class,
				() -> new CMLCheckers.PathToExistingFile().validate("-i", new File(folder.getRoot(), "none.mrg").getPath()));
	}

	@Test
	public void validatesOutputFiles()
	{
		new CMLCheckers.ValidPathToFile().validate("-o", new File(folder.getRoot(), "out.gexf").getPath());
		new CMLCheckers.ValidPathToFile().validate("-o", "out.gexf");
		assertThrows(ParameterException.class,
				() -> new CMLCheckers.ValidPathToFile().validate("-o", folder.getRoot().getPath()));
		assertThrows(ParameterException.class,
				() -> new CMLCheckers.ValidPathToFile().validate("-o", new File(folder.getRoot(), "a/b/out.gexf").getPath()));
	}
}
