package edu.upf.taln.textnetwork.common;

import com.google.common.base.Enums;
import edu.upf.taln.textnetwork.core.io.NetworkWriter.Format;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Default settings for the command-line driver, read from a properties file.
 * Keys: tn.output.format, tn.output.folder, tn.threads, tn.verbose, tn.parser.eolonly
 */
public class CompilerProperties
{
	private Format format = Format.GEXF;
	private Path outputFolder = null;
	private int threads = 1;
	private boolean verbose = false;
	private boolean eolOnly = false;

	private final static String default_file = "textnetwork.properties";
	private final static Logger log = LogManager.getLogger();

	/**
	 * Loads textnetwork.properties from the classpath, or keeps the defaults if there is none
	 */
	public CompilerProperties()
	{
		Properties prop = new Properties();
		try (InputStream input = CompilerProperties.class.getClassLoader().getResourceAsStream(default_file))
		{
			if (input == null)
			{
				log.debug("No " + default_file + " found in classpath, using default settings");
				return;
			}
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties: " + e);
			throw new RuntimeException("Cannot load " + default_file, e);
		}

		load(prop);
	}

	public CompilerProperties(Path file)
	{
		Properties prop = new Properties();
		try (InputStream input = Files.newInputStream(file))
		{
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties from " + file + ": " + e);
			throw new RuntimeException("Cannot load properties file " + file, e);
		}

		load(prop);
	}

	public CompilerProperties(Properties prop)
	{
		load(prop);
	}

	private void load(Properties prop)
	{
		final String format_value = prop.getProperty("tn.output.format");
		if (format_value != null && !format_value.isEmpty())
			format = Enums.getIfPresent(Format.class, format_value.trim().toUpperCase())
					.toJavaUtil()
					.orElseThrow(() -> new RuntimeException(format_value + " is not a valid output format"));
		outputFolder = checkValidFolder(prop.getProperty("tn.output.folder"));
		threads = checkPositiveInteger(prop.getProperty("tn.threads"), threads);
		verbose = checkBoolean(prop.getProperty("tn.verbose"), verbose);
		eolOnly = checkBoolean(prop.getProperty("tn.parser.eolonly"), eolOnly);
	}

	public Format getFormat() { return format; }
	public Path getOutputFolder() { return outputFolder; }
	public int getThreads() { return threads; }
	public boolean isVerbose() { return verbose; }
	public boolean isEolOnly() { return eolOnly; }

	@Override
	public String toString()
	{
		return "Properties:" +
				"\n\tformat = " + format +
				"\n\toutput folder = " + outputFolder +
				"\n\tthreads = " + threads +
				"\n\tverbose = " + verbose +
				"\n\teol only = " + eolOnly;
	}

	// The folder may not exist yet, but mustn't be a file
	private static Path checkValidFolder(String value)
	{
		if (value == null || value.isEmpty())
			return null;

		Path path = Paths.get(value.trim());
		if (Files.exists(path) && !Files.isDirectory(path))
		{
			throw new RuntimeException(value + " is not a valid folder");
		}
		return path;
	}

	private static int checkPositiveInteger(String value, int default_value)
	{
		if (value == null || value.isEmpty())
			return default_value;

		try
		{
			int n = Integer.parseInt(value.trim());
			if (n < 1)
				throw new RuntimeException(value + " is not a positive integer");
			return n;
		}
		catch (NumberFormatException e)
		{
			throw new RuntimeException(value + " is not a valid integer", e);
		}
	}

	private static boolean checkBoolean(String value, boolean default_value)
	{
		if (value == null || value.isEmpty())
			return default_value;

		final String v = value.trim();
		if (v.equalsIgnoreCase("true"))
			return true;
		if (v.equalsIgnoreCase("false"))
			return false;
		throw new RuntimeException(value + " is not a valid boolean");
	}
}
