package edu.upf.taln.textnetwork.common;

import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils
{
	private final static Logger log = LogManager.getLogger();

	public static String readTextFile(Path file)
	{
		try
		{
			return org.apache.commons.io.FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			log.error("Cannot read file " + file + ": " + e);
			throw new RuntimeException("Cannot read file " + file, e);
		}
	}

	public static void writeTextToFile(Path file, String text)
	{
		try
		{
			org.apache.commons.io.FileUtils.writeStringToFile(file.toFile(), text, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			log.error("Cannot write to file " + file + ": " + e);
			throw new RuntimeException("Cannot write to file " + file, e);
		}
	}

	/**
	 * Path to a file in the output folder named after the input file, with its extension replaced.
	 * The output folder is created if it doesn't exist.
	 */
	public static Path createOutputPath(Path input_file, Path output_folder, String extension)
	{
		try
		{
			if (!Files.exists(output_folder))
			{
				Files.createDirectories(output_folder);
			}

			final String basename = FilenameUtils.getBaseName(input_file.getFileName().toString());
			return output_folder.resolve(basename + "." + extension);
		}
		catch (IOException e)
		{
			log.error("Cannot create output path: " + e);
			throw new RuntimeException("Cannot create output folder " + output_folder, e);
		}
	}
}
