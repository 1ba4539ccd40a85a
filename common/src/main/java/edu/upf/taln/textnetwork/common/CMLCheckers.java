package edu.upf.taln.textnetwork.common;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Enums;
import edu.upf.taln.textnetwork.core.io.NetworkWriter.Format;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class IntegerConverter implements IStringConverter<Integer>
	{
		@Override
		public Integer convert(String value) { return Integer.parseInt(value); }
	}

	public static class FormatConverter implements IStringConverter<Format>
	{
		@Override
		public Format convert(String value) { return Format.valueOf(value.toUpperCase()); }
	}

	public static class ValidPathToFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isDirectory(path)) || path.getParent() == null || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot write to file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class IntegerGreaterThanZero implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				int n = Integer.parseInt(value);
				if (n < 1)
					throw new ParameterException("Value must be greater than 0: " + value);
			}
			catch (NumberFormatException e)
			{
				throw new ParameterException("Parameter " + name + " is not an integer: " + value);
			}
		}
	}

	public static class FormatValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (!Enums.getIfPresent(Format.class, value.toUpperCase()).isPresent())
				throw new ParameterException("Parameter " + name + " has invalid value " + value);
		}
	}
}
