package org.lokray.pyrite.util;

import java.util.List;

/**
 * Options that shape a translation. Parsed from flags in the same form the
 * driver receives them, or taken from {@link #defaults()}.
 */
public class TranslatorOptions
{
	public static final int DEFAULT_INDENT = 4;

	private boolean verboseFlag = false;
	private boolean quietFlag = false;
	private int indentWidth = DEFAULT_INDENT;
	private OverloadPolicy overloadPolicy = OverloadPolicy.WARN;

	// Private constructor, use parse() or defaults()
	private TranslatorOptions()
	{
	}

	public static TranslatorOptions defaults()
	{
		return new TranslatorOptions();
	}

	public static TranslatorOptions parse(String... args)
	{
		TranslatorOptions options = new TranslatorOptions();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			// --- Flags with no argument ---
			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				options.verboseFlag = true;
				Debug.ENABLE_DEBUG = true;
				continue;
			}
			if (arg.equals("--quiet"))
			{
				options.quietFlag = true;
				continue;
			}

			// --- Flags with one argument ---
			if (arg.equals("--indent"))
			{
				String value = getNextArg(args, ++i, arg);
				try
				{
					options.indentWidth = Integer.parseInt(value);
				}
				catch (NumberFormatException e)
				{
					throw new IllegalArgumentException("Invalid value for --indent: " + value, e);
				}
				if (options.indentWidth < 1)
				{
					throw new IllegalArgumentException("Invalid value for --indent: " + value);
				}
				continue;
			}
			if (arg.startsWith("--overloads="))
			{
				String level = arg.substring(arg.indexOf('=') + 1);
				if (!List.of("warn", "fail").contains(level))
				{
					throw new IllegalArgumentException("Invalid value for --overloads: " + level);
				}
				options.overloadPolicy = OverloadPolicy.valueOf(level.toUpperCase());
				continue;
			}

			throw new IllegalArgumentException("Unknown option: " + arg);
		}

		return options;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isQuietFlag()
	{
		return quietFlag;
	}

	public int getIndentWidth()
	{
		return indentWidth;
	}

	public String getIndentUnit()
	{
		return " ".repeat(indentWidth);
	}

	public OverloadPolicy getOverloadPolicy()
	{
		return overloadPolicy;
	}
}
