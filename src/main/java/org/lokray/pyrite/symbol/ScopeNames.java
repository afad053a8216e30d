package org.lokray.pyrite.symbol;

import java.util.Arrays;
import java.util.List;

public class ScopeNames
{
	public static final String SEPARATOR = "::";

	// Removed literally, wherever they occur. "constant" becomes "ant".
	private static final String[] QUALIFIERS = {"const", "class", "virtual"};

	/**
	 * Removes cosmetic C++ qualifiers and all spaces from a type or name spelling.
	 */
	public static String strip(String name)
	{
		for (String qualifier : QUALIFIERS)
		{
			name = name.replace(qualifier, "");
		}
		return name.replace(" ", "");
	}

	public static boolean isQualified(String name)
	{
		return name.contains(SEPARATOR);
	}

	/**
	 * Splits on the scope separator. A leading separator yields an empty first segment.
	 */
	public static List<String> split(String name)
	{
		return Arrays.asList(name.split(SEPARATOR, -1));
	}

	public static String join(String parent, String name)
	{
		if (parent == null || parent.isEmpty())
		{
			return name;
		}
		return parent + SEPARATOR + name;
	}

	public static String toDotted(String qualifiedName)
	{
		return qualifiedName.replace(SEPARATOR, ".");
	}
}
