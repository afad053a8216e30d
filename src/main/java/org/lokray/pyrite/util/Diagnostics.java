package org.lokray.pyrite.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the non-fatal problems found while a tree is being built.
 * Each warning is also routed through {@link Debug#logWarning(String)} unless
 * the collector is quiet.
 */
public class Diagnostics
{
	private final List<String> warnings = new ArrayList<>();
	private final boolean quiet;

	public Diagnostics()
	{
		this(false);
	}

	public Diagnostics(boolean quiet)
	{
		this.quiet = quiet;
	}

	public void warn(String msg)
	{
		warnings.add(msg);
		if (!quiet)
		{
			Debug.logWarning("[Warning] " + msg);
		}
	}

	public boolean hasWarnings()
	{
		return !warnings.isEmpty();
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
