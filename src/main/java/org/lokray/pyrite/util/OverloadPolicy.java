package org.lokray.pyrite.util;

/**
 * What a class does when a constructor with a new parameter signature is added
 * next to an existing one. Python has a single {@code __init__}, so the later
 * definition shadows the earlier ones at runtime.
 */
public enum OverloadPolicy
{
	/**
	 * Keep every signature and report a warning.
	 */
	WARN,
	/**
	 * Abort with a {@link ConstructorOverloadException}.
	 */
	FAIL
}
