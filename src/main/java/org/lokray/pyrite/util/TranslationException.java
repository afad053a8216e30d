package org.lokray.pyrite.util;

/**
 * Base class for errors that abort translation of the current unit.
 */
public class TranslationException extends RuntimeException
{
	public TranslationException(String message)
	{
		super(message);
	}
}
