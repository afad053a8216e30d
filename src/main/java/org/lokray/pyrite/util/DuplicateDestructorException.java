package org.lokray.pyrite.util;

public class DuplicateDestructorException extends TranslationException
{
	public DuplicateDestructorException(String className)
	{
		super("Cannot handle multiple destructors for " + className);
	}
}
