package org.lokray.pyrite.util;

import java.util.List;

public class ConstructorOverloadException extends TranslationException
{
	public ConstructorOverloadException(String className, List<String> signature)
	{
		super("Multiple constructors for class " + className + " (adding [" + String.join(",", signature) + "])");
	}
}
