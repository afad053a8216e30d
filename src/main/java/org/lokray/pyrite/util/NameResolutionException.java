package org.lokray.pyrite.util;

public class NameResolutionException extends TranslationException
{
	private final String query;
	private final String scopeName;

	public NameResolutionException(String query, String scopeName)
	{
		super("Cannot resolve '" + query + "' in " + (scopeName == null || scopeName.isEmpty() ? "<root>" : scopeName));
		this.query = query;
		this.scopeName = scopeName;
	}

	public String getQuery()
	{
		return query;
	}

	public String getScopeName()
	{
		return scopeName;
	}
}
