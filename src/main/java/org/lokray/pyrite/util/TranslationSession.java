package org.lokray.pyrite.util;

/**
 * Per-unit state shared by every node of one tree: the options it was built
 * with and the diagnostics it reports into. Owned by the root module.
 */
public class TranslationSession
{
	private final TranslatorOptions options;
	private final Diagnostics diagnostics;

	public TranslationSession()
	{
		this(TranslatorOptions.defaults());
	}

	public TranslationSession(TranslatorOptions options)
	{
		this.options = options;
		this.diagnostics = new Diagnostics(options.isQuietFlag());
	}

	public TranslatorOptions getOptions()
	{
		return options;
	}

	public Diagnostics getDiagnostics()
	{
		return diagnostics;
	}
}
