package org.lokray.pyrite.codegen;

import org.lokray.pyrite.symbol.ModuleSymbol;
import org.lokray.pyrite.symbol.ScopeNames;
import org.lokray.pyrite.util.Debug;
import org.lokray.pyrite.util.TranslationException;
import org.lokray.pyrite.util.TranslatorOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a finished tree, one Python source per module.
 */
public class CodeGenerator
{
	private final TranslatorOptions options;

	public CodeGenerator()
	{
		this(TranslatorOptions.defaults());
	}

	public CodeGenerator(TranslatorOptions options)
	{
		this.options = options;
	}

	/**
	 * Emits a single module.
	 */
	public String generate(ModuleSymbol module)
	{
		PythonCodeWriter out = new PythonCodeWriter(options.getIndentUnit());
		module.emit(out);
		return out.toString();
	}

	/**
	 * Emits {@code root} and every module below it, parents before children,
	 * keyed by dotted module path.
	 */
	public Map<String, String> generateAll(ModuleSymbol root)
	{
		Map<String, String> sources = new LinkedHashMap<>();
		for (ModuleSymbol module : modules(root))
		{
			Debug.logDebug("Generating Python for module " + module.getPath());
			sources.put(module.getPath(), generate(module));
		}
		return sources;
	}

	/**
	 * Generates every module and writes it under {@code outputDir}. Nothing is
	 * written unless every module generates.
	 *
	 * @return the files written, in generation order
	 */
	public List<Path> writeTo(ModuleSymbol root, Path outputDir) throws IOException
	{
		Map<Path, String> files = new LinkedHashMap<>();
		try
		{
			for (ModuleSymbol module : modules(root))
			{
				files.put(outputDir.resolve(relativePath(module)), generate(module));
			}
		}
		catch (TranslationException e)
		{
			Debug.logError("Translation failed: " + e.getMessage());
			throw e;
		}

		List<Path> written = new ArrayList<>();
		for (Map.Entry<Path, String> file : files.entrySet())
		{
			Path target = file.getKey();
			if (target.getParent() != null)
			{
				Files.createDirectories(target.getParent());
			}
			Files.writeString(target, file.getValue());
			Debug.logInfo("Python written to " + target);
			written.add(target);
		}
		return written;
	}

	/**
	 * Where a module lives relative to the output directory. A module with
	 * submodules is a package and gets an {@code __init__.py}.
	 */
	public static Path relativePath(ModuleSymbol module)
	{
		List<String> segments = new ArrayList<>();
		for (String segment : ScopeNames.split(module.getFullName()))
		{
			if (!segment.isEmpty())
			{
				segments.add(segment);
			}
		}

		if (segments.isEmpty() || !module.getSubmodules().isEmpty())
		{
			segments.add("__init__.py");
		}
		else
		{
			int last = segments.size() - 1;
			segments.set(last, segments.get(last) + ".py");
		}
		return Path.of(segments.get(0), segments.subList(1, segments.size()).toArray(new String[0]));
	}

	private static List<ModuleSymbol> modules(ModuleSymbol root)
	{
		List<ModuleSymbol> modules = new ArrayList<>();
		collect(root, modules);
		return modules;
	}

	private static void collect(ModuleSymbol module, List<ModuleSymbol> modules)
	{
		modules.add(module);
		for (ModuleSymbol submodule : module.getSubmodules().values())
		{
			collect(submodule, modules);
		}
	}
}
