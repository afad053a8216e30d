package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.util.Debug;
import org.lokray.pyrite.util.TranslationSession;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A Python module. The root of every tree is a module, and it owns the
 * {@link TranslationSession} the rest of the tree reports into.
 */
public class ModuleSymbol extends Scope implements DeclarationContainer
{
	private final Map<String, Declaration> declarations = new LinkedHashMap<>();
	private final Map<String, Set<String>> imports = new TreeMap<>();
	private final Map<String, ModuleSymbol> submodules = new LinkedHashMap<>();
	private final TranslationSession session;

	/**
	 * Creates a root module with a default session.
	 */
	public ModuleSymbol(String name)
	{
		this(name, new TranslationSession());
	}

	/**
	 * Creates a root module.
	 */
	public ModuleSymbol(String name, TranslationSession session)
	{
		super(null, name);
		this.session = session;
	}

	/**
	 * Creates a module nested in {@code parent}. It shares the root's session.
	 */
	public ModuleSymbol(String name, ModuleSymbol parent)
	{
		super(parent, name);
		this.session = null;
	}

	TranslationSession getOwnSession()
	{
		return session;
	}

	public boolean isRoot()
	{
		return getScope() == null;
	}

	@Override
	public void attach()
	{
		if (!(getScope() instanceof ModuleSymbol parent))
		{
			throw new IllegalStateException("Cannot attach " + this + ": it has no parent module");
		}
		parent.addSubmodule(this);
	}

	public void addSubmodule(ModuleSymbol module)
	{
		submodules.put(module.getName(), module);
	}

	@Override
	public void addDeclaration(Declaration declaration)
	{
		declarations.put(declaration.getName(), declaration);
		declaration.addImports(this);
	}

	/**
	 * Records that this module needs {@code symbol} from {@code path}. A
	 * {@code null} symbol asks for the module itself.
	 */
	public void addImport(String path, String symbol)
	{
		Set<String> symbols = imports.computeIfAbsent(path, k -> new TreeSet<>());
		if (symbol != null && symbols.add(symbol))
		{
			Debug.logDebug("Module " + getFullName() + " imports " + symbol + " from " + path);
		}
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
	}

	public Map<String, Set<String>> getImports()
	{
		return Collections.unmodifiableMap(imports);
	}

	public Map<String, Declaration> getDeclarations()
	{
		return Collections.unmodifiableMap(declarations);
	}

	public Map<String, ModuleSymbol> getSubmodules()
	{
		return Collections.unmodifiableMap(submodules);
	}

	/**
	 * The dotted Python path of this module, including a named root.
	 */
	public String getPath()
	{
		return ScopeNames.toDotted(getFullName());
	}

	@Override
	public void emit(CodeWriter out)
	{
		for (Map.Entry<String, Set<String>> entry : imports.entrySet())
		{
			if (entry.getValue().isEmpty())
			{
				out.write("import " + entry.getKey());
			}
			else
			{
				out.write("from " + entry.getKey() + " import " + String.join(", ", entry.getValue()));
			}
			out.clearLine();
		}

		out.clearMajorBlock();
		for (Declaration declaration : declarations.values())
		{
			out.clearMajorBlock();
			declaration.emit(out);
		}
		out.clearLine();
	}
}
