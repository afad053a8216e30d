package org.lokray.pyrite.symbol;

import org.lokray.pyrite.util.Debug;
import org.lokray.pyrite.util.NameResolutionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A declaration that is also a namespace. Its table keeps insertion order and
 * only ever grows; a name reserved by {@link #declare(String)} maps to {@code null}
 * until a definition takes its place.
 */
public abstract class Scope extends Declaration
{
	private final Map<String, Declaration> symbols = new LinkedHashMap<>();

	protected Scope(Scope enclosingScope, String name)
	{
		super(enclosingScope, name);
	}

	void define(String name, Declaration declaration)
	{
		Debug.logDebug("Registering " + name + " in " + this);
		symbols.put(name, declaration);
	}

	/**
	 * Reserves {@code name} without a value. An existing definition is kept.
	 */
	public void declare(String name)
	{
		if (!symbols.containsKey(name))
		{
			symbols.put(name, null);
		}
	}

	public boolean isDeclared(String name)
	{
		return symbols.containsKey(name);
	}

	public Optional<Declaration> resolveLocally(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	/**
	 * Looks {@code name} up in this table only.
	 *
	 * @return the declaration, or {@code null} if the name is only forward-declared
	 * @throws NameResolutionException if the name is absent
	 */
	public Declaration resolveMember(String name)
	{
		if (!symbols.containsKey(name))
		{
			throw new NameResolutionException(name, getFullName());
		}
		return symbols.get(name);
	}

	/**
	 * Resolves a possibly qualified name as seen from this scope.
	 * <p>
	 * Qualifiers such as {@code const} are stripped first. An unqualified name is
	 * searched here and then in each enclosing scope up to the root. A qualified
	 * name is descended segment by segment from the root; if the root does not
	 * know the first segment, that segment is looked up outward from here instead.
	 * A leading {@code ::} pins the lookup to the root.
	 *
	 * @return the declaration, or {@code null} if the final name is only forward-declared
	 * @throws NameResolutionException if any segment cannot be found
	 */
	public Declaration resolve(String query)
	{
		String name = ScopeNames.strip(query);
		if (ScopeNames.isQualified(name))
		{
			return resolveQualified(query, ScopeNames.split(name));
		}

		Scope current = this;
		while (current != null)
		{
			if (current.symbols.containsKey(name))
			{
				return current.symbols.get(name);
			}
			current = current.getScope();
		}
		throw new NameResolutionException(query, getFullName());
	}

	private Declaration resolveQualified(String query, List<String> parts)
	{
		Scope root = getRoot();
		Scope start;
		if (parts.get(0).isEmpty())
		{
			parts = parts.subList(1, parts.size());
			start = root;
		}
		else if (root.symbols.containsKey(parts.get(0)))
		{
			start = root;
		}
		else
		{
			start = this;
			while (start != null && !start.symbols.containsKey(parts.get(0)))
			{
				start = start.getScope();
			}
			if (start == null)
			{
				throw new NameResolutionException(query, getFullName());
			}
		}

		Declaration current = start;
		Scope last = start;
		for (String part : parts)
		{
			if (!(current instanceof Scope))
			{
				throw new NameResolutionException(query, last.getFullName());
			}
			last = (Scope) current;
			if (!last.symbols.containsKey(part))
			{
				throw new NameResolutionException(query, last.getFullName());
			}
			current = last.symbols.get(part);
		}
		return current;
	}

	public Map<String, Declaration> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}
}
