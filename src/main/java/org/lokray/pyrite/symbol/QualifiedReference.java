package org.lokray.pyrite.symbol;

import org.lokray.pyrite.util.NameResolutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A scoped C++ name split into the Python module that declares it and the
 * dotted path of the symbol inside that module.
 * <p>
 * For {@code geometry::shapes::Point::Origin} where {@code geometry} and
 * {@code shapes} are modules, the scope is {@code geometry.shapes}, the
 * declaring module is {@code shapes} and the relative path is {@code Point.Origin}.
 */
public class QualifiedReference
{
	private final String scope;
	private final ModuleSymbol declaringModule;
	private final List<String> nameParts;
	private final Declaration target;

	private QualifiedReference(String scope, ModuleSymbol declaringModule, List<String> nameParts, Declaration target)
	{
		this.scope = scope;
		this.declaringModule = declaringModule;
		this.nameParts = nameParts;
		this.target = target;
	}

	/**
	 * Walks {@code ref} from the root of {@code module}'s tree.
	 *
	 * @throws NameResolutionException if a segment does not exist
	 */
	public static QualifiedReference resolve(ModuleSymbol module, String ref)
	{
		Scope root = module.getRoot();
		if (!(root instanceof ModuleSymbol rootModule))
		{
			throw new IllegalStateException("Tree of " + module + " is not rooted in a module");
		}

		List<String> parts = ScopeNames.split(ScopeNames.strip(ref));
		if (!parts.isEmpty() && parts.get(0).isEmpty())
		{
			parts = parts.subList(1, parts.size());
		}

		List<String> scopeParts = new ArrayList<>();
		if (rootModule.getName() != null && !rootModule.getName().isEmpty())
		{
			scopeParts.add(rootModule.getName());
		}

		ModuleSymbol declaringModule = null;
		List<String> nameParts = new ArrayList<>();
		Declaration candidate = rootModule;
		Scope last = rootModule;
		for (String part : parts)
		{
			if (!(candidate instanceof Scope))
			{
				throw new NameResolutionException(ref, last.getFullName());
			}
			last = (Scope) candidate;
			Declaration next = last.resolveMember(part);

			if (declaringModule == null && next instanceof ModuleSymbol)
			{
				scopeParts.add(part);
			}
			else
			{
				if (declaringModule == null)
				{
					declaringModule = (ModuleSymbol) last;
				}
				nameParts.add(part);
			}
			candidate = next;
		}

		if (declaringModule == null)
		{
			// Every segment named a module.
			declaringModule = candidate instanceof ModuleSymbol ? (ModuleSymbol) candidate : rootModule;
		}
		return new QualifiedReference(String.join(".", scopeParts), declaringModule, nameParts, candidate);
	}

	/**
	 * Adds the import {@code module} needs to see this name, if it is declared elsewhere.
	 */
	public void recordImport(ModuleSymbol module)
	{
		if (declaringModule == module || scope.isEmpty())
		{
			return;
		}
		module.addImport(scope, getImportedSymbol());
	}

	public boolean isModuleReference()
	{
		return nameParts.isEmpty();
	}

	/**
	 * The leading relative segment, or {@code null} when the reference names a module.
	 */
	public String getImportedSymbol()
	{
		return nameParts.isEmpty() ? null : nameParts.get(0);
	}

	/**
	 * How the name is spelled in the referencing module once the import is in place.
	 */
	public String getDisplayName()
	{
		return nameParts.isEmpty() ? scope : String.join(".", nameParts);
	}

	public String getScope()
	{
		return scope;
	}

	public ModuleSymbol getDeclaringModule()
	{
		return declaringModule;
	}

	public List<String> getNameParts()
	{
		return Collections.unmodifiableList(nameParts);
	}

	public Declaration getTarget()
	{
		return target;
	}
}
