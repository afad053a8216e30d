package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.util.Debug;
import org.lokray.pyrite.util.TranslationSession;

/**
 * A node that belongs to a scope. A named declaration registers itself in that
 * scope's table as soon as it is constructed; an anonymous one (name {@code null})
 * does not.
 */
public abstract class Declaration implements Node
{
	private final Scope scope;
	private final String name;

	protected Declaration(Scope scope, String name)
	{
		this.scope = scope;
		this.name = name;

		if (scope != null && name != null)
		{
			scope.define(name, this);
		}
	}

	public String getName()
	{
		return name;
	}

	public Scope getScope()
	{
		return scope;
	}

	/**
	 * The {@code ::}-joined names from the root down to this declaration.
	 * Anonymous ancestors and an unnamed root contribute no segment.
	 */
	public String getFullName()
	{
		String parent = scope == null ? "" : scope.getFullName();
		if (name == null || name.isEmpty())
		{
			return parent;
		}
		return ScopeNames.join(parent, name);
	}

	public Scope getRoot()
	{
		Declaration current = this;
		while (current.getScope() != null)
		{
			current = current.getScope();
		}
		return current instanceof Scope ? (Scope) current : null;
	}

	/**
	 * The nearest module enclosing this declaration, or {@code null} for the root.
	 */
	public ModuleSymbol getModule()
	{
		Scope current = scope;
		while (current != null && !(current instanceof ModuleSymbol))
		{
			current = current.getScope();
		}
		return (ModuleSymbol) current;
	}

	public TranslationSession getSession()
	{
		Scope root = getRoot();
		if (root instanceof ModuleSymbol module && module.getOwnSession() != null)
		{
			return module.getOwnSession();
		}
		throw new IllegalStateException("No translation session reachable from " + this);
	}

	/**
	 * Files this declaration into its semantic parent. The default files it into
	 * an enclosing module or class.
	 */
	public void attach()
	{
		if (scope instanceof DeclarationContainer container)
		{
			Debug.logDebug("Attaching " + this + " to " + scope);
			container.addDeclaration(this);
		}
		else
		{
			throw new IllegalStateException("Cannot attach " + this + " to " + scope);
		}
	}

	/**
	 * Module-level declarations are set apart by two blank lines, members by one.
	 */
	protected void separate(CodeWriter out)
	{
		if (scope instanceof ModuleSymbol)
		{
			out.clearMajorBlock();
		}
		else
		{
			out.clearMinorBlock();
		}
	}

	@Override
	public String toString()
	{
		String fullName = getFullName();
		return "<" + getClass().getSimpleName() + (fullName.isEmpty() ? "" : " " + fullName) + ">";
	}
}
