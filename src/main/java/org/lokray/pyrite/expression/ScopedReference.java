package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;
import org.lokray.pyrite.symbol.QualifiedReference;
import org.lokray.pyrite.symbol.ScopeNames;

/**
 * A reference by C++ name. A scoped name is resolved against the tree when the
 * reference is attached, which fixes the spelling it is emitted with and the
 * import the attaching module needs. Subclasses decide whether a bare name is
 * resolved too.
 */
public abstract class ScopedReference implements Expression
{
	private final String ref;
	private String displayName;

	protected ScopedReference(String ref)
	{
		this.ref = ref;
	}

	public String getRef()
	{
		return ref;
	}

	/**
	 * The spelling used for a name without a scope separator.
	 */
	protected abstract String unscopedName();

	/**
	 * Whether a name without a scope separator is still looked up from the root.
	 */
	protected boolean resolvesUnscoped()
	{
		return false;
	}

	public String getDisplayName()
	{
		if (displayName != null)
		{
			return displayName;
		}
		// Not attached yet; fall back to the dotted source spelling.
		return ScopeNames.isQualified(ref) ? ScopeNames.toDotted(ScopeNames.strip(ref)) : unscopedName();
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		if (ScopeNames.isQualified(ref) || resolvesUnscoped())
		{
			QualifiedReference resolved = QualifiedReference.resolve(module, ref);
			displayName = resolved.getDisplayName();
			resolved.recordImport(module);
		}
		else
		{
			displayName = unscopedName();
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write(getDisplayName());
	}

	@Override
	public String toString()
	{
		return "<" + getClass().getSimpleName() + " " + ref + ">";
	}
}
