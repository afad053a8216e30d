package org.lokray.pyrite.expression;

import org.lokray.pyrite.symbol.ScopeNames;

/**
 * A reference to a user-defined type. Type spellings may carry qualifiers such as
 * {@code const}, which are dropped. Every type name, scoped or not, is resolved
 * from the root of the tree, so a missing type fails on attach.
 */
public class TypeReference extends ScopedReference
{
	public TypeReference(String ref)
	{
		super(ref);
	}

	@Override
	protected String unscopedName()
	{
		return ScopeNames.strip(getRef());
	}

	@Override
	protected boolean resolvesUnscoped()
	{
		return true;
	}
}
