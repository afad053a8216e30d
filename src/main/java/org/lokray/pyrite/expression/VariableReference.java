package org.lokray.pyrite.expression;

public class VariableReference extends ScopedReference
{
	public VariableReference(String ref)
	{
		super(ref);
	}

	@Override
	protected String unscopedName()
	{
		return getRef();
	}
}
