package org.lokray.pyrite.symbol;

/**
 * A C++ struct. Python gets only the synthesized attribute initializer, so user
 * constructors are dropped with a warning.
 */
public class StructSymbol extends ClassSymbol
{
	public StructSymbol(Scope enclosingScope, String name)
	{
		super(enclosingScope, name);
	}

	@Override
	public void addConstructor(ConstructorSymbol constructor)
	{
		getSession().getDiagnostics().warn("Ignoring constructor for struct " + getName());
	}
}
