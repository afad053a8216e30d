package org.lokray.pyrite.symbol;

public class UnionSymbol extends ClassSymbol
{
	public UnionSymbol(Scope enclosingScope, String name)
	{
		super(enclosingScope, name);
	}

	@Override
	public void addConstructor(ConstructorSymbol constructor)
	{
		getSession().getDiagnostics().warn("Ignoring constructor for union " + getName());
	}

	@Override
	public void addDestructor(DestructorSymbol destructor)
	{
		getSession().getDiagnostics().warn("Ignoring destructor for union " + getName());
	}
}
