package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;

/**
 * A destructor. One without statements is a placeholder that a later full
 * definition may replace.
 */
public class DestructorSymbol extends CallableSymbol
{
	private final ClassSymbol owner;

	public DestructorSymbol(ClassSymbol owner)
	{
		super(owner, null);
		this.owner = owner;
	}

	@Override
	public void attach()
	{
		owner.addDestructor(this);
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.clearMinorBlock();
		out.write("def __del__(self):");
		emitBody(out, "pass");
	}

	@Override
	public String toString()
	{
		return "<DestructorSymbol " + owner.getFullName() + ">";
	}
}
