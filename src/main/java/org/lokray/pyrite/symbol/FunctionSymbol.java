package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;

public class FunctionSymbol extends CallableSymbol
{
	public FunctionSymbol(Scope enclosingScope, String name)
	{
		super(enclosingScope, name);
	}

	@Override
	public void emit(CodeWriter out)
	{
		separate(out);
		out.write("def " + getName() + "(");
		emitParameters(out, false);
		out.write("):");
		emitBody(out, "pass");
	}
}
