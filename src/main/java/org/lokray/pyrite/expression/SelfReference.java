package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

public class SelfReference implements Expression
{
	@Override
	public void addImports(ModuleSymbol module)
	{
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write("self");
	}
}
