package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

public class ArraySubscript implements Expression
{
	private final Expression value;
	private final Expression index;

	public ArraySubscript(Expression value, Expression index)
	{
		this.value = value;
		this.index = index;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		value.addImports(module);
		index.addImports(module);
	}

	@Override
	public void emit(CodeWriter out)
	{
		value.emit(out);
		out.write("[");
		index.emit(out);
		out.write("]");
	}

	@Override
	public Expression cleanArgument()
	{
		return this;
	}
}
