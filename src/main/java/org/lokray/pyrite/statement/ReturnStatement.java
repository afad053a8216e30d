package org.lokray.pyrite.statement;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.expression.Expression;
import org.lokray.pyrite.symbol.ModuleSymbol;
import org.lokray.pyrite.symbol.Node;

public class ReturnStatement implements Node
{
	private Expression value;

	public ReturnStatement()
	{
	}

	public ReturnStatement(Expression value)
	{
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	public void setValue(Expression value)
	{
		this.value = value;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		if (value != null)
		{
			value.addImports(module);
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write("return");
		if (value != null)
		{
			out.write(" ");
			value.emit(out);
		}
		out.clearLine();
	}
}
