package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

/**
 * Source parentheses. They survive only around operations that need them.
 */
public class Parentheses implements Expression
{
	private final Expression body;

	public Parentheses(Expression body)
	{
		this.body = body;
	}

	public Expression getBody()
	{
		return body;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		body.addImports(module);
	}

	@Override
	public void emit(CodeWriter out)
	{
		if (body instanceof BinaryOperation || body instanceof ConditionalOperation)
		{
			out.write("(");
			body.emit(out);
			out.write(")");
		}
		else
		{
			body.emit(out);
		}
	}
}
