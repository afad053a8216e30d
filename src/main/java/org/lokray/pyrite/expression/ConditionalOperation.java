package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

/**
 * {@code c ? a : b}, emitted as Python's {@code a if c else b}.
 */
public class ConditionalOperation implements Expression
{
	private final Expression condition;
	private final Expression trueResult;
	private final Expression falseResult;

	public ConditionalOperation(Expression condition, Expression trueResult, Expression falseResult)
	{
		this.condition = condition;
		this.trueResult = trueResult;
		this.falseResult = falseResult;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		condition.addImports(module);
		trueResult.addImports(module);
		falseResult.addImports(module);
	}

	@Override
	public void emit(CodeWriter out)
	{
		trueResult.emit(out);
		out.write(" if ");
		condition.emit(out);
		out.write(" else ");
		falseResult.emit(out);
	}
}
