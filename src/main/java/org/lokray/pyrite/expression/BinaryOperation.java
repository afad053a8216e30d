package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.codegen.Operators;
import org.lokray.pyrite.symbol.ModuleSymbol;

public class BinaryOperation implements Expression
{
	private final Expression left;
	private final String operator;
	private final Expression right;

	public BinaryOperation(Expression left, String operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public String getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		left.addImports(module);
		right.addImports(module);
	}

	@Override
	public void emit(CodeWriter out)
	{
		left.emit(out);
		out.write(Operators.binary(operator));
		right.emit(out);
	}

	@Override
	public String toString()
	{
		return "<BinaryOperation " + operator + ">";
	}
}
