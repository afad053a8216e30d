package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.codegen.Operators;
import org.lokray.pyrite.symbol.ModuleSymbol;

/**
 * A prefix operator applied to one operand.
 */
public class UnaryOperation implements Expression
{
	private final String operator;
	private final Expression value;

	public UnaryOperation(String operator, Expression value)
	{
		this.operator = operator;
		this.value = value;
	}

	public String getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		value.addImports(module);
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write(Operators.unary(operator));
		value.emit(out);
	}

	/**
	 * Address-of and dereference are dropped, however deeply they nest.
	 */
	@Override
	public Expression cleanArgument()
	{
		if (operator.equals("&") || operator.equals("*"))
		{
			return value.cleanArgument();
		}
		return this;
	}

	@Override
	public String toString()
	{
		return "<UnaryOperation " + operator + ">";
	}
}
