package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

/**
 * A literal value, emitted as its text. Java booleans and {@code null} take
 * their Python spellings.
 */
public class Literal implements Expression
{
	private final Object value;

	public Literal(Object value)
	{
		this.value = value;
	}

	public Object getValue()
	{
		return value;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
	}

	@Override
	public void emit(CodeWriter out)
	{
		if (value == null)
		{
			out.write("None");
		}
		else if (value instanceof Boolean b)
		{
			out.write(b ? "True" : "False");
		}
		else
		{
			out.write(String.valueOf(value));
		}
	}

	@Override
	public String toString()
	{
		return "<Literal " + value + ">";
	}
}
