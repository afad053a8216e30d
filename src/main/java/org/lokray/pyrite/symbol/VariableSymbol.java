package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.expression.Expression;

/**
 * A variable declaration, either at module level or as a statement in a body.
 */
public class VariableSymbol extends Declaration
{
	private final Expression value;

	public VariableSymbol(Scope scope, String name)
	{
		this(scope, name, null);
	}

	public VariableSymbol(Scope scope, String name, Expression value)
	{
		super(scope, name);
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
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
		out.write(getName() + " = ");
		if (value != null)
		{
			value.emit(out);
		}
		else
		{
			out.write("None");
		}
		out.clearLine();
	}
}
