package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A call, {@code callee(arg0, arg1, ...)}.
 */
public class Invoke implements Expression
{
	private final Expression callee;
	private final List<Expression> arguments = new ArrayList<>();

	public Invoke(Expression callee)
	{
		this.callee = callee;
	}

	public void addArgument(Expression argument)
	{
		arguments.add(argument);
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		callee.addImports(module);
		for (Expression argument : arguments)
		{
			argument.addImports(module);
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		callee.emit(out);
		emitArguments(out, arguments);
	}

	static void emitArguments(CodeWriter out, List<Expression> arguments)
	{
		out.write("(");
		for (int i = 0; i < arguments.size(); i++)
		{
			if (i != 0)
			{
				out.write(", ");
			}
			arguments.get(i).emit(out);
		}
		out.write(")");
	}
}
