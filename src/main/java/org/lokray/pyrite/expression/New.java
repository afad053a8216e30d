package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code new T(args)}, which in Python is a plain call of the class.
 */
public class New implements Expression
{
	private final TypeReference type;
	private final List<Expression> arguments = new ArrayList<>();

	public New(TypeReference type)
	{
		this.type = type;
	}

	public TypeReference getType()
	{
		return type;
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
		type.addImports(module);
		for (Expression argument : arguments)
		{
			argument.addImports(module);
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		type.emit(out);
		Invoke.emitArguments(out, arguments);
	}

	@Override
	public String toString()
	{
		return "<New " + type.getRef() + ">";
	}
}
