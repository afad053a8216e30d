package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared shape of functions, methods, constructors and destructors: a scope
 * with a parameter list and a statement body.
 * <p>
 * Parameters and statements contribute their imports once the callable itself
 * has been attached; anything appended after that contributes immediately.
 */
public abstract class CallableSymbol extends Scope implements StatementContainer
{
	private final List<ParameterSymbol> parameters = new ArrayList<>();
	private final List<Node> statements = new ArrayList<>();
	private ModuleSymbol importTarget;

	protected CallableSymbol(Scope enclosingScope, String name)
	{
		super(enclosingScope, name);
	}

	public void addParameter(ParameterSymbol parameter)
	{
		parameter.setPosition(parameters.size());
		parameters.add(parameter);
		if (importTarget != null)
		{
			parameter.addImports(importTarget);
		}
	}

	@Override
	public void addStatement(Node statement)
	{
		statements.add(statement);
		if (importTarget != null)
		{
			statement.addImports(importTarget);
		}
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		importTarget = module;
		for (ParameterSymbol parameter : parameters)
		{
			parameter.addImports(module);
		}
		for (Node statement : statements)
		{
			statement.addImports(module);
		}
	}

	public List<ParameterSymbol> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	@Override
	public List<Node> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public boolean hasBody()
	{
		return !statements.isEmpty();
	}

	/**
	 * Writes the parameter list, each entry preceded by ", " unless it comes first
	 * and {@code leadingSelf} is false.
	 */
	protected void emitParameters(CodeWriter out, boolean leadingSelf)
	{
		for (int i = 0; i < parameters.size(); i++)
		{
			if (i != 0 || leadingSelf)
			{
				out.write(", ");
			}
			parameters.get(i).emit(out);
		}
	}

	protected void emitStatements(CodeWriter out)
	{
		for (Node statement : statements)
		{
			out.clearLine();
			statement.emit(out);
		}
	}

	/**
	 * Emits an indented body, or {@code placeholder} when there are no statements.
	 */
	protected void emitBody(CodeWriter out, String placeholder)
	{
		out.startBlock();
		if (statements.isEmpty())
		{
			out.clearLine();
			out.write(placeholder);
		}
		else
		{
			emitStatements(out);
		}
		out.endBlock();
	}
}
