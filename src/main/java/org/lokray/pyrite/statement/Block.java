package org.lokray.pyrite.statement;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;
import org.lokray.pyrite.symbol.Node;
import org.lokray.pyrite.symbol.Scope;
import org.lokray.pyrite.symbol.StatementContainer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An anonymous scope holding a statement sequence, emitted one level deeper
 * than the line that opens it. Statements added after the block has contributed
 * its imports contribute immediately.
 */
public class Block extends Scope implements StatementContainer
{
	private final List<Node> statements = new ArrayList<>();
	private ModuleSymbol importTarget;

	public Block(Scope enclosingScope)
	{
		super(enclosingScope, null);
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
	public List<Node> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		importTarget = module;
		for (Node statement : statements)
		{
			statement.addImports(module);
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.startBlock();
		if (statements.isEmpty())
		{
			out.clearLine();
			out.write("pass");
		}
		else
		{
			for (Node statement : statements)
			{
				out.clearLine();
				statement.emit(out);
			}
		}
		out.endBlock();
	}

	@Override
	public String toString()
	{
		return "<Block>";
	}
}
