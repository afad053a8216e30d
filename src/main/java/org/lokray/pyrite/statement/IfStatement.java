package org.lokray.pyrite.statement;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.expression.Expression;
import org.lokray.pyrite.symbol.ModuleSymbol;
import org.lokray.pyrite.symbol.Node;
import org.lokray.pyrite.symbol.Scope;

/**
 * An if statement. The false branch may be another {@code IfStatement}, which
 * is emitted as an {@code elif} at the same depth, a {@link Block}, or any single
 * statement.
 */
public class IfStatement extends Scope
{
	private final Expression condition;
	private final Block ifTrue;
	private Node ifFalse;
	private ModuleSymbol importTarget;

	public IfStatement(Expression condition, Scope enclosingScope)
	{
		super(enclosingScope, null);
		this.condition = condition;
		this.ifTrue = new Block(this);
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Block getIfTrue()
	{
		return ifTrue;
	}

	public Node getIfFalse()
	{
		return ifFalse;
	}

	public void setIfFalse(Node ifFalse)
	{
		this.ifFalse = ifFalse;
		if (importTarget != null && ifFalse != null)
		{
			ifFalse.addImports(importTarget);
		}
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		importTarget = module;
		condition.addImports(module);
		ifTrue.addImports(module);
		if (ifFalse != null)
		{
			ifFalse.addImports(module);
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		emit(out, false);
	}

	private void emit(CodeWriter out, boolean isElif)
	{
		out.clearLine();
		out.write(isElif ? "elif " : "if ");
		condition.emit(out);
		out.write(":");

		ifTrue.emit(out);

		if (ifFalse instanceof IfStatement elif)
		{
			elif.emit(out, true);
		}
		else if (ifFalse != null)
		{
			out.clearLine();
			out.write("else:");
			if (ifFalse instanceof Block)
			{
				ifFalse.emit(out);
			}
			else
			{
				out.clearLine();
				out.startBlock();
				ifFalse.emit(out);
				out.endBlock();
			}
		}
	}

	@Override
	public String toString()
	{
		return "<IfStatement>";
	}
}
