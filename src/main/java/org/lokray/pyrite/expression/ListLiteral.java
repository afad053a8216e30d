package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ListLiteral implements Expression
{
	private final List<Expression> items = new ArrayList<>();

	public void append(Expression item)
	{
		items.add(item);
	}

	public List<Expression> getItems()
	{
		return Collections.unmodifiableList(items);
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		for (Expression item : items)
		{
			item.addImports(module);
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write("[");
		for (int i = 0; i < items.size(); i++)
		{
			if (i != 0)
			{
				out.write(", ");
			}
			items.get(i).emit(out);
		}
		out.write("]");
	}
}
