package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.symbol.ModuleSymbol;

/**
 * Member access, {@code instance.attribute}.
 */
public class AttributeReference implements Expression
{
	private final Expression instance;
	private final String name;

	public AttributeReference(Expression instance, String name)
	{
		this.instance = instance;
		this.name = name;
	}

	public Expression getInstance()
	{
		return instance;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		instance.addImports(module);
	}

	@Override
	public void emit(CodeWriter out)
	{
		instance.emit(out);
		out.write("." + name);
	}
}
