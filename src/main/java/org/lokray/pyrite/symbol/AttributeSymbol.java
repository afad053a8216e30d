package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.expression.Expression;

/**
 * A data member, optionally with a default value.
 */
public class AttributeSymbol extends Declaration
{
	private final ClassSymbol owner;
	private final Expression defaultValue;

	public AttributeSymbol(ClassSymbol owner, String name)
	{
		this(owner, name, null);
	}

	public AttributeSymbol(ClassSymbol owner, String name, Expression defaultValue)
	{
		super(owner, name);
		this.owner = owner;
		this.defaultValue = defaultValue;
	}

	public boolean hasDefaultValue()
	{
		return defaultValue != null;
	}

	public Expression getDefaultValue()
	{
		return defaultValue;
	}

	@Override
	public void attach()
	{
		owner.addAttribute(this);
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		if (defaultValue != null)
		{
			defaultValue.addImports(module);
		}
	}

	/**
	 * Emits the assignment made by a user constructor: the default, or {@code None}.
	 */
	@Override
	public void emit(CodeWriter out)
	{
		out.write("self." + getName() + " = ");
		if (defaultValue != null)
		{
			defaultValue.emit(out);
		}
		else
		{
			out.write("None");
		}
		out.clearLine();
	}

	/**
	 * Emits the assignment made by a synthesized initializer from its keyword argument.
	 */
	public void emitInitializer(CodeWriter out)
	{
		out.write("self." + getName() + " = " + getName());
		if (defaultValue != null)
		{
			out.write(" if " + getName() + " is not None else ");
			defaultValue.emit(out);
		}
		out.clearLine();
	}
}
