package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.expression.Expression;

/**
 * A parameter of a function, method or constructor. An unnamed C++ parameter
 * is emitted positionally as {@code arg1}, {@code arg2}, ...
 */
public class ParameterSymbol extends Declaration
{
	private final CallableSymbol owner;
	private final String cType;
	private final Expression defaultValue;
	private int position;

	public ParameterSymbol(CallableSymbol owner, String name, String cType)
	{
		this(owner, name, cType, null);
	}

	public ParameterSymbol(CallableSymbol owner, String name, String cType, Expression defaultValue)
	{
		super(owner, name);
		this.owner = owner;
		this.cType = cType;
		this.defaultValue = defaultValue;
	}

	void setPosition(int position)
	{
		this.position = position;
	}

	public int getPosition()
	{
		return position;
	}

	/**
	 * The declared C++ type, as spelled by the front-end.
	 */
	public String getCType()
	{
		return cType;
	}

	public boolean hasDefaultValue()
	{
		return defaultValue != null;
	}

	public Expression getDefaultValue()
	{
		return defaultValue;
	}

	public String getEmittedName()
	{
		return getName() != null ? getName() : "arg" + (position + 1);
	}

	@Override
	public void attach()
	{
		owner.addParameter(this);
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		if (defaultValue != null)
		{
			defaultValue.addImports(module);
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write(getEmittedName());
		if (defaultValue != null)
		{
			out.write("=");
			defaultValue.emit(out);
		}
	}
}
