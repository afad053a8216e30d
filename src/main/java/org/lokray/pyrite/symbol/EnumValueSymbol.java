package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.expression.Expression;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * One enumerator. Used as an expression it renders as {@code Enum.NAME}, qualified
 * by any classes the enumeration is nested in.
 */
public class EnumValueSymbol extends Declaration implements Expression
{
	private final EnumSymbol enumeration;
	private final Expression value;

	public EnumValueSymbol(EnumSymbol enumeration, String name, Expression value)
	{
		super(enumeration, name);
		this.enumeration = enumeration;
		this.value = value;
	}

	public EnumSymbol getEnumeration()
	{
		return enumeration;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public void attach()
	{
		enumeration.addEnumerator(this);
	}

	/**
	 * The names from just below the declaring module down to the enumeration.
	 */
	private Deque<String> relativePath()
	{
		Deque<String> path = new ArrayDeque<>();
		Declaration current = enumeration;
		while (current != null && !(current instanceof ModuleSymbol))
		{
			if (current.getName() != null)
			{
				path.addFirst(current.getName());
			}
			current = current.getScope();
		}
		return path;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		ModuleSymbol declaringModule = enumeration.getModule();
		if (declaringModule != null && declaringModule != module && !declaringModule.getPath().isEmpty())
		{
			module.addImport(declaringModule.getPath(), relativePath().getFirst());
		}
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write(String.join(".", relativePath()) + "." + getName());
	}

	/**
	 * Emits {@code NAME = value}. Without an explicit value the enumerator takes
	 * its position, as in C++.
	 */
	void emitDefinition(CodeWriter out, int position)
	{
		out.write(getName() + " = ");
		if (value != null)
		{
			value.emit(out);
		}
		else
		{
			out.write(Integer.toString(position));
		}
	}
}
