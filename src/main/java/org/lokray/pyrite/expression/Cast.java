package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.codegen.TypeConverter;
import org.lokray.pyrite.symbol.ModuleSymbol;

import java.util.Optional;

/**
 * A static cast. Casts to primitive families become Python conversion calls;
 * anything else is duck-typed and passes the value through.
 */
public class Cast implements Expression
{
	private final SourceTypeKind typeKind;
	private final Expression value;

	public Cast(SourceTypeKind typeKind, Expression value)
	{
		this.typeKind = typeKind;
		this.value = value;
	}

	public SourceTypeKind getTypeKind()
	{
		return typeKind;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		value.addImports(module);
	}

	@Override
	public void emit(CodeWriter out)
	{
		Optional<String> conversion = TypeConverter.conversionFor(typeKind);
		if (conversion.isPresent())
		{
			out.write(conversion.get() + "(");
			value.emit(out);
			out.write(")");
		}
		else
		{
			value.emit(out);
		}
	}

	/**
	 * As an argument only the value matters; the conversion is dropped.
	 */
	@Override
	public Expression cleanArgument()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return "<Cast " + typeKind + ">";
	}
}
