package org.lokray.pyrite.expression;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.codegen.TypeConverter;
import org.lokray.pyrite.symbol.ModuleSymbol;

public class PrimitiveTypeReference implements Expression
{
	private final String name;

	public PrimitiveTypeReference(String cTypeName)
	{
		this.name = TypeConverter.toPythonPrimitive(cTypeName);
	}

	public String getName()
	{
		return name;
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.write(name);
	}
}
