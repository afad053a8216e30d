package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;

import java.util.ArrayList;
import java.util.List;

public class ConstructorSymbol extends CallableSymbol
{
	private final ClassSymbol owner;

	public ConstructorSymbol(ClassSymbol owner)
	{
		super(owner, null);
		this.owner = owner;
	}

	/**
	 * The declared C++ types of the parameters, in order.
	 */
	public List<String> getSignature()
	{
		List<String> signature = new ArrayList<>();
		for (ParameterSymbol parameter : getParameters())
		{
			signature.add(parameter.getCType() == null ? "" : parameter.getCType());
		}
		return signature;
	}

	@Override
	public void attach()
	{
		owner.addConstructor(this);
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.clearMinorBlock();
		out.write("def __init__(self");
		emitParameters(out, true);
		out.write("):");
		out.startBlock();

		boolean hasInit = false;
		for (AttributeSymbol attribute : owner.getAttributes().values())
		{
			if (attribute.hasDefaultValue())
			{
				out.clearLine();
				attribute.emit(out);
				hasInit = true;
			}
		}

		if (hasBody())
		{
			emitStatements(out);
		}
		else if (!hasInit)
		{
			out.clearLine();
			out.write("pass");
		}
		out.endBlock();
	}

	@Override
	public String toString()
	{
		return "<ConstructorSymbol " + owner.getFullName() + ">";
	}
}
