package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A C++ enumeration rendered as a subclass of Python's {@code enum.Enum}.
 */
public class EnumSymbol extends Scope
{
	private final List<EnumValueSymbol> enumerators = new ArrayList<>();

	public EnumSymbol(Scope enclosingScope, String name)
	{
		super(enclosingScope, name);
	}

	/**
	 * Adds an enumerator. Like an unscoped C++ enum, its name also becomes visible
	 * in the scope enclosing the enumeration.
	 */
	public void addEnumerator(EnumValueSymbol enumerator)
	{
		enumerators.add(enumerator);
		if (getScope() != null)
		{
			getScope().define(enumerator.getName(), enumerator);
		}
	}

	public List<EnumValueSymbol> getEnumerators()
	{
		return Collections.unmodifiableList(enumerators);
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		module.addImport("enum", "Enum");
	}

	@Override
	public void emit(CodeWriter out)
	{
		separate(out);
		out.write("class " + getName() + "(Enum):");
		out.startBlock();
		if (enumerators.isEmpty())
		{
			out.clearLine();
			out.write("pass");
		}
		else
		{
			for (int i = 0; i < enumerators.size(); i++)
			{
				out.clearLine();
				enumerators.get(i).emitDefinition(out, i);
			}
		}
		out.endBlock();
	}
}
