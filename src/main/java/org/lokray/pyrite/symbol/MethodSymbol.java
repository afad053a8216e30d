package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;

public class MethodSymbol extends CallableSymbol
{
	private final ClassSymbol owner;
	private final boolean isPureVirtual;
	private final boolean isStatic;

	public MethodSymbol(ClassSymbol owner, String name)
	{
		this(owner, name, false, false);
	}

	public MethodSymbol(ClassSymbol owner, String name, boolean isPureVirtual, boolean isStatic)
	{
		super(owner, name);
		this.owner = owner;
		this.isPureVirtual = isPureVirtual;
		this.isStatic = isStatic;
	}

	public boolean isPureVirtual()
	{
		return isPureVirtual;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	@Override
	public void attach()
	{
		owner.addMethod(this);
	}

	@Override
	public void emit(CodeWriter out)
	{
		out.clearMinorBlock();
		if (isStatic)
		{
			out.write("@staticmethod");
			out.clearLine();
			out.write("def " + getName() + "(");
		}
		else
		{
			out.write("def " + getName() + "(self");
		}
		emitParameters(out, !isStatic);
		out.write("):");

		// An abstract method without an inline body must not be called.
		emitBody(out, isPureVirtual ? "raise NotImplementedError()" : "pass");
	}
}
