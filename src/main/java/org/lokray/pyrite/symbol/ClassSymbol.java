package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;
import org.lokray.pyrite.expression.TypeReference;
import org.lokray.pyrite.util.ConstructorOverloadException;
import org.lokray.pyrite.util.Debug;
import org.lokray.pyrite.util.DuplicateDestructorException;
import org.lokray.pyrite.util.OverloadPolicy;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A C++ class rendered as a Python class.
 * <p>
 * Constructors are keyed by the C++ types of their parameters. Python has a single
 * {@code __init__}, so a class holding more than one signature is reported
 * according to the session's {@link OverloadPolicy}.
 */
public class ClassSymbol extends Scope implements DeclarationContainer
{
	// Element-wise, then shorter first.
	static final Comparator<List<String>> SIGNATURE_ORDER = (a, b) ->
	{
		for (int i = 0; i < Math.min(a.size(), b.size()); i++)
		{
			int cmp = a.get(i).compareTo(b.get(i));
			if (cmp != 0)
			{
				return cmp;
			}
		}
		return Integer.compare(a.size(), b.size());
	};

	private final ModuleSymbol module;
	private final Map<List<String>, ConstructorSymbol> constructors = new TreeMap<>(SIGNATURE_ORDER);
	private final Map<String, AttributeSymbol> attributes = new LinkedHashMap<>();
	private final Map<String, MethodSymbol> methods = new LinkedHashMap<>();
	private final Map<String, Declaration> classes = new LinkedHashMap<>();
	private DestructorSymbol destructor;
	private TypeReference superclass;
	private ModuleSymbol importTarget;

	public ClassSymbol(Scope enclosingScope, String name)
	{
		super(enclosingScope, name);
		this.module = getModule();
	}

	/**
	 * The module this class is defined in, resolved once at construction. For a
	 * nested class this is still that module, not the outer class.
	 */
	@Override
	public ModuleSymbol getModule()
	{
		return module != null ? module : super.getModule();
	}

	public TypeReference getSuperclass()
	{
		return superclass;
	}

	public void setSuperclass(TypeReference superclass)
	{
		this.superclass = superclass;
		contribute(superclass);
	}

	@Override
	public void addDeclaration(Declaration declaration)
	{
		classes.put(declaration.getName(), declaration);
		contribute(declaration);
	}

	public void addConstructor(ConstructorSymbol constructor)
	{
		List<String> signature = constructor.getSignature();
		if (!constructors.isEmpty() && !constructors.containsKey(signature))
		{
			if (getSession().getOptions().getOverloadPolicy() == OverloadPolicy.FAIL)
			{
				throw new ConstructorOverloadException(getName(), signature);
			}
			getSession().getDiagnostics().warn("Multiple constructors for class " + getName()
					+ " (adding [" + String.join(",", signature) + "])");
		}
		constructors.put(signature, constructor);
		contribute(constructor);
	}

	/**
	 * Sets the destructor. A full destructor may replace an empty placeholder, an
	 * empty one never replaces a full one, and two full ones are fatal.
	 *
	 * @throws DuplicateDestructorException if both destructors have bodies
	 */
	public void addDestructor(DestructorSymbol incoming)
	{
		if (destructor != null && destructor.hasBody())
		{
			if (incoming.hasBody())
			{
				throw new DuplicateDestructorException(getFullName());
			}
			Debug.logDebug("Ignoring placeholder destructor for " + getFullName());
			return;
		}
		destructor = incoming;
		contribute(incoming);
	}

	public void addAttribute(AttributeSymbol attribute)
	{
		attributes.put(attribute.getName(), attribute);
		contribute(attribute);
	}

	public void addMethod(MethodSymbol method)
	{
		if (methods.containsKey(method.getName()))
		{
			Debug.logDebug("Method " + method.getName() + " of " + getFullName() + " replaces an earlier overload");
		}
		methods.put(method.getName(), method);
		contribute(method);
	}

	private void contribute(Node member)
	{
		if (importTarget != null && member != null)
		{
			member.addImports(importTarget);
		}
	}

	@Override
	public void addImports(ModuleSymbol module)
	{
		importTarget = module;
		if (superclass != null)
		{
			superclass.addImports(module);
		}
		attributes.values().forEach(a -> a.addImports(module));
		constructors.values().forEach(c -> c.addImports(module));
		if (destructor != null)
		{
			destructor.addImports(module);
		}
		classes.values().forEach(c -> c.addImports(module));
		methods.values().forEach(m -> m.addImports(module));
	}

	public Map<List<String>, ConstructorSymbol> getConstructors()
	{
		return Collections.unmodifiableMap(constructors);
	}

	public Map<String, AttributeSymbol> getAttributes()
	{
		return Collections.unmodifiableMap(attributes);
	}

	public Map<String, MethodSymbol> getMethods()
	{
		return Collections.unmodifiableMap(methods);
	}

	public Map<String, Declaration> getNestedDeclarations()
	{
		return Collections.unmodifiableMap(classes);
	}

	public DestructorSymbol getDestructor()
	{
		return destructor;
	}

	public boolean hasMembers()
	{
		return !attributes.isEmpty() || !constructors.isEmpty() || destructor != null
				|| !classes.isEmpty() || !methods.isEmpty();
	}

	protected void emitHeader(CodeWriter out)
	{
		out.write("class " + getName());
		if (superclass != null)
		{
			out.write("(");
			superclass.emit(out);
			out.write(")");
		}
		out.write(":");
	}

	/**
	 * Emits {@code __init__} taking every attribute as an optional keyword argument.
	 */
	protected void emitInitializer(CodeWriter out)
	{
		StringBuilder params = new StringBuilder();
		for (String name : attributes.keySet())
		{
			params.append(", ").append(name).append("=None");
		}

		out.clearMinorBlock();
		out.write("def __init__(self" + params + "):");
		out.startBlock();
		for (AttributeSymbol attribute : attributes.values())
		{
			out.clearLine();
			attribute.emitInitializer(out);
		}
		out.endBlock();
	}

	@Override
	public void emit(CodeWriter out)
	{
		separate(out);
		emitHeader(out);
		out.startBlock();
		if (hasMembers())
		{
			if (!attributes.isEmpty() && constructors.isEmpty())
			{
				emitInitializer(out);
			}

			for (ConstructorSymbol constructor : constructors.values())
			{
				constructor.emit(out);
			}

			if (destructor != null)
			{
				destructor.emit(out);
			}

			for (Declaration nested : classes.values())
			{
				nested.emit(out);
			}

			for (MethodSymbol method : methods.values())
			{
				method.emit(out);
			}
		}
		else
		{
			out.clearLine();
			out.write("pass");
		}
		out.endBlock();
	}
}
