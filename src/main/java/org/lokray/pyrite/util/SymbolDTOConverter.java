package org.lokray.pyrite.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.pyrite.dto.DeclarationDTO;
import org.lokray.pyrite.dto.ModuleDTO;
import org.lokray.pyrite.symbol.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a declaration tree into DTOs and JSON, so that a front-end author can
 * inspect what was registered and which imports were collected.
 */
public class SymbolDTOConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static String toJson(ModuleSymbol root)
	{
		return GSON.toJson(toModuleDTO(root));
	}

	public static void writeJson(ModuleSymbol root, Path out) throws IOException
	{
		if (out.getParent() != null)
		{
			Files.createDirectories(out.getParent());
		}
		Files.writeString(out, toJson(root), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logDebug("Symbol table written to " + out);
	}

	public static ModuleDTO toModuleDTO(ModuleSymbol module)
	{
		ModuleDTO dto = new ModuleDTO();
		dto.name = module.getName();
		dto.path = module.getPath();
		for (Map.Entry<String, Set<String>> entry : module.getImports().entrySet())
		{
			dto.imports.put(entry.getKey(), new ArrayList<>(entry.getValue()));
		}
		for (Declaration declaration : module.getDeclarations().values())
		{
			dto.declarations.add(declarationToDTO(declaration));
		}
		for (ModuleSymbol submodule : module.getSubmodules().values())
		{
			dto.submodules.add(toModuleDTO(submodule));
		}
		return dto;
	}

	private static DeclarationDTO declarationToDTO(Declaration declaration)
	{
		DeclarationDTO dto = new DeclarationDTO();
		dto.kind = kindOf(declaration);
		dto.name = declaration.getName();

		if (declaration instanceof ClassSymbol cs)
		{
			if (cs.getSuperclass() != null)
			{
				dto.type = cs.getSuperclass().getRef();
			}
			for (AttributeSymbol attribute : cs.getAttributes().values())
			{
				dto.members.add(leaf("attribute", attribute.getName(), null));
			}
			for (Map.Entry<List<String>, ConstructorSymbol> entry : cs.getConstructors().entrySet())
			{
				DeclarationDTO constructor = leaf("constructor", "__init__", "(" + String.join(",", entry.getKey()) + ")");
				addParameters(constructor, entry.getValue());
				dto.members.add(constructor);
			}
			if (cs.getDestructor() != null)
			{
				dto.members.add(leaf("destructor", "__del__", null));
			}
			for (Declaration nested : cs.getNestedDeclarations().values())
			{
				dto.members.add(declarationToDTO(nested));
			}
			for (MethodSymbol method : cs.getMethods().values())
			{
				DeclarationDTO md = leaf(method.isStatic() ? "static method" : "method", method.getName(), null);
				addParameters(md, method);
				dto.members.add(md);
			}
		}
		else if (declaration instanceof CallableSymbol callable)
		{
			addParameters(dto, callable);
		}
		else if (declaration instanceof EnumSymbol es)
		{
			for (EnumValueSymbol enumerator : es.getEnumerators())
			{
				dto.members.add(leaf("enumerator", enumerator.getName(), null));
			}
		}
		return dto;
	}

	private static void addParameters(DeclarationDTO dto, CallableSymbol callable)
	{
		for (ParameterSymbol parameter : callable.getParameters())
		{
			dto.members.add(leaf("parameter", parameter.getEmittedName(), parameter.getCType()));
		}
	}

	private static DeclarationDTO leaf(String kind, String name, String type)
	{
		DeclarationDTO dto = new DeclarationDTO();
		dto.kind = kind;
		dto.name = name;
		dto.type = type;
		return dto;
	}

	private static String kindOf(Declaration declaration)
	{
		if (declaration instanceof StructSymbol)
		{
			return "struct";
		}
		if (declaration instanceof UnionSymbol)
		{
			return "union";
		}
		if (declaration instanceof ClassSymbol)
		{
			return "class";
		}
		if (declaration instanceof EnumSymbol)
		{
			return "enum";
		}
		if (declaration instanceof FunctionSymbol)
		{
			return "function";
		}
		if (declaration instanceof VariableSymbol)
		{
			return "variable";
		}
		return declaration.getClass().getSimpleName();
	}
}
