package org.lokray.pyrite.symbol;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.pyrite.codegen.CodeGenerator;
import org.lokray.pyrite.expression.Invoke;
import org.lokray.pyrite.expression.Literal;
import org.lokray.pyrite.expression.New;
import org.lokray.pyrite.expression.TypeReference;
import org.lokray.pyrite.expression.VariableReference;
import org.lokray.pyrite.util.NameResolutionException;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleSymbolTest
{
	private ModuleSymbol root;
	private ModuleSymbol geometry;
	private ModuleSymbol render;

	@BeforeEach
	void buildTree()
	{
		root = new ModuleSymbol("");
		geometry = new ModuleSymbol("geometry", root);
		geometry.attach();
		new ClassSymbol(geometry, "Point").attach();
		new ClassSymbol(geometry, "Line").attach();
		render = new ModuleSymbol("render", root);
		render.attach();
	}

	private String generate(ModuleSymbol module)
	{
		return new CodeGenerator().generate(module);
	}

	@Test
	void repeatedReferencesProduceOneImport()
	{
		FunctionSymbol draw = new FunctionSymbol(render, "draw");
		for (int i = 0; i < 3; i++)
		{
			draw.addStatement(new Invoke(new VariableReference("geometry::Point")));
		}
		draw.attach();

		assertEquals(Map.of("geometry", Set.of("Point")), render.getImports());
		assertEquals("from geometry import Point\n"
				+ "\n"
				+ "\n"
				+ "def draw():\n"
				+ "    Point()\n"
				+ "    Point()\n"
				+ "    Point()\n", generate(render));
	}

	@Test
	void importedNamesAreSortedAndGrouped()
	{
		FunctionSymbol draw = new FunctionSymbol(render, "draw");
		draw.addStatement(new Invoke(new TypeReference("geometry::Point")));
		draw.addStatement(new Invoke(new TypeReference("geometry::Line")));
		draw.attach();
		new EnumSymbol(render, "Mode").attach();

		assertTrue(generate(render).startsWith("from enum import Enum\n"
				+ "from geometry import Line, Point\n"
				+ "\n"
				+ "\n"
				+ "def draw():\n"));
	}

	@Test
	void unattachedDeclarationsContributeNothing()
	{
		FunctionSymbol draw = new FunctionSymbol(render, "draw");
		draw.addStatement(new Invoke(new VariableReference("geometry::Point")));

		assertTrue(render.getImports().isEmpty());
		assertEquals("", generate(render));
	}

	@Test
	void statementsAddedAfterAttachStillContribute()
	{
		FunctionSymbol draw = new FunctionSymbol(render, "draw");
		draw.attach();
		assertTrue(render.getImports().isEmpty());

		draw.addStatement(new Invoke(new VariableReference("geometry::Line")));
		assertEquals(Map.of("geometry", Set.of("Line")), render.getImports());
	}

	@Test
	void referenceToAModuleIsABareImport()
	{
		ModuleSymbol shapes = new ModuleSymbol("shapes", geometry);
		shapes.attach();
		FunctionSymbol draw = new FunctionSymbol(render, "draw");
		Invoke call = new Invoke(new VariableReference("geometry::shapes"));
		draw.addStatement(call);
		draw.attach();

		assertEquals(Map.of("geometry.shapes", Set.of()), render.getImports());
		assertEquals("import geometry.shapes\n"
				+ "\n"
				+ "\n"
				+ "def draw():\n"
				+ "    geometry.shapes()\n", generate(render));
	}

	@Test
	void referencesInsideTheSameModuleNeedNoImport()
	{
		FunctionSymbol make = new FunctionSymbol(geometry, "make");
		make.addStatement(new Invoke(new TypeReference("geometry::Point")));
		make.attach();

		assertTrue(geometry.getImports().isEmpty());
		assertTrue(generate(geometry).contains("    Point()\n"));
	}

	@Test
	void unresolvableScopedReferenceFailsOnAttach()
	{
		FunctionSymbol draw = new FunctionSymbol(render, "draw");
		draw.addStatement(new Invoke(new VariableReference("geometry::Circle")));

		assertThrows(NameResolutionException.class, draw::attach);
	}

	@Test
	void moduleLevelDeclarationsAreSeparatedByTwoBlankLines()
	{
		new ClassSymbol(render, "Canvas").attach();
		new VariableSymbol(render, "DEFAULT_WIDTH", new Literal(640)).attach();

		assertEquals("class Canvas:\n"
				+ "    pass\n"
				+ "\n"
				+ "\n"
				+ "DEFAULT_WIDTH = 640\n", generate(render));
	}

	@Test
	void namedRootIsPartOfEveryImportPath()
	{
		ModuleSymbol app = new ModuleSymbol("app");
		ModuleSymbol model = new ModuleSymbol("model", app);
		model.attach();
		new ClassSymbol(model, "User").attach();
		ModuleSymbol views = new ModuleSymbol("views", app);
		views.attach();

		new VariableSymbol(views, "current", new Invoke(new TypeReference("model::User"))).attach();

		assertEquals(Map.of("app.model", Set.of("User")), views.getImports());
		assertEquals("app.views", views.getPath());
	}

	@Test
	void bareTypeNameDeclaredInNamedRootIsImported()
	{
		ModuleSymbol app = new ModuleSymbol("app");
		new ClassSymbol(app, "Shape").attach();
		ModuleSymbol views = new ModuleSymbol("views", app);
		views.attach();

		new VariableSymbol(views, "s", new New(new TypeReference("Shape"))).attach();

		assertEquals(Map.of("app", Set.of("Shape")), views.getImports());
		assertEquals("from app import Shape\n"
				+ "\n"
				+ "\n"
				+ "s = Shape()\n", generate(views));
	}

	@Test
	void unknownBareTypeNameFailsOnAttach()
	{
		VariableSymbol s = new VariableSymbol(render, "s", new New(new TypeReference("DoesNotExist")));

		assertThrows(NameResolutionException.class, s::attach);
	}

	@Test
	void bareVariableNamesAreNotLookedUp()
	{
		FunctionSymbol draw = new FunctionSymbol(render, "draw");
		draw.addStatement(new Invoke(new VariableReference("callback")));
		draw.attach();

		assertTrue(render.getImports().isEmpty());
		assertTrue(generate(render).contains("    callback()\n"));
	}
}
