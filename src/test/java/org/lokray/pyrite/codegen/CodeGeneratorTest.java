package org.lokray.pyrite.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.pyrite.expression.Invoke;
import org.lokray.pyrite.expression.Literal;
import org.lokray.pyrite.expression.VariableReference;
import org.lokray.pyrite.symbol.AttributeSymbol;
import org.lokray.pyrite.symbol.ClassSymbol;
import org.lokray.pyrite.symbol.FunctionSymbol;
import org.lokray.pyrite.symbol.ModuleSymbol;
import org.lokray.pyrite.util.TranslatorOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CodeGeneratorTest
{
	private ModuleSymbol root;
	private ModuleSymbol graphics;
	private ModuleSymbol shapes;
	private ModuleSymbol app;

	@BeforeEach
	void buildTree()
	{
		root = new ModuleSymbol("");
		graphics = new ModuleSymbol("graphics", root);
		graphics.attach();
		shapes = new ModuleSymbol("shapes", graphics);
		shapes.attach();
		ClassSymbol square = new ClassSymbol(shapes, "Square");
		new AttributeSymbol(square, "side", new Literal(1)).attach();
		square.attach();

		app = new ModuleSymbol("app", root);
		app.attach();
		FunctionSymbol main = new FunctionSymbol(app, "main");
		main.addStatement(new Invoke(new VariableReference("graphics::shapes::Square")));
		main.attach();
	}

	@Test
	void modulesAreGeneratedParentsFirst()
	{
		Map<String, String> sources = new CodeGenerator().generateAll(root);

		assertEquals(List.of("", "graphics", "graphics.shapes", "app"), List.copyOf(sources.keySet()));
		assertEquals("", sources.get(""));
		assertEquals("from graphics.shapes import Square\n"
				+ "\n"
				+ "\n"
				+ "def main():\n"
				+ "    Square()\n", sources.get("app"));
	}

	@Test
	void generationIsDeterministic()
	{
		CodeGenerator generator = new CodeGenerator();

		assertEquals(generator.generateAll(root), generator.generateAll(root));
	}

	@Test
	void indentWidthComesFromOptions()
	{
		String source = new CodeGenerator(TranslatorOptions.parse("--indent", "2")).generate(shapes);

		assertEquals("class Square:\n"
				+ "  def __init__(self, side=None):\n"
				+ "    self.side = side if side is not None else 1\n", source);
	}

	@Test
	void packagesMapToInitFiles()
	{
		assertEquals(Path.of("__init__.py"), CodeGenerator.relativePath(root));
		assertEquals(Path.of("graphics", "__init__.py"), CodeGenerator.relativePath(graphics));
		assertEquals(Path.of("graphics", "shapes.py"), CodeGenerator.relativePath(shapes));
		assertEquals(Path.of("app.py"), CodeGenerator.relativePath(app));
	}

	@Test
	void writeToCreatesOneFilePerModule(@TempDir Path outputDir) throws IOException
	{
		List<Path> written = new CodeGenerator().writeTo(root, outputDir);

		assertEquals(4, written.size());
		Path square = outputDir.resolve("graphics").resolve("shapes.py");
		assertTrue(Files.exists(outputDir.resolve("graphics").resolve("__init__.py")));
		assertTrue(Files.readString(square).startsWith("class Square:\n"));
		assertTrue(Files.readString(outputDir.resolve("app.py")).contains("def main():"));
	}
}
