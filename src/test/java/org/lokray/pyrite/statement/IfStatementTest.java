package org.lokray.pyrite.statement;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.pyrite.codegen.CodeGenerator;
import org.lokray.pyrite.codegen.PythonCodeWriter;
import org.lokray.pyrite.expression.BinaryOperation;
import org.lokray.pyrite.expression.Invoke;
import org.lokray.pyrite.expression.Literal;
import org.lokray.pyrite.expression.UnaryOperation;
import org.lokray.pyrite.expression.VariableReference;
import org.lokray.pyrite.symbol.ClassSymbol;
import org.lokray.pyrite.symbol.FunctionSymbol;
import org.lokray.pyrite.symbol.ModuleSymbol;
import org.lokray.pyrite.symbol.ParameterSymbol;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IfStatementTest
{
	private ModuleSymbol root;

	@BeforeEach
	void createRoot()
	{
		root = new ModuleSymbol("");
	}

	@Test
	void elseIfChainIsFlattenedToElif()
	{
		FunctionSymbol sign = new FunctionSymbol(root, "sign");
		new ParameterSymbol(sign, "x", "int").attach();

		IfStatement positive = new IfStatement(
				new BinaryOperation(new VariableReference("x"), ">", new Literal(0)), sign);
		positive.getIfTrue().addStatement(new ReturnStatement(new Literal(1)));

		IfStatement negative = new IfStatement(
				new BinaryOperation(new VariableReference("x"), "<", new Literal(0)), sign);
		negative.getIfTrue().addStatement(new ReturnStatement(new UnaryOperation("-", new Literal(1))));

		Block otherwise = new Block(sign);
		otherwise.addStatement(new ReturnStatement(new Literal(0)));
		negative.setIfFalse(otherwise);
		positive.setIfFalse(negative);

		sign.addStatement(positive);
		sign.attach();

		assertEquals("def sign(x):\n"
				+ "    if x > 0:\n"
				+ "        return 1\n"
				+ "    elif x < 0:\n"
				+ "        return -1\n"
				+ "    else:\n"
				+ "        return 0\n", new CodeGenerator().generate(root));
	}

	@Test
	void singleStatementElseIsIndented()
	{
		IfStatement check = new IfStatement(new VariableReference("flag"), root);
		check.setIfFalse(new Invoke(new VariableReference("reset")));

		PythonCodeWriter out = new PythonCodeWriter();
		check.emit(out);

		assertEquals("if flag:\n"
				+ "    pass\n"
				+ "else:\n"
				+ "    reset()\n", out.toString());
	}

	@Test
	void branchesContributeImportsThroughTheirOwner()
	{
		ModuleSymbol io = new ModuleSymbol("io", root);
		io.attach();
		new ClassSymbol(io, "Reader").attach();
		new ClassSymbol(io, "Writer").attach();
		ModuleSymbol app = new ModuleSymbol("app", root);
		app.attach();

		FunctionSymbol run = new FunctionSymbol(app, "run");
		IfStatement choose = new IfStatement(new VariableReference("reading"), run);
		choose.getIfTrue().addStatement(new Invoke(new VariableReference("io::Reader")));
		choose.setIfFalse(new Invoke(new VariableReference("io::Writer")));
		run.addStatement(choose);
		run.attach();

		assertEquals(Map.of("io", Set.of("Reader", "Writer")), app.getImports());
	}

	@Test
	void branchesFilledAfterAttachStillContributeImports()
	{
		ModuleSymbol io = new ModuleSymbol("io", root);
		io.attach();
		new ClassSymbol(io, "Reader").attach();
		new ClassSymbol(io, "Writer").attach();
		ModuleSymbol app = new ModuleSymbol("app", root);
		app.attach();

		FunctionSymbol run = new FunctionSymbol(app, "run");
		run.attach();
		IfStatement choose = new IfStatement(new VariableReference("reading"), run);
		run.addStatement(choose);

		choose.getIfTrue().addStatement(new Invoke(new VariableReference("io::Reader")));
		assertEquals(Map.of("io", Set.of("Reader")), app.getImports());

		Block otherwise = new Block(run);
		choose.setIfFalse(otherwise);
		otherwise.addStatement(new Invoke(new VariableReference("io::Writer")));
		assertEquals(Map.of("io", Set.of("Reader", "Writer")), app.getImports());
	}

	@Test
	void emptyBlockIsPass()
	{
		Block block = new Block(root);
		PythonCodeWriter out = new PythonCodeWriter();
		out.write("while True:");
		block.emit(out);

		assertEquals("while True:\n    pass\n", out.toString());
	}

	@Test
	void returnWithAndWithoutValue()
	{
		PythonCodeWriter out = new PythonCodeWriter();
		new ReturnStatement().emit(out);
		ReturnStatement withValue = new ReturnStatement();
		withValue.setValue(new Literal(true));
		withValue.emit(out);

		assertEquals("return\nreturn True\n", out.toString());
	}
}
