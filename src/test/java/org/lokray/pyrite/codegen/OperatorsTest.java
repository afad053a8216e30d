package org.lokray.pyrite.codegen;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OperatorsTest
{
	@Test
	void logicalOperatorsUseWordForms()
	{
		assertEquals(" and ", Operators.binary("&&"));
		assertEquals(" or ", Operators.binary("||"));
		assertEquals("not ", Operators.unary("!"));
	}

	@Test
	void everyAcceptedBinaryOperatorHasATranslation()
	{
		List<String> accepted = List.of(
				"=", "+", "-", "*", "/", "%",
				"==", "!=", ">", "<", ">=", "<=",
				"&", "|", "^", "<<", ">>",
				"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=",
				"&&", "||");

		for (String token : accepted)
		{
			assertTrue(Operators.binaryTable().containsKey(token), token);
		}
		assertEquals(" <<= ", Operators.binary("<<="));
		assertEquals(" % ", Operators.binary("%"));
	}

	@Test
	void unknownTokensPassThrough()
	{
		assertEquals("<=>", Operators.binary("<=>"));
		assertEquals("++", Operators.unary("++"));
		assertEquals(4, Operators.unaryTable().size());
	}
}
