package org.lokray.pyrite.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * C++ operator tokens and their Python spellings. Binary spellings carry
 * their own padding so that callers can write them between two operands.
 */
public class Operators
{
	private static final Map<String, String> BINARY = new LinkedHashMap<>();
	private static final Map<String, String> UNARY = new LinkedHashMap<>();

	static
	{
		// Assignment
		BINARY.put("=", " = ");

		// Arithmetic
		BINARY.put("+", " + ");
		BINARY.put("-", " - ");
		BINARY.put("*", " * ");
		BINARY.put("/", " / ");
		BINARY.put("%", " % ");

		// Comparison
		BINARY.put("==", " == ");
		BINARY.put("!=", " != ");
		BINARY.put(">", " > ");
		BINARY.put("<", " < ");
		BINARY.put(">=", " >= ");
		BINARY.put("<=", " <= ");

		// Bitwise
		BINARY.put("&", " & ");
		BINARY.put("|", " | ");
		BINARY.put("^", " ^ ");
		BINARY.put("<<", " << ");
		BINARY.put(">>", " >> ");

		// Compound assignment
		BINARY.put("+=", " += ");
		BINARY.put("-=", " -= ");
		BINARY.put("*=", " *= ");
		BINARY.put("/=", " /= ");
		BINARY.put("%=", " %= ");
		BINARY.put("&=", " &= ");
		BINARY.put("|=", " |= ");
		BINARY.put("^=", " ^= ");
		BINARY.put("<<=", " <<= ");
		BINARY.put(">>=", " >>= ");

		// Logical
		BINARY.put("&&", " and ");
		BINARY.put("||", " or ");

		UNARY.put("!", "not ");
		UNARY.put("~", "~");
		UNARY.put("-", "-");
		UNARY.put("+", "+");
	}

	/**
	 * Unknown tokens pass through unchanged.
	 */
	public static String binary(String token)
	{
		return BINARY.getOrDefault(token, token);
	}

	/**
	 * Unknown tokens pass through unchanged.
	 */
	public static String unary(String token)
	{
		return UNARY.getOrDefault(token, token);
	}

	public static Map<String, String> binaryTable()
	{
		return Collections.unmodifiableMap(BINARY);
	}

	public static Map<String, String> unaryTable()
	{
		return Collections.unmodifiableMap(UNARY);
	}
}
