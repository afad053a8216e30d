package org.lokray.pyrite.codegen;

/**
 * A line and indentation tracking text sink that nodes emit into.
 * <p>
 * The two block-clearing directives are idempotent: asking for one blank line
 * twice yields one blank line, and asking for two after one adds a single more.
 */
public interface CodeWriter
{
	/**
	 * Appends text to the current line, indenting it first if the line is fresh.
	 */
	void write(String text);

	/**
	 * Terminates the current line if anything has been written on it.
	 */
	void clearLine();

	/**
	 * Ensures exactly one blank line separates what follows from what came before.
	 */
	void clearMinorBlock();

	/**
	 * Ensures exactly two blank lines separate what follows from what came before.
	 */
	void clearMajorBlock();

	/**
	 * Pushes one indentation level.
	 */
	void startBlock();

	/**
	 * Terminates the current line and pops one indentation level.
	 */
	void endBlock();
}
