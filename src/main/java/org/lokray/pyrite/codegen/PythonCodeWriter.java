package org.lokray.pyrite.codegen;

import org.lokray.pyrite.util.TranslatorOptions;

/**
 * {@link CodeWriter} that buffers Python source in memory.
 * No blank line is produced at the very start of the output or directly
 * after a block opens, and blank lines never carry indentation.
 */
public class PythonCodeWriter implements CodeWriter
{
	private final StringBuilder buffer = new StringBuilder();
	private final String indentUnit;
	private int depth = 0;
	private boolean lineOpen = false;
	private int blankLines = 0;
	private boolean blockStart = true;

	public PythonCodeWriter()
	{
		this(TranslatorOptions.defaults().getIndentUnit());
	}

	public PythonCodeWriter(String indentUnit)
	{
		this.indentUnit = indentUnit;
	}

	@Override
	public void write(String text)
	{
		if (!lineOpen)
		{
			buffer.append(indentUnit.repeat(depth));
			lineOpen = true;
		}
		buffer.append(text);
		blankLines = 0;
		blockStart = false;
	}

	@Override
	public void clearLine()
	{
		if (lineOpen)
		{
			buffer.append('\n');
			lineOpen = false;
		}
	}

	@Override
	public void clearMinorBlock()
	{
		clearBlock(1);
	}

	@Override
	public void clearMajorBlock()
	{
		clearBlock(2);
	}

	private void clearBlock(int lines)
	{
		clearLine();
		if (blockStart)
		{
			return;
		}
		while (blankLines < lines)
		{
			buffer.append('\n');
			blankLines++;
		}
	}

	@Override
	public void startBlock()
	{
		depth++;
		blockStart = true;
	}

	@Override
	public void endBlock()
	{
		clearLine();
		if (depth > 0)
		{
			depth--;
		}
	}

	public int getDepth()
	{
		return depth;
	}

	@Override
	public String toString()
	{
		return buffer.toString();
	}
}
