package org.lokray.pyrite.symbol;

import org.lokray.pyrite.codegen.CodeWriter;

/**
 * Any element of the translated program tree.
 */
public interface Node
{
	/**
	 * Records into {@code module} every import this node needs in order to be
	 * emitted inside it. Called when the node is attached, never when it is built.
	 */
	void addImports(ModuleSymbol module);

	/**
	 * Emits this node's Python rendering into {@code out}.
	 */
	void emit(CodeWriter out);
}
