package org.lokray.pyrite.expression;

import org.lokray.pyrite.symbol.Node;

/**
 * An unnamed value-producing node. Expressions are not registered in any scope.
 */
public interface Expression extends Node
{
	/**
	 * Returns the form of this expression to pass as a call argument. Pointer
	 * indirection and casts mean nothing at a Python call boundary.
	 */
	default Expression cleanArgument()
	{
		return this;
	}
}
