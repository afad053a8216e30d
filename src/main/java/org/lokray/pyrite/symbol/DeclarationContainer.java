package org.lokray.pyrite.symbol;

/**
 * A scope that files nested named declarations: modules and classes.
 */
public interface DeclarationContainer
{
	void addDeclaration(Declaration declaration);
}
