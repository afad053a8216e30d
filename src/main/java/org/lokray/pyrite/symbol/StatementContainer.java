package org.lokray.pyrite.symbol;

import java.util.List;

/**
 * A scope that owns an ordered statement list.
 */
public interface StatementContainer
{
	void addStatement(Node statement);

	List<Node> getStatements();
}
