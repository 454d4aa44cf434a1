package org.javai.formula.ast;

import java.util.List;

/**
 * Reduces the children of a matched production into a single value.
 */
@FunctionalInterface
public interface AstBuilder {

	/**
	 * @param children the production's right-hand side values, in order
	 * @throws AstBuildException if the children do not have the expected count or types
	 */
	ChildNode build(List<ChildNode> children);
}
