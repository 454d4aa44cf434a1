package org.javai.formula.ast;

/**
 * Discriminator of {@link AstNode} variants.
 */
public enum NodeKind {
	NUMBER,
	BOOLEAN,
	VARIABLE,
	UNARY_OP,
	BINARY_OP,
	FUNCTION_CALL,
	CONDITIONAL
}
