package org.javai.formula.ast;

import java.util.Set;

/**
 * Operator symbols used in {@link AstNode.BinaryOp} and {@link AstNode.UnaryOp} nodes.
 */
public final class Operators {

	public static final String OR = "||";
	public static final String AND = "&&";
	public static final String EQUAL = "==";
	public static final String NOT_EQUAL = "!=";
	public static final String LESS = "<";
	public static final String LESS_EQUAL = "<=";
	public static final String GREATER = ">";
	public static final String GREATER_EQUAL = ">=";
	public static final String PLUS = "+";
	public static final String MINUS = "-";
	public static final String MULTIPLY = "*";
	public static final String DIVIDE = "/";
	public static final String MODULO = "%";
	public static final String POWER = "^";
	public static final String NOT = "!";

	public static final Set<String> BINARY = Set.of(OR, AND, EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER,
			GREATER_EQUAL, PLUS, MINUS, MULTIPLY, DIVIDE, MODULO, POWER);

	public static final Set<String> UNARY = Set.of(PLUS, MINUS, NOT);

	private Operators() {
	}

	/**
	 * Binding strength of a binary operator as encoded by the grammar, higher binds tighter;
	 * 0 for unknown operators.
	 */
	public static int precedence(String operator) {
		return switch (operator) {
			case OR -> 1;
			case AND -> 2;
			case EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> 3;
			case PLUS, MINUS -> 4;
			case MULTIPLY, DIVIDE, MODULO -> 5;
			case POWER -> 6;
			default -> 0;
		};
	}

	public static boolean isRightAssociative(String operator) {
		return POWER.equals(operator);
	}
}
