package org.javai.formula.lexer;

/**
 * Token types produced by {@link FormulaTokenizer}.
 * <p>
 * The constant name doubles as the terminal symbol used by the expression grammar.
 */
public enum TokenType {
	NUMBER,
	IDENTIFIER,
	VARIABLE,

	PLUS,
	MINUS,
	MULTIPLY,
	DIVIDE,
	MODULO,
	POWER,

	EQUAL,
	NOT_EQUAL,
	LESS,
	LESS_EQUAL,
	GREATER,
	GREATER_EQUAL,

	AND,
	OR,
	NOT,

	LEFT_PAREN,
	RIGHT_PAREN,
	COMMA,

	IF,
	TRUE,
	FALSE,

	EOF;

	/**
	 * Terminal name of this token type in the grammar.
	 */
	public String terminal() {
		return name();
	}

	public boolean isOperator() {
		return switch (this) {
			case PLUS, MINUS, MULTIPLY, DIVIDE, MODULO, POWER,
					EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
					AND, OR, NOT -> true;
			default -> false;
		};
	}

	public boolean isKeyword() {
		return this == IF || this == TRUE || this == FALSE;
	}
}
