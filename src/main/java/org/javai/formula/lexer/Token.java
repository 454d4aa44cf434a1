package org.javai.formula.lexer;

import java.util.Objects;

/**
 * A token produced by the formula tokenizer.
 *
 * @param type token type
 * @param text the exact input slice this token covers (empty for EOF)
 * @param position where the token starts
 */
public record Token(TokenType type, String text, TokenPosition position) {

	public Token {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(position, "position must not be null");
	}

	public static Token eof(TokenPosition position) {
		return new Token(TokenType.EOF, "", position);
	}

	/**
	 * The semantic value of the token. Variable references are returned without their
	 * {@code {}} or {@code ${}} delimiters; every other token returns its raw text.
	 */
	public String value() {
		if (type != TokenType.VARIABLE) {
			return text;
		}
		int start = text.startsWith("$") ? 2 : 1;
		return text.substring(start, text.length() - 1);
	}

	public boolean isEof() {
		return type == TokenType.EOF;
	}

	@Override
	public String toString() {
		return switch (type) {
			case EOF -> "EOF";
			case NUMBER, IDENTIFIER, VARIABLE -> type + "(" + text + ")";
			default -> "'" + text + "'";
		};
	}
}
