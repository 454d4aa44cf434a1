package org.javai.formula.lexer;

import org.javai.formula.FormulaEngineException;

/**
 * Exception thrown when formula text cannot be tokenized.
 */
public class LexerException extends FormulaEngineException {

	public enum Kind {
		UNEXPECTED_CHARACTER,
		UNCLOSED_VARIABLE,
		INVALID_NUMBER_FORMAT,
		INVALID_TOKEN_SEQUENCE,
		TOO_LARGE
	}

	private final Kind kind;
	private final String text;
	private final TokenPosition position;

	private LexerException(Kind kind, String message, String text, TokenPosition position, LimitViolation limit) {
		super(message, limit, null);
		this.kind = kind;
		this.text = text;
		this.position = position;
	}

	public static LexerException unexpectedCharacter(char c, TokenPosition position) {
		String text = String.valueOf(c);
		return new LexerException(Kind.UNEXPECTED_CHARACTER,
				"Unexpected character '" + text + "' at " + position, text, position, null);
	}

	public static LexerException unclosedVariable(String text, TokenPosition position) {
		return new LexerException(Kind.UNCLOSED_VARIABLE,
				"Variable reference '" + text + "' is not closed before end of input (started at " + position + ")",
				text, position, null);
	}

	public static LexerException invalidNumberFormat(String text, TokenPosition position) {
		return new LexerException(Kind.INVALID_NUMBER_FORMAT,
				"Invalid number format '" + text + "' at " + position, text, position, null);
	}

	public static LexerException invalidTokenSequence(String text, TokenPosition position, String detail) {
		return new LexerException(Kind.INVALID_TOKEN_SEQUENCE,
				"Invalid token sequence '" + text + "' at " + position + ": " + detail, text, position, null);
	}

	public static LexerException tooLarge(String limitName, long limit, long observed) {
		LimitViolation violation = new LimitViolation(limitName, limit, observed);
		return new LexerException(Kind.TOO_LARGE, "Formula too large: " + violation, null, null, violation);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * The offending input text, or {@code null} for size-limit errors.
	 */
	public String text() {
		return text;
	}

	/**
	 * Where the offending text starts, or {@code null} for size-limit errors.
	 */
	public TokenPosition position() {
		return position;
	}

	@Override
	public String errorCode() {
		return "LEXER." + kind.name();
	}
}
