package org.javai.formula.parser;

import java.util.List;
import org.javai.formula.FormulaEngineException;
import org.javai.formula.lexer.Token;

/**
 * Exception thrown when a token stream cannot be parsed.
 */
public class ParserException extends FormulaEngineException {

	public enum Kind {
		UNEXPECTED_TOKEN,
		TOO_DEEP,
		TOO_MANY_STEPS
	}

	private final Kind kind;
	private final Token token;
	private final List<String> expected;

	private ParserException(Kind kind, String message, Token token, List<String> expected, LimitViolation limit) {
		super(message, limit, null);
		this.kind = kind;
		this.token = token;
		this.expected = List.copyOf(expected);
	}

	public static ParserException unexpectedToken(Token token, List<String> expected) {
		String found = token.isEof() ? "end of input" : "'" + token.text() + "'";
		return new ParserException(Kind.UNEXPECTED_TOKEN,
				"Unexpected " + found + " at " + token.position() + "; expected one of " + expected,
				token, expected, null);
	}

	public static ParserException tooDeep(String limitName, long limit, long observed) {
		LimitViolation violation = new LimitViolation(limitName, limit, observed);
		return new ParserException(Kind.TOO_DEEP, "Expression nested too deeply: " + violation,
				null, List.of(), violation);
	}

	public static ParserException tooManySteps(long limit, long observed) {
		LimitViolation violation = new LimitViolation("maxParsingSteps", limit, observed);
		return new ParserException(Kind.TOO_MANY_STEPS, "Parsing took too many steps: " + violation,
				null, List.of(), violation);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * The offending token for {@code UNEXPECTED_TOKEN}; {@code null} otherwise.
	 */
	public Token token() {
		return token;
	}

	public List<String> expected() {
		return expected;
	}

	@Override
	public String errorCode() {
		return "PARSER." + kind.name();
	}
}
