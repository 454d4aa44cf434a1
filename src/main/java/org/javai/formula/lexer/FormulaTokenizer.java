package org.javai.formula.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Tokenizer for formula expressions.
 * <p>
 * Converts formula text into a list of tokens in a single left-to-right pass. Instances
 * hold only their size limits and may be shared between threads; all scanning state lives
 * in a per-call cursor.
 */
public class FormulaTokenizer {

	public static final int DEFAULT_MAX_FORMULA_LENGTH = 5_000;
	public static final int DEFAULT_MAX_TOKEN_COUNT = 10_000;

	private static final Map<String, TokenType> KEYWORDS = Map.of(
			"if", TokenType.IF,
			"true", TokenType.TRUE,
			"false", TokenType.FALSE,
			"and", TokenType.AND,
			"or", TokenType.OR,
			"not", TokenType.NOT);

	private final int maxFormulaLength;
	private final int maxTokenCount;

	public FormulaTokenizer() {
		this(DEFAULT_MAX_FORMULA_LENGTH, DEFAULT_MAX_TOKEN_COUNT);
	}

	public FormulaTokenizer(int maxFormulaLength, int maxTokenCount) {
		if (maxFormulaLength <= 0 || maxTokenCount <= 0) {
			throw new IllegalArgumentException("Tokenizer limits must be positive");
		}
		this.maxFormulaLength = maxFormulaLength;
		this.maxTokenCount = maxTokenCount;
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws LexerException if the input is too large or contains invalid syntax
	 */
	public List<Token> tokenize(String input) {
		List<Token> tokens = new ArrayList<>();
		Iterator<Token> it = lazyTokens(input);
		while (it.hasNext()) {
			tokens.add(it.next());
		}
		return tokens;
	}

	/**
	 * Lazily tokenizes the input. The iterator yields exactly the tokens {@link #tokenize(String)}
	 * would return, ending with EOF; errors surface from {@code next()} when the offending
	 * text is reached. The length guard is checked before any character is scanned.
	 */
	public Iterator<Token> lazyTokens(String input) {
		String text = input != null ? input : "";
		if (text.length() > maxFormulaLength) {
			throw LexerException.tooLarge("maxFormulaLength", maxFormulaLength, text.length());
		}
		return new Cursor(text);
	}

	public int maxFormulaLength() {
		return maxFormulaLength;
	}

	public int maxTokenCount() {
		return maxTokenCount;
	}

	/**
	 * Whether {@code text} would be read back as a single IDENTIFIER token: a well-formed name
	 * that is not a keyword.
	 */
	public static boolean isPlainIdentifier(String text) {
		if (text == null || text.isEmpty() || !isIdentifierStart(text.charAt(0))) {
			return false;
		}
		for (int i = 1; i < text.length(); i++) {
			if (!isIdentifierPart(text.charAt(i))) {
				return false;
			}
		}
		return !KEYWORDS.containsKey(text.toLowerCase(Locale.ROOT));
	}

	static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	static boolean isIdentifierPart(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
	}

	private final class Cursor implements Iterator<Token> {

		private final String input;
		private int pos = 0;
		private int line = 1;
		private int column = 1;
		private int count = 0;
		private boolean finished = false;

		private Cursor(String input) {
			this.input = input;
		}

		@Override
		public boolean hasNext() {
			return !finished;
		}

		@Override
		public Token next() {
			if (finished) {
				throw new NoSuchElementException("Token stream exhausted");
			}
			skipWhitespace();
			if (isAtEnd()) {
				finished = true;
				return Token.eof(position());
			}
			if (++count > maxTokenCount) {
				throw LexerException.tooLarge("maxTokenCount", maxTokenCount, count);
			}
			return nextToken();
		}

		private Token nextToken() {
			TokenPosition start = position();
			char c = peek();

			if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
				return scanNumber(start);
			}
			if (isIdentifierStart(c)) {
				return scanIdentifier(start);
			}
			if (c == '{' || (c == '$' && peekNext() == '{')) {
				return scanVariable(start);
			}

			advance();
			return switch (c) {
				case '+' -> token(TokenType.PLUS, start);
				case '-' -> token(TokenType.MINUS, start);
				case '*' -> token(TokenType.MULTIPLY, start);
				case '/' -> token(TokenType.DIVIDE, start);
				case '%' -> token(TokenType.MODULO, start);
				case '^' -> token(TokenType.POWER, start);
				case '(' -> token(TokenType.LEFT_PAREN, start);
				case ')' -> token(TokenType.RIGHT_PAREN, start);
				case ',' -> token(TokenType.COMMA, start);
				case '=' -> {
					match('=');
					yield token(TokenType.EQUAL, start);
				}
				case '!' -> token(match('=') ? TokenType.NOT_EQUAL : TokenType.NOT, start);
				case '<' -> token(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS, start);
				case '>' -> token(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER, start);
				case '&' -> {
					if (!match('&')) {
						throw LexerException.unexpectedCharacter(c, start);
					}
					yield token(TokenType.AND, start);
				}
				case '|' -> {
					if (!match('|')) {
						throw LexerException.unexpectedCharacter(c, start);
					}
					yield token(TokenType.OR, start);
				}
				default -> throw LexerException.unexpectedCharacter(c, start);
			};
		}

		private Token scanNumber(TokenPosition start) {
			while (isDigit(peek())) {
				advance();
			}

			if (peek() == '.') {
				advance();
				if (!isDigit(peek())) {
					throw LexerException.invalidNumberFormat(slice(start), start);
				}
				while (isDigit(peek())) {
					advance();
				}
				if (peek() == '.') {
					advance();
					throw LexerException.invalidNumberFormat(slice(start), start);
				}
			}

			if (peek() == 'e' || peek() == 'E') {
				advance();
				if (peek() == '+' || peek() == '-') {
					advance();
				}
				if (!isDigit(peek())) {
					throw LexerException.invalidNumberFormat(slice(start), start);
				}
				while (isDigit(peek())) {
					advance();
				}
			}

			if (!isAtEnd() && isIdentifierPart(peek())) {
				advance();
				throw LexerException.invalidTokenSequence(slice(start), start,
						"a number must not be directly followed by a name");
			}
			String text = slice(start);
			if (Double.isInfinite(Double.parseDouble(text))) {
				throw LexerException.invalidNumberFormat(text, start);
			}
			return new Token(TokenType.NUMBER, text, start);
		}

		private Token scanIdentifier(TokenPosition start) {
			while (!isAtEnd() && isIdentifierPart(peek())) {
				advance();
			}
			String text = slice(start);
			TokenType keyword = KEYWORDS.get(text.toLowerCase(Locale.ROOT));
			return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, text, start);
		}

		private Token scanVariable(TokenPosition start) {
			if (peek() == '$') {
				advance();
			}
			advance(); // consume '{'

			if (isAtEnd()) {
				throw LexerException.unclosedVariable(slice(start), start);
			}
			if (peek() == '}') {
				advance();
				throw LexerException.invalidTokenSequence(slice(start), start, "variable name is empty");
			}
			if (!isIdentifierStart(peek())) {
				throw LexerException.unexpectedCharacter(peek(), position());
			}
			while (!isAtEnd() && isIdentifierPart(peek())) {
				advance();
			}
			if (isAtEnd()) {
				throw LexerException.unclosedVariable(slice(start), start);
			}
			if (peek() != '}') {
				throw LexerException.unexpectedCharacter(peek(), position());
			}
			advance(); // consume '}'
			return token(TokenType.VARIABLE, start);
		}

		private Token token(TokenType type, TokenPosition start) {
			return new Token(type, slice(start), start);
		}

		private String slice(TokenPosition start) {
			return input.substring(start.index(), pos);
		}

		private void skipWhitespace() {
			while (!isAtEnd() && isWhitespace(peek())) {
				advance();
			}
		}

		private boolean match(char expected) {
			if (isAtEnd() || peek() != expected) {
				return false;
			}
			advance();
			return true;
		}

		private char peek() {
			return isAtEnd() ? '\0' : input.charAt(pos);
		}

		private char peekNext() {
			return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
		}

		private char advance() {
			char c = input.charAt(pos++);
			if (c == '\n') {
				line++;
				column = 1;
			}
			else {
				column++;
			}
			return c;
		}

		private boolean isAtEnd() {
			return pos >= input.length();
		}

		private TokenPosition position() {
			return new TokenPosition(pos, line, column);
		}
	}
}
