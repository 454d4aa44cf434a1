package org.javai.formula.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("FormulaTokenizer")
class FormulaTokenizerTest {

	private FormulaTokenizer tokenizer;

	@BeforeEach
	void setUp() {
		tokenizer = new FormulaTokenizer();
	}

	private List<TokenType> types(String input) {
		return tokenizer.tokenize(input).stream().map(Token::type).toList();
	}

	@Nested
	@DisplayName("Token recognition")
	class Recognition {

		@Test
		@DisplayName("should tokenize arithmetic with precedence-relevant operators")
		void arithmetic() {
			assertThat(types("2 + 3 * 4")).containsExactly(
					TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER, TokenType.MULTIPLY, TokenType.NUMBER,
					TokenType.EOF);
		}

		@Test
		@DisplayName("should recognize every operator")
		void operators() {
			assertThat(types("+ - * / % ^ == != < <= > >= && || ! = ( ) ,")).containsExactly(
					TokenType.PLUS, TokenType.MINUS, TokenType.MULTIPLY, TokenType.DIVIDE, TokenType.MODULO,
					TokenType.POWER, TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
					TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.AND, TokenType.OR, TokenType.NOT,
					TokenType.EQUAL, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.COMMA, TokenType.EOF);
		}

		@Test
		@DisplayName("should recognize keywords case-insensitively")
		void keywords() {
			assertThat(types("IF if True FALSE and OR Not")).containsExactly(
					TokenType.IF, TokenType.IF, TokenType.TRUE, TokenType.FALSE, TokenType.AND, TokenType.OR,
					TokenType.NOT, TokenType.EOF);
		}

		@Test
		@DisplayName("MOD is a plain name so the function of that name can be called")
		void modIsAnIdentifier() {
			assertThat(types("MOD(7, 3)")).containsExactly(
					TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.NUMBER, TokenType.COMMA, TokenType.NUMBER,
					TokenType.RIGHT_PAREN, TokenType.EOF);
			assertThat(FormulaTokenizer.isPlainIdentifier("mod")).isTrue();
		}

		@Test
		@DisplayName("should accept integer, decimal, leading-dot and exponent numbers")
		void numbers() {
			List<Token> tokens = tokenizer.tokenize("42 3.14 .5 1e3 2.5E-2");
			assertThat(tokens).extracting(Token::text).containsExactly("42", "3.14", ".5", "1e3", "2.5E-2", "");
			assertThat(tokens.subList(0, 5)).allMatch(t -> t.type() == TokenType.NUMBER);
		}

		@Test
		@DisplayName("should strip delimiters from variable values but keep them in raw text")
		void variables() {
			List<Token> tokens = tokenizer.tokenize("{score} + ${bonus_1}");
			assertThat(tokens.get(0).type()).isEqualTo(TokenType.VARIABLE);
			assertThat(tokens.get(0).text()).isEqualTo("{score}");
			assertThat(tokens.get(0).value()).isEqualTo("score");
			assertThat(tokens.get(2).text()).isEqualTo("${bonus_1}");
			assertThat(tokens.get(2).value()).isEqualTo("bonus_1");
		}

		@Test
		@DisplayName("identifiers are ASCII letters, digits and underscores")
		void asciiIdentifiers() {
			List<Token> tokens = tokenizer.tokenize("_rate2 * 2");
			assertThat(tokens.get(0).type()).isEqualTo(TokenType.IDENTIFIER);
			assertThat(tokens.get(0).text()).isEqualTo("_rate2");
			assertThatThrownBy(() -> tokenizer.tokenize("größe * 2"))
					.isInstanceOfSatisfying(LexerException.class, e -> {
						assertThat(e.kind()).isEqualTo(LexerException.Kind.UNEXPECTED_CHARACTER);
						assertThat(e.position().column()).isEqualTo(3);
					});
		}

		@Test
		@DisplayName("should produce only EOF for blank input")
		void blankInput() {
			assertThat(types("   \t\n")).containsExactly(TokenType.EOF);
			assertThat(types("")).containsExactly(TokenType.EOF);
		}
	}

	@Nested
	@DisplayName("Positions and round trip")
	class Positions {

		@Test
		@DisplayName("should report one-based lines and columns")
		void linesAndColumns() {
			List<Token> tokens = tokenizer.tokenize("a +\n  b");
			Token b = tokens.get(2);
			assertThat(b.text()).isEqualTo("b");
			assertThat(b.position()).isEqualTo(new TokenPosition(6, 2, 3));
			assertThat(tokens.get(0).position()).isEqualTo(TokenPosition.START);
		}

		@Test
		@DisplayName("raw token texts concatenated with the skipped whitespace reproduce the input")
		void roundTrip() {
			String input = "if({a} >= 10 && ${b} != 2.5e1, MAX(x, .5), -y ^ 2) % 3";
			List<Token> tokens = tokenizer.tokenize(input);
			StringBuilder rebuilt = new StringBuilder();
			for (Token token : tokens) {
				while (rebuilt.length() < token.position().index()) {
					rebuilt.append(input.charAt(rebuilt.length()));
				}
				assertThat(input.substring(token.position().index())).startsWith(token.text());
				rebuilt.append(token.text());
			}
			assertThat(rebuilt.toString()).isEqualTo(input);
			assertThat(tokens.stream().filter(t -> !t.isEof()).map(Token::text).collect(Collectors.joining()))
					.isEqualTo(input.replace(" ", ""));
		}

		@Test
		@DisplayName("lazy tokenization should yield the same tokens as eager tokenization")
		void lazyMatchesEager() {
			String input = "ROUND({total} / 3, 2) + if(flag, 1, 0)";
			List<Token> lazy = new ArrayList<>();
			Iterator<Token> it = tokenizer.lazyTokens(input);
			while (it.hasNext()) {
				lazy.add(it.next());
			}
			assertThat(lazy).isEqualTo(tokenizer.tokenize(input));
			assertThat(lazy.get(lazy.size() - 1).isEof()).isTrue();
		}
	}

	@Nested
	@DisplayName("Lexical errors")
	class Errors {

		@Test
		@DisplayName("should reject an unexpected character with its position")
		void unexpectedCharacter() {
			assertThatThrownBy(() -> tokenizer.tokenize("1 + #"))
					.isInstanceOfSatisfying(LexerException.class, e -> {
						assertThat(e.kind()).isEqualTo(LexerException.Kind.UNEXPECTED_CHARACTER);
						assertThat(e.text()).isEqualTo("#");
						assertThat(e.position().column()).isEqualTo(5);
						assertThat(e.errorCode()).isEqualTo("LEXER.UNEXPECTED_CHARACTER");
					});
		}

		@ParameterizedTest
		@ValueSource(strings = {"a & b", "a | b"})
		@DisplayName("single ampersand or bar is not an operator")
		void singleLogicalCharacter(String input) {
			assertThatThrownBy(() -> tokenizer.tokenize(input))
					.isInstanceOfSatisfying(LexerException.class,
							e -> assertThat(e.kind()).isEqualTo(LexerException.Kind.UNEXPECTED_CHARACTER));
		}

		@Test
		@DisplayName("should reject an unclosed variable reference")
		void unclosedVariable() {
			assertThatThrownBy(() -> tokenizer.tokenize("{price * 2"))
					.isInstanceOfSatisfying(LexerException.class,
							e -> assertThat(e.kind()).isEqualTo(LexerException.Kind.UNEXPECTED_CHARACTER));
			assertThatThrownBy(() -> tokenizer.tokenize("1 + ${price"))
					.isInstanceOfSatisfying(LexerException.class,
							e -> assertThat(e.kind()).isEqualTo(LexerException.Kind.UNCLOSED_VARIABLE));
		}

		@Test
		@DisplayName("should reject an empty variable name")
		void emptyVariable() {
			assertThatThrownBy(() -> tokenizer.tokenize("{} + 1"))
					.isInstanceOfSatisfying(LexerException.class,
							e -> assertThat(e.kind()).isEqualTo(LexerException.Kind.INVALID_TOKEN_SEQUENCE));
		}

		@ParameterizedTest
		@ValueSource(strings = {"1.2.3", "4.", "1e", "2E+"})
		@DisplayName("should reject malformed numbers")
		void malformedNumbers(String input) {
			assertThatThrownBy(() -> tokenizer.tokenize(input))
					.isInstanceOfSatisfying(LexerException.class,
							e -> assertThat(e.kind()).isEqualTo(LexerException.Kind.INVALID_NUMBER_FORMAT));
		}

		@Test
		@DisplayName("should reject a literal too large to represent")
		void overflowingNumber() {
			assertThatThrownBy(() -> tokenizer.tokenize("1e999 + 1"))
					.isInstanceOfSatisfying(LexerException.class, e -> {
						assertThat(e.kind()).isEqualTo(LexerException.Kind.INVALID_NUMBER_FORMAT);
						assertThat(e.text()).isEqualTo("1e999");
					});
			assertThat(tokenizer.tokenize("1e308").get(0).type()).isEqualTo(TokenType.NUMBER);
		}

		@Test
		@DisplayName("should reject a number directly followed by a name")
		void numberFollowedByName() {
			assertThatThrownBy(() -> tokenizer.tokenize("3x + 1"))
					.isInstanceOfSatisfying(LexerException.class, e -> {
						assertThat(e.kind()).isEqualTo(LexerException.Kind.INVALID_TOKEN_SEQUENCE);
						assertThat(e.text()).isEqualTo("3x");
					});
		}
	}

	@Nested
	@DisplayName("Size guards")
	class Guards {

		@Test
		@DisplayName("should reject formulas longer than the limit before scanning")
		void formulaLength() {
			FormulaTokenizer small = new FormulaTokenizer(10, 100);
			// the invalid character would fail scanning; the length check must come first
			assertThatThrownBy(() -> small.lazyTokens("#".repeat(11)))
					.isInstanceOfSatisfying(LexerException.class, e -> {
						assertThat(e.kind()).isEqualTo(LexerException.Kind.TOO_LARGE);
						assertThat(e.limitViolation()).hasValueSatisfying(v -> {
							assertThat(v.limitName()).isEqualTo("maxFormulaLength");
							assertThat(v.limit()).isEqualTo(10);
							assertThat(v.observed()).isEqualTo(11);
						});
					});
		}

		@Test
		@DisplayName("should reject formulas with more tokens than the limit")
		void tokenCount() {
			FormulaTokenizer small = new FormulaTokenizer(1_000, 5);
			assertThat(small.tokenize("1 + 2 + 3")).hasSize(6);
			assertThatThrownBy(() -> small.tokenize("1 + 2 + 3 + 4"))
					.isInstanceOfSatisfying(LexerException.class, e -> {
						assertThat(e.kind()).isEqualTo(LexerException.Kind.TOO_LARGE);
						assertThat(e.limitViolation()).hasValueSatisfying(
								v -> assertThat(v.limitName()).isEqualTo("maxTokenCount"));
					});
		}

		@Test
		@DisplayName("should reject non-positive limits")
		void invalidLimits() {
			assertThatThrownBy(() -> new FormulaTokenizer(0, 10)).isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Test
	@DisplayName("isPlainIdentifier should exclude keywords and malformed names")
	void plainIdentifier() {
		assertThat(FormulaTokenizer.isPlainIdentifier("score_1")).isTrue();
		assertThat(FormulaTokenizer.isPlainIdentifier("If")).isFalse();
		assertThat(FormulaTokenizer.isPlainIdentifier("1abc")).isFalse();
		assertThat(FormulaTokenizer.isPlainIdentifier("a-b")).isFalse();
		assertThat(FormulaTokenizer.isPlainIdentifier("")).isFalse();
	}
}
