package org.javai.formula.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Grammar")
class GrammarTest {

	/**
	 * E → E + T | T ; T → ( E ) | n | ε-free
	 */
	private static Grammar expressionGrammar() {
		return Grammar.builder("E")
				.terminals("PLUS", "LEFT_PAREN", "RIGHT_PAREN", "NUMBER")
				.production(1, "E", "E", "PLUS", "T")
				.production(2, "E", "T")
				.production(3, "T", "LEFT_PAREN", "E", "RIGHT_PAREN")
				.production(4, "T", "NUMBER")
				.build();
	}

	@Nested
	@DisplayName("Symbols and productions")
	class Symbols {

		@Test
		@DisplayName("should classify terminals and nonterminals, always including EOF")
		void classification() {
			Grammar grammar = expressionGrammar();
			assertThat(grammar.terminals()).contains("PLUS", "NUMBER", Grammar.END_OF_INPUT);
			assertThat(grammar.nonTerminals()).containsExactlyInAnyOrder("E", "T");
			assertThat(grammar.isNonTerminal(Grammar.START)).isTrue();
			assertThat(grammar.isTerminal("E")).isFalse();
		}

		@Test
		@DisplayName("should derive the augmented production START → start EOF")
		void augmentedProduction() {
			Grammar grammar = expressionGrammar();
			Production augmented = grammar.augmentedProduction();
			assertThat(augmented.id()).isEqualTo(Grammar.AUGMENTED_PRODUCTION_ID);
			assertThat(augmented.left()).isEqualTo(Grammar.START);
			assertThat(augmented.right()).containsExactly("E", Grammar.END_OF_INPUT);
			assertThat(augmented.isAugmented()).isTrue();
			assertThat(grammar.productionsFor(Grammar.START)).containsExactly(augmented);
			assertThat(grammar.requireProduction(-1)).isSameAs(augmented);
		}

		@Test
		@DisplayName("should index productions by id and left-hand side")
		void lookup() {
			Grammar grammar = expressionGrammar();
			assertThat(grammar.production(3)).hasValueSatisfying(p -> assertThat(p.left()).isEqualTo("T"));
			assertThat(grammar.production(99)).isEmpty();
			assertThat(grammar.productionsFor("E")).extracting(Production::id).containsExactly(1, 2);
			assertThat(grammar.leftRecursiveProductions()).extracting(Production::id).containsExactly(1);
			assertThatThrownBy(() -> grammar.requireProduction(99)).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("should render BNF with production ids")
		void bnf() {
			assertThat(expressionGrammar().toBnf()).contains("1: E → E PLUS T").contains("4: T → NUMBER");
		}
	}

	@Nested
	@DisplayName("FIRST sets")
	class FirstSets {

		@Test
		@DisplayName("should compute FIRST through left recursion")
		void first() {
			Grammar grammar = expressionGrammar();
			assertThat(grammar.first("E")).containsExactlyInAnyOrder("LEFT_PAREN", "NUMBER");
			assertThat(grammar.first("PLUS")).containsExactly("PLUS");
		}

		@Test
		@DisplayName("should pass through nullable symbols to the lookahead")
		void nullable() {
			Grammar grammar = Grammar.builder("S")
					.terminals("a", "b")
					.production(1, "S", "A", "B")
					.production(2, "A", "a")
					.production(3, "A")
					.production(4, "B", "b")
					.production(5, "B")
					.build();
			assertThat(grammar.isNullable("A")).isTrue();
			assertThat(grammar.isNullable("S")).isTrue();
			assertThat(grammar.epsilonProductions()).extracting(Production::id).containsExactly(3, 5);
			assertThat(grammar.first("S")).containsExactlyInAnyOrder("a", "b");
			assertThat(grammar.firstOfSequence(List.of("A", "B"), "EOF")).containsExactlyInAnyOrder("a", "b", "EOF");
			assertThat(grammar.firstOfSequence(List.of("B", "a"), "EOF")).containsExactlyInAnyOrder("b", "a");
		}
	}

	@Nested
	@DisplayName("Validation")
	class Validation {

		@Test
		@DisplayName("should reject duplicate production ids")
		void duplicateIds() {
			assertInvalid(Grammar.builder("S").terminals("a").production(1, "S", "a").production(1, "S", "S", "a"));
		}

		@Test
		@DisplayName("should reject undeclared symbols")
		void undeclaredSymbol() {
			assertInvalid(Grammar.builder("S").terminals("a").production(1, "S", "a", "b"));
		}

		@Test
		@DisplayName("should reject a start symbol without productions")
		void unknownStart() {
			assertInvalid(Grammar.builder("X").terminals("a").production(1, "S", "a"));
		}

		@Test
		@DisplayName("should reject a grammar without productions")
		void noProductions() {
			assertInvalid(Grammar.builder("S").terminals("a"));
		}

		@Test
		@DisplayName("should reject reserved symbols")
		void reservedSymbols() {
			assertInvalid(Grammar.builder("S").terminals("a").production(1, "S", "a", "EOF"));
			assertInvalid(Grammar.builder("S").terminals("a").production(1, "S", "a").production(2, "START", "S"));
		}

		@Test
		@DisplayName("should reject a symbol that is both terminal and nonterminal")
		void terminalAndNonTerminal() {
			assertInvalid(Grammar.builder("S").terminals("a", "S").production(1, "S", "a"));
		}

		@Test
		@DisplayName("should reject a declared nonterminal without productions")
		void emptyNonTerminal() {
			assertInvalid(Grammar.builder("S").terminals("a").nonTerminals(List.of("S", "T")).production(1, "S", "a"));
		}

		@Test
		@DisplayName("should reject negative production ids")
		void negativeId() {
			assertInvalid(Grammar.builder("S").terminals("a").production(-5, "S", "a"));
		}

		private void assertInvalid(Grammar.Builder builder) {
			assertThatThrownBy(builder::build)
					.isInstanceOfSatisfying(GrammarException.class, e -> {
						assertThat(e.kind()).isEqualTo(GrammarException.Kind.INVALID_GRAMMAR);
						assertThat(e.errorCode()).isEqualTo("GRAMMAR.INVALID_GRAMMAR");
					});
		}
	}

	@Test
	@DisplayName("grammars with the same definition should be equal")
	void equality() {
		assertThat(expressionGrammar()).isEqualTo(expressionGrammar());
		assertThat(expressionGrammar().hashCode()).isEqualTo(expressionGrammar().hashCode());
	}
}
