package org.javai.formula.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.formula.ast.AstNode.NumberLiteral;
import org.javai.formula.ast.ChildNode.NodeChild;
import org.javai.formula.grammar.Grammar;
import org.javai.formula.grammar.GrammarParser;
import org.javai.formula.lexer.Token;
import org.javai.formula.lexer.TokenPosition;
import org.javai.formula.lexer.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AstBuilderRegistry")
class AstBuilderRegistryTest {

	private Grammar cc;

	@BeforeEach
	void setUp() {
		cc = Grammar.builder("S")
				.terminals("c", "d")
				.production(1, "S", "C", "C")
				.production(2, "C", "c", "C")
				.production(3, "C", "d")
				.build();
	}

	@Test
	@DisplayName("the formula grammar has a builder for every production")
	void formulaGrammarIsCovered() {
		Grammar grammar = new GrammarParser().parseFormulaGrammar();
		AstBuilderRegistry registry = AstBuilderRegistry.forGrammar(grammar);

		assertThat(registry.size()).isEqualTo(grammar.productions().size());
		assertThat(grammar.productions()).allSatisfy(p -> assertThat(registry.builderFor(p.id())).isPresent());
	}

	@Test
	@DisplayName("a production without a semantic action fails registry creation")
	void missingAction() {
		assertThatThrownBy(() -> AstBuilderRegistry.forGrammar(cc))
				.isInstanceOfSatisfying(AstBuildException.class,
						e -> assertThat(e.kind()).isEqualTo(AstBuildException.Kind.MISSING_BUILDER));
	}

	@Test
	@DisplayName("manual registration must cover every production")
	void manualRegistrationIsTotal() {
		AstBuilderRegistry.Builder builder = AstBuilderRegistry.builder(cc)
				.register(1, AstBuilders.passthrough())
				.register(2, AstBuilders.passthrough());

		assertThatThrownBy(builder::build)
				.isInstanceOfSatisfying(AstBuildException.class, e -> {
					assertThat(e.kind()).isEqualTo(AstBuildException.Kind.MISSING_BUILDER);
					assertThat(e.getMessage()).contains("production 3");
				});
	}

	@Test
	@DisplayName("should refuse duplicate and unknown production ids")
	void invalidRegistrations() {
		AstBuilderRegistry.Builder builder = AstBuilderRegistry.builder(cc).register(1, AstBuilders.passthrough());

		assertThatThrownBy(() -> builder.register(1, AstBuilders.passthrough()))
				.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> builder.register(42, AstBuilders.passthrough()))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> builder.register(Grammar.AUGMENTED_PRODUCTION_ID, AstBuilders.passthrough()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("reduce dispatches to the builder registered for the production")
	void reduceDispatches() {
		AstBuilderRegistry registry = AstBuilderRegistry.builder(cc)
				.register(1, children -> new NodeChild(new NumberLiteral(children.size())))
				.register(2, AstBuilders.passthrough())
				.register(3, AstBuilders.number())
				.build();

		ChildNode token = new ChildNode.TokenChild(new Token(TokenType.NUMBER, "9", TokenPosition.START));
		assertThat(registry.reduce(cc.requireProduction(3), List.of(token)))
				.isEqualTo(new NodeChild(new NumberLiteral(9)));
		assertThat(registry.reduce(cc.requireProduction(1), List.of(token, token)))
				.isEqualTo(new NodeChild(new NumberLiteral(2)));
		assertThatThrownBy(() -> registry.requireBuilder(7))
				.isInstanceOfSatisfying(AstBuildException.class,
						e -> assertThat(e.errorCode()).isEqualTo("AST.MISSING_BUILDER"));
	}
}
