package org.javai.formula.ast;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.formula.ast.AstNode.BooleanLiteral;
import org.javai.formula.ast.AstNode.NumberLiteral;
import org.javai.formula.ast.AstNode.VariableRef;
import org.javai.formula.engine.ParserEngine;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("AstFormatter")
class AstFormatterTest {

	private static ParserEngine engine;

	@BeforeAll
	static void createEngine() {
		engine = ParserEngine.create();
	}

	private static String normalize(String formula) {
		return AstFormatter.format(engine.parse(formula));
	}

	@ParameterizedTest(name = "{0} -> {1}")
	@CsvSource(delimiterString = "=>", value = {
			"2+3*4            => 2 + 3 * 4",
			"(2+3)*4          => (2 + 3) * 4",
			"a-(b-c)          => a - (b - c)",
			"(a-b)-c          => a - b - c",
			"2^(3^2)          => 2 ^ 3 ^ 2",
			"(2^3)^2          => (2 ^ 3) ^ 2",
			"-x^2             => -x ^ 2",
			"-(x^2)           => -(x ^ 2)",
			"!(a && b)        => !(a && b)",
			"a == (b == c)    => a == (b == c)",
			"(a || b) && c    => (a || b) && c",
			"a or b and not c => a || b && !c",
			"a || b || c      => a || b || c",
			"a || (b || c)    => a || (b || c)",
			"((((7))))        => 7"
	})
	@DisplayName("should emit only the parentheses the grouping needs")
	void minimalParentheses(String input, String expected) {
		assertThat(normalize(input)).isEqualTo(expected);
	}

	@Test
	@DisplayName("should format calls and conditionals with comma-space separators")
	void callsAndConditionals() {
		assertThat(normalize("if(a>1,MAX(a,2),-1)")).isEqualTo("if(a > 1, MAX(a, 2), -1)");
		assertThat(normalize("PI( )")).isEqualTo("PI()");
	}

	@Test
	@DisplayName("should format literals")
	void literals() {
		assertThat(AstFormatter.format(new NumberLiteral(2.5))).isEqualTo("2.5");
		assertThat(AstFormatter.format(new NumberLiteral(42))).isEqualTo("42");
		assertThat(AstFormatter.format(new NumberLiteral(-2))).isEqualTo("(-2)");
		assertThat(AstFormatter.format(new BooleanLiteral(false))).isEqualTo("false");
	}

	@Test
	@DisplayName("should brace variable names that read as keywords")
	void bracedVariables() {
		assertThat(AstFormatter.format(new VariableRef("if"))).isEqualTo("{if}");
		assertThat(AstFormatter.format(new VariableRef("not"))).isEqualTo("{not}");
		assertThat(AstFormatter.format(new VariableRef("mod"))).isEqualTo("mod");
		assertThat(engine.parse(normalize("{and} + 1"))).isEqualTo(engine.parse("{and} + 1"));
		assertThat(AstFormatter.format(new VariableRef("total"))).isEqualTo("total");
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"if({a} >= 10 && ${b} != 2.5e1, MAX(x, .5), -y ^ 2) % 3",
			"1 - (2 - (3 - 4)) * -(5 ^ -6)",
			"!flag || {my_var} < 1e-3 && ROUND(z / 7, 2) = 0",
			"2 ^ 3 ^ (1 + 1) / (4 % 3)",
			"SUM() + ABS(-0.125)"
	})
	@DisplayName("formatted text parses back to the same tree")
	void roundTrip(String formula) {
		AstNode parsed = engine.parse(formula);
		assertThat(engine.parse(AstFormatter.format(parsed))).isEqualTo(parsed);
	}

	@Test
	@DisplayName("node queries report variables, functions, depth and size")
	void nodeQueries() {
		AstNode ast = engine.parse("MAX(b, a) + if(a > c, MIN(b), 1)");
		assertThat(AstNodes.variableNames(ast)).containsExactly("b", "a", "c");
		assertThat(AstNodes.functionNames(ast)).containsExactly("MAX", "MIN");
		assertThat(AstNodes.depth(ast)).isEqualTo(4);
		assertThat(AstNodes.nodeCount(new NumberLiteral(1))).isEqualTo(1);
		assertThat(AstNodes.nodeCount(engine.parse("1 + 2"))).isEqualTo(3);
		assertThat(AstNodes.variableNames(engine.parse("x * x"))).containsExactly("x");
	}
}
