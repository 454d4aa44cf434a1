package org.javai.formula.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.Map;
import org.javai.formula.ast.AstNode;
import org.javai.formula.ast.AstNode.BinaryOp;
import org.javai.formula.ast.AstNode.NumberLiteral;
import org.javai.formula.engine.ParserEngine;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("ExpressionEvaluator")
class ExpressionEvaluatorTest {

	private static ParserEngine parser;

	private ExpressionEvaluator evaluator;

	@BeforeAll
	static void createParser() {
		parser = ParserEngine.create();
	}

	@BeforeEach
	void setUp() {
		evaluator = new ExpressionEvaluator(FunctionRegistry.withBuiltins());
	}

	private EvaluationResult eval(String formula, Map<String, ?> variables) {
		return evaluator.evaluate(parser.parse(formula), EvaluationContext.of(variables));
	}

	private Object value(String formula, Map<String, ?> variables) {
		EvaluationResult result = eval(formula, variables);
		assertThat(result.success()).as("evaluation of %s: %s", formula, result.errorMessage()).isTrue();
		return result.value();
	}

	private Object value(String formula) {
		return value(formula, Map.of());
	}

	private EvaluationException.Kind failure(String formula, Map<String, ?> variables) {
		EvaluationResult result = eval(formula, variables);
		assertThat(result.success()).as("evaluation of %s", formula).isFalse();
		assertThat(result.value()).isNull();
		assertThat(result.error()).isInstanceOf(EvaluationException.class);
		return ((EvaluationException) result.error()).kind();
	}

	@Nested
	@DisplayName("Arithmetic")
	class Arithmetic {

		@ParameterizedTest(name = "{0} = {1}")
		@CsvSource(delimiter = '|', value = {
				"2 + 3 * 4       | 14.0",
				"(2 + 3) * 4     | 20.0",
				"10 - 4 - 3      | 3.0",
				"2 ^ 3 ^ 2       | 512.0",
				"-2 ^ 2          | 4.0",
				"-(2 ^ 2)        | -4.0",
				"7 % 3           | 1.0",
				"MOD(7, 4)       | 3.0",
				"1 / 4           | 0.25",
				"+5              | 5.0",
				"1e3 + .5        | 1000.5"
		})
		@DisplayName("should follow precedence and associativity")
		void precedence(String formula, double expected) {
			assertThat(value(formula)).isEqualTo(expected);
		}

		@Test
		@DisplayName("should read variables from the context")
		void variables() {
			assertThat(value("(x + 1) * 2", Map.of("x", 3))).isEqualTo(8.0);
			assertThat(value("{net} * (1 + ${rate})", Map.of("net", 100, "rate", 0.2))).isEqualTo(120.0);
		}

		@Test
		@DisplayName("should reject division and modulo by zero")
		void divisionByZero() {
			assertThat(failure("a / b", Map.of("a", 1, "b", 0))).isEqualTo(EvaluationException.Kind.DIVISION_BY_ZERO);
			assertThat(failure("5 % 0", Map.of())).isEqualTo(EvaluationException.Kind.DIVISION_BY_ZERO);
		}

		@Test
		@DisplayName("should report an undefined variable by name")
		void undefinedVariable() {
			EvaluationResult result = eval("unknownVar + 1", Map.of());
			assertThat(result.errorCode()).isEqualTo("EVALUATOR.UNDEFINED_VARIABLE");
			assertThat(((EvaluationException) result.error()).subject()).isEqualTo("unknownVar");
		}

		@Test
		@DisplayName("a power that overflows is a math error")
		void powerOverflow() {
			assertThat(failure("10 ^ 400", Map.of())).isEqualTo(EvaluationException.Kind.MATH_ERROR);
		}

		@Test
		@DisplayName("should reject an operator it does not know")
		void unknownOperator() {
			EvaluationResult result = evaluator.evaluate(new BinaryOp("<>", new NumberLiteral(1), new NumberLiteral(2)),
					EvaluationContext.empty());
			assertThat(result.errorCode()).isEqualTo("EVALUATOR.UNSUPPORTED_OPERATOR");
		}
	}

	@Nested
	@DisplayName("Logic and comparison")
	class Logic {

		@Test
		@DisplayName("comparisons yield booleans")
		void comparisons() {
			assertThat(value("3 > 2")).isEqualTo(true);
			assertThat(value("3 <= 2")).isEqualTo(false);
			assertThat(value("1 == 1.0")).isEqualTo(true);
			assertThat(value("x = 2", Map.of("x", 2))).isEqualTo(true);
			assertThat(value("s == t", Map.of("s", "abc", "t", "abc"))).isEqualTo(true);
			assertThat(value("s != 1", Map.of("s", "abc"))).isEqualTo(true);
		}

		@Test
		@DisplayName("&& and || evaluate the right operand only when needed")
		void shortCircuit() {
			EvaluationResult and = eval("false && missing", Map.of());
			assertThat(and.value()).isEqualTo(false);
			assertThat(and.touchedNames()).doesNotContain("missing");

			assertThat(value("true || missing")).isEqualTo(true);
			assertThat(failure("true && missing", Map.of())).isEqualTo(EvaluationException.Kind.UNDEFINED_VARIABLE);
		}

		@Test
		@DisplayName("a conditional evaluates only the selected branch")
		void conditional() {
			assertThat(value("if(score > 50, 1, missing)", Map.of("score", 80))).isEqualTo(1.0);
			assertThat(value("if(0, missing, 2)")).isEqualTo(2.0);
		}

		@Test
		@DisplayName("numbers and TRUE/FALSE strings have truth values")
		void truthiness() {
			assertThat(value("!0")).isEqualTo(true);
			assertThat(value("!2.5")).isEqualTo(false);
			assertThat(value("if(flag, 1, 2)", Map.of("flag", "true"))).isEqualTo(1.0);
			assertThat(failure("if(flag, 1, 2)", Map.of("flag", "yes"))).isEqualTo(EvaluationException.Kind.UNSUPPORTED_TYPE);
		}
	}

	@Nested
	@DisplayName("Coercion")
	class Coercion {

		@Test
		@DisplayName("outside strict mode booleans and numeric strings act as numbers")
		void lenient() {
			assertThat(value("true + 1")).isEqualTo(2.0);
			assertThat(value("s + 1", Map.of("s", " 2.5 "))).isEqualTo(3.5);
			assertThat(failure("s + 1", Map.of("s", "abc"))).isEqualTo(EvaluationException.Kind.NUMBER_CONVERSION_ERROR);
			assertThat(value("1e308 * 10")).isEqualTo(Double.POSITIVE_INFINITY);
		}

		@Test
		@DisplayName("strict mode refuses mixed types and non-finite results")
		void strict() {
			EvaluationContext strict = EvaluationContext.empty().withStrictMode(true);
			assertThat(evaluator.evaluate(parser.parse("true + 1"), strict).errorCode())
					.isEqualTo("EVALUATOR.UNSUPPORTED_TYPE");
			assertThat(evaluator.evaluate(parser.parse("if(1, 2, 3)"), strict).errorCode())
					.isEqualTo("EVALUATOR.UNSUPPORTED_TYPE");
			assertThat(evaluator.evaluate(parser.parse("1e308 * 10"), strict).errorCode())
					.isEqualTo("EVALUATOR.MATH_ERROR");
			assertThat(evaluator.evaluate(parser.parse("1 < 2 && 2 > 1"), strict).value()).isEqualTo(true);
		}
	}

	@Nested
	@DisplayName("Function calls")
	class Functions {

		@Test
		@DisplayName("function names are case-insensitive")
		void caseInsensitive() {
			assertThat(value("max(1, 5, 3) + Min(4, 2)")).isEqualTo(7.0);
		}

		@Test
		@DisplayName("should report unknown functions and domain errors")
		void errors() {
			assertThat(failure("UNKNOWN(1)", Map.of())).isEqualTo(EvaluationException.Kind.UNSUPPORTED_FUNCTION);
			assertThat(failure("SQRT(-1)", Map.of())).isEqualTo(EvaluationException.Kind.MATH_ERROR);
		}

		@Test
		@DisplayName("arity is checked before any argument is evaluated")
		void arityFirst() {
			assertThat(failure("ABS(1, missing)", Map.of())).isEqualTo(EvaluationException.Kind.WRONG_ARGUMENT_COUNT);
		}

		@Test
		@DisplayName("runtime failures and non-finite results become math errors")
		void misbehavingFunctions() {
			evaluator.functions().register("BROKEN", Arity.exactly(0), a -> {
				throw new IllegalStateException("boom");
			});
			evaluator.functions().register("NAN", Arity.exactly(0), a -> Double.NaN);

			EvaluationResult broken = eval("BROKEN()", Map.of());
			assertThat(broken.errorCode()).isEqualTo("EVALUATOR.MATH_ERROR");
			assertThat(broken.error()).hasCauseInstanceOf(IllegalStateException.class);
			assertThat(failure("NAN()", Map.of())).isEqualTo(EvaluationException.Kind.MATH_ERROR);
		}

		@Test
		@DisplayName("touched names include variables and functions that were reached")
		void touchedNames() {
			assertThat(eval("a + MAX(b, 1)", Map.of("a", 1, "b", 2)).touchedNames()).containsExactlyInAnyOrder("a", "MAX", "b");
		}
	}

	@Nested
	@DisplayName("Limits and purity")
	class Limits {

		@Test
		@DisplayName("should stop at the context's depth limit")
		void tooDeep() {
			AstNode ast = parser.parse("-(-(-(-1)))");
			EvaluationResult result = evaluator.evaluate(ast, EvaluationContext.empty().withMaxDepth(3));
			assertThat(result.errorCode()).isEqualTo("EVALUATOR.TOO_DEEP");
			assertThat(result.error().limitViolation()).hasValueSatisfying(v -> {
				assertThat(v.limitName()).isEqualTo("maxDepth");
				assertThat(v.limit()).isEqualTo(3);
			});
			assertThat(evaluator.evaluate(ast, EvaluationContext.empty().withMaxDepth(5)).value()).isEqualTo(1.0);
		}

		@Test
		@DisplayName("evaluation neither changes the context nor depends on earlier runs")
		void purity() {
			Map<String, Object> variables = new HashMap<>(Map.of("x", 4));
			EvaluationContext context = EvaluationContext.of(variables);
			AstNode ast = parser.parse("if(x > 3, x * 2, x / 2) + SQRT(x)");

			EvaluationResult first = evaluator.evaluate(ast, context);
			EvaluationResult second = evaluator.evaluate(ast, context);
			assertThat(first.value()).isEqualTo(10.0).isEqualTo(second.value());
			assertThat(context.variables()).hasSize(1).containsEntry("x", 4);
			variables.put("x", 100);
			assertThat(evaluator.evaluate(ast, context).value()).isEqualTo(10.0);
		}

		@Test
		@DisplayName("evaluateValue throws instead of reporting")
		void evaluateValueThrows() {
			assertThatThrownBy(() -> evaluator.evaluateValue(parser.parse("1 / 0"), EvaluationContext.empty()))
					.isInstanceOfSatisfying(EvaluationException.class,
							e -> assertThat(e.kind()).isEqualTo(EvaluationException.Kind.DIVISION_BY_ZERO));
		}
	}

	@Nested
	@ExtendWith(MockitoExtension.class)
	@DisplayName("Caching")
	class Caching {

		@Mock
		private MathFunction expensive;

		private FunctionRegistry functions;

		private ExpressionEvaluator cached;

		@BeforeEach
		void setUp() {
			when(expensive.apply(any(double[].class))).thenReturn(42.0);
			functions = FunctionRegistry.create().register("SLOW", Arity.exactly(1), expensive);
			cached = new ExpressionEvaluator(functions, new EvaluationCache());
		}

		@Test
		@DisplayName("repeated evaluation with the same bindings reuses subtree results")
		void reusesResults() {
			AstNode ast = parser.parse("SLOW(x) + 1");
			EvaluationContext context = EvaluationContext.of(Map.of("x", 2)).withCaching(true);

			EvaluationResult first = cached.evaluate(ast, context);
			EvaluationResult second = cached.evaluate(ast, context);

			assertThat(first.value()).isEqualTo(43.0);
			assertThat(second.value()).isEqualTo(43.0);
			assertThat(second.touchedNames()).containsExactlyInAnyOrder("SLOW", "x");
			verify(expensive, times(1)).apply(any(double[].class));
			assertThat(cached.cache().size()).isPositive();
		}

		@Test
		@DisplayName("different bindings miss the cache")
		void differentBindings() {
			AstNode ast = parser.parse("SLOW(x)");
			EvaluationContext context = EvaluationContext.of(Map.of("x", 2)).withCaching(true);

			cached.evaluate(ast, context);
			cached.evaluate(ast, context.withVariable("x", 3));

			verify(expensive, times(2)).apply(any(double[].class));
		}

		@Test
		@DisplayName("caching is off unless the context enables it")
		void disabledByDefault() {
			AstNode ast = parser.parse("SLOW(1)");
			cached.evaluate(ast, EvaluationContext.empty());
			cached.evaluate(ast, EvaluationContext.empty());

			verify(expensive, times(2)).apply(any(double[].class));
			assertThat(cached.cache().size()).isZero();
		}

		@Test
		@DisplayName("re-registering a function invalidates results computed with the old definition")
		void reRegistrationInvalidates() {
			AstNode ast = parser.parse("SLOW(x) + 1");
			EvaluationContext context = EvaluationContext.of(Map.of("x", 2)).withCaching(true);

			assertThat(cached.evaluate(ast, context).value()).isEqualTo(43.0);
			functions.register("SLOW", Arity.exactly(1), a -> 7.0);

			assertThat(cached.evaluate(ast, context).value()).isEqualTo(8.0);
			verify(expensive, times(1)).apply(any(double[].class));
		}

		@Test
		@DisplayName("a failed evaluation reports the same touched names with or without caching")
		void failureTouchedNames() {
			AstNode ast = parser.parse("SLOW(x) + unknownVar");
			Map<String, Object> bindings = Map.of("x", 2);

			EvaluationResult withCache = cached.evaluate(ast, EvaluationContext.of(bindings).withCaching(true));
			EvaluationResult withoutCache = cached.evaluate(ast, EvaluationContext.of(bindings));

			assertThat(withCache.success()).isFalse();
			assertThat(withCache.errorCode()).isEqualTo("EVALUATOR.UNDEFINED_VARIABLE");
			assertThat(withCache.touchedNames()).containsExactlyInAnyOrder("SLOW", "x", "unknownVar");
			assertThat(withoutCache.touchedNames()).containsExactlyInAnyOrderElementsOf(withCache.touchedNames());
		}
	}
}
