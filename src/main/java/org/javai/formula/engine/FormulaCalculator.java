package org.javai.formula.engine;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.formula.FormulaEngineException;
import org.javai.formula.ast.AstFormatter;
import org.javai.formula.ast.AstNode;
import org.javai.formula.ast.AstNodes;
import org.javai.formula.eval.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-formula operations on top of a {@link ParserEngine}.
 * <p>
 * Calculations report engine errors in the returned {@link EvaluationResult}; they throw only
 * for requests that are malformed as a whole, such as an empty or oversized list of steps.
 */
public class FormulaCalculator {

	private static final Logger logger = LoggerFactory.getLogger(FormulaCalculator.class);

	/**
	 * Prefix of the variable each multi-step result is bound to: {@code step1}, {@code step2}, ...
	 */
	public static final String STEP_VARIABLE_PREFIX = "step";

	private final ParserEngine engine;

	public FormulaCalculator(ParserEngine engine) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
	}

	public EvaluationResult calculate(String formula, Map<String, ?> variables) {
		long start = System.nanoTime();
		AstNode ast;
		try {
			ast = engine.compile(formula);
		}
		catch (FormulaEngineException e) {
			return EvaluationResult.failure(e, Duration.ofNanos(System.nanoTime() - start), Set.of());
		}
		return engine.evaluate(ast, variables);
	}

	/**
	 * Evaluate formulas in order, binding each result to {@code step1}, {@code step2}, ... so
	 * later formulas can refer to earlier ones. The first failing step ends the calculation.
	 *
	 * @return the last step's result, or a failure of kind {@code STEP_EXECUTION_ERROR}
	 * wrapping the failing step's error
	 * @throws FormulaExecutionException of kind {@code EMPTY_STEPS} or {@code TOO_MANY_STEPS}
	 */
	public EvaluationResult calculateMultiStep(List<String> formulas, Map<String, ?> variables) {
		if (formulas == null || formulas.isEmpty()) {
			throw FormulaExecutionException.emptySteps("multi-step calculation");
		}
		int maxSteps = engine.config().maxFormulaSteps();
		if (formulas.size() > maxSteps) {
			throw FormulaExecutionException.tooManySteps(maxSteps, formulas.size());
		}

		long start = System.nanoTime();
		Map<String, Object> bindings = new LinkedHashMap<>();
		if (variables != null) {
			bindings.putAll(variables);
		}
		Set<String> touched = new LinkedHashSet<>();
		EvaluationResult last = null;
		for (int i = 0; i < formulas.size(); i++) {
			last = calculate(formulas.get(i), bindings);
			touched.addAll(last.touchedNames());
			if (!last.success()) {
				logger.debug("Multi-step calculation stopped at step {}: {}", i + 1, last.errorMessage());
				return EvaluationResult.failure(
						FormulaExecutionException.stepExecutionError(i, STEP_VARIABLE_PREFIX + (i + 1), last.error()),
						Duration.ofNanos(System.nanoTime() - start), touched);
			}
			bindings.put(STEP_VARIABLE_PREFIX + (i + 1), last.value());
		}
		return EvaluationResult.success(last.value(), Duration.ofNanos(System.nanoTime() - start), touched);
	}

	/**
	 * Check that a formula tokenizes and parses.
	 *
	 * @throws FormulaExecutionException of kind {@code FORMULA_VALIDATION_ERROR}, caused by the
	 * lexer or parser error
	 */
	public void validateFormula(String formula) {
		try {
			engine.parse(formula);
		}
		catch (FormulaEngineException e) {
			throw FormulaExecutionException.formulaValidationError(formula, e);
		}
	}

	public boolean isValidFormula(String formula) {
		try {
			engine.parse(formula);
			return true;
		}
		catch (FormulaEngineException e) {
			logger.debug("Formula '{}' is not valid: {}", formula, e.getMessage());
			return false;
		}
	}

	/**
	 * Names of the variables a formula refers to, in order of first appearance. Function names
	 * are not included.
	 *
	 * @throws FormulaExecutionException of kind {@code VARIABLE_EXTRACTION_ERROR} if the formula
	 * does not parse
	 */
	public Set<String> extractVariables(String formula) {
		try {
			return AstNodes.variableNames(engine.parse(formula));
		}
		catch (FormulaEngineException e) {
			throw FormulaExecutionException.variableExtractionError(formula, e);
		}
	}

	/**
	 * Canonical text of a formula: single spaces around binary operators and only the
	 * parentheses the grouping requires.
	 *
	 * @throws FormulaEngineException if the formula does not parse
	 */
	public String normalize(String formula) {
		return AstFormatter.format(engine.parse(formula));
	}

	public ParserEngine engine() {
		return engine;
	}
}
