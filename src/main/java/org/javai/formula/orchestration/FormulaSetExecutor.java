package org.javai.formula.orchestration;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.javai.formula.FormulaEngineException;
import org.javai.formula.ast.AstNode;
import org.javai.formula.engine.FormulaExecutionException;
import org.javai.formula.engine.ParserEngine;
import org.javai.formula.eval.EvaluationResult;
import org.javai.formula.eval.TypeCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the formulas of a {@link FormulaSet} in order.
 * <p>
 * Each formula sees the initial variables plus the results bound by the formulas before it.
 * A formula whose execution condition is not truthy is skipped. The first failing formula
 * ends the run: later formulas are not evaluated and the execution is marked FAILED.
 * <p>
 * Executors are stateless apart from their engine and clock and may run sets concurrently.
 */
public class FormulaSetExecutor {

	private static final Logger logger = LoggerFactory.getLogger(FormulaSetExecutor.class);

	private final ParserEngine engine;
	private final Clock clock;

	public FormulaSetExecutor(ParserEngine engine) {
		this(engine, Clock.systemUTC());
	}

	public FormulaSetExecutor(ParserEngine engine, Clock clock) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	/**
	 * Run a formula set.
	 *
	 * @throws FormulaExecutionException of kind {@code EMPTY_STEPS} if the set has no formulas
	 */
	public FormulaExecution execute(FormulaSet formulaSet, Map<String, ?> initialVariables) {
		Objects.requireNonNull(formulaSet, "formulaSet must not be null");
		if (formulaSet.isEmpty()) {
			throw FormulaExecutionException.emptySteps("formula set '" + formulaSet.id() + "'");
		}

		String executionId = UUID.randomUUID().toString();
		Instant startedAt = clock.instant();
		Map<String, Object> input = initialVariables != null ? new LinkedHashMap<>(initialVariables) : Map.of();
		Map<String, Object> variables = new LinkedHashMap<>(input);
		List<ExecutionStep> steps = new ArrayList<>();
		List<String> skipped = new ArrayList<>();
		int maxSteps = engine.config().maxFormulaSteps();
		logger.debug("Executing formula set '{}' ({} formulas) as {}", formulaSet.id(), formulaSet.size(), executionId);

		List<Formula> formulas = formulaSet.formulas();
		for (int i = 0; i < formulas.size(); i++) {
			Formula formula = formulas.get(i);
			if (i >= maxSteps) {
				FormulaExecutionException error = FormulaExecutionException.tooManySteps(maxSteps, formulas.size());
				logger.warn("Formula set '{}' stopped: {}", formulaSet.id(), error.getMessage());
				return failed(executionId, formulaSet, input, steps, skipped,
						new StepFailure(i, formula.id(), error.errorCode(), error.getMessage()), startedAt);
			}

			try {
				if (formula.isConditional() && !conditionHolds(formula, variables)) {
					logger.debug("Skipping formula '{}': condition '{}' not met", formula.id(), formula.executionCondition());
					skipped.add(formula.id());
					continue;
				}
				Object value = evaluate(formula.expression(), variables);
				variables.put(formula.resultVariable(), value);
				steps.add(new ExecutionStep(formula.order(), formula.id(), formula.expression(),
						formula.resultVariable(), value, clock.instant()));
				logger.debug("Formula '{}' bound {} = {}", formula.id(), formula.resultVariable(), value);
			}
			catch (FormulaEngineException e) {
				logger.warn("Formula set '{}' failed at step {} ('{}'): [{}] {}", formulaSet.id(), i, formula.id(),
						e.errorCode(), e.getMessage());
				return failed(executionId, formulaSet, input, steps, skipped,
						new StepFailure(i, formula.id(), e.errorCode(), e.getMessage()), startedAt);
			}
		}

		Object finalResult = formulaSet.resolvedFinalResultVariable().map(variables::get).orElse(null);
		ExecutionStatus status = skipped.isEmpty() ? ExecutionStatus.SUCCESS : ExecutionStatus.PARTIAL;
		logger.debug("Formula set '{}' finished with {}: final result {}", formulaSet.id(), status, finalResult);
		return new FormulaExecution(executionId, formulaSet.id(), input, steps, skipped, finalResult, status, null,
				startedAt);
	}

	private boolean conditionHolds(Formula formula, Map<String, Object> variables) {
		Object value = evaluate(formula.executionCondition(), variables);
		return TypeCoercion.toBoolean(value, engine.config().strictMode());
	}

	private Object evaluate(String expression, Map<String, Object> variables) {
		AstNode ast = engine.compile(expression);
		EvaluationResult result = engine.evaluate(ast, variables);
		if (!result.success()) {
			throw result.error();
		}
		return result.value();
	}

	private static FormulaExecution failed(String executionId, FormulaSet formulaSet, Map<String, Object> input,
			List<ExecutionStep> steps, List<String> skipped, StepFailure failure, Instant startedAt) {
		return new FormulaExecution(executionId, formulaSet.id(), input, steps, skipped, null, ExecutionStatus.FAILED,
				failure, startedAt);
	}
}
