package org.javai.formula.orchestration;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Audit trail of one run of a {@link FormulaSet}.
 *
 * @param id unique id of this run
 * @param formulaSetId the set that ran
 * @param inputVariables bindings the run started with
 * @param steps formulas that ran, in order
 * @param skippedFormulaIds formulas whose execution condition was not met
 * @param finalResult value of the final result variable; {@code null} if the run failed or the
 * variable was never bound
 * @param status outcome
 * @param failure where the run stopped; {@code null} unless {@code status} is FAILED
 * @param executedAt when the run started
 */
public record FormulaExecution(
		String id,
		String formulaSetId,
		Map<String, Object> inputVariables,
		List<ExecutionStep> steps,
		List<String> skippedFormulaIds,
		Object finalResult,
		ExecutionStatus status,
		StepFailure failure,
		Instant executedAt
) {

	public FormulaExecution {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(status, "status must not be null");
		inputVariables = inputVariables != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(inputVariables)) : Map.of();
		steps = steps != null ? List.copyOf(steps) : List.of();
		skippedFormulaIds = skippedFormulaIds != null ? List.copyOf(skippedFormulaIds) : List.of();
		if ((status == ExecutionStatus.FAILED) != (failure != null)) {
			throw new IllegalArgumentException("An execution records a failure exactly when its status is FAILED");
		}
	}

	public boolean succeeded() {
		return status != ExecutionStatus.FAILED;
	}

	public Optional<StepFailure> failureDetails() {
		return Optional.ofNullable(failure);
	}

	/**
	 * Result bound by the step with the given result variable, if that step ran.
	 */
	public Optional<Object> stepResult(String resultVariable) {
		return steps.stream()
				.filter(step -> step.resultVariable().equals(resultVariable))
				.map(ExecutionStep::resultValue)
				.findFirst();
	}
}
