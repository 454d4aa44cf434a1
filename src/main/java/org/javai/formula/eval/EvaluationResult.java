package org.javai.formula.eval;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import org.javai.formula.FormulaEngineException;

/**
 * Outcome of evaluating one formula.
 *
 * @param value {@link Double}, {@link Boolean} or {@link String}; {@code null} on failure
 * @param success whether evaluation completed
 * @param error the failure, or {@code null} on success
 * @param evaluationTime wall time spent
 * @param touchedNames variable and function names referenced while evaluating
 */
public record EvaluationResult(Object value, boolean success, FormulaEngineException error, Duration evaluationTime,
		Set<String> touchedNames) {

	public EvaluationResult {
		evaluationTime = evaluationTime != null ? evaluationTime : Duration.ZERO;
		touchedNames = touchedNames != null ? Set.copyOf(touchedNames) : Set.of();
		if (success == (error != null)) {
			throw new IllegalArgumentException("A result carries an error exactly when it failed");
		}
	}

	public static EvaluationResult success(Object value, Duration evaluationTime, Set<String> touchedNames) {
		return new EvaluationResult(Objects.requireNonNull(value, "value must not be null"), true, null,
				evaluationTime, touchedNames);
	}

	public static EvaluationResult failure(FormulaEngineException error, Duration evaluationTime, Set<String> touchedNames) {
		return new EvaluationResult(null, false, Objects.requireNonNull(error, "error must not be null"),
				evaluationTime, touchedNames);
	}

	public String errorMessage() {
		return error != null ? error.getMessage() : null;
	}

	public String errorCode() {
		return error != null ? error.errorCode() : null;
	}

	/**
	 * The value as a double.
	 *
	 * @throws IllegalStateException if evaluation failed or the value is not a number
	 */
	public double asDouble() {
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		throw new IllegalStateException(success ? "Result is not a number: " + value : "Evaluation failed: " + errorMessage());
	}
}
