package org.javai.formula.engine;

import java.util.OptionalInt;
import org.javai.formula.FormulaEngineException;

/**
 * Exception raised when a calculation or a formula set cannot be carried out as a whole.
 * <p>
 * Wrapping kinds keep the underlying engine error as the cause, so its own error code stays
 * available through {@link #getCause()}.
 */
public class FormulaExecutionException extends FormulaEngineException {

	public enum Kind {
		EMPTY_STEPS,
		STEP_EXECUTION_ERROR,
		TOO_MANY_STEPS,
		FORMULA_VALIDATION_ERROR,
		VARIABLE_EXTRACTION_ERROR
	}

	private final Kind kind;
	private final Integer stepIndex;

	private FormulaExecutionException(Kind kind, String message, Integer stepIndex, LimitViolation limit,
			Throwable cause) {
		super(message, limit, cause);
		this.kind = kind;
		this.stepIndex = stepIndex;
	}

	public static FormulaExecutionException emptySteps(String subject) {
		return new FormulaExecutionException(Kind.EMPTY_STEPS, "No formulas to execute in " + subject, null, null, null);
	}

	public static FormulaExecutionException stepExecutionError(int stepIndex, String formulaId,
			FormulaEngineException cause) {
		return new FormulaExecutionException(Kind.STEP_EXECUTION_ERROR,
				"Step " + stepIndex + " (" + formulaId + ") failed: " + cause.getMessage(), stepIndex, null, cause);
	}

	public static FormulaExecutionException tooManySteps(long limit, long observed) {
		LimitViolation violation = new LimitViolation("maxFormulaSteps", limit, observed);
		return new FormulaExecutionException(Kind.TOO_MANY_STEPS, "Too many formula steps: " + violation, null,
				violation, null);
	}

	public static FormulaExecutionException formulaValidationError(String formula, FormulaEngineException cause) {
		return new FormulaExecutionException(Kind.FORMULA_VALIDATION_ERROR,
				"Invalid formula '" + formula + "': " + cause.getMessage(), null, null, cause);
	}

	public static FormulaExecutionException variableExtractionError(String formula, FormulaEngineException cause) {
		return new FormulaExecutionException(Kind.VARIABLE_EXTRACTION_ERROR,
				"Cannot extract variables from '" + formula + "': " + cause.getMessage(), null, null, cause);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Zero-based index of the failing step, for {@code STEP_EXECUTION_ERROR}.
	 */
	public OptionalInt stepIndex() {
		return stepIndex != null ? OptionalInt.of(stepIndex) : OptionalInt.empty();
	}

	@Override
	public String errorCode() {
		return "EXECUTION." + kind.name();
	}
}
