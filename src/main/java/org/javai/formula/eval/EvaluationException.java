package org.javai.formula.eval;

import org.javai.formula.FormulaEngineException;

/**
 * Exception raised while evaluating an AST. It is fatal to the evaluation in progress only:
 * {@link ExpressionEvaluator#evaluate} reports it in a failed {@link EvaluationResult}.
 */
public class EvaluationException extends FormulaEngineException {

	public enum Kind {
		UNDEFINED_VARIABLE,
		DIVISION_BY_ZERO,
		UNSUPPORTED_OPERATOR,
		UNSUPPORTED_FUNCTION,
		WRONG_ARGUMENT_COUNT,
		UNSUPPORTED_TYPE,
		NUMBER_CONVERSION_ERROR,
		MATH_ERROR,
		TOO_DEEP,
		TOO_MANY_VARIABLES
	}

	private final Kind kind;
	private final String subject;

	private EvaluationException(Kind kind, String message, String subject, LimitViolation limit, Throwable cause) {
		super(message, limit, cause);
		this.kind = kind;
		this.subject = subject;
	}

	public static EvaluationException undefinedVariable(String name) {
		return new EvaluationException(Kind.UNDEFINED_VARIABLE, "Undefined variable: " + name, name, null, null);
	}

	public static EvaluationException divisionByZero(String operator) {
		return new EvaluationException(Kind.DIVISION_BY_ZERO, "Division by zero in '" + operator + "'", operator, null, null);
	}

	public static EvaluationException unsupportedOperator(String operator) {
		return new EvaluationException(Kind.UNSUPPORTED_OPERATOR, "Unsupported operator: " + operator, operator, null, null);
	}

	public static EvaluationException unsupportedFunction(String name) {
		return new EvaluationException(Kind.UNSUPPORTED_FUNCTION, "Unsupported function: " + name, name, null, null);
	}

	public static EvaluationException wrongArgumentCount(String function, Arity expected, int actual) {
		return new EvaluationException(Kind.WRONG_ARGUMENT_COUNT,
				"Function " + function + " expects " + expected + " argument(s) but got " + actual, function, null, null);
	}

	public static EvaluationException unsupportedType(String detail, Object value) {
		return new EvaluationException(Kind.UNSUPPORTED_TYPE,
				detail + ": " + TypeCoercion.describe(value), TypeCoercion.describe(value), null, null);
	}

	public static EvaluationException numberConversionError(Object value) {
		return new EvaluationException(Kind.NUMBER_CONVERSION_ERROR,
				"Cannot convert " + TypeCoercion.describe(value) + " to a number", String.valueOf(value), null, null);
	}

	public static EvaluationException mathError(String subject, String detail) {
		return new EvaluationException(Kind.MATH_ERROR, "Math error in " + subject + ": " + detail, subject, null, null);
	}

	public static EvaluationException mathError(String subject, String detail, Throwable cause) {
		return new EvaluationException(Kind.MATH_ERROR, "Math error in " + subject + ": " + detail, subject, null, cause);
	}

	public static EvaluationException tooDeep(long limit, long observed) {
		LimitViolation violation = new LimitViolation("maxDepth", limit, observed);
		return new EvaluationException(Kind.TOO_DEEP, "Evaluation nested too deeply: " + violation, null, violation, null);
	}

	public static EvaluationException tooManyVariables(long limit, long observed) {
		LimitViolation violation = new LimitViolation("maxVariables", limit, observed);
		return new EvaluationException(Kind.TOO_MANY_VARIABLES, "Too many variables: " + violation, null, violation, null);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * The variable, operator, function or value the error is about; {@code null} for limit errors.
	 */
	public String subject() {
		return subject;
	}

	@Override
	public String errorCode() {
		return "EVALUATOR." + kind.name();
	}
}
