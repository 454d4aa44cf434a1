package org.javai.formula;

import java.util.Optional;

/**
 * Base type for every error raised by the formula engine.
 * <p>
 * Each layer (lexer, grammar, parser, AST builder, evaluator, orchestration) has its own
 * subclass with a {@code Kind} enum; {@link #errorCode()} combines the two into a stable
 * {@code LAYER.KIND} string that callers can log, persist or switch on.
 */
public abstract class FormulaEngineException extends RuntimeException {

	private final LimitViolation limitViolation;

	protected FormulaEngineException(String message) {
		this(message, null, null);
	}

	protected FormulaEngineException(String message, Throwable cause) {
		this(message, null, cause);
	}

	protected FormulaEngineException(String message, LimitViolation limitViolation, Throwable cause) {
		super(message, cause);
		this.limitViolation = limitViolation;
	}

	/**
	 * Stable error code in the form {@code LAYER.KIND}, e.g. {@code EVALUATOR.DIVISION_BY_ZERO}.
	 */
	public abstract String errorCode();

	/**
	 * The configured guard that was exceeded, for limit errors (too large, too deep, too many steps).
	 */
	public Optional<LimitViolation> limitViolation() {
		return Optional.ofNullable(limitViolation);
	}

	/**
	 * A configuration guard that was exceeded: the option name, its configured value and the
	 * value that was observed when the guard tripped.
	 */
	public record LimitViolation(String limitName, long limit, long observed) {

		@Override
		public String toString() {
			return limitName + " exceeded (limit " + limit + ", observed " + observed + ")";
		}
	}
}
