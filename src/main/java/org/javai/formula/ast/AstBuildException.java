package org.javai.formula.ast;

import org.javai.formula.FormulaEngineException;

/**
 * Exception thrown when reduce-time children do not match what a builder expects, or when a
 * production has no builder.
 */
public class AstBuildException extends FormulaEngineException {

	public enum Kind {
		CHILD_COUNT_MISMATCH,
		CHILD_TYPE_MISMATCH,
		MISSING_BUILDER
	}

	private final Kind kind;
	private final String expected;
	private final String actual;

	private AstBuildException(Kind kind, String message, String expected, String actual) {
		super(message);
		this.kind = kind;
		this.expected = expected;
		this.actual = actual;
	}

	public static AstBuildException childCountMismatch(String builder, int expected, int actual) {
		return new AstBuildException(Kind.CHILD_COUNT_MISMATCH,
				"Builder '" + builder + "' expects " + expected + " children but got " + actual,
				String.valueOf(expected), String.valueOf(actual));
	}

	public static AstBuildException childTypeMismatch(String builder, int index, String expected, String actual) {
		return new AstBuildException(Kind.CHILD_TYPE_MISMATCH,
				"Builder '" + builder + "' expects " + expected + " at child " + index + " but got " + actual,
				expected, actual);
	}

	public static AstBuildException missingBuilder(String message) {
		return new AstBuildException(Kind.MISSING_BUILDER, message, null, null);
	}

	public Kind kind() {
		return kind;
	}

	public String expected() {
		return expected;
	}

	public String actual() {
		return actual;
	}

	@Override
	public String errorCode() {
		return "AST." + kind.name();
	}
}
