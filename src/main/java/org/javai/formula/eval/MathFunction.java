package org.javai.formula.eval;

/**
 * A numeric function callable from formulas. Arguments have already been coerced to numbers
 * and checked against the function's {@link Arity}.
 * <p>
 * Implementations must be pure: results may be memoized and constant calls folded.
 */
@FunctionalInterface
public interface MathFunction {

	/**
	 * @throws EvaluationException for domain errors, typically of kind {@code MATH_ERROR}
	 */
	double apply(double[] arguments);
}
