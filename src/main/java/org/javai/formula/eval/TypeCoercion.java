package org.javai.formula.eval;

import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Conversion rules between formula values.
 * <p>
 * Formula values are {@link Double}, {@link Boolean} or {@link String}. Numbers of other
 * boxed types are widened to double. Truthiness: booleans are themselves, numbers are true
 * unless zero or NaN, strings must read {@code TRUE} or {@code FALSE} ignoring case. In strict
 * mode only numbers convert to numbers and only booleans to booleans.
 */
public final class TypeCoercion {

	private TypeCoercion() {
	}

	/**
	 * Normalize a variable value: numbers become {@link Double}, booleans and strings are kept.
	 *
	 * @throws EvaluationException of kind {@code UNSUPPORTED_TYPE} for any other value
	 */
	public static Object normalize(Object value) {
		if (value instanceof Double) {
			return value;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		if (value instanceof Boolean || value instanceof String) {
			return value;
		}
		throw EvaluationException.unsupportedType("Unsupported value type", value);
	}

	public static double toNumber(Object value, boolean strict) {
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		if (strict) {
			throw EvaluationException.unsupportedType("Strict mode requires a number", value);
		}
		if (value instanceof Boolean bool) {
			return bool ? 1.0 : 0.0;
		}
		if (value instanceof String text) {
			if (StringUtils.isBlank(text)) {
				throw EvaluationException.numberConversionError(value);
			}
			try {
				return Double.parseDouble(text.trim());
			}
			catch (NumberFormatException e) {
				throw EvaluationException.numberConversionError(value);
			}
		}
		throw EvaluationException.unsupportedType("Expected a number", value);
	}

	public static boolean toBoolean(Object value, boolean strict) {
		if (value instanceof Boolean bool) {
			return bool;
		}
		if (strict) {
			throw EvaluationException.unsupportedType("Strict mode requires a boolean", value);
		}
		if (value instanceof Number number) {
			double d = number.doubleValue();
			return d != 0.0 && !Double.isNaN(d);
		}
		if (value instanceof String text) {
			if ("TRUE".equalsIgnoreCase(text.trim())) {
				return true;
			}
			if ("FALSE".equalsIgnoreCase(text.trim())) {
				return false;
			}
		}
		throw EvaluationException.unsupportedType("Expected a boolean", value);
	}

	/**
	 * Equality for {@code ==} and {@code !=}. Values of the same type compare by value, numbers
	 * numerically. Mixed types compare numerically outside strict mode, and are unequal if
	 * either side is not numeric.
	 */
	public static boolean valuesEqual(Object left, Object right, boolean strict) {
		if (left instanceof Number l && right instanceof Number r) {
			return l.doubleValue() == r.doubleValue();
		}
		if (left.getClass() == right.getClass()) {
			return left.equals(right);
		}
		if (strict) {
			throw EvaluationException.unsupportedType("Strict mode cannot compare " + describe(left) + " with", right);
		}
		try {
			return toNumber(left, false) == toNumber(right, false);
		}
		catch (EvaluationException e) {
			if (e.kind() == EvaluationException.Kind.NUMBER_CONVERSION_ERROR) {
				return false;
			}
			throw e;
		}
	}

	static String describe(Object value) {
		if (value == null) {
			return "null";
		}
		if (value instanceof String) {
			return "string \"" + value + "\"";
		}
		return value.getClass().getSimpleName().toLowerCase(Locale.ROOT) + " " + value;
	}
}
