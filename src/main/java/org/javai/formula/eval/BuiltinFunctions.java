package org.javai.formula.eval;

/**
 * The math functions every engine provides.
 * <p>
 * ROUND scales by a power of ten and rounds the scaled double half to even, so a decimal
 * tie that is not exactly representable rounds by its binary value. GCD, LCM, FACTORIAL, COMB and PERM require integral arguments.
 * Results that are not finite are rejected by the evaluator, so only true domain errors are
 * checked here.
 */
final class BuiltinFunctions {

	private static final int MAX_FACTORIAL = 170;

	private BuiltinFunctions() {
	}

	static void registerAll(FunctionRegistry registry) {
		registry.register("ABS", Arity.exactly(1), a -> Math.abs(a[0]));
		registry.register("SQRT", Arity.exactly(1), a -> {
			if (a[0] < 0) {
				throw EvaluationException.mathError("SQRT", "square root of negative number " + a[0]);
			}
			return Math.sqrt(a[0]);
		});
		registry.register("ROUND", Arity.between(1, 2), BuiltinFunctions::round);
		registry.register("MIN", Arity.atLeast(1), a -> {
			double min = a[0];
			for (double v : a) {
				min = Math.min(min, v);
			}
			return min;
		});
		registry.register("MAX", Arity.atLeast(1), a -> {
			double max = a[0];
			for (double v : a) {
				max = Math.max(max, v);
			}
			return max;
		});
		registry.register("SUM", Arity.atLeast(0), BuiltinFunctions::sum);
		registry.register("AVG", Arity.atLeast(1), a -> sum(a) / a.length);
		registry.register("AVERAGE", Arity.atLeast(1), a -> sum(a) / a.length);
		registry.register("POW", Arity.exactly(2), a -> Math.pow(a[0], a[1]));

		registry.register("SIN", Arity.exactly(1), a -> Math.sin(a[0]));
		registry.register("COS", Arity.exactly(1), a -> Math.cos(a[0]));
		registry.register("TAN", Arity.exactly(1), a -> Math.tan(a[0]));
		registry.register("ASIN", Arity.exactly(1), a -> Math.asin(unitRange("ASIN", a[0])));
		registry.register("ACOS", Arity.exactly(1), a -> Math.acos(unitRange("ACOS", a[0])));
		registry.register("ATAN", Arity.exactly(1), a -> Math.atan(a[0]));
		registry.register("ATAN2", Arity.exactly(2), a -> Math.atan2(a[0], a[1]));
		registry.register("SINH", Arity.exactly(1), a -> Math.sinh(a[0]));
		registry.register("COSH", Arity.exactly(1), a -> Math.cosh(a[0]));
		registry.register("TANH", Arity.exactly(1), a -> Math.tanh(a[0]));
		registry.register("ASINH", Arity.exactly(1), a -> asinh(a[0]));
		registry.register("ACOSH", Arity.exactly(1), a -> {
			if (a[0] < 1.0) {
				throw EvaluationException.mathError("ACOSH", "argument must be at least 1, got " + a[0]);
			}
			return Math.log(a[0] + Math.sqrt(a[0] * a[0] - 1.0));
		});
		registry.register("ATANH", Arity.exactly(1), a -> {
			if (a[0] <= -1.0 || a[0] >= 1.0) {
				throw EvaluationException.mathError("ATANH", "argument must be between -1 and 1 exclusive, got " + a[0]);
			}
			return 0.5 * Math.log1p(2.0 * a[0] / (1.0 - a[0]));
		});

		registry.register("LOG", Arity.between(1, 2), BuiltinFunctions::log);
		registry.register("LN", Arity.exactly(1), a -> Math.log(positive("LN", a[0])));
		registry.register("LOG10", Arity.exactly(1), a -> Math.log10(positive("LOG10", a[0])));
		registry.register("EXP", Arity.exactly(1), a -> Math.exp(a[0]));

		registry.register("FLOOR", Arity.exactly(1), a -> Math.floor(a[0]));
		registry.register("CEIL", Arity.exactly(1), a -> Math.ceil(a[0]));
		registry.register("CEILING", Arity.exactly(1), a -> Math.ceil(a[0]));
		registry.register("TRUNC", Arity.exactly(1), a -> truncate(a[0]));
		registry.register("TRUNCATE", Arity.exactly(1), a -> truncate(a[0]));
		registry.register("SIGN", Arity.exactly(1), a -> Math.signum(a[0]));
		registry.register("MOD", Arity.exactly(2), a -> {
			if (a[1] == 0.0) {
				throw EvaluationException.divisionByZero("MOD");
			}
			return a[0] % a[1];
		});

		registry.register("GCD", Arity.atLeast(2), a -> {
			long result = integral("GCD", a[0]);
			for (int i = 1; i < a.length; i++) {
				result = gcd(result, integral("GCD", a[i]));
			}
			return Math.abs(result);
		});
		registry.register("LCM", Arity.atLeast(2), a -> {
			long result = integral("LCM", a[0]);
			for (int i = 1; i < a.length; i++) {
				long next = integral("LCM", a[i]);
				result = result == 0 || next == 0 ? 0 : Math.abs(result / gcd(result, next) * next);
			}
			return result;
		});
		registry.register("FACTORIAL", Arity.exactly(1), a -> factorial("FACTORIAL", a[0]));
		registry.register("COMB", Arity.exactly(2), BuiltinFunctions::combinations);
		registry.register("COMBINATION", Arity.exactly(2), BuiltinFunctions::combinations);
		registry.register("PERM", Arity.exactly(2), BuiltinFunctions::permutations);
		registry.register("PERMUTATION", Arity.exactly(2), BuiltinFunctions::permutations);

		registry.register("RADIANS", Arity.exactly(1), a -> Math.toRadians(a[0]));
		registry.register("DEGREES", Arity.exactly(1), a -> Math.toDegrees(a[0]));
		registry.register("PI", Arity.exactly(0), a -> Math.PI);
		registry.register("E", Arity.exactly(0), a -> Math.E);
	}

	private static double round(double[] a) {
		if (a.length == 1) {
			return Math.rint(a[0]);
		}
		int places = (int) integral("ROUND", a[1]);
		double factor = Math.pow(10, places);
		return Math.rint(a[0] * factor) / factor;
	}

	// odd function; computed on |x| to keep precision for large negative arguments
	private static double asinh(double x) {
		double abs = Math.abs(x);
		double result = Math.log(abs + Math.sqrt(abs * abs + 1.0));
		return x < 0 ? -result : result;
	}

	private static double sum(double[] a) {
		double total = 0.0;
		for (double v : a) {
			total += v;
		}
		return total;
	}

	private static double log(double[] a) {
		double value = positive("LOG", a[0]);
		if (a.length == 1) {
			return Math.log(value);
		}
		double base = positive("LOG", a[1]);
		if (base == 1.0) {
			throw EvaluationException.mathError("LOG", "logarithm base must not be 1");
		}
		return Math.log(value) / Math.log(base);
	}

	private static double truncate(double value) {
		return value < 0 ? Math.ceil(value) : Math.floor(value);
	}

	private static double combinations(double[] a) {
		long n = integral("COMB", a[0]);
		long k = integral("COMB", a[1]);
		checkChoose("COMB", n, k);
		double result = 1.0;
		for (long i = 1; i <= Math.min(k, n - k); i++) {
			result = result * (n - i + 1) / i;
		}
		return Math.rint(result);
	}

	private static double permutations(double[] a) {
		long n = integral("PERM", a[0]);
		long k = integral("PERM", a[1]);
		checkChoose("PERM", n, k);
		double result = 1.0;
		for (long i = 0; i < k; i++) {
			result *= n - i;
		}
		return result;
	}

	private static void checkChoose(String function, long n, long k) {
		if (n < 0 || k < 0 || k > n) {
			throw EvaluationException.mathError(function, "requires 0 <= k <= n, got n=" + n + ", k=" + k);
		}
	}

	private static double factorial(String function, double value) {
		long n = integral(function, value);
		if (n < 0 || n > MAX_FACTORIAL) {
			throw EvaluationException.mathError(function, "argument must be between 0 and " + MAX_FACTORIAL + ", got " + n);
		}
		double result = 1.0;
		for (long i = 2; i <= n; i++) {
			result *= i;
		}
		return result;
	}

	private static long gcd(long a, long b) {
		a = Math.abs(a);
		b = Math.abs(b);
		while (b != 0) {
			long t = a % b;
			a = b;
			b = t;
		}
		return a;
	}

	private static long integral(String function, double value) {
		if (value != Math.rint(value) || Double.isInfinite(value) || Math.abs(value) > Long.MAX_VALUE) {
			throw EvaluationException.mathError(function, "argument must be an integer, got " + value);
		}
		return (long) value;
	}

	private static double positive(String function, double value) {
		if (value <= 0) {
			throw EvaluationException.mathError(function, "argument must be positive, got " + value);
		}
		return value;
	}

	private static double unitRange(String function, double value) {
		if (value < -1.0 || value > 1.0) {
			throw EvaluationException.mathError(function, "argument must be between -1 and 1, got " + value);
		}
		return value;
	}
}
