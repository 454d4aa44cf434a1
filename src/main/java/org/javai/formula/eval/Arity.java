package org.javai.formula.eval;

/**
 * Accepted argument counts of a function: {@code min} to {@code max} inclusive, where a
 * negative {@code max} means unbounded.
 */
public record Arity(int min, int max) {

	public Arity {
		if (min < 0 || (max >= 0 && max < min)) {
			throw new IllegalArgumentException("Invalid arity: " + min + ".." + max);
		}
	}

	public static Arity exactly(int count) {
		return new Arity(count, count);
	}

	public static Arity atLeast(int min) {
		return new Arity(min, -1);
	}

	public static Arity between(int min, int max) {
		return new Arity(min, max);
	}

	public boolean accepts(int count) {
		return count >= min && (max < 0 || count <= max);
	}

	@Override
	public String toString() {
		if (max < 0) {
			return "at least " + min;
		}
		return min == max ? String.valueOf(min) : min + " to " + max;
	}
}
