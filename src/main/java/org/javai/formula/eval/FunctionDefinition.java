package org.javai.formula.eval;

import java.util.Locale;
import java.util.Objects;

/**
 * A named function with its arity. Names are case-insensitive and stored upper case.
 */
public record FunctionDefinition(String name, Arity arity, MathFunction body) {

	public FunctionDefinition {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(arity, "arity must not be null");
		Objects.requireNonNull(body, "body must not be null");
		if (name.isBlank()) {
			throw new IllegalArgumentException("Function name must not be blank");
		}
		name = name.toUpperCase(Locale.ROOT);
	}
}
