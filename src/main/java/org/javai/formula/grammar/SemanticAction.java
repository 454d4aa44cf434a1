package org.javai.formula.grammar;

import java.util.Objects;

/**
 * Names the AST builder that reduces a production, with an optional argument such as the
 * operator symbol of a binary production or the literal of a boolean production.
 */
public record SemanticAction(String builder, String argument) {

	public SemanticAction {
		Objects.requireNonNull(builder, "builder must not be null");
		if (builder.isBlank()) {
			throw new IllegalArgumentException("builder must not be blank");
		}
	}

	public static SemanticAction of(String builder) {
		return new SemanticAction(builder, null);
	}

	public static SemanticAction of(String builder, String argument) {
		return new SemanticAction(builder, argument);
	}

	@Override
	public String toString() {
		return argument == null ? builder : builder + "(" + argument + ")";
	}
}
