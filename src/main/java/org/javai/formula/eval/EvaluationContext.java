package org.javai.formula.eval;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable variable bindings and evaluation limits.
 * <p>
 * Every {@code with...} method returns a new context; the receiver is never changed, so a
 * context can be handed to concurrent evaluations and threaded between formula steps without
 * one step observing another's bindings.
 *
 * @param variables bindings from name to {@link Number}, {@link Boolean} or {@link String}
 * @param maxDepth maximum evaluation depth
 * @param maxVariables maximum number of bindings
 * @param strictMode disables coercion between numbers, booleans and strings
 * @param enableCaching memoize subtree results by node identity and variable snapshot
 */
public record EvaluationContext(Map<String, Object> variables, int maxDepth, int maxVariables, boolean strictMode,
		boolean enableCaching) {

	public static final int DEFAULT_MAX_DEPTH = 256;
	public static final int DEFAULT_MAX_VARIABLES = 1_000;

	public EvaluationContext {
		if (maxDepth <= 0 || maxVariables < 0) {
			throw new IllegalArgumentException("Invalid context limits: maxDepth=" + maxDepth + ", maxVariables=" + maxVariables);
		}
		Map<String, Object> source = variables != null ? variables : Map.of();
		if (source.size() > maxVariables) {
			throw EvaluationException.tooManyVariables(maxVariables, source.size());
		}
		for (Map.Entry<String, Object> entry : source.entrySet()) {
			Objects.requireNonNull(entry.getKey(), "variable name must not be null");
			if (entry.getValue() == null) {
				throw EvaluationException.unsupportedType("Variable '" + entry.getKey() + "' has no value", null);
			}
			TypeCoercion.normalize(entry.getValue());
		}
		variables = Map.copyOf(source);
	}

	public static EvaluationContext empty() {
		return of(Map.of());
	}

	public static EvaluationContext of(Map<String, ?> variables) {
		return new EvaluationContext(new LinkedHashMap<>(variables), DEFAULT_MAX_DEPTH, DEFAULT_MAX_VARIABLES, false, false);
	}

	public Optional<Object> variable(String name) {
		return Optional.ofNullable(variables.get(name));
	}

	public boolean hasVariable(String name) {
		return variables.containsKey(name);
	}

	/**
	 * @throws EvaluationException of kind {@code TOO_MANY_VARIABLES} if the binding would exceed {@code maxVariables}
	 */
	public EvaluationContext withVariable(String name, Object value) {
		Map<String, Object> copy = new LinkedHashMap<>(variables);
		copy.put(name, value);
		return new EvaluationContext(copy, maxDepth, maxVariables, strictMode, enableCaching);
	}

	public EvaluationContext withVariables(Map<String, ?> additional) {
		Map<String, Object> copy = new LinkedHashMap<>(variables);
		copy.putAll(additional);
		return new EvaluationContext(copy, maxDepth, maxVariables, strictMode, enableCaching);
	}

	public EvaluationContext withoutVariable(String name) {
		Map<String, Object> copy = new LinkedHashMap<>(variables);
		copy.remove(name);
		return new EvaluationContext(copy, maxDepth, maxVariables, strictMode, enableCaching);
	}

	public EvaluationContext withMaxDepth(int maxDepth) {
		return new EvaluationContext(variables, maxDepth, maxVariables, strictMode, enableCaching);
	}

	public EvaluationContext withMaxVariables(int maxVariables) {
		return new EvaluationContext(variables, maxDepth, maxVariables, strictMode, enableCaching);
	}

	public EvaluationContext withStrictMode(boolean strictMode) {
		return new EvaluationContext(variables, maxDepth, maxVariables, strictMode, enableCaching);
	}

	public EvaluationContext withCaching(boolean enableCaching) {
		return new EvaluationContext(variables, maxDepth, maxVariables, strictMode, enableCaching);
	}
}
