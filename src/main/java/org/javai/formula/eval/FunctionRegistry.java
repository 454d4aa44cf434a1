package org.javai.formula.eval;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Functions callable from formulas, looked up case-insensitively.
 * <p>
 * The arity of every function is fixed at registration; the evaluator checks it before the
 * function is called.
 */
public final class FunctionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

	private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();
	private final AtomicLong generation = new AtomicLong();

	private FunctionRegistry() {
	}

	/**
	 * Create an empty registry.
	 */
	public static FunctionRegistry create() {
		return new FunctionRegistry();
	}

	/**
	 * Create a registry holding the built-in math functions.
	 */
	public static FunctionRegistry withBuiltins() {
		FunctionRegistry registry = new FunctionRegistry();
		BuiltinFunctions.registerAll(registry);
		return registry;
	}

	/**
	 * Register a function. A later registration under the same name replaces the earlier one.
	 */
	public FunctionRegistry register(FunctionDefinition definition) {
		Objects.requireNonNull(definition, "definition must not be null");
		FunctionDefinition previous = functions.put(definition.name(), definition);
		generation.incrementAndGet();
		if (previous != null) {
			logger.debug("Function '{}' re-registered; replacing previous definition", definition.name());
		}
		return this;
	}

	public FunctionRegistry register(String name, Arity arity, MathFunction body) {
		return register(new FunctionDefinition(name, arity, body));
	}

	public Optional<FunctionDefinition> lookup(String name) {
		if (name == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(functions.get(name.toUpperCase(Locale.ROOT)));
	}

	/**
	 * @throws EvaluationException of kind {@code UNSUPPORTED_FUNCTION} if no such function exists
	 */
	public FunctionDefinition require(String name) {
		return lookup(name).orElseThrow(() -> EvaluationException.unsupportedFunction(name));
	}

	public boolean contains(String name) {
		return lookup(name).isPresent();
	}

	/**
	 * Registered names, upper case, sorted.
	 */
	public Set<String> names() {
		return new TreeSet<>(functions.keySet());
	}

	/**
	 * Counter advanced by every registration. Memoized results are only valid for the generation
	 * they were computed under.
	 */
	public long generation() {
		return generation.get();
	}

	public int size() {
		return functions.size();
	}
}
