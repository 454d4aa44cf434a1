package org.javai.formula.eval;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.formula.ast.AstNode;

/**
 * Memoized subtree results, keyed by AST node identity, the variable snapshot, the coercion
 * mode, the remaining depth budget and the {@link FunctionRegistry#generation() generation} of
 * the functions in use. Only successful results are stored.
 * <p>
 * Safe for concurrent use. When the entry limit is reached the cache is cleared rather than
 * evicting selectively.
 */
public final class EvaluationCache {

	public static final int DEFAULT_MAX_ENTRIES = 10_000;

	private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
	private final int maxEntries;

	public EvaluationCache() {
		this(DEFAULT_MAX_ENTRIES);
	}

	public EvaluationCache(int maxEntries) {
		if (maxEntries <= 0) {
			throw new IllegalArgumentException("maxEntries must be positive");
		}
		this.maxEntries = maxEntries;
	}

	Optional<Entry> get(AstNode node, EvaluationContext context, int remainingDepth, long functionsGeneration) {
		return Optional.ofNullable(entries.get(key(node, context, remainingDepth, functionsGeneration)));
	}

	void put(AstNode node, EvaluationContext context, int remainingDepth, long functionsGeneration, Object value,
			Set<String> touchedNames) {
		if (entries.size() >= maxEntries) {
			entries.clear();
		}
		entries.put(key(node, context, remainingDepth, functionsGeneration),
				new Entry(value, Set.copyOf(touchedNames)));
	}

	public int size() {
		return entries.size();
	}

	public void clear() {
		entries.clear();
	}

	private static Key key(AstNode node, EvaluationContext context, int remainingDepth, long functionsGeneration) {
		return new Key(new NodeIdentity(node), context.variables(), context.strictMode(), remainingDepth,
				functionsGeneration);
	}

	record Entry(Object value, Set<String> touchedNames) {
	}

	private record Key(NodeIdentity node, Map<String, Object> variables, boolean strictMode, int remainingDepth,
			long functionsGeneration) {
	}

	/**
	 * Identity wrapper: structurally equal subtrees at different positions are distinct keys.
	 */
	private record NodeIdentity(AstNode node) {

		@Override
		public boolean equals(Object o) {
			return o instanceof NodeIdentity other && other.node == node;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(node);
		}
	}
}
