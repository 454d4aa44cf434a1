package org.javai.formula.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.formula.grammar.Grammar;
import org.javai.formula.grammar.GrammarException;

/**
 * An LR(1) state viewed by its cores: each {@link ItemCore} maps to the set of lookaheads
 * that the full LR(1) items with that core carry.
 * <p>
 * The signature is the sorted list of core keys and depends on nothing else, so two states
 * with equal signatures are LALR merge candidates. Whether a merge is legal is decided by
 * {@link #canMergeLALR(CompressedLRState)}.
 */
public final class CompressedLRState {

	private final Grammar grammar;
	private final Map<ItemCore, Set<String>> lookaheads;
	private final String signature;
	private final boolean fullyBuilt;

	private CompressedLRState(Grammar grammar, Map<ItemCore, Set<String>> lookaheads, boolean fullyBuilt) {
		this.grammar = grammar;
		Map<ItemCore, Set<String>> copy = new LinkedHashMap<>();
		lookaheads.forEach((core, las) -> copy.put(core, Collections.unmodifiableSet(new LinkedHashSet<>(las))));
		this.lookaheads = Collections.unmodifiableMap(copy);
		this.signature = copy.keySet().stream()
				.sorted()
				.map(ItemCore::key)
				.collect(Collectors.joining("|"));
		this.fullyBuilt = fullyBuilt;
	}

	/**
	 * Compress a set of LR(1) items, grouping lookaheads by core.
	 *
	 * @throws GrammarException of kind {@code EMPTY_CORE_ITEMS} if {@code items} is empty
	 */
	public static CompressedLRState fromItems(Grammar grammar, Collection<LRItem> items, boolean fullyBuilt) {
		Objects.requireNonNull(grammar, "grammar must not be null");
		if (items == null || items.isEmpty()) {
			throw GrammarException.emptyCoreItems();
		}
		Map<ItemCore, Set<String>> byCore = new LinkedHashMap<>();
		for (LRItem item : items) {
			byCore.computeIfAbsent(item.core(), k -> new LinkedHashSet<>()).add(item.lookahead());
		}
		return new CompressedLRState(grammar, byCore, fullyBuilt);
	}

	static CompressedLRState of(Grammar grammar, Map<ItemCore, Set<String>> lookaheads, boolean fullyBuilt) {
		if (lookaheads.isEmpty()) {
			throw GrammarException.emptyCoreItems();
		}
		return new CompressedLRState(grammar, lookaheads, fullyBuilt);
	}

	public String signature() {
		return signature;
	}

	public boolean isFullyBuilt() {
		return fullyBuilt;
	}

	public Set<ItemCore> coreItems() {
		return lookaheads.keySet();
	}

	public Set<String> lookaheads(ItemCore core) {
		return lookaheads.getOrDefault(core, Set.of());
	}

	Map<ItemCore, Set<String>> lookaheadMap() {
		return lookaheads;
	}

	/**
	 * Expand back into full LR(1) items.
	 */
	public Set<LRItem> items() {
		Set<LRItem> items = new LinkedHashSet<>();
		lookaheads.forEach((core, las) -> las.forEach(la -> items.add(LRItem.of(core, la))));
		return items;
	}

	public boolean hasSameCore(CompressedLRState other) {
		return signature.equals(other.signature);
	}

	/**
	 * Whether this state and {@code other} may be merged into one LALR state: both must be fully
	 * built, share the same core, and the merge must not create a conflict that neither state
	 * had on its own.
	 */
	public boolean canMergeLALR(CompressedLRState other) {
		return fullyBuilt && other.fullyBuilt && hasSameCore(other) && !hasLookaheadConflicts(other);
	}

	/**
	 * Whether merging with {@code other} would introduce a new shift/reduce or reduce/reduce
	 * conflict. Cores are compared pairwise: a pair whose trigger terminals overlap in the
	 * merged state conflicts, and the conflict is new unless the same pair already overlapped
	 * on that terminal within one of the two source states.
	 */
	public boolean hasLookaheadConflicts(CompressedLRState other) {
		if (!hasSameCore(other)) {
			throw new IllegalArgumentException("States with different cores cannot be merged: "
					+ signature + " vs " + other.signature);
		}
		CompressedLRState merged = union(other, fullyBuilt && other.fullyBuilt);
		List<ItemCore> cores = new ArrayList<>(merged.lookaheads.keySet());
		for (int i = 0; i < cores.size(); i++) {
			for (int j = i + 1; j < cores.size(); j++) {
				ItemCore first = cores.get(i);
				ItemCore second = cores.get(j);
				for (String terminal : merged.sharedTriggers(first, second)) {
					if (!this.sharedTriggers(first, second).contains(terminal)
							&& !other.sharedTriggers(first, second).contains(terminal)) {
						return true;
					}
				}
			}
		}
		return false;
	}

	/**
	 * Whether this state on its own has a shift/reduce or reduce/reduce conflict.
	 */
	public boolean hasLookaheadConflicts() {
		List<ItemCore> cores = new ArrayList<>(lookaheads.keySet());
		for (int i = 0; i < cores.size(); i++) {
			for (int j = i + 1; j < cores.size(); j++) {
				if (!sharedTriggers(cores.get(i), cores.get(j)).isEmpty()) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Merge with {@code other}, taking the union of lookaheads per core.
	 *
	 * @throws IllegalArgumentException if the merge is not legal
	 */
	public CompressedLRState mergeLALR(CompressedLRState other) {
		if (!canMergeLALR(other)) {
			throw new IllegalArgumentException("States cannot be LALR-merged: " + signature);
		}
		return union(other, true);
	}

	CompressedLRState union(CompressedLRState other, boolean built) {
		Map<ItemCore, Set<String>> merged = new LinkedHashMap<>();
		lookaheads.forEach((core, las) -> merged.put(core, new LinkedHashSet<>(las)));
		other.lookaheads.forEach((core, las) -> merged.computeIfAbsent(core, k -> new LinkedHashSet<>()).addAll(las));
		return new CompressedLRState(grammar, merged, built);
	}

	/**
	 * Terminals on which both cores would act, where at least one of them reduces. Two shifts
	 * on the same terminal never conflict.
	 */
	private Set<String> sharedTriggers(ItemCore first, ItemCore second) {
		if (!first.isComplete() && !second.isComplete()) {
			return Set.of();
		}
		Set<String> shared = new LinkedHashSet<>(triggers(first));
		shared.retainAll(triggers(second));
		return shared;
	}

	private Set<String> triggers(ItemCore core) {
		if (core.isComplete()) {
			return lookaheads(core);
		}
		String next = core.nextSymbol();
		return grammar.isTerminal(next) ? Set.of(next) : Set.of();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CompressedLRState other)) {
			return false;
		}
		return fullyBuilt == other.fullyBuilt && lookaheads.equals(other.lookaheads);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lookaheads, fullyBuilt);
	}

	@Override
	public String toString() {
		return lookaheads.entrySet().stream()
				.map(e -> "[" + e.getKey() + ", " + String.join("/", e.getValue()) + "]")
				.collect(Collectors.joining(" ", "CompressedLRState{", "}"));
	}
}
