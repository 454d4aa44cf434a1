package org.javai.formula.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.javai.formula.grammar.Grammar;

/**
 * Immutable LALR(1) ACTION and GOTO tables.
 * <p>
 * Built once by {@link ParseTableBuilder} and shared read-only by every parse. Equality is by
 * table content, so two tables built from the same grammar compare equal.
 */
public final class ParseTable {

	private final Grammar grammar;
	private final Map<Integer, Map<String, LRAction>> actions;
	private final Map<Integer, Map<String, Integer>> gotos;
	private final int stateCount;
	private final int canonicalStateCount;

	ParseTable(Grammar grammar, Map<Integer, Map<String, LRAction>> actions, Map<Integer, Map<String, Integer>> gotos,
			int stateCount, int canonicalStateCount) {
		this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
		this.actions = freeze(actions);
		this.gotos = freeze(gotos);
		this.stateCount = stateCount;
		this.canonicalStateCount = canonicalStateCount;
	}

	private static <V> Map<Integer, Map<String, V>> freeze(Map<Integer, Map<String, V>> table) {
		Map<Integer, Map<String, V>> copy = new LinkedHashMap<>();
		table.forEach((state, row) -> copy.put(state, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
		return Collections.unmodifiableMap(copy);
	}

	public Grammar grammar() {
		return grammar;
	}

	public int startState() {
		return 0;
	}

	/**
	 * The action for {@code terminal} in {@code state}; {@link LRAction#ERROR} if there is none.
	 */
	public LRAction action(int state, String terminal) {
		Map<String, LRAction> row = actions.get(state);
		if (row == null) {
			return LRAction.ERROR;
		}
		return row.getOrDefault(terminal, LRAction.ERROR);
	}

	public OptionalInt gotoState(int state, String nonTerminal) {
		Map<String, Integer> row = gotos.get(state);
		if (row == null || !row.containsKey(nonTerminal)) {
			return OptionalInt.empty();
		}
		return OptionalInt.of(row.get(nonTerminal));
	}

	/**
	 * Terminals with a non-error action in {@code state}, for syntax error messages.
	 */
	public List<String> expectedTerminals(int state) {
		Map<String, LRAction> row = actions.get(state);
		if (row == null) {
			return List.of();
		}
		return row.keySet().stream().sorted().toList();
	}

	public Map<String, LRAction> actionRow(int state) {
		return actions.getOrDefault(state, Map.of());
	}

	public Map<String, Integer> gotoRow(int state) {
		return gotos.getOrDefault(state, Map.of());
	}

	/**
	 * Number of LALR states in this table.
	 */
	public int stateCount() {
		return stateCount;
	}

	/**
	 * Number of canonical LR(1) states the table was merged from.
	 */
	public int canonicalStateCount() {
		return canonicalStateCount;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ParseTable other)) {
			return false;
		}
		return stateCount == other.stateCount && actions.equals(other.actions) && gotos.equals(other.gotos);
	}

	@Override
	public int hashCode() {
		return Objects.hash(actions, gotos, stateCount);
	}

	@Override
	public String toString() {
		return "ParseTable[states=" + stateCount + ", canonicalStates=" + canonicalStateCount + "]";
	}
}
