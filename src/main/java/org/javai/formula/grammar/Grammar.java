package org.javai.formula.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable context-free grammar.
 * <p>
 * Operator precedence and associativity are expressed only through the shape of the
 * productions (left recursion for left-associative operators, right recursion for
 * right-associative ones); there is no separate precedence table. The grammar is validated
 * on construction and its FIRST sets are computed once.
 * <p>
 * Symbol sets keep declaration order so that everything derived from a grammar, parse
 * tables included, is deterministic.
 */
public final class Grammar {

	public static final String START = "START";
	public static final String END_OF_INPUT = "EOF";
	public static final int AUGMENTED_PRODUCTION_ID = -1;

	private final String startSymbol;
	private final Set<String> terminals;
	private final Set<String> nonTerminals;
	private final List<Production> productions;
	private final Map<Integer, Production> productionsById;
	private final Map<String, List<Production>> productionsByLeft;
	private final Production augmentedProduction;
	private final Set<String> nullable;
	private final Map<String, Set<String>> firstSets;

	private Grammar(Builder builder) {
		this.startSymbol = builder.startSymbol;
		this.productions = List.copyOf(builder.productions);

		Set<String> declaredNonTerminals = new LinkedHashSet<>(builder.nonTerminals);
		for (Production p : productions) {
			declaredNonTerminals.add(p.left());
		}
		Set<String> declaredTerminals = new LinkedHashSet<>(builder.terminals);
		declaredTerminals.add(END_OF_INPUT);
		this.terminals = Collections.unmodifiableSet(declaredTerminals);
		this.nonTerminals = Collections.unmodifiableSet(declaredNonTerminals);

		Map<Integer, Production> byId = new LinkedHashMap<>();
		Map<String, List<Production>> byLeft = new LinkedHashMap<>();
		for (Production p : productions) {
			if (byId.put(p.id(), p) != null) {
				throw GrammarException.invalidGrammar("Duplicate production id " + p.id());
			}
			byLeft.computeIfAbsent(p.left(), k -> new ArrayList<>()).add(p);
		}
		this.productionsById = Collections.unmodifiableMap(byId);
		Map<String, List<Production>> frozen = new LinkedHashMap<>();
		byLeft.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
		this.productionsByLeft = Collections.unmodifiableMap(frozen);

		validate();

		this.augmentedProduction = new Production(AUGMENTED_PRODUCTION_ID, START, List.of(startSymbol, END_OF_INPUT));
		this.nullable = computeNullable();
		this.firstSets = computeFirstSets();
	}

	public static Builder builder(String startSymbol) {
		return new Builder(startSymbol);
	}

	public String startSymbol() {
		return startSymbol;
	}

	/**
	 * Declared terminals, always including {@link #END_OF_INPUT}.
	 */
	public Set<String> terminals() {
		return terminals;
	}

	public Set<String> nonTerminals() {
		return nonTerminals;
	}

	public List<Production> productions() {
		return productions;
	}

	/**
	 * {@code START → startSymbol EOF}.
	 */
	public Production augmentedProduction() {
		return augmentedProduction;
	}

	public Optional<Production> production(int id) {
		if (id == AUGMENTED_PRODUCTION_ID) {
			return Optional.of(augmentedProduction);
		}
		return Optional.ofNullable(productionsById.get(id));
	}

	public Production requireProduction(int id) {
		return production(id).orElseThrow(() -> new IllegalArgumentException("No production with id " + id));
	}

	public List<Production> productionsFor(String nonTerminal) {
		if (START.equals(nonTerminal)) {
			return List.of(augmentedProduction);
		}
		return productionsByLeft.getOrDefault(nonTerminal, List.of());
	}

	public List<Production> leftRecursiveProductions() {
		return productions.stream().filter(Production::isLeftRecursive).toList();
	}

	public List<Production> epsilonProductions() {
		return productions.stream().filter(Production::isEpsilon).toList();
	}

	public boolean isTerminal(String symbol) {
		return terminals.contains(symbol);
	}

	public boolean isNonTerminal(String symbol) {
		return nonTerminals.contains(symbol) || START.equals(symbol);
	}

	public boolean isNullable(String symbol) {
		return nullable.contains(symbol);
	}

	/**
	 * FIRST set of a single symbol (terminals only; nullability is reported by {@link #isNullable}).
	 */
	public Set<String> first(String symbol) {
		if (isTerminal(symbol)) {
			return Set.of(symbol);
		}
		return firstSets.getOrDefault(symbol, Set.of());
	}

	/**
	 * FIRST of the sequence {@code symbols} followed by {@code lookahead}: the terminals that can
	 * begin a string derived from it. Used to compute LR(1) closure lookaheads.
	 */
	public Set<String> firstOfSequence(List<String> symbols, String lookahead) {
		Set<String> result = new LinkedHashSet<>();
		for (String symbol : symbols) {
			result.addAll(first(symbol));
			if (!isNullable(symbol)) {
				return result;
			}
		}
		result.add(lookahead);
		return result;
	}

	/**
	 * Renders the grammar in BNF, one production per line, prefixed with its id.
	 */
	public String toBnf() {
		StringBuilder sb = new StringBuilder();
		for (Production p : productions) {
			sb.append(p.id()).append(": ").append(p).append('\n');
		}
		return sb.toString();
	}

	private void validate() {
		if (startSymbol == null || startSymbol.isBlank()) {
			throw GrammarException.invalidGrammar("Grammar has no start symbol");
		}
		if (productions.isEmpty()) {
			throw GrammarException.invalidGrammar("Grammar has no productions");
		}
		if (!nonTerminals.contains(startSymbol)) {
			throw GrammarException.invalidGrammar("Start symbol '" + startSymbol + "' is not a nonterminal");
		}
		if (nonTerminals.contains(START) || terminals.contains(START)) {
			throw GrammarException.invalidGrammar("Symbol '" + START + "' is reserved for the augmented start production");
		}
		if (nonTerminals.contains(END_OF_INPUT)) {
			throw GrammarException.invalidGrammar("Symbol '" + END_OF_INPUT + "' is reserved for end of input");
		}
		for (String symbol : terminals) {
			if (nonTerminals.contains(symbol)) {
				throw GrammarException.invalidGrammar("Symbol '" + symbol + "' is declared both terminal and nonterminal");
			}
		}
		for (String nonTerminal : nonTerminals) {
			if (!productionsByLeft.containsKey(nonTerminal)) {
				throw GrammarException.invalidGrammar("Nonterminal '" + nonTerminal + "' has no productions");
			}
		}
		for (Production p : productions) {
			if (p.id() < 0) {
				throw GrammarException.invalidGrammar("Production id must not be negative: " + p);
			}
			for (String symbol : p.right()) {
				if (END_OF_INPUT.equals(symbol)) {
					throw GrammarException.invalidGrammar("Production " + p.id() + " uses reserved symbol " + END_OF_INPUT);
				}
				if (!terminals.contains(symbol) && !nonTerminals.contains(symbol)) {
					throw GrammarException.invalidGrammar(
							"Production " + p.id() + " (" + p + ") references undeclared symbol '" + symbol + "'");
				}
			}
		}
	}

	private Set<String> computeNullable() {
		Set<String> result = new LinkedHashSet<>();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Production p : productions) {
				if (!result.contains(p.left()) && result.containsAll(p.right())) {
					result.add(p.left());
					changed = true;
				}
			}
		}
		return Collections.unmodifiableSet(result);
	}

	private Map<String, Set<String>> computeFirstSets() {
		Map<String, Set<String>> first = new LinkedHashMap<>();
		for (String nonTerminal : nonTerminals) {
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Production p : productions) {
				Set<String> target = first.get(p.left());
				for (String symbol : p.right()) {
					Set<String> contribution = isTerminal(symbol) ? Set.of(symbol) : first.get(symbol);
					if (target.addAll(contribution)) {
						changed = true;
					}
					if (!nullable.contains(symbol)) {
						break;
					}
				}
			}
		}
		Map<String, Set<String>> frozen = new LinkedHashMap<>();
		first.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
		return Collections.unmodifiableMap(frozen);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Grammar other)) {
			return false;
		}
		return startSymbol.equals(other.startSymbol)
				&& terminals.equals(other.terminals)
				&& productions.equals(other.productions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(startSymbol, terminals, productions);
	}

	@Override
	public String toString() {
		return "Grammar[start=" + startSymbol + ", productions=" + productions.size()
				+ ", terminals=" + terminals.size() + ", nonTerminals=" + nonTerminals.size() + "]";
	}

	/**
	 * Assembles a grammar programmatically. Nonterminals are taken from the left-hand sides
	 * of the productions plus any declared explicitly.
	 */
	public static final class Builder {

		private final String startSymbol;
		private final Set<String> terminals = new LinkedHashSet<>();
		private final Set<String> nonTerminals = new LinkedHashSet<>();
		private final List<Production> productions = new ArrayList<>();

		private Builder(String startSymbol) {
			this.startSymbol = startSymbol;
		}

		public Builder terminals(String... symbols) {
			return terminals(List.of(symbols));
		}

		public Builder terminals(List<String> symbols) {
			terminals.addAll(symbols);
			return this;
		}

		public Builder nonTerminals(List<String> symbols) {
			nonTerminals.addAll(symbols);
			return this;
		}

		public Builder production(int id, String left, String... right) {
			return production(new Production(id, left, List.of(right)));
		}

		public Builder production(Production production) {
			productions.add(Objects.requireNonNull(production, "production must not be null"));
			return this;
		}

		/**
		 * @throws GrammarException of kind {@code INVALID_GRAMMAR} if the grammar is malformed
		 */
		public Grammar build() {
			return new Grammar(this);
		}
	}
}
