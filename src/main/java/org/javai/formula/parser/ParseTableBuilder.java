package org.javai.formula.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.javai.formula.grammar.Grammar;
import org.javai.formula.grammar.GrammarException;
import org.javai.formula.grammar.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds LALR(1) parse tables.
 * <p>
 * The canonical LR(1) collection is constructed first (closure and GOTO to a fixpoint).
 * States are then compressed to their cores and states sharing a core are merged whenever
 * {@link CompressedLRState#canMergeLALR} allows it; the resulting partition is refined until
 * every merged state has a single GOTO target per symbol. ACTION and GOTO entries are derived
 * from the merged states and every remaining conflict is reported at once.
 */
public final class ParseTableBuilder {

	private static final Logger logger = LoggerFactory.getLogger(ParseTableBuilder.class);

	private final Grammar grammar;

	public ParseTableBuilder(Grammar grammar) {
		this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
	}

	/**
	 * Build the table.
	 *
	 * @throws GrammarException of kind {@code GRAMMAR_CONFLICT} listing every conflict if the
	 * grammar is not LALR(1)
	 */
	public ParseTable build() {
		CanonicalCollection canonical = canonicalCollection();
		List<List<Integer>> groups = mergeGroups(canonical);
		ParseTable table = buildTable(canonical, groups);
		logger.info("Built LALR(1) parse table: {} canonical LR(1) states merged into {} states ({} productions)",
				canonical.size(), table.stateCount(), grammar.productions().size());
		return table;
	}

	/**
	 * The canonical LR(1) states, compressed to their cores, in construction order.
	 * State 0 is the closure of the augmented start item.
	 */
	public List<CompressedLRState> canonicalStates() {
		return canonicalCollection().states();
	}

	/**
	 * LR(1) closure of {@code items}.
	 */
	public Set<LRItem> closure(Collection<LRItem> items) {
		Map<ItemCore, Set<String>> kernel = new LinkedHashMap<>();
		for (LRItem item : items) {
			kernel.computeIfAbsent(item.core(), k -> new LinkedHashSet<>()).add(item.lookahead());
		}
		Set<LRItem> result = new LinkedHashSet<>();
		closure(kernel).forEach((core, las) -> las.forEach(la -> result.add(LRItem.of(core, la))));
		return result;
	}

	private Map<ItemCore, Set<String>> closure(Map<ItemCore, Set<String>> kernel) {
		Map<ItemCore, Set<String>> result = new LinkedHashMap<>();
		kernel.forEach((core, las) -> result.put(core, new LinkedHashSet<>(las)));
		Deque<ItemCore> work = new ArrayDeque<>(result.keySet());
		Set<ItemCore> queued = new HashSet<>(result.keySet());

		while (!work.isEmpty()) {
			ItemCore core = work.poll();
			queued.remove(core);
			String next = core.nextSymbol();
			if (next == null || !grammar.isNonTerminal(next)) {
				continue;
			}
			List<String> rest = core.production().right().subList(core.dot() + 1, core.production().length());
			Set<String> propagated = new LinkedHashSet<>();
			for (String lookahead : result.get(core)) {
				propagated.addAll(grammar.firstOfSequence(rest, lookahead));
			}
			for (Production production : grammar.productionsFor(next)) {
				ItemCore target = new ItemCore(production, 0);
				Set<String> targetLookaheads = result.computeIfAbsent(target, k -> new LinkedHashSet<>());
				if (targetLookaheads.addAll(propagated) && queued.add(target)) {
					work.add(target);
				}
			}
		}
		return result;
	}

	private CanonicalCollection canonicalCollection() {
		List<Map<ItemCore, Set<String>>> states = new ArrayList<>();
		List<Map<String, Integer>> transitions = new ArrayList<>();
		Map<Map<ItemCore, Set<String>>, Integer> byKernel = new HashMap<>();

		Map<ItemCore, Set<String>> startKernel = new LinkedHashMap<>();
		startKernel.put(new ItemCore(grammar.augmentedProduction(), 0), new LinkedHashSet<>(List.of(Grammar.END_OF_INPUT)));
		byKernel.put(startKernel, 0);
		states.add(closure(startKernel));
		transitions.add(new LinkedHashMap<>());

		for (int i = 0; i < states.size(); i++) {
			Map<String, Map<ItemCore, Set<String>>> kernels = new LinkedHashMap<>();
			states.get(i).forEach((core, las) -> {
				String next = core.nextSymbol();
				if (next == null || isAcceptPosition(core)) {
					return;
				}
				kernels.computeIfAbsent(next, k -> new LinkedHashMap<>())
						.computeIfAbsent(core.advance(), k -> new LinkedHashSet<>())
						.addAll(las);
			});
			for (Map.Entry<String, Map<ItemCore, Set<String>>> entry : kernels.entrySet()) {
				Integer target = byKernel.get(entry.getValue());
				if (target == null) {
					target = states.size();
					byKernel.put(entry.getValue(), target);
					states.add(closure(entry.getValue()));
					transitions.add(new LinkedHashMap<>());
				}
				transitions.get(i).put(entry.getKey(), target);
			}
		}

		List<CompressedLRState> compressed = new ArrayList<>(states.size());
		for (Map<ItemCore, Set<String>> state : states) {
			compressed.add(CompressedLRState.of(grammar, state, true));
		}
		return new CanonicalCollection(compressed, transitions);
	}

	private List<List<Integer>> mergeGroups(CanonicalCollection canonical) {
		Map<String, List<Cluster>> bySignature = new LinkedHashMap<>();
		List<Cluster> clusters = new ArrayList<>();
		for (int i = 0; i < canonical.size(); i++) {
			CompressedLRState state = canonical.states().get(i);
			List<Cluster> candidates = bySignature.computeIfAbsent(state.signature(), k -> new ArrayList<>());
			Cluster home = null;
			for (Cluster candidate : candidates) {
				if (candidate.merged.canMergeLALR(state)) {
					home = candidate;
					break;
				}
			}
			if (home == null) {
				if (!candidates.isEmpty()) {
					logger.debug("Keeping LR(1) state {} apart from its core twins: merging would add a conflict", i);
				}
				home = new Cluster(state);
				candidates.add(home);
				clusters.add(home);
			}
			else {
				home.merged = home.merged.mergeLALR(state);
			}
			home.members.add(i);
		}

		List<List<Integer>> groups = new ArrayList<>();
		for (Cluster cluster : clusters) {
			groups.add(cluster.members);
		}
		return refine(groups, canonical.transitions());
	}

	/**
	 * Split groups whose members disagree on the group of a GOTO target, until stable.
	 */
	private List<List<Integer>> refine(List<List<Integer>> groups, List<Map<String, Integer>> transitions) {
		boolean split = true;
		while (split) {
			split = false;
			int[] groupOf = groupIndex(groups, transitions.size());
			List<List<Integer>> refined = new ArrayList<>();
			for (List<Integer> group : groups) {
				Map<Map<String, Integer>, List<Integer>> bySuccessors = new LinkedHashMap<>();
				for (int member : group) {
					Map<String, Integer> successorGroups = new TreeMap<>();
					transitions.get(member).forEach((symbol, target) -> successorGroups.put(symbol, groupOf[target]));
					bySuccessors.computeIfAbsent(successorGroups, k -> new ArrayList<>()).add(member);
				}
				if (bySuccessors.size() > 1) {
					split = true;
				}
				refined.addAll(bySuccessors.values());
			}
			groups = refined;
		}
		groups.sort(Comparator.comparingInt(group -> group.get(0)));
		return groups;
	}

	private ParseTable buildTable(CanonicalCollection canonical, List<List<Integer>> groups) {
		int[] groupOf = groupIndex(groups, canonical.size());
		Map<Integer, Map<String, LRAction>> actions = new LinkedHashMap<>();
		Map<Integer, Map<String, Integer>> gotos = new LinkedHashMap<>();
		List<GrammarException.Conflict> conflicts = new ArrayList<>();

		for (int g = 0; g < groups.size(); g++) {
			List<Integer> members = groups.get(g);
			CompressedLRState merged = canonical.states().get(members.get(0));
			for (int k = 1; k < members.size(); k++) {
				merged = merged.union(canonical.states().get(members.get(k)), true);
			}
			Map<String, Integer> successors = canonical.transitions().get(members.get(0));

			Map<String, Set<LRAction>> candidates = new LinkedHashMap<>();
			Map<String, Integer> gotoRow = new LinkedHashMap<>();
			for (Map.Entry<ItemCore, Set<String>> entry : merged.lookaheadMap().entrySet()) {
				ItemCore core = entry.getKey();
				if (core.isComplete()) {
					for (String lookahead : entry.getValue()) {
						candidates.computeIfAbsent(lookahead, k -> new LinkedHashSet<>()).add(new LRAction.Reduce(core.production()));
					}
					continue;
				}
				String next = core.nextSymbol();
				if (isAcceptPosition(core)) {
					candidates.computeIfAbsent(next, k -> new LinkedHashSet<>()).add(LRAction.ACCEPT);
				}
				else if (grammar.isTerminal(next)) {
					candidates.computeIfAbsent(next, k -> new LinkedHashSet<>()).add(new LRAction.Shift(groupOf[successors.get(next)]));
				}
				else {
					gotoRow.put(next, groupOf[successors.get(next)]);
				}
			}

			Map<String, LRAction> actionRow = new LinkedHashMap<>();
			for (Map.Entry<String, Set<LRAction>> entry : candidates.entrySet()) {
				if (entry.getValue().size() > 1) {
					conflicts.add(new GrammarException.Conflict(g, entry.getKey(),
							entry.getValue().stream().map(LRAction::toString).toList()));
				}
				else {
					actionRow.put(entry.getKey(), entry.getValue().iterator().next());
				}
			}
			actions.put(g, actionRow);
			gotos.put(g, gotoRow);
		}

		if (!conflicts.isEmpty()) {
			throw GrammarException.conflicts(conflicts);
		}
		return new ParseTable(grammar, actions, gotos, groups.size(), canonical.size());
	}

	private boolean isAcceptPosition(ItemCore core) {
		return core.production().isAugmented() && Grammar.END_OF_INPUT.equals(core.nextSymbol());
	}

	private static int[] groupIndex(List<List<Integer>> groups, int stateCount) {
		int[] groupOf = new int[stateCount];
		for (int g = 0; g < groups.size(); g++) {
			for (int member : groups.get(g)) {
				groupOf[member] = g;
			}
		}
		return groupOf;
	}

	private record CanonicalCollection(List<CompressedLRState> states, List<Map<String, Integer>> transitions) {

		int size() {
			return states.size();
		}
	}

	private static final class Cluster {

		private CompressedLRState merged;
		private final List<Integer> members = new ArrayList<>();

		private Cluster(CompressedLRState first) {
			this.merged = first;
		}
	}
}
