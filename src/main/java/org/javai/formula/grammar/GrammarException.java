package org.javai.formula.grammar;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.formula.FormulaEngineException;

/**
 * Exception thrown when a grammar is malformed or cannot be turned into a deterministic
 * LALR(1) parse table. These errors are fatal at engine construction time.
 */
public class GrammarException extends FormulaEngineException {

	public enum Kind {
		INVALID_GRAMMAR,
		GRAMMAR_CONFLICT,
		EMPTY_CORE_ITEMS
	}

	/**
	 * A shift/reduce or reduce/reduce conflict: more than one action for one state and lookahead.
	 */
	public record Conflict(int state, String terminal, List<String> actions) {

		public Conflict {
			actions = List.copyOf(actions);
		}

		public boolean isReduceReduce() {
			return actions.stream().noneMatch(a -> a.startsWith("shift"));
		}

		@Override
		public String toString() {
			return (isReduceReduce() ? "reduce/reduce" : "shift/reduce") + " conflict in state " + state
					+ " on " + terminal + ": " + String.join(" | ", actions);
		}
	}

	private final Kind kind;
	private final List<Conflict> conflicts;

	private GrammarException(Kind kind, String message, List<Conflict> conflicts, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.conflicts = List.copyOf(conflicts);
	}

	public static GrammarException invalidGrammar(String message) {
		return new GrammarException(Kind.INVALID_GRAMMAR, message, List.of(), null);
	}

	public static GrammarException invalidGrammar(String message, Throwable cause) {
		return new GrammarException(Kind.INVALID_GRAMMAR, message, List.of(), cause);
	}

	public static GrammarException conflicts(List<Conflict> conflicts) {
		String detail = conflicts.stream().map(Conflict::toString).collect(Collectors.joining("\n  "));
		return new GrammarException(Kind.GRAMMAR_CONFLICT,
				"Grammar is not LALR(1): " + conflicts.size() + " conflict(s)\n  " + detail, conflicts, null);
	}

	public static GrammarException emptyCoreItems() {
		return new GrammarException(Kind.EMPTY_CORE_ITEMS, "Cannot compress an LR state without items", List.of(), null);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * All conflicts found during table construction; empty for other kinds.
	 */
	public List<Conflict> conflicts() {
		return conflicts;
	}

	@Override
	public String errorCode() {
		return "GRAMMAR." + kind.name();
	}
}
