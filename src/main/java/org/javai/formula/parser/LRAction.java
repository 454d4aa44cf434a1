package org.javai.formula.parser;

import java.util.Objects;
import org.javai.formula.grammar.Production;

/**
 * An entry of the ACTION table.
 */
public sealed interface LRAction {

	LRAction ACCEPT = new Accept();
	LRAction ERROR = new Error();

	record Shift(int state) implements LRAction {

		@Override
		public String toString() {
			return "shift " + state;
		}
	}

	record Reduce(Production production) implements LRAction {

		public Reduce {
			Objects.requireNonNull(production, "production must not be null");
		}

		@Override
		public String toString() {
			return "reduce " + production.id() + " (" + production + ")";
		}
	}

	record Accept() implements LRAction {

		@Override
		public String toString() {
			return "accept";
		}
	}

	/**
	 * No action: the lookahead is a syntax error in this state.
	 */
	record Error() implements LRAction {

		@Override
		public String toString() {
			return "error";
		}
	}
}
