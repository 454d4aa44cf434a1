package org.javai.formula.parser;

import java.util.Objects;
import org.javai.formula.grammar.Production;

/**
 * An LR(1) item {@code [A → α • β, lookahead]}.
 */
public record LRItem(Production production, int dot, String lookahead) {

	public LRItem {
		Objects.requireNonNull(production, "production must not be null");
		Objects.requireNonNull(lookahead, "lookahead must not be null");
		if (dot < 0 || dot > production.length()) {
			throw new IllegalArgumentException("Dot position " + dot + " out of range for " + production);
		}
	}

	public static LRItem of(ItemCore core, String lookahead) {
		return new LRItem(core.production(), core.dot(), lookahead);
	}

	public ItemCore core() {
		return new ItemCore(production, dot);
	}

	public boolean isComplete() {
		return dot == production.length();
	}

	public String nextSymbol() {
		return isComplete() ? null : production.right().get(dot);
	}

	@Override
	public String toString() {
		return "[" + core() + ", " + lookahead + "]";
	}
}
