package org.javai.formula.parser;

import java.util.Objects;
import org.javai.formula.grammar.Production;

/**
 * The core of an LR item: a production and a dot position, without lookahead.
 */
public record ItemCore(Production production, int dot) implements Comparable<ItemCore> {

	public ItemCore {
		Objects.requireNonNull(production, "production must not be null");
		if (dot < 0 || dot > production.length()) {
			throw new IllegalArgumentException("Dot position " + dot + " out of range for " + production);
		}
	}

	public boolean isComplete() {
		return dot == production.length();
	}

	/**
	 * The symbol after the dot, or {@code null} if the item is complete.
	 */
	public String nextSymbol() {
		return isComplete() ? null : production.right().get(dot);
	}

	public ItemCore advance() {
		if (isComplete()) {
			throw new IllegalStateException("Cannot advance complete item " + this);
		}
		return new ItemCore(production, dot + 1);
	}

	/**
	 * {@code productionId:dot}, the unit from which state signatures are built.
	 */
	public String key() {
		return production.id() + ":" + dot;
	}

	@Override
	public int compareTo(ItemCore other) {
		int byId = Integer.compare(production.id(), other.production.id());
		return byId != 0 ? byId : Integer.compare(dot, other.dot);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(production.left()).append(" →");
		for (int i = 0; i <= production.length(); i++) {
			if (i == dot) {
				sb.append(" •");
			}
			if (i < production.length()) {
				sb.append(' ').append(production.right().get(i));
			}
		}
		return sb.toString();
	}
}
