package org.javai.formula.grammar;

import java.util.List;
import java.util.Objects;

/**
 * A context-free production {@code left → right}.
 *
 * @param id stable production id; the augmented start production uses {@link Grammar#AUGMENTED_PRODUCTION_ID}
 * @param left the nonterminal being defined
 * @param right right-hand symbols, empty for an epsilon production
 * @param action the builder that reduces this production, or {@code null} if none is attached
 */
public record Production(int id, String left, List<String> right, SemanticAction action) {

	public Production {
		Objects.requireNonNull(left, "left must not be null");
		right = right != null ? List.copyOf(right) : List.of();
	}

	public Production(int id, String left, List<String> right) {
		this(id, left, right, null);
	}

	public int length() {
		return right.size();
	}

	public boolean isEpsilon() {
		return right.isEmpty();
	}

	/**
	 * Direct left recursion, e.g. {@code EXPR → EXPR OR AND_EXPR}.
	 */
	public boolean isLeftRecursive() {
		return !right.isEmpty() && right.get(0).equals(left);
	}

	public boolean isAugmented() {
		return id == Grammar.AUGMENTED_PRODUCTION_ID;
	}

	@Override
	public String toString() {
		return left + " → " + (right.isEmpty() ? "ε" : String.join(" ", right));
	}
}
