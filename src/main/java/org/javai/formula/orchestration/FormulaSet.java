package org.javai.formula.orchestration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * An ordered, named collection of formulas that together compute one result, for example an
 * admission score.
 * <p>
 * Formulas are kept sorted by {@link Formula#order()}. Orders and result variables are
 * unique within a set, so every step's result has exactly one producer.
 *
 * @param id stable identifier
 * @param name display name; defaults to the id
 * @param criteria attributes identifying where the set applies, e.g. a programme or year
 * @param formulas the steps, sorted by order
 * @param finalResultVariable variable holding the overall result; {@code null} for the last
 * formula's result variable
 */
public record FormulaSet(
		String id,
		String name,
		Map<String, String> criteria,
		List<Formula> formulas,
		String finalResultVariable
) {

	public FormulaSet {
		if (StringUtils.isBlank(id)) {
			throw new IllegalArgumentException("Formula set id must not be blank");
		}
		name = StringUtils.isBlank(name) ? id : name;
		criteria = criteria != null ? Map.copyOf(criteria) : Map.of();
		List<Formula> sorted = new ArrayList<>(formulas != null ? formulas : List.of());
		sorted.forEach(f -> Objects.requireNonNull(f, "formula must not be null"));
		sorted.sort(Comparator.comparingInt(Formula::order));
		Set<Integer> orders = new HashSet<>();
		Set<String> results = new HashSet<>();
		for (Formula formula : sorted) {
			if (!orders.add(formula.order())) {
				throw new IllegalArgumentException("Formula set '" + id + "' has more than one formula with order "
						+ formula.order());
			}
			if (!results.add(formula.resultVariable())) {
				throw new IllegalArgumentException("Formula set '" + id + "' binds result variable '"
						+ formula.resultVariable() + "' more than once");
			}
		}
		formulas = List.copyOf(sorted);
		finalResultVariable = StringUtils.trimToNull(finalResultVariable);
	}

	public static Builder builder(String id) {
		return new Builder(id);
	}

	/**
	 * The variable holding the overall result: the declared one, else the last formula's.
	 */
	public Optional<String> resolvedFinalResultVariable() {
		if (finalResultVariable != null) {
			return Optional.of(finalResultVariable);
		}
		return formulas.isEmpty() ? Optional.empty() : Optional.of(formulas.get(formulas.size() - 1).resultVariable());
	}

	public boolean isEmpty() {
		return formulas.isEmpty();
	}

	public int size() {
		return formulas.size();
	}

	public static final class Builder {

		private final String id;
		private String name;
		private final Map<String, String> criteria = new LinkedHashMap<>();
		private final List<Formula> formulas = new ArrayList<>();
		private String finalResultVariable;

		private Builder(String id) {
			this.id = id;
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder criterion(String key, String value) {
			criteria.put(key, value);
			return this;
		}

		public Builder formula(Formula formula) {
			formulas.add(formula);
			return this;
		}

		public Builder formula(String id, String expression, String resultVariable) {
			return formula(Formula.of(id, formulas.size() + 1, expression, resultVariable));
		}

		public Builder finalResultVariable(String variable) {
			this.finalResultVariable = variable;
			return this;
		}

		public FormulaSet build() {
			return new FormulaSet(id, name, criteria, formulas, finalResultVariable);
		}
	}
}
