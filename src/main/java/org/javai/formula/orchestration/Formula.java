package org.javai.formula.orchestration;

import org.apache.commons.lang3.StringUtils;

/**
 * One step of a {@link FormulaSet}.
 *
 * @param id stable identifier, recorded in executions
 * @param name display name; defaults to the id
 * @param expression formula text
 * @param order position within the set; positive and unique per set
 * @param resultVariable variable the result is bound to for later steps
 * @param executionCondition formula that must be truthy for this step to run; {@code null}
 * to always run
 * @param description free text, may be {@code null}
 */
public record Formula(
		String id,
		String name,
		String expression,
		int order,
		String resultVariable,
		String executionCondition,
		String description
) {

	public Formula {
		if (StringUtils.isBlank(id)) {
			throw new IllegalArgumentException("Formula id must not be blank");
		}
		if (StringUtils.isBlank(expression)) {
			throw new IllegalArgumentException("Formula '" + id + "' has no expression");
		}
		if (StringUtils.isBlank(resultVariable)) {
			throw new IllegalArgumentException("Formula '" + id + "' has no result variable");
		}
		if (order <= 0) {
			throw new IllegalArgumentException("Formula '" + id + "' order must be positive, got " + order);
		}
		name = StringUtils.isBlank(name) ? id : name;
		executionCondition = StringUtils.trimToNull(executionCondition);
	}

	public static Formula of(String id, int order, String expression, String resultVariable) {
		return new Formula(id, null, expression, order, resultVariable, null, null);
	}

	public Formula withExecutionCondition(String condition) {
		return new Formula(id, name, expression, order, resultVariable, condition, description);
	}

	public Formula withDescription(String text) {
		return new Formula(id, name, expression, order, resultVariable, executionCondition, text);
	}

	public boolean isConditional() {
		return executionCondition != null;
	}
}
