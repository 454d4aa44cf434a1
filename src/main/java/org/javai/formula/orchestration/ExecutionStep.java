package org.javai.formula.orchestration;

import java.time.Instant;

/**
 * Record of one formula that ran.
 */
public record ExecutionStep(
		int order,
		String formulaId,
		String expression,
		String resultVariable,
		Object resultValue,
		Instant executedAt
) {
}
