package org.javai.formula.orchestration;

public enum ExecutionStatus {
	/** Every formula ran. */
	SUCCESS,
	/** Execution stopped at a failing step. */
	FAILED,
	/** No step failed, but at least one was skipped by its execution condition. */
	PARTIAL
}
