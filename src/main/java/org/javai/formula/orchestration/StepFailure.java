package org.javai.formula.orchestration;

/**
 * Where and why an execution stopped.
 *
 * @param stepIndex zero-based position of the failing formula in the set
 * @param formulaId id of the failing formula; {@code null} when no single formula is to blame
 * @param errorCode {@code LAYER.KIND} code of the underlying error
 * @param message the underlying error's message
 */
public record StepFailure(int stepIndex, String formulaId, String errorCode, String message) {
}
