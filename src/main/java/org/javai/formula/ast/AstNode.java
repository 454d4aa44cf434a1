package org.javai.formula.ast;

import java.util.List;
import java.util.Objects;

/**
 * Immutable abstract syntax tree of a formula expression.
 * <p>
 * The set of node types is closed. Consumers dispatch on {@link #kind()} with an exhaustive
 * switch; adding a variant adds a {@link NodeKind} constant and every such switch stops
 * compiling until it handles it.
 */
public sealed interface AstNode {

	NodeKind kind();

	/**
	 * Direct children in evaluation order; empty for leaves.
	 */
	List<AstNode> children();

	record NumberLiteral(double value) implements AstNode {

		@Override
		public NodeKind kind() {
			return NodeKind.NUMBER;
		}

		@Override
		public List<AstNode> children() {
			return List.of();
		}
	}

	record BooleanLiteral(boolean value) implements AstNode {

		@Override
		public NodeKind kind() {
			return NodeKind.BOOLEAN;
		}

		@Override
		public List<AstNode> children() {
			return List.of();
		}
	}

	record VariableRef(String name) implements AstNode {

		public VariableRef {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public NodeKind kind() {
			return NodeKind.VARIABLE;
		}

		@Override
		public List<AstNode> children() {
			return List.of();
		}
	}

	record UnaryOp(String operator, AstNode operand) implements AstNode {

		public UnaryOp {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public NodeKind kind() {
			return NodeKind.UNARY_OP;
		}

		@Override
		public List<AstNode> children() {
			return List.of(operand);
		}
	}

	record BinaryOp(String operator, AstNode left, AstNode right) implements AstNode {

		public BinaryOp {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public NodeKind kind() {
			return NodeKind.BINARY_OP;
		}

		@Override
		public List<AstNode> children() {
			return List.of(left, right);
		}
	}

	record FunctionCall(String name, List<AstNode> arguments) implements AstNode {

		public FunctionCall {
			Objects.requireNonNull(name, "name must not be null");
			arguments = arguments != null ? List.copyOf(arguments) : List.of();
		}

		@Override
		public NodeKind kind() {
			return NodeKind.FUNCTION_CALL;
		}

		@Override
		public List<AstNode> children() {
			return arguments;
		}
	}

	/**
	 * {@code if(condition, whenTrue, whenFalse)}; only the selected branch is evaluated.
	 */
	record Conditional(AstNode condition, AstNode whenTrue, AstNode whenFalse) implements AstNode {

		public Conditional {
			Objects.requireNonNull(condition, "condition must not be null");
			Objects.requireNonNull(whenTrue, "whenTrue must not be null");
			Objects.requireNonNull(whenFalse, "whenFalse must not be null");
		}

		@Override
		public NodeKind kind() {
			return NodeKind.CONDITIONAL;
		}

		@Override
		public List<AstNode> children() {
			return List.of(condition, whenTrue, whenFalse);
		}
	}
}
