package org.javai.formula.ast;

import java.util.ArrayList;
import java.util.List;
import org.javai.formula.ast.AstNode.BinaryOp;
import org.javai.formula.ast.AstNode.BooleanLiteral;
import org.javai.formula.ast.AstNode.Conditional;
import org.javai.formula.ast.AstNode.FunctionCall;
import org.javai.formula.ast.AstNode.NumberLiteral;
import org.javai.formula.ast.AstNode.UnaryOp;
import org.javai.formula.ast.AstNode.VariableRef;
import org.javai.formula.ast.ChildNode.ArgumentsChild;
import org.javai.formula.ast.ChildNode.NodeChild;
import org.javai.formula.ast.ChildNode.TokenChild;
import org.javai.formula.grammar.SemanticAction;
import org.javai.formula.lexer.Token;

/**
 * The builders referenced by name from grammar definitions.
 * <p>
 * Every builder checks the number and kind of its children before constructing anything.
 */
public final class AstBuilders {

	public static final String PASSTHROUGH = "passthrough";
	public static final String PARENTHESIZED = "parenthesized";
	public static final String UNARY = "unary";
	public static final String BINARY = "binary";
	public static final String NUMBER = "number";
	public static final String VARIABLE = "variable";
	public static final String BOOLEAN = "boolean";
	public static final String FUNCTION_CALL = "function_call";
	public static final String FUNCTION_CALL_EMPTY = "function_call_empty";
	public static final String CONDITIONAL = "conditional";
	public static final String ARGUMENTS_FIRST = "arguments_first";
	public static final String ARGUMENTS_APPEND = "arguments_append";

	private AstBuilders() {
	}

	/**
	 * Resolve the builder a grammar action names.
	 *
	 * @throws AstBuildException of kind {@code MISSING_BUILDER} if the name is unknown or a
	 * required argument is absent
	 */
	public static AstBuilder resolve(SemanticAction action) {
		String argument = action.argument();
		return switch (action.builder()) {
			case PASSTHROUGH -> passthrough();
			case PARENTHESIZED -> parenthesized();
			case UNARY -> unary(requireArgument(action), 1);
			case BINARY -> binary(requireArgument(action));
			case NUMBER -> number();
			case VARIABLE -> variable();
			case BOOLEAN -> bool(Boolean.parseBoolean(requireArgument(action)));
			case FUNCTION_CALL -> functionCall();
			case FUNCTION_CALL_EMPTY -> functionCallEmpty();
			case CONDITIONAL -> conditional();
			case ARGUMENTS_FIRST -> argumentsFirst();
			case ARGUMENTS_APPEND -> argumentsAppend();
			default -> throw AstBuildException.missingBuilder("Unknown builder '" + action.builder()
					+ "'" + (argument != null ? " with argument '" + argument + "'" : ""));
		};
	}

	private static String requireArgument(SemanticAction action) {
		if (action.argument() == null) {
			throw AstBuildException.missingBuilder("Builder '" + action.builder() + "' requires an argument");
		}
		return action.argument();
	}

	/**
	 * One child, returned unchanged ({@code EXPR → AND_EXPR}).
	 */
	public static AstBuilder passthrough() {
		return children -> {
			expectCount(PASSTHROUGH, children, 1);
			node(PASSTHROUGH, children, 0);
			return children.get(0);
		};
	}

	/**
	 * {@code ( expr )}: the middle child, returned unchanged.
	 */
	public static AstBuilder parenthesized() {
		return children -> {
			expectCount(PARENTHESIZED, children, 3);
			token(PARENTHESIZED, children, 0);
			node(PARENTHESIZED, children, 1);
			token(PARENTHESIZED, children, 2);
			return children.get(1);
		};
	}

	/**
	 * Operator token followed by its operand; the operand sits at {@code operandIndex}.
	 */
	public static AstBuilder unary(String operator, int operandIndex) {
		if (operandIndex < 1) {
			throw new IllegalArgumentException("operandIndex must be at least 1");
		}
		return children -> {
			if (children.size() < 2 || children.size() <= operandIndex) {
				throw AstBuildException.childCountMismatch(UNARY, Math.max(2, operandIndex + 1), children.size());
			}
			AstNode operand = node(UNARY, children, operandIndex);
			return new NodeChild(new UnaryOp(operator, operand));
		};
	}

	/**
	 * {@code left operator right}.
	 */
	public static AstBuilder binary(String operator) {
		return children -> {
			expectCount(BINARY, children, 3);
			AstNode left = node(BINARY, children, 0);
			token(BINARY, children, 1);
			AstNode right = node(BINARY, children, 2);
			return new NodeChild(new BinaryOp(operator, left, right));
		};
	}

	public static AstBuilder number() {
		return children -> {
			expectCount(NUMBER, children, 1);
			Token token = token(NUMBER, children, 0);
			return new NodeChild(new NumberLiteral(Double.parseDouble(token.text())));
		};
	}

	/**
	 * A {@code {name}} reference or a bare identifier, both resolved from the context.
	 */
	public static AstBuilder variable() {
		return children -> {
			expectCount(VARIABLE, children, 1);
			Token token = token(VARIABLE, children, 0);
			return new NodeChild(new VariableRef(token.value()));
		};
	}

	public static AstBuilder bool(boolean value) {
		return children -> {
			expectCount(BOOLEAN, children, 1);
			token(BOOLEAN, children, 0);
			return new NodeChild(new BooleanLiteral(value));
		};
	}

	/**
	 * {@code name ( args )}.
	 */
	public static AstBuilder functionCall() {
		return children -> {
			expectCount(FUNCTION_CALL, children, 4);
			Token name = token(FUNCTION_CALL, children, 0);
			token(FUNCTION_CALL, children, 1);
			List<AstNode> arguments = arguments(FUNCTION_CALL, children, 2);
			token(FUNCTION_CALL, children, 3);
			return new NodeChild(new FunctionCall(name.value(), arguments));
		};
	}

	/**
	 * {@code name ( )}.
	 */
	public static AstBuilder functionCallEmpty() {
		return children -> {
			expectCount(FUNCTION_CALL_EMPTY, children, 3);
			Token name = token(FUNCTION_CALL_EMPTY, children, 0);
			token(FUNCTION_CALL_EMPTY, children, 1);
			token(FUNCTION_CALL_EMPTY, children, 2);
			return new NodeChild(new FunctionCall(name.value(), List.of()));
		};
	}

	/**
	 * {@code if ( condition , whenTrue , whenFalse )}.
	 */
	public static AstBuilder conditional() {
		return children -> {
			expectCount(CONDITIONAL, children, 8);
			AstNode condition = node(CONDITIONAL, children, 2);
			AstNode whenTrue = node(CONDITIONAL, children, 4);
			AstNode whenFalse = node(CONDITIONAL, children, 6);
			for (int i : new int[] { 0, 1, 3, 5, 7 }) {
				token(CONDITIONAL, children, i);
			}
			return new NodeChild(new Conditional(condition, whenTrue, whenFalse));
		};
	}

	public static AstBuilder argumentsFirst() {
		return children -> {
			expectCount(ARGUMENTS_FIRST, children, 1);
			return new ArgumentsChild(List.of(node(ARGUMENTS_FIRST, children, 0)));
		};
	}

	public static AstBuilder argumentsAppend() {
		return children -> {
			expectCount(ARGUMENTS_APPEND, children, 3);
			List<AstNode> arguments = new ArrayList<>(arguments(ARGUMENTS_APPEND, children, 0));
			token(ARGUMENTS_APPEND, children, 1);
			arguments.add(node(ARGUMENTS_APPEND, children, 2));
			return new ArgumentsChild(arguments);
		};
	}

	private static void expectCount(String builder, List<ChildNode> children, int expected) {
		if (children.size() != expected) {
			throw AstBuildException.childCountMismatch(builder, expected, children.size());
		}
	}

	private static AstNode node(String builder, List<ChildNode> children, int index) {
		if (children.get(index) instanceof NodeChild child) {
			return child.node();
		}
		throw AstBuildException.childTypeMismatch(builder, index, "node", children.get(index).describe());
	}

	private static Token token(String builder, List<ChildNode> children, int index) {
		if (children.get(index) instanceof TokenChild child) {
			return child.token();
		}
		throw AstBuildException.childTypeMismatch(builder, index, "token", children.get(index).describe());
	}

	private static List<AstNode> arguments(String builder, List<ChildNode> children, int index) {
		if (children.get(index) instanceof ArgumentsChild child) {
			return child.arguments();
		}
		throw AstBuildException.childTypeMismatch(builder, index, "arguments", children.get(index).describe());
	}
}
