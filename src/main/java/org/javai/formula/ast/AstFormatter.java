package org.javai.formula.ast;

import java.util.stream.Collectors;
import org.javai.formula.ast.AstNode.BinaryOp;
import org.javai.formula.ast.AstNode.BooleanLiteral;
import org.javai.formula.ast.AstNode.Conditional;
import org.javai.formula.ast.AstNode.FunctionCall;
import org.javai.formula.ast.AstNode.NumberLiteral;
import org.javai.formula.ast.AstNode.UnaryOp;
import org.javai.formula.ast.AstNode.VariableRef;
import org.javai.formula.lexer.FormulaTokenizer;

/**
 * Renders an AST as canonical formula text.
 * <p>
 * Parentheses are emitted only where the grammar needs them, so formatting a parsed formula
 * and parsing the result again yields the same tree.
 */
public final class AstFormatter {

	private static final int UNARY_LEVEL = 7;
	private static final int PRIMARY_LEVEL = 8;

	private AstFormatter() {
	}

	public static String format(AstNode node) {
		StringBuilder sb = new StringBuilder();
		append(node, sb);
		return sb.toString();
	}

	private static void append(AstNode node, StringBuilder sb) {
		switch (node.kind()) {
			case NUMBER -> appendNumber(((NumberLiteral) node).value(), sb);
			case BOOLEAN -> sb.append(((BooleanLiteral) node).value());
			case VARIABLE -> appendVariable(((VariableRef) node).name(), sb);
			case UNARY_OP -> {
				UnaryOp unary = (UnaryOp) node;
				sb.append(unary.operator());
				appendOperand(unary.operand(), level(unary.operand()) < UNARY_LEVEL, sb);
			}
			case BINARY_OP -> {
				BinaryOp binary = (BinaryOp) node;
				int level = Operators.precedence(binary.operator());
				boolean rightAssociative = Operators.isRightAssociative(binary.operator());
				int leftLevel = level(binary.left());
				int rightLevel = level(binary.right());
				boolean wrapLeft = rightAssociative ? leftLevel < UNARY_LEVEL : leftLevel < level || level == 0;
				boolean wrapRight = rightAssociative ? rightLevel < level : rightLevel <= level;
				appendOperand(binary.left(), wrapLeft, sb);
				sb.append(' ').append(binary.operator()).append(' ');
				appendOperand(binary.right(), wrapRight, sb);
			}
			case FUNCTION_CALL -> {
				FunctionCall call = (FunctionCall) node;
				sb.append(call.name()).append('(');
				sb.append(call.arguments().stream().map(AstFormatter::format).collect(Collectors.joining(", ")));
				sb.append(')');
			}
			case CONDITIONAL -> {
				Conditional conditional = (Conditional) node;
				sb.append("if(").append(format(conditional.condition()))
						.append(", ").append(format(conditional.whenTrue()))
						.append(", ").append(format(conditional.whenFalse()))
						.append(')');
			}
		}
	}

	private static void appendOperand(AstNode operand, boolean wrap, StringBuilder sb) {
		if (wrap) {
			sb.append('(');
			append(operand, sb);
			sb.append(')');
		}
		else {
			append(operand, sb);
		}
	}

	private static int level(AstNode node) {
		return switch (node.kind()) {
			case BINARY_OP -> Operators.precedence(((BinaryOp) node).operator());
			case UNARY_OP -> UNARY_LEVEL;
			case NUMBER, BOOLEAN, VARIABLE, FUNCTION_CALL, CONDITIONAL -> PRIMARY_LEVEL;
		};
	}

	private static void appendNumber(double value, StringBuilder sb) {
		if (value < 0 || (value == 0.0 && 1.0 / value < 0)) {
			sb.append("(-");
			appendNumber(-value, sb);
			sb.append(')');
		}
		else if (value == Math.rint(value) && value < 1e15) {
			sb.append((long) value);
		}
		else {
			sb.append(value);
		}
	}

	private static void appendVariable(String name, StringBuilder sb) {
		if (FormulaTokenizer.isPlainIdentifier(name)) {
			sb.append(name);
		}
		else {
			sb.append('{').append(name).append('}');
		}
	}
}
