package org.javai.formula.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.formula.ast.AstNode;
import org.javai.formula.ast.AstNode.BinaryOp;
import org.javai.formula.ast.AstNode.BooleanLiteral;
import org.javai.formula.ast.AstNode.Conditional;
import org.javai.formula.ast.AstNode.FunctionCall;
import org.javai.formula.ast.AstNode.NumberLiteral;
import org.javai.formula.ast.AstNode.UnaryOp;

/**
 * Replaces subtrees that depend on no variable with their value.
 * <p>
 * A subtree whose children are all literals is evaluated once with the same evaluator and
 * coercion mode used at run time; a conditional with a literal condition is replaced by the
 * branch it selects. A subtree whose evaluation fails is left as it is, so the error is
 * reported when the formula is evaluated.
 */
public class ConstantFolder {

	private final ExpressionEvaluator evaluator;

	public ConstantFolder(ExpressionEvaluator evaluator) {
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
	}

	public AstNode fold(AstNode root, boolean strictMode) {
		Objects.requireNonNull(root, "root must not be null");
		EvaluationContext constants = new EvaluationContext(Map.of(), EvaluationContext.DEFAULT_MAX_DEPTH, 0,
				strictMode, false);
		return fold(root, constants);
	}

	private AstNode fold(AstNode node, EvaluationContext constants) {
		AstNode rebuilt = switch (node.kind()) {
			case NUMBER, BOOLEAN, VARIABLE -> node;
			case UNARY_OP -> {
				UnaryOp op = (UnaryOp) node;
				yield new UnaryOp(op.operator(), fold(op.operand(), constants));
			}
			case BINARY_OP -> {
				BinaryOp op = (BinaryOp) node;
				yield new BinaryOp(op.operator(), fold(op.left(), constants), fold(op.right(), constants));
			}
			case FUNCTION_CALL -> {
				FunctionCall call = (FunctionCall) node;
				List<AstNode> arguments = new ArrayList<>(call.arguments().size());
				for (AstNode argument : call.arguments()) {
					arguments.add(fold(argument, constants));
				}
				yield new FunctionCall(call.name(), arguments);
			}
			case CONDITIONAL -> foldConditional((Conditional) node, constants);
		};
		if (rebuilt.children().isEmpty() || !rebuilt.children().stream().allMatch(ConstantFolder::isLiteral)) {
			return rebuilt;
		}
		EvaluationResult result = evaluator.evaluate(rebuilt, constants);
		if (!result.success()) {
			return rebuilt;
		}
		return toLiteral(result.value(), rebuilt);
	}

	private AstNode foldConditional(Conditional conditional, EvaluationContext constants) {
		AstNode condition = fold(conditional.condition(), constants);
		if (isLiteral(condition)) {
			EvaluationResult selected = evaluator.evaluate(condition, constants);
			if (selected.success()) {
				try {
					boolean truth = TypeCoercion.toBoolean(selected.value(), constants.strictMode());
					return fold(truth ? conditional.whenTrue() : conditional.whenFalse(), constants);
				}
				catch (EvaluationException e) {
					// not a usable condition; evaluation will report it
					return new Conditional(condition, fold(conditional.whenTrue(), constants),
							fold(conditional.whenFalse(), constants));
				}
			}
		}
		return new Conditional(condition, fold(conditional.whenTrue(), constants), fold(conditional.whenFalse(), constants));
	}

	private static boolean isLiteral(AstNode node) {
		return node instanceof NumberLiteral || node instanceof BooleanLiteral;
	}

	private static AstNode toLiteral(Object value, AstNode original) {
		if (value instanceof Double number) {
			return new NumberLiteral(number);
		}
		if (value instanceof Boolean bool) {
			return new BooleanLiteral(bool);
		}
		return original;
	}
}
