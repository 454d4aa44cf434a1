package org.javai.formula.eval;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.formula.ast.AstNode;
import org.javai.formula.ast.AstNode.BinaryOp;
import org.javai.formula.ast.AstNode.BooleanLiteral;
import org.javai.formula.ast.AstNode.Conditional;
import org.javai.formula.ast.AstNode.FunctionCall;
import org.javai.formula.ast.AstNode.NumberLiteral;
import org.javai.formula.ast.AstNode.UnaryOp;
import org.javai.formula.ast.AstNode.VariableRef;
import org.javai.formula.ast.Operators;

/**
 * Tree-walking evaluator.
 * <p>
 * Evaluation reads the AST and the context and mutates neither, so the same inputs always
 * give the same result. Arithmetic is carried out in double precision; see {@link TypeCoercion}
 * for how operands are converted. {@code &&}, {@code ||} and conditionals evaluate only the
 * operands they need.
 */
public class ExpressionEvaluator {

	private final FunctionRegistry functions;
	private final EvaluationCache cache;

	public ExpressionEvaluator(FunctionRegistry functions) {
		this(functions, new EvaluationCache());
	}

	public ExpressionEvaluator(FunctionRegistry functions, EvaluationCache cache) {
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
	}

	/**
	 * Evaluate {@code root}. Evaluation errors are reported in the result, never thrown.
	 */
	public EvaluationResult evaluate(AstNode root, EvaluationContext context) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(context, "context must not be null");
		long start = System.nanoTime();
		Set<String> touched = new LinkedHashSet<>();
		try {
			Object value = eval(root, context, 1, touched);
			return EvaluationResult.success(value, Duration.ofNanos(System.nanoTime() - start), touched);
		}
		catch (EvaluationException e) {
			return EvaluationResult.failure(e, Duration.ofNanos(System.nanoTime() - start), touched);
		}
	}

	/**
	 * Evaluate {@code root}, throwing on failure.
	 *
	 * @throws EvaluationException if evaluation fails
	 */
	public Object evaluateValue(AstNode root, EvaluationContext context) {
		return eval(root, context, 1, new LinkedHashSet<>());
	}

	public FunctionRegistry functions() {
		return functions;
	}

	public EvaluationCache cache() {
		return cache;
	}

	private Object eval(AstNode node, EvaluationContext context, int depth, Set<String> touched) {
		if (depth > context.maxDepth()) {
			throw EvaluationException.tooDeep(context.maxDepth(), depth);
		}
		boolean cacheable = context.enableCaching() && !node.children().isEmpty();
		int remaining = context.maxDepth() - depth;
		long generation = functions.generation();
		if (cacheable) {
			Optional<EvaluationCache.Entry> hit = cache.get(node, context, remaining, generation);
			if (hit.isPresent()) {
				touched.addAll(hit.get().touchedNames());
				return hit.get().value();
			}
		}

		Set<String> local = cacheable ? new LinkedHashSet<>() : touched;
		try {
			Object value = switch (node.kind()) {
				case NUMBER -> ((NumberLiteral) node).value();
				case BOOLEAN -> ((BooleanLiteral) node).value();
				case VARIABLE -> variable((VariableRef) node, context, local);
				case UNARY_OP -> unary((UnaryOp) node, context, depth, local);
				case BINARY_OP -> binary((BinaryOp) node, context, depth, local);
				case FUNCTION_CALL -> call((FunctionCall) node, context, depth, local);
				case CONDITIONAL -> conditional((Conditional) node, context, depth, local);
			};
			if (cacheable) {
				cache.put(node, context, remaining, generation, value, local);
			}
			return value;
		}
		finally {
			if (cacheable) {
				touched.addAll(local);
			}
		}
	}

	private Object variable(VariableRef ref, EvaluationContext context, Set<String> touched) {
		touched.add(ref.name());
		Object value = context.variables().get(ref.name());
		if (value == null) {
			throw EvaluationException.undefinedVariable(ref.name());
		}
		return TypeCoercion.normalize(value);
	}

	private Object unary(UnaryOp op, EvaluationContext context, int depth, Set<String> touched) {
		Object operand = eval(op.operand(), context, depth + 1, touched);
		boolean strict = context.strictMode();
		return switch (op.operator()) {
			case Operators.MINUS -> -TypeCoercion.toNumber(operand, strict);
			case Operators.PLUS -> TypeCoercion.toNumber(operand, strict);
			case Operators.NOT -> !TypeCoercion.toBoolean(operand, strict);
			default -> throw EvaluationException.unsupportedOperator(op.operator());
		};
	}

	private Object binary(BinaryOp op, EvaluationContext context, int depth, Set<String> touched) {
		boolean strict = context.strictMode();
		String operator = op.operator();
		if (Operators.AND.equals(operator)) {
			return TypeCoercion.toBoolean(eval(op.left(), context, depth + 1, touched), strict)
					&& TypeCoercion.toBoolean(eval(op.right(), context, depth + 1, touched), strict);
		}
		if (Operators.OR.equals(operator)) {
			return TypeCoercion.toBoolean(eval(op.left(), context, depth + 1, touched), strict)
					|| TypeCoercion.toBoolean(eval(op.right(), context, depth + 1, touched), strict);
		}
		if (!Operators.BINARY.contains(operator)) {
			throw EvaluationException.unsupportedOperator(operator);
		}

		Object left = eval(op.left(), context, depth + 1, touched);
		Object right = eval(op.right(), context, depth + 1, touched);
		if (Operators.EQUAL.equals(operator)) {
			return TypeCoercion.valuesEqual(left, right, strict);
		}
		if (Operators.NOT_EQUAL.equals(operator)) {
			return !TypeCoercion.valuesEqual(left, right, strict);
		}

		double l = TypeCoercion.toNumber(left, strict);
		double r = TypeCoercion.toNumber(right, strict);
		return switch (operator) {
			case Operators.LESS -> l < r;
			case Operators.LESS_EQUAL -> l <= r;
			case Operators.GREATER -> l > r;
			case Operators.GREATER_EQUAL -> l >= r;
			default -> arithmetic(operator, l, r, strict);
		};
	}

	private double arithmetic(String operator, double l, double r, boolean strict) {
		double result = switch (operator) {
			case Operators.PLUS -> l + r;
			case Operators.MINUS -> l - r;
			case Operators.MULTIPLY -> l * r;
			case Operators.DIVIDE -> {
				if (r == 0.0) {
					throw EvaluationException.divisionByZero(operator);
				}
				yield l / r;
			}
			case Operators.MODULO -> {
				if (r == 0.0) {
					throw EvaluationException.divisionByZero(operator);
				}
				yield l % r;
			}
			case Operators.POWER -> {
				double power = Math.pow(l, r);
				if (!Double.isFinite(power)) {
					throw EvaluationException.mathError("'^'", l + " ^ " + r + " is not a finite number");
				}
				yield power;
			}
			default -> throw EvaluationException.unsupportedOperator(operator);
		};
		if (strict && !Double.isFinite(result)) {
			throw EvaluationException.mathError("'" + operator + "'", "result is not a finite number");
		}
		return result;
	}

	private Object call(FunctionCall call, EvaluationContext context, int depth, Set<String> touched) {
		touched.add(call.name());
		FunctionDefinition function = functions.require(call.name());
		List<AstNode> arguments = call.arguments();
		if (!function.arity().accepts(arguments.size())) {
			throw EvaluationException.wrongArgumentCount(function.name(), function.arity(), arguments.size());
		}
		double[] values = new double[arguments.size()];
		for (int i = 0; i < values.length; i++) {
			values[i] = TypeCoercion.toNumber(eval(arguments.get(i), context, depth + 1, touched), context.strictMode());
		}

		double result;
		try {
			result = function.body().apply(values);
		}
		catch (EvaluationException e) {
			throw e;
		}
		catch (RuntimeException e) {
			throw EvaluationException.mathError(function.name(), String.valueOf(e.getMessage()), e);
		}
		if (!Double.isFinite(result)) {
			throw EvaluationException.mathError(function.name(), "result is not a finite number");
		}
		return result;
	}

	private Object conditional(Conditional conditional, EvaluationContext context, int depth, Set<String> touched) {
		boolean condition = TypeCoercion.toBoolean(eval(conditional.condition(), context, depth + 1, touched),
				context.strictMode());
		return eval(condition ? conditional.whenTrue() : conditional.whenFalse(), context, depth + 1, touched);
	}
}
