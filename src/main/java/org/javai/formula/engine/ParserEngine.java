package org.javai.formula.engine;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.formula.FormulaEngineException;
import org.javai.formula.ast.AstBuilderRegistry;
import org.javai.formula.ast.AstNode;
import org.javai.formula.ast.ChildNode;
import org.javai.formula.eval.ConstantFolder;
import org.javai.formula.eval.EvaluationCache;
import org.javai.formula.eval.EvaluationContext;
import org.javai.formula.eval.EvaluationResult;
import org.javai.formula.eval.ExpressionEvaluator;
import org.javai.formula.eval.FunctionRegistry;
import org.javai.formula.grammar.Grammar;
import org.javai.formula.grammar.GrammarParser;
import org.javai.formula.lexer.FormulaTokenizer;
import org.javai.formula.lexer.Token;
import org.javai.formula.parser.LRParser;
import org.javai.formula.parser.ParseTable;
import org.javai.formula.parser.ParseTableBuilder;

/**
 * The assembled formula pipeline: grammar, parse table, AST builders, functions and limits.
 * <p>
 * Construction loads the grammar and builds the LALR(1) table, and fails fast with a
 * {@link org.javai.formula.grammar.GrammarException} if either is invalid. Afterwards the
 * engine holds no mutable state of its own and is meant to be built once and shared between
 * threads. Functions registered into the {@link FunctionRegistry} after construction become
 * visible to later evaluations.
 */
public final class ParserEngine {

	private final EngineConfig config;
	private final Grammar grammar;
	private final ParseTable table;
	private final AstBuilderRegistry builders;
	private final FunctionRegistry functions;
	private final FormulaTokenizer tokenizer;
	private final LRParser parser;
	private final ExpressionEvaluator evaluator;
	private final ConstantFolder folder;

	private ParserEngine(EngineConfig config, Grammar grammar, FunctionRegistry functions) {
		this.config = config;
		this.grammar = grammar;
		this.table = new ParseTableBuilder(grammar).build();
		this.builders = AstBuilderRegistry.forGrammar(grammar);
		this.functions = functions;
		this.tokenizer = new FormulaTokenizer(config.maxFormulaLength(), config.maxTokenCount());
		this.parser = new LRParser(table, builders, config.maxParsingSteps(), config.maxStackDepth(),
				config.maxParsingDepth());
		this.evaluator = new ExpressionEvaluator(functions, new EvaluationCache());
		this.folder = new ConstantFolder(evaluator);
	}

	public static ParserEngine create() {
		return create(EngineConfig.defaults());
	}

	public static ParserEngine create(EngineConfig config) {
		return create(config, FunctionRegistry.withBuiltins());
	}

	public static ParserEngine create(EngineConfig config, FunctionRegistry functions) {
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(functions, "functions must not be null");
		return new ParserEngine(config, new GrammarParser().parseFormulaGrammar(), functions);
	}

	public List<Token> tokenize(String formula) {
		return tokenizer.tokenize(formula);
	}

	/**
	 * Parse formula text into its syntax tree, without optimization.
	 *
	 * @throws FormulaEngineException if the text cannot be tokenized or parsed
	 */
	public AstNode parse(String formula) {
		ChildNode root = parser.parse(tokenizer.lazyTokens(formula));
		if (!(root instanceof ChildNode.NodeChild node)) {
			throw new IllegalStateException("Parser produced " + root.describe() + " instead of an expression");
		}
		return node.node();
	}

	/**
	 * Parse formula text and, when optimization is enabled, fold its constant subtrees.
	 */
	public AstNode compile(String formula) {
		AstNode ast = parse(formula);
		return config.enableOptimization() ? folder.fold(ast, config.strictMode()) : ast;
	}

	/**
	 * An evaluation context carrying this engine's limits.
	 *
	 * @throws org.javai.formula.eval.EvaluationException if the bindings exceed
	 * {@code maxVariables} or hold an unsupported value
	 */
	public EvaluationContext newContext(Map<String, ?> variables) {
		Map<String, Object> bindings = variables != null ? new LinkedHashMap<>(variables) : Map.of();
		return new EvaluationContext(bindings, config.maxParsingDepth(), config.maxVariables(), config.strictMode(),
				config.enableCaching());
	}

	/**
	 * Evaluate a compiled formula against the given bindings. Never throws for engine errors.
	 */
	public EvaluationResult evaluate(AstNode ast, Map<String, ?> variables) {
		EvaluationContext context;
		try {
			context = newContext(variables);
		}
		catch (FormulaEngineException e) {
			return EvaluationResult.failure(e, Duration.ZERO, Set.of());
		}
		return evaluator.evaluate(ast, context);
	}

	public EngineConfig config() {
		return config;
	}

	public Grammar grammar() {
		return grammar;
	}

	public ParseTable parseTable() {
		return table;
	}

	public AstBuilderRegistry builders() {
		return builders;
	}

	public FunctionRegistry functions() {
		return functions;
	}

	public ExpressionEvaluator evaluator() {
		return evaluator;
	}
}
