package org.javai.formula.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.javai.formula.ast.AstBuilderRegistry;
import org.javai.formula.ast.ChildNode;
import org.javai.formula.grammar.Production;
import org.javai.formula.lexer.Token;

/**
 * Table-driven LR parser.
 * <p>
 * Runs in a loop over an explicit state stack and value stack, so nesting depth never turns
 * into Java recursion. Three guards bound the work per formula: the number of shift/reduce
 * steps, the height of the state stack, and the depth of the tree being built (passthrough
 * reductions and argument lists do not add a level).
 */
public class LRParser {

	public static final int DEFAULT_MAX_PARSING_STEPS = 1_000_000;
	public static final int DEFAULT_MAX_STACK_DEPTH = 1_024;
	public static final int DEFAULT_MAX_PARSING_DEPTH = 256;

	private final ParseTable table;
	private final AstBuilderRegistry builders;
	private final int maxParsingSteps;
	private final int maxStackDepth;
	private final int maxParsingDepth;

	public LRParser(ParseTable table, AstBuilderRegistry builders) {
		this(table, builders, DEFAULT_MAX_PARSING_STEPS, DEFAULT_MAX_STACK_DEPTH, DEFAULT_MAX_PARSING_DEPTH);
	}

	public LRParser(ParseTable table, AstBuilderRegistry builders, int maxParsingSteps, int maxStackDepth,
			int maxParsingDepth) {
		this.table = Objects.requireNonNull(table, "table must not be null");
		this.builders = Objects.requireNonNull(builders, "builders must not be null");
		if (maxParsingSteps <= 0 || maxStackDepth <= 0 || maxParsingDepth <= 0) {
			throw new IllegalArgumentException("Parser limits must be positive");
		}
		this.maxParsingSteps = maxParsingSteps;
		this.maxStackDepth = maxStackDepth;
		this.maxParsingDepth = maxParsingDepth;
	}

	public ChildNode parse(List<Token> tokens) {
		return parse(tokens.iterator());
	}

	/**
	 * Parse a token stream ending with EOF.
	 *
	 * @return the value reduced for the start symbol
	 * @throws ParserException on a syntax error or when a guard trips
	 */
	public ChildNode parse(Iterator<Token> tokens) {
		List<Integer> states = new ArrayList<>();
		List<ChildNode> values = new ArrayList<>();
		List<Integer> depths = new ArrayList<>();
		states.add(table.startState());

		Token lookahead = next(tokens, null);
		long steps = 0;
		while (true) {
			if (++steps > maxParsingSteps) {
				throw ParserException.tooManySteps(maxParsingSteps, steps);
			}
			int state = states.get(states.size() - 1);
			LRAction action = table.action(state, lookahead.type().terminal());

			if (action instanceof LRAction.Shift shift) {
				states.add(shift.state());
				values.add(new ChildNode.TokenChild(lookahead));
				depths.add(0);
				if (states.size() > maxStackDepth) {
					throw ParserException.tooDeep("maxStackDepth", maxStackDepth, states.size());
				}
				lookahead = next(tokens, lookahead);
			}
			else if (action instanceof LRAction.Reduce reduce) {
				Production production = reduce.production();
				int from = values.size() - production.length();
				List<ChildNode> children = new ArrayList<>(values.subList(from, values.size()));
				List<Integer> childDepths = new ArrayList<>(depths.subList(from, depths.size()));
				truncate(values, from);
				truncate(depths, from);
				truncate(states, states.size() - production.length());

				ChildNode result = builders.reduce(production, children);
				int depth = depthOf(result, children, childDepths);
				if (depth > maxParsingDepth) {
					throw ParserException.tooDeep("maxParsingDepth", maxParsingDepth, depth);
				}

				int top = states.get(states.size() - 1);
				OptionalInt target = table.gotoState(top, production.left());
				if (target.isEmpty()) {
					throw new IllegalStateException("Parse table has no GOTO for state " + top + " on " + production.left());
				}
				states.add(target.getAsInt());
				values.add(result);
				depths.add(depth);
			}
			else if (action instanceof LRAction.Accept) {
				return values.get(values.size() - 1);
			}
			else {
				throw ParserException.unexpectedToken(lookahead, table.expectedTerminals(state));
			}
		}
	}

	private static Token next(Iterator<Token> tokens, Token previous) {
		if (!tokens.hasNext()) {
			if (previous != null && previous.isEof()) {
				return previous;
			}
			throw new IllegalArgumentException("Token stream must end with EOF");
		}
		return tokens.next();
	}

	private static int depthOf(ChildNode result, List<ChildNode> children, List<Integer> childDepths) {
		int deepest = 0;
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == result) {
				return childDepths.get(i);
			}
			deepest = Math.max(deepest, childDepths.get(i));
		}
		return result instanceof ChildNode.ArgumentsChild ? deepest : deepest + 1;
	}

	private static <T> void truncate(List<T> list, int size) {
		list.subList(size, list.size()).clear();
	}
}
