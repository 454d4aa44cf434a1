package org.javai.formula.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Queries over AST trees.
 */
public final class AstNodes {

	private AstNodes() {
	}

	/**
	 * Names of referenced variables in order of first appearance.
	 */
	public static Set<String> variableNames(AstNode root) {
		Set<String> names = new LinkedHashSet<>();
		collect(root, NodeKind.VARIABLE, names);
		return names;
	}

	/**
	 * Names of called functions in order of first appearance.
	 */
	public static Set<String> functionNames(AstNode root) {
		Set<String> names = new LinkedHashSet<>();
		collect(root, NodeKind.FUNCTION_CALL, names);
		return names;
	}

	public static int depth(AstNode root) {
		int deepest = 0;
		for (AstNode child : root.children()) {
			deepest = Math.max(deepest, depth(child));
		}
		return deepest + 1;
	}

	public static int nodeCount(AstNode root) {
		int count = 1;
		for (AstNode child : root.children()) {
			count += nodeCount(child);
		}
		return count;
	}

	private static void collect(AstNode node, NodeKind kind, Set<String> names) {
		if (node.kind() == kind) {
			if (node instanceof AstNode.VariableRef ref) {
				names.add(ref.name());
			}
			else if (node instanceof AstNode.FunctionCall call) {
				names.add(call.name());
			}
		}
		for (AstNode child : node.children()) {
			collect(child, kind, names);
		}
	}
}
