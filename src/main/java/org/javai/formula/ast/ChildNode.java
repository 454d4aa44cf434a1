package org.javai.formula.ast;

import java.util.List;
import java.util.Objects;
import org.javai.formula.lexer.Token;

/**
 * A value on the parser's value stack: a shifted token, a built AST node, or a function
 * argument list under construction.
 */
public sealed interface ChildNode {

	/**
	 * Short name of the variant, used in structural mismatch messages.
	 */
	String describe();

	record TokenChild(Token token) implements ChildNode {

		public TokenChild {
			Objects.requireNonNull(token, "token must not be null");
		}

		@Override
		public String describe() {
			return "token " + token;
		}
	}

	record NodeChild(AstNode node) implements ChildNode {

		public NodeChild {
			Objects.requireNonNull(node, "node must not be null");
		}

		@Override
		public String describe() {
			return "node " + node.kind();
		}
	}

	record ArgumentsChild(List<AstNode> arguments) implements ChildNode {

		public ArgumentsChild {
			arguments = List.copyOf(arguments);
		}

		@Override
		public String describe() {
			return "arguments(" + arguments.size() + ")";
		}
	}
}
