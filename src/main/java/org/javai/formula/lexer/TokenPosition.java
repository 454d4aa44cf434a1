package org.javai.formula.lexer;

/**
 * Location of a character in formula text: zero-based index, one-based line and column.
 */
public record TokenPosition(int index, int line, int column) {

	public static final TokenPosition START = new TokenPosition(0, 1, 1);

	public TokenPosition {
		if (index < 0 || line < 1 || column < 1) {
			throw new IllegalArgumentException("Invalid position: index=" + index + ", line=" + line + ", column=" + column);
		}
	}

	@Override
	public String toString() {
		return "line " + line + ", column " + column + " (index " + index + ")";
	}
}
