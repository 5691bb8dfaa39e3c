package org.javai.lambda.syntax;

/**
 * Character classes of the lambda surface syntax.
 * <p>
 * Variable names are ASCII only and case-sensitive: a letter followed by any
 * number of letters or digits.
 */
public final class Alphabet {

	public static final char LAMBDA = '\\';
	public static final char OPEN_PAREN = '(';
	public static final char CLOSE_PAREN = ')';
	public static final char DOT = '.';
	public static final char SPACE = ' ';

	private Alphabet() {
		// Utility class - no instantiation
	}

	public static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	public static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	public static boolean isIdentChar(char c) {
		return isLetter(c) || isDigit(c);
	}

	public static boolean isStructural(char c) {
		return c == OPEN_PAREN || c == CLOSE_PAREN || c == DOT || c == LAMBDA;
	}

	public static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	/**
	 * Returns true if {@code name} is a legal variable name.
	 */
	public static boolean isValidName(String name) {
		if (name == null || name.isEmpty() || !isLetter(name.charAt(0))) {
			return false;
		}
		for (int i = 1; i < name.length(); i++) {
			if (!isIdentChar(name.charAt(i))) {
				return false;
			}
		}
		return true;
	}
}
