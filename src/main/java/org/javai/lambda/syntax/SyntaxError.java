package org.javai.lambda.syntax;

import java.util.Objects;

/**
 * A syntax error found in one input line.
 *
 * @param kind the error category
 * @param message human readable description, without trailing punctuation
 * @param position 1-based character offset into the original line
 */
public record SyntaxError(SyntaxErrorKind kind, String message, int position) {

	public SyntaxError {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	/**
	 * Renders the diagnostic for display, e.g.
	 * {@code Error in [(a] at position 2: Expected closing parenthesis, found EOL.}
	 */
	public String describe(String line) {
		return "Error in [" + line + "] at position " + position + ": " + message + ".";
	}

	@Override
	public String toString() {
		return kind + " at position " + position + ": " + message;
	}
}
