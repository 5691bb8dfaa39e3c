package org.javai.lambda.syntax;

import java.util.Objects;

/**
 * A token of the lambda surface syntax.
 * <p>
 * Dots never appear as tokens: the tokenizer desugars them into explicit
 * parentheses.
 *
 * @param type the token type
 * @param text the token text (the variable name for identifiers)
 */
public record LambdaToken(TokenType type, String text) {

	public enum TokenType {
		LAMBDA,        // \
		IDENTIFIER,    // variable names
		OPEN_PAREN,    // (
		CLOSE_PAREN    // )
	}

	public static final LambdaToken LAMBDA = new LambdaToken(TokenType.LAMBDA, "\\");
	public static final LambdaToken OPEN_PAREN = new LambdaToken(TokenType.OPEN_PAREN, "(");
	public static final LambdaToken CLOSE_PAREN = new LambdaToken(TokenType.CLOSE_PAREN, ")");

	public LambdaToken {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}

	/**
	 * Creates an identifier token.
	 *
	 * @throws IllegalArgumentException if {@code name} is not a legal variable name
	 */
	public static LambdaToken identifier(String name) {
		if (!Alphabet.isValidName(name)) {
			throw new IllegalArgumentException("Not a valid variable name: '" + name + "'");
		}
		return new LambdaToken(TokenType.IDENTIFIER, name);
	}

	/**
	 * Maps display text back to a token: {@code \}, {@code (}, {@code )} or a variable name.
	 */
	public static LambdaToken of(String text) {
		return switch (text) {
			case "\\" -> LAMBDA;
			case "(" -> OPEN_PAREN;
			case ")" -> CLOSE_PAREN;
			default -> identifier(text);
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isIdentifier() {
		return type == TokenType.IDENTIFIER;
	}

	@Override
	public String toString() {
		return text;
	}
}
