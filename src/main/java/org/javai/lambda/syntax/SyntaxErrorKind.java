package org.javai.lambda.syntax;

/**
 * Categories of syntax errors.
 */
public enum SyntaxErrorKind {
	/** {@code \} not followed by a valid name, or nothing after the bound name. */
	MALFORMED_VARIABLE,
	/** Whitespace between a bound variable and its dot. */
	ILLEGAL_DOT_SPACING,
	/** A {@code (} without its {@code )}. */
	UNBALANCED_PARENTHESIS,
	/** Brackets with nothing usable inside. */
	EMPTY_GROUP,
	/** A name that starts with a digit. */
	INVALID_IDENTIFIER_START,
	/** A character that cannot start any construct. */
	UNEXPECTED_CHARACTER,
	/** Brackets or abstractions nested beyond the configured limit. */
	NESTING_TOO_DEEP,
	/** A token sequence handed to the tree builder that could not come from the tokenizer. */
	MALFORMED_TOKEN_SEQUENCE
}
