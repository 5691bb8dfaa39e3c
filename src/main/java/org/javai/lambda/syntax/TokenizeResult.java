package org.javai.lambda.syntax;

import java.util.List;

/**
 * Outcome of tokenizing one line: either the tokens or the error, never both.
 */
public record TokenizeResult(List<LambdaToken> tokens, SyntaxError error) {

	public TokenizeResult {
		if ((tokens == null) == (error == null)) {
			throw new IllegalArgumentException("Exactly one of tokens and error must be present");
		}
		tokens = tokens != null ? List.copyOf(tokens) : null;
	}

	public static TokenizeResult success(List<LambdaToken> tokens) {
		return new TokenizeResult(tokens, null);
	}

	public static TokenizeResult failure(SyntaxError error) {
		return new TokenizeResult(null, error);
	}

	public boolean isValid() {
		return error == null;
	}
}
